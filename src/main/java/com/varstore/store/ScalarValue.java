/*
 * VarStore: Transactional Package Variables for Java
 *
 * Copyright 2021 Ken Westlund
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.varstore.store;

import com.varstore.core.Column;

/**
 * A single typed datum, possibly null.
 */
public class ScalarValue implements Value {
    private Column column;

    public ScalarValue(Column column) {
        this.column = column;
    }

    public Column getColumn() {
        return column;
    }

    /**
     * Replaces the datum held by this value with a copy of the given one.
     *
     * @param value the new value, of the same type
     */
    public void assign(Column value) {
        column.assign(value);
    }

    @Override
    public ScalarValue copyValue() {
        return new ScalarValue(column.copy());
    }

    @Override
    public void release() {
        column = null;
    }

    @Override
    public long storeSize() {
        return column == null ? 0 : column.storeSize();
    }

    @Override
    public String toString() {
        return String.valueOf(column);
    }
}
