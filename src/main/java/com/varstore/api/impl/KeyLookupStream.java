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

package com.varstore.api.impl;

import com.varstore.api.RowDescriptor;
import com.varstore.core.Column;
import com.varstore.store.RecordSet;
import com.varstore.store.VariableEntry;

import java.util.List;

/**
 * Stream of the rows matching a list of keys, in key order. Each key is
 * looked up in the current value of the variable when it is fetched; keys
 * without a matching row are skipped. The stream ends early if the variable
 * is removed or no longer has the stream's shape.
 */
class KeyLookupStream extends AbstractRowStream {
    private final VariableEntry var;
    private final List<Column> keys;
    private int next;

    KeyLookupStream(RowDescriptor descriptor, int bigMaxLength, VariableEntry var, List<Column> keys) {
        super(descriptor, bigMaxLength);
        this.var = var;
        this.keys = keys;
    }

    @Override
    protected Column[] nextRow() {
        while (next < keys.size()) {
            if (var.isDeleted() || !var.isValid() || !var.getPackage().isValid())
                return null;
            RecordSet records = (RecordSet) var.getValue();
            if (!records.getDescriptor().equals(getDescriptor()))
                return null;
            Column[] row = records.get(keys.get(next++));
            if (row != null)
                return row;
        }
        return null;
    }

    @Override
    protected void reset() {
        next = 0;
    }
}
