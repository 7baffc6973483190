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

import java.util.List;

/**
 * Stream over the rows a record variable held when the select was made.
 */
class RecordSetStream extends AbstractRowStream {
    private final List<Column[]> rows;
    private int next;

    RecordSetStream(RowDescriptor descriptor, int bigMaxLength, List<Column[]> rows) {
        super(descriptor, bigMaxLength);
        this.rows = rows;
    }

    @Override
    protected Column[] nextRow() {
        if (next >= rows.size())
            return null;
        return rows.get(next++);
    }

    @Override
    protected void reset() {
        next = 0;
    }
}
