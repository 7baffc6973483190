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

import com.varstore.api.Row;
import com.varstore.api.RowDescriptor;
import com.varstore.api.RowStream;
import com.varstore.api.TypeException;
import com.varstore.api.VarStoreException;
import com.varstore.core.Column;

/**
 * Common functions of the streams returned by the select operations: row
 * allocation, the closed state and copying stored rows out to the caller.
 */
abstract class AbstractRowStream implements RowStream {
    private final RowDescriptor descriptor;
    private final int bigMaxLength;
    private boolean closed;

    AbstractRowStream(RowDescriptor descriptor, int bigMaxLength) {
        this.descriptor = descriptor;
        this.bigMaxLength = bigMaxLength;
    }

    RowDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public Row allocateRow() {
        try {
            return new RowImpl(descriptor, bigMaxLength);
        } catch (TypeException e) {
            // the descriptor was validated when it was created
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean fetchNext(Row row) throws VarStoreException {
        checkOpen();
        if (!(row instanceof RowImpl) || !descriptor.equals(row.getDescriptor()))
            throw new TypeException("Row does not have the shape " + descriptor + " of this stream.");
        Column[] next = nextRow();
        if (next == null)
            return false;
        ((RowImpl) row).assignColumns(next);
        return true;
    }

    @Override
    public void rewind() throws VarStoreException {
        checkOpen();
        reset();
    }

    @Override
    public void close() {
        closed = true;
    }

    private void checkOpen() throws VarStoreException {
        if (closed)
            throw new VarStoreException("RowStream closed.");
    }

    /**
     * Gets the next stored row.
     *
     * @return the columns of the row, or null if there are no more rows
     */
    protected abstract Column[] nextRow();

    /**
     * Restarts the stream from its first row.
     */
    protected abstract void reset();
}
