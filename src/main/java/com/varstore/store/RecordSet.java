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

import com.varstore.api.NoSuchRowException;
import com.varstore.api.RowDescriptor;
import com.varstore.core.Column;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The value of a record variable: a set of rows of a fixed shape indexed by
 * their first column. Inserting a row whose key is already present replaces
 * that row in place.
 * <p>
 * Stored rows are never modified; every insert or update stores a fresh copy
 * of the caller's row, so a list of rows taken by {@link #rows} stays
 * consistent while the set changes.
 */
public class RecordSet implements Value {
    static final int ROW_OVERHEAD = 16;

    private final RowDescriptor descriptor;
    private final Map<RecordKey, Column[]> index;

    public RecordSet(RowDescriptor descriptor) {
        this(descriptor, 16);
    }

    RecordSet(RowDescriptor descriptor, int capacity) {
        this.descriptor = descriptor;
        this.index = new LinkedHashMap<>(capacity);
    }

    public RowDescriptor getDescriptor() {
        return descriptor;
    }

    public int size() {
        return index.size();
    }

    /**
     * Inserts a copy of the given row, replacing any row with the same key.
     *
     * @param row the columns of the row
     */
    public void insert(Column[] row) {
        index.put(new RecordKey(row[0]), copyRow(row));
    }

    /**
     * Replaces the row with the same key as the given row.
     *
     * @param row the columns of the row
     * @throws NoSuchRowException if no row has that key
     */
    public void update(Column[] row) throws NoSuchRowException {
        RecordKey key = new RecordKey(row[0]);
        if (!index.containsKey(key))
            throw new NoSuchRowException(null);
        index.put(key, copyRow(row));
    }

    /**
     * Deletes the row with the given key.
     *
     * @param key the key, possibly null
     * @return true if a row was deleted
     */
    public boolean delete(Column key) {
        return index.remove(new RecordKey(key)) != null;
    }

    public boolean containsKey(Column key) {
        return index.containsKey(new RecordKey(key));
    }

    /**
     * Gets the stored row with the given key. The returned columns must not
     * be modified.
     *
     * @param key the key, possibly null
     * @return the row, or null if there is none
     */
    public Column[] get(Column key) {
        return index.get(new RecordKey(key));
    }

    /**
     * Gets the stored rows as of now, in insertion order. The returned
     * columns must not be modified.
     *
     * @return the rows
     */
    public List<Column[]> rows() {
        return new ArrayList<>(index.values());
    }

    @Override
    public RecordSet copyValue() {
        RecordSet copy = new RecordSet(descriptor, Math.max(16, index.size() * 2));
        for (Column[] row : index.values())
            copy.insert(row);
        return copy;
    }

    @Override
    public void release() {
        index.clear();
    }

    @Override
    public long storeSize() {
        long size = 0;
        for (Column[] row : index.values()) {
            size += ROW_OVERHEAD;
            for (Column col : row)
                size += col.storeSize();
        }
        return size;
    }

    static Column[] copyRow(Column[] row) {
        Column[] copy = new Column[row.length];
        for (int i = 0; i < row.length; i++)
            copy[i] = row[i].copy();
        return copy;
    }
}
