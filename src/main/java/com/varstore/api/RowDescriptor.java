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

package com.varstore.api;

import com.varstore.core.Column;

import java.util.Arrays;

/**
 * <code>RowDescriptor</code> describes the shape of the rows stored in a
 * record variable: an ordered list of column names and their type codes. The
 * first column is the key column of the record variable.
 * <p>
 * Two descriptors are equal when they have the same column count, names and
 * types, which is what a record variable requires of every row stored in it.
 *
 * @see Datum
 * @see Row
 */
public final class RowDescriptor {
    private final String[] names;
    private final String types;

    /**
     * Creates a descriptor with the given column names and types.
     *
     * @param names the column names, one per column
     * @param types the string of column type codes, one per column
     * @throws TypeException if a type code is not recognized
     */
    public RowDescriptor(String[] names, String types) throws TypeException {
        if (names.length == 0)
            throw new IllegalArgumentException("A row must have at least one column.");
        if (names.length != types.length())
            throw new IllegalArgumentException("Expected " + names.length + " column types, got "
                                                       + types.length());
        for (int i = 0; i < types.length(); i++) {
            if (names[i] == null)
                throw new IllegalArgumentException("Column name " + i + " is null.");
            if (!Column.isValidType(types.charAt(i)))
                throw new TypeException("Unrecognized type: '" + types.charAt(i) + "'");
        }
        this.names = names.clone();
        this.types = types;
    }

    public int getColumnCount() {
        return names.length;
    }

    public String getName(int pos) {
        return names[pos];
    }

    public char getType(int pos) {
        return types.charAt(pos);
    }

    /**
     * Gets the type codes of all columns as a string.
     *
     * @return the column type codes
     */
    public String getTypes() {
        return types;
    }

    /**
     * Gets the type of the key column, which is always the first column.
     *
     * @return the key type code
     */
    public char getKeyType() {
        return types.charAt(0);
    }

    /**
     * Gets the position of the named column.
     *
     * @param name the column name
     * @return the column position, or -1 if there is no such column
     */
    public int indexOf(String name) {
        for (int i = 0; i < names.length; i++) {
            if (names[i].equals(name))
                return i;
        }
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof RowDescriptor))
            return false;
        RowDescriptor o = (RowDescriptor) obj;
        return types.equals(o.types) && Arrays.equals(names, o.names);
    }

    @Override
    public int hashCode() {
        return types.hashCode() * 31 + Arrays.hashCode(names);
    }

    @Override
    public String toString() {
        StringBuilder sbuf = new StringBuilder("(");
        for (int i = 0; i < names.length; i++) {
            if (i > 0)
                sbuf.append(", ");
            sbuf.append(names[i]).append(' ').append(types.charAt(i));
        }
        return sbuf.append(')').toString();
    }
}
