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

package com.varstore.core;

import com.varstore.api.Datum;
import com.varstore.api.TypeException;

/**
 * <code>Column</code> is the internal representation of a {@link Datum}, used
 * both for scalar variable values and for the columns of stored rows.
 * Columns can be copied and assigned so that every history state owns an
 * independent value, and report the size of the memory they hold.
 */
public interface Column extends Datum, Comparable<Object> {
    /**
     * Maximum byte length of the small types 's' and 'a'.
     */
    int SMALL_MAX_LENGTH = 255;

    /**
     * Constructs a column of the specified type, initially null.
     *
     * @param type         the type code
     * @param bigMaxLength the maximum byte length of the big types 'S' and 'A'
     * @return the new column
     * @throws TypeException if the type code is not recognized
     */
    static Column createColumn(char type, int bigMaxLength) throws TypeException {
        switch (type) {
            case 's':
            case 'a':
                return new VarcharColumn(type, SMALL_MAX_LENGTH);
            case 'S':
            case 'A':
                return new VarcharColumn(type, bigMaxLength);
            case 'b':
            case 'i':
            case 'I':
            case 'l':
            case 'd':
                return new NumberColumn(type);
            default:
                throw new TypeException("Unrecognized type: '" + type + "'");
        }
    }

    /**
     * Constructs an array of columns from the specified list of column types.
     *
     * @param columnTypes  the string of column type codes
     * @param bigMaxLength the maximum byte length of the big types
     * @return the new columns
     * @throws TypeException if a type code is not recognized
     */
    static Column[] createColumns(String columnTypes, int bigMaxLength) throws TypeException {
        Column[] cols = new Column[columnTypes.length()];
        for (int i = 0; i < cols.length; i++)
            cols[i] = createColumn(columnTypes.charAt(i), bigMaxLength);
        return cols;
    }

    /**
     * Checks whether the given type code is recognized.
     *
     * @param type the type code
     * @return true if the type is valid
     */
    static boolean isValidType(char type) {
        switch (type) {
            case 's':
            case 'S':
            case 'a':
            case 'A':
            case 'b':
            case 'i':
            case 'I':
            case 'l':
            case 'd':
                return true;
            default:
                return false;
        }
    }

    /**
     * Checks whether values of the given type hold a payload by reference,
     * which must be deep-copied with the value.
     *
     * @param type the type code
     * @return true for the string and byte array types
     */
    static boolean isByReference(char type) {
        return type == 's' || type == 'S' || type == 'a' || type == 'A';
    }

    /**
     * Creates an independent copy of this column and its value.
     *
     * @return the copy
     */
    Column copy();

    /**
     * Copies the value of the given column, which must be of the same type,
     * into this one.
     *
     * @param column the column to be copied
     */
    void assign(Column column);

    /**
     * Gets the estimated number of bytes held by this column.
     *
     * @return the size in bytes
     */
    int storeSize();
}
