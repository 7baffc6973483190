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

/**
 * Row is an array of column values that can be stored in or fetched from a
 * record variable.
 * <p>
 * A <code>Row</code> is allocated with a {@link RowDescriptor} through
 * {@link Session#allocateRow} or {@link RowStream#allocateRow}, and keeps that
 * shape for its whole life. The first column is the key of the row.
 * <p>
 * <code>Row</code> provides various type-specific methods to get/set column
 * values by the absolute positions of the columns within the row.
 * <code>Row</code> will implicitly cast values where possible or throw a
 * TypeException if the type of the column at the specified position is
 * incompatible with the method type. In general, if a column is null then
 * casting to a string will return an empty string and casting to a number will
 * return zero. If a column that is null is set with some non-null value, then
 * the column is implicitly non-null.
 *
 * @see Datum
 * @see RowDescriptor
 */
public interface Row {
    /**
     * Gets the descriptor this row was allocated with.
     *
     * @return the row descriptor
     */
    RowDescriptor getDescriptor();

    /**
     * Gets the number of columns in this row.
     *
     * @return the number of columns in this row
     */
    int getColumnCount();

    /**
     * Creates a copy of this row
     *
     * @return a copy of this row
     */
    Row copyRow();

    /**
     * Copies the given row, which must have the same descriptor, into this one
     *
     * @param row the row to be copied into this one
     */
    void assignRow(Row row);

    /**
     * Gets the column at the given position as a <code>Datum</code>. The
     * returned datum is backed by this row.
     *
     * @param pos the position of the column
     * @return the column
     */
    Datum getColumn(int pos);

    /**
     * Gets the key column of this row, which is always the first one.
     *
     * @return the key column
     */
    Datum getKey();

    boolean isNull(int pos);

    void setNull(int pos, boolean val);

    String getString(int pos) throws TypeException;

    byte getByte(int pos) throws TypeException;

    short getShort(int pos) throws TypeException;

    int getInt(int pos) throws TypeException;

    long getLong(int pos) throws TypeException;

    double getDouble(int pos) throws TypeException;

    byte[] getBytes(int pos) throws TypeException;

    void setString(int pos, String val) throws TypeException;

    void setByte(int pos, byte val) throws TypeException;

    void setShort(int pos, short val) throws TypeException;

    void setInt(int pos, int val) throws TypeException;

    void setLong(int pos, long val) throws TypeException;

    void setDouble(int pos, double val) throws TypeException;

    void setBytes(int pos, byte[] val) throws TypeException;
}
