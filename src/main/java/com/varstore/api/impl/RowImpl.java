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

import com.varstore.api.Datum;
import com.varstore.api.Row;
import com.varstore.api.RowDescriptor;
import com.varstore.api.TypeException;
import com.varstore.core.Column;

public class RowImpl implements Row {

    private final RowDescriptor descriptor;
    private final Column[] cols;

    /**
     * Constructs a row of the specified shape with all columns null.
     *
     * @param descriptor   the shape of the row
     * @param bigMaxLength the maximum byte length of big string and byte array
     *                     columns
     * @throws TypeException if a column type is not recognized
     */
    RowImpl(RowDescriptor descriptor, int bigMaxLength) throws TypeException {
        this.descriptor = descriptor;
        cols = Column.createColumns(descriptor.getTypes(), bigMaxLength);
    }

    /**
     * Constructs a row as a copy of another row.
     *
     * @param row the row to be copied into this one
     */
    RowImpl(RowImpl row) {
        descriptor = row.descriptor;
        cols = new Column[row.cols.length];
        for (int i = 0; i < cols.length; i++)
            cols[i] = row.cols[i].copy();
    }

    /**
     * Gets the columns backing this row.
     *
     * @return the columns
     */
    Column[] getColumns() {
        return cols;
    }

    /**
     * Copies stored columns into this row.
     *
     * @param row the stored columns, of the same shape
     */
    void assignColumns(Column[] row) {
        for (int i = 0; i < cols.length; i++)
            cols[i].assign(row[i]);
    }

    @Override
    public RowDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public int getColumnCount() {
        return cols.length;
    }

    @Override
    public Row copyRow() {
        return new RowImpl(this);
    }

    @Override
    public void assignRow(Row row) {
        RowImpl o = (RowImpl) row;
        if (!descriptor.equals(o.descriptor))
            throw new IllegalArgumentException("Row " + o.descriptor + " does not match " + descriptor);
        assignColumns(o.cols);
    }

    @Override
    public Datum getColumn(int pos) {
        return cols[pos];
    }

    @Override
    public Datum getKey() {
        return cols[0];
    }

    @Override
    public boolean isNull(int pos) {
        return cols[pos].isNull();
    }

    @Override
    public void setNull(int pos, boolean val) {
        cols[pos].setNull(val);
    }

    @Override
    public String getString(int pos) throws TypeException {
        return cols[pos].getString();
    }

    @Override
    public byte getByte(int pos) throws TypeException {
        return cols[pos].getByte();
    }

    @Override
    public short getShort(int pos) throws TypeException {
        return cols[pos].getShort();
    }

    @Override
    public int getInt(int pos) throws TypeException {
        return cols[pos].getInt();
    }

    @Override
    public long getLong(int pos) throws TypeException {
        return cols[pos].getLong();
    }

    @Override
    public double getDouble(int pos) throws TypeException {
        return cols[pos].getDouble();
    }

    @Override
    public byte[] getBytes(int pos) throws TypeException {
        return cols[pos].getBytes();
    }

    @Override
    public void setString(int pos, String val) throws TypeException {
        cols[pos].setString(val);
    }

    @Override
    public void setByte(int pos, byte val) throws TypeException {
        cols[pos].setByte(val);
    }

    @Override
    public void setShort(int pos, short val) throws TypeException {
        cols[pos].setShort(val);
    }

    @Override
    public void setInt(int pos, int val) throws TypeException {
        cols[pos].setInt(val);
    }

    @Override
    public void setLong(int pos, long val) throws TypeException {
        cols[pos].setLong(val);
    }

    @Override
    public void setDouble(int pos, double val) throws TypeException {
        cols[pos].setDouble(val);
    }

    @Override
    public void setBytes(int pos, byte[] val) throws TypeException {
        cols[pos].setBytes(val);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof RowImpl))
            return false;
        RowImpl o = (RowImpl) obj;
        if (!descriptor.equals(o.descriptor))
            return false;
        for (int i = 0; i < cols.length; i++) {
            if (!cols[i].equals(o.cols[i]))
                return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Column col : cols) hash += col.hashCode();
        return hash;
    }

    // Debugging
    @Override
    public String toString() {
        StringBuilder sbuf = new StringBuilder();
        for (int i = 0; i < cols.length; i++) {
            sbuf.append(cols[i]);
            if (i < cols.length - 1)
                sbuf.append(",");
        }
        return sbuf.toString();
    }
}
