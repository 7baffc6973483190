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

import com.varstore.api.TypeException;

import java.nio.charset.StandardCharsets;

/**
 * Column of one of the by-reference types: strings 's' and 'S' held as UTF-8
 * bytes, and byte arrays 'a' and 'A'. The payload is cloned whenever the
 * column is copied or assigned.
 */
public class VarcharColumn extends AbstractColumn {
    private byte[] bytes;
    private int length;
    private final int maxLength;

    /**
     * Creates a column of the given type with the specified maximum byte
     * length. The value of the column is initially set to null.
     *
     * @param type      one of 's', 'S', 'a' or 'A'
     * @param maxLength the maximum byte length
     */
    public VarcharColumn(char type, int maxLength) {
        super(type);
        this.maxLength = maxLength;
    }

    /**
     * Creates this column as a copy of the specified column and its value.
     *
     * @param vc the column to be copied into this one
     */
    public VarcharColumn(VarcharColumn vc) {
        super(vc);
        if (!vc.isNull())
            bytes = vc.getBytes();
        length = vc.length;
        maxLength = vc.maxLength;
    }

    @Override
    public void assign(Column o) {
        super.assign(o);
        VarcharColumn vc = (VarcharColumn) o;
        bytes = vc.isNull() ? null : vc.getBytes();
        length = vc.length;
    }

    public int getLength() {
        return length;
    }

    public int getMaxLength() {
        return maxLength;
    }

    @Override
    public String getString() {
        if (isNull())
            return "";
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    @Override
    public void setString(String string) throws TypeException {
        if (string == null) {
            setNull(true);
            return;
        }
        byte[] tmp = string.getBytes(StandardCharsets.UTF_8);
        if (tmp.length > maxLength)
            throw new TypeException("String too long.");

        bytes = tmp;
        length = tmp.length;

        setNull(false);
    }

    @Override
    public byte[] getBytes() {
        if (isNull())
            return new byte[0];
        byte[] r = new byte[length];
        System.arraycopy(bytes, 0, r, 0, length);
        return r;
    }

    @Override
    public void setBytes(byte[] tmp) throws TypeException {
        if (tmp == null) {
            setNull(true);
            return;
        }
        if (tmp.length > maxLength)
            throw new TypeException("Byte array too long.");

        length = tmp.length;
        bytes = tmp.clone();

        setNull(false);
    }

    @Override
    public void setNull(boolean isNull) {
        super.setNull(isNull);
        if (isNull) {
            bytes = null;
            length = 0;
        } else if (bytes == null) {
            bytes = new byte[0];
        }
    }

    @Override
    public Column copy() {
        return new VarcharColumn(this);
    }

    @Override
    public int storeSize() {
        int size = super.storeSize();
        if (isNull())
            return size;

        return size + length + (maxLength > SMALL_MAX_LENGTH ? 4 : 1);
    }

    @Override
    protected int _compareTo(Object obj) {
        VarcharColumn o = (VarcharColumn) obj;
        int l = Math.min(length, o.length);
        for (int i = 0; i < l; i++) {
            int diff = (bytes[i] & 0xff) - (o.bytes[i] & 0xff);
            if (diff != 0)
                return diff;
        }
        return length - o.length;
    }

    @Override
    protected int _hashCode() {
        int hash = 5381;
        for (int i = 0; i < length; i++)
            hash = ((hash << 5) + hash) + bytes[i];
        return hash;
    }

    @Override
    public byte getByte() throws TypeException {
        throw notANumber();
    }

    @Override
    public void setByte(byte val) throws TypeException {
        throw notANumber();
    }

    @Override
    public short getShort() throws TypeException {
        throw notANumber();
    }

    @Override
    public void setShort(short val) throws TypeException {
        throw notANumber();
    }

    @Override
    public int getInt() throws TypeException {
        throw notANumber();
    }

    @Override
    public void setInt(int val) throws TypeException {
        throw notANumber();
    }

    @Override
    public long getLong() throws TypeException {
        throw notANumber();
    }

    @Override
    public void setLong(long val) throws TypeException {
        throw notANumber();
    }

    @Override
    public double getDouble() throws TypeException {
        throw notANumber();
    }

    @Override
    public void setDouble(double val) throws TypeException {
        throw notANumber();
    }

    private TypeException notANumber() {
        return new TypeException("Column of type '" + type + "' is not a number.");
    }

    @Override
    protected void _toString(StringBuilder sbuf) {
        sbuf.append(new String(bytes, 0, length, StandardCharsets.UTF_8));
    }
}
