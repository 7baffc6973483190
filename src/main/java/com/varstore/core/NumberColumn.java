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

import java.nio.ByteBuffer;

/**
 * Column of one of the by-value numeric types 'b', 'i', 'I', 'l' and 'd'.
 * Integral values are held in a long and doubles in a double. Values are
 * never truncated: setting a value the column type cannot hold, or getting a
 * value the requested type cannot hold, fails with a TypeException.
 */
class NumberColumn extends AbstractColumn {
    private long li;
    private double fp;

    NumberColumn(char type) {
        super(type);
    }

    NumberColumn(NumberColumn nc) {
        super(nc);
        li = nc.li;
        fp = nc.fp;
    }

    @Override
    public String getString() {
        if (isNull())
            return "0";

        if (type == 'd')
            return Double.toString(fp);
        else
            return Long.toString(li);
    }

    @Override
    public void setString(String string) throws TypeException {
        if (string == null) {
            setNull(true);
            return;
        }
        try {
            switch (type) {
                case 'b':
                    li = Byte.parseByte(string);
                    break;
                case 'i':
                    li = Short.parseShort(string);
                    break;
                case 'I':
                    li = Integer.parseInt(string);
                    break;
                case 'l':
                    li = Long.parseLong(string);
                    break;
                case 'd':
                    fp = Double.parseDouble(string);
                    break;
            }
        } catch (NumberFormatException nfe) {
            throw new TypeException(nfe);
        }
        setNull(false);
    }

    @Override
    public byte getByte() throws TypeException {
        return (byte) getChecked(Byte.MIN_VALUE, Byte.MAX_VALUE);
    }

    @Override
    public void setByte(byte val) throws TypeException {
        setLong(val);
    }

    @Override
    public short getShort() throws TypeException {
        return (short) getChecked(Short.MIN_VALUE, Short.MAX_VALUE);
    }

    @Override
    public void setShort(short val) throws TypeException {
        setLong(val);
    }

    @Override
    public int getInt() throws TypeException {
        return (int) getChecked(Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Override
    public void setInt(int val) throws TypeException {
        setLong(val);
    }

    @Override
    public long getLong() throws TypeException {
        if (isNull())
            return 0;

        if (type == 'd')
            return toLong(fp);
        else
            return li;
    }

    @Override
    public void setLong(long val) throws TypeException {
        if (type == 'd') {
            if (!isExactDouble(val))
                throw new TypeException("Value " + val + " can not be represented exactly as a double.");
            fp = val;
        } else {
            li = checkRange(val);
        }
        setNull(false);
    }

    @Override
    public double getDouble() throws TypeException {
        if (isNull())
            return 0.0;

        if (type == 'd')
            return fp;
        if (!isExactDouble(li))
            throw new TypeException("Value " + li + " can not be represented exactly as a double.");
        return li;
    }

    @Override
    public void setDouble(double val) throws TypeException {
        if (type == 'd')
            fp = val;
        else
            li = checkRange(toLong(val));
        setNull(false);
    }

    @Override
    public byte[] getBytes() {
        if (isNull())
            return new byte[0];

        ByteBuffer bb = ByteBuffer.allocate(valueSize());
        switch (type) {
            case 'b':
                bb.put((byte) li);
                break;
            case 'i':
                bb.putShort((short) li);
                break;
            case 'I':
                bb.putInt((int) li);
                break;
            case 'l':
                bb.putLong(li);
                break;
            case 'd':
                bb.putDouble(fp);
                break;
        }
        return bb.array();
    }

    @Override
    public void setBytes(byte[] val) throws TypeException {
        if (val == null || val.length == 0) {
            setNull(true);
            return;
        }
        if (val.length != valueSize())
            throw new TypeException("Expected " + valueSize() + " bytes for type '" + type
                                            + "' but got " + val.length + ".");

        ByteBuffer bb = ByteBuffer.wrap(val);
        switch (type) {
            case 'b':
                li = bb.get();
                break;
            case 'i':
                li = bb.getShort();
                break;
            case 'I':
                li = bb.getInt();
                break;
            case 'l':
                li = bb.getLong();
                break;
            case 'd':
                fp = bb.getDouble();
                break;
        }
        setNull(false);
    }

    /**
     * Gets the value as a long, checking that it fits the requested width.
     */
    private long getChecked(long min, long max) throws TypeException {
        long val = getLong();
        if (val < min || val > max)
            throw new TypeException("Value " + val + " out of range of the requested type.");
        return val;
    }

    /**
     * Converts a double holding an integral value within the range of long.
     */
    private static long toLong(double val) throws TypeException {
        // 2^63 itself is out of range
        if (Double.isNaN(val) || val != Math.floor(val) || val < -0x1p63 || val >= 0x1p63)
            throw new TypeException("Value " + val + " is not an integral number within range.");
        return (long) val;
    }

    private static boolean isExactDouble(long val) {
        double d = val;
        return d < 0x1p63 && (long) d == val;
    }

    private long checkRange(long val) throws TypeException {
        long min, max;
        switch (type) {
            case 'b':
                min = Byte.MIN_VALUE;
                max = Byte.MAX_VALUE;
                break;
            case 'i':
                min = Short.MIN_VALUE;
                max = Short.MAX_VALUE;
                break;
            case 'I':
                min = Integer.MIN_VALUE;
                max = Integer.MAX_VALUE;
                break;
            default:
                return val;
        }
        if (val < min || val > max)
            throw new TypeException("Value " + val + " out of range for type '" + type + "'");
        return val;
    }

    private int valueSize() {
        switch (type) {
            case 'b':
                return 1;
            case 'i':
                return 2;
            case 'I':
                return 4;
            default:
                return 8;
        }
    }

    @Override
    public void assign(Column o) {
        super.assign(o);
        NumberColumn nc = (NumberColumn) o;
        li = nc.li;
        fp = nc.fp;
    }

    @Override
    public Column copy() {
        return new NumberColumn(this);
    }

    @Override
    public int storeSize() {
        int size = super.storeSize();
        if (!isNull())
            size += valueSize();
        return size;
    }

    @Override
    protected int _compareTo(Object obj) {
        NumberColumn o = (NumberColumn) obj;
        if (type == 'd')
            return Double.compare(fp, o.fp);
        else
            return Long.compare(li, o.li);
    }

    @Override
    protected int _hashCode() {
        if (type == 'd')
            return Double.hashCode(fp);
        else
            return Long.hashCode(li);
    }

    @Override
    protected void _toString(StringBuilder sbuf) {
        if (type == 'd')
            sbuf.append(fp);
        else
            sbuf.append(li);
    }
}
