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
 * <code>Datum</code> holds a single typed scalar value, or null. The type of a
 * <code>Datum</code> is fixed when it is allocated and is identified by one of
 * the following codes:
 * <ul>
 * <li>s : small variable-length string (&lt;= 255 maximum UTF-8 bytes)
 * <li>S : big variable-length string (&gt; 255 maximum UTF-8 bytes)
 * <li>b : byte
 * <li>i : short integer (2 bytes)
 * <li>I : integer (4 bytes)
 * <li>l : long integer (8 bytes)
 * <li>d : double precision float (8 byte)
 * <li>a : small variable-length byte array (&lt;= 255 maximum bytes)
 * <li>A : big variable-length byte array (&gt; 255 maximum bytes)
 * </ul>
 * <p>
 * <code>Datum</code> will implicitly cast values where possible or throw a
 * TypeException if its type is incompatible with the method type. If a datum
 * is null then casting to a string will return an empty string and casting to
 * a number will return zero. Setting a non-null value makes the datum
 * implicitly non-null.
 * <p>
 * Values are always copied when a <code>Datum</code> is stored in or fetched
 * from a {@link Session}, so a datum never aliases a stored value.
 *
 * @see Session#allocateDatum
 */
public interface Datum {
    /**
     * Gets the type code of this datum.
     *
     * @return the type code
     */
    char getType();

    /**
     * Gets the null value indicator for this datum.
     *
     * @return true if the datum is null, false otherwise
     */
    boolean isNull();

    /**
     * Sets the value for this datum to be null if <code>nullIndicator</code>
     * is true or to be not-null if <code>nullIndicator</code> is false.
     *
     * @param nullIndicator indicates that the datum should be set to null if
     *                      true, not-null if false
     */
    void setNull(boolean nullIndicator);

    /**
     * Gets the value of this datum cast as a <code>String</code>
     *
     * @return the value of the datum cast as a <code>String</code>
     * @throws TypeException if the type of this datum is incompatible with the
     *                       return type
     */
    String getString() throws TypeException;

    /**
     * Sets the value of this datum cast from a <code>String</code> argument.
     *
     * @param val the value of the datum represented as a <code>String</code>
     * @throws TypeException if the type of this datum is incompatible with the
     *                       argument type, or the string is too long
     */
    void setString(String val) throws TypeException;

    byte getByte() throws TypeException;

    void setByte(byte val) throws TypeException;

    short getShort() throws TypeException;

    void setShort(short val) throws TypeException;

    int getInt() throws TypeException;

    void setInt(int val) throws TypeException;

    long getLong() throws TypeException;

    void setLong(long val) throws TypeException;

    double getDouble() throws TypeException;

    void setDouble(double val) throws TypeException;

    /**
     * Gets the value of this datum cast as an array of bytes.
     *
     * @return the value of the datum cast as an array of bytes.
     * @throws TypeException if the type of this datum is incompatible with the
     *                       return type
     */
    byte[] getBytes() throws TypeException;

    /**
     * Sets the value of this datum cast from an array of bytes. This will
     * always work to set the value of the datum if the argument is the value
     * returned by {@link #getBytes}.
     *
     * @param val the value of the datum represented as an array of bytes.
     * @throws TypeException if the type of this datum is incompatible with the
     *                       argument type
     */
    void setBytes(byte[] val) throws TypeException;
}
