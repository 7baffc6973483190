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

/**
 * The abstract class <code>AbstractColumn</code> is the superclass of all
 * column objects and provides common functions such as null value handling,
 * comparison and equality.
 * <p>
 * Null columns compare equal to each other and higher than all non-null
 * values, and all hash to the same value.
 *
 * @see NumberColumn
 * @see VarcharColumn
 */
public abstract class AbstractColumn implements Column {
    static final int NULL_HASH = 0;

    protected final char type;
    protected boolean nullIndicator;

    protected AbstractColumn(char type) {
        this.type = type;
        nullIndicator = true;
    }

    protected AbstractColumn(AbstractColumn column) {
        type = column.type;
        nullIndicator = column.nullIndicator;
    }

    @Override
    public char getType() {
        return type;
    }

    @Override
    public boolean isNull() {
        return nullIndicator;
    }

    @Override
    public void setNull(boolean nullIndicator) {
        this.nullIndicator = nullIndicator;
    }

    @Override
    public void assign(Column o) {
        AbstractColumn column = (AbstractColumn) o;
        nullIndicator = column.nullIndicator;
    }

    @Override
    public int storeSize() {
        return 1;
    }

    @Override
    public int compareTo(Object obj) {
        AbstractColumn col = (AbstractColumn) obj;
        if (nullIndicator || col.nullIndicator)
            return Boolean.compare(nullIndicator, col.nullIndicator);
        return _compareTo(col);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AbstractColumn && ((AbstractColumn) obj).type == type
                && compareTo(obj) == 0;
    }

    @Override
    public int hashCode() {
        return nullIndicator ? NULL_HASH : _hashCode();
    }

    // Debugging
    @Override
    public String toString() {
        if (nullIndicator)
            return "null";
        StringBuilder sbuf = new StringBuilder();
        _toString(sbuf);
        return sbuf.toString();
    }

    /**
     * Subclasses provide the type-specific compare without concern for the null
     * indicator.
     */
    protected abstract int _compareTo(Object obj);

    /**
     * Subclasses provide the type-specific hash of a non-null value.
     */
    protected abstract int _hashCode();

    /**
     * Subclasses provide the type-specific toString without concern for the
     * null indicator.
     */
    protected abstract void _toString(StringBuilder sbuf);
}
