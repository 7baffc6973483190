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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <code>KeyArray</code> is an array of key values used to look up several rows
 * of a record variable at once with {@link Session#selectByKeys}. Only
 * one-dimensional arrays can be searched.
 */
public final class KeyArray {
    private final int dimensions;
    private final List<Datum> elements;

    /**
     * Creates a key array with the given number of dimensions whose elements
     * are listed in storage order.
     *
     * @param dimensions the number of dimensions
     * @param elements   the key values
     */
    public KeyArray(int dimensions, List<Datum> elements) {
        if (dimensions < 1)
            throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
        this.dimensions = dimensions;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    /**
     * Creates a one-dimensional key array.
     *
     * @param keys the key values
     * @return the key array
     */
    public static KeyArray of(Datum... keys) {
        return new KeyArray(1, Arrays.asList(keys));
    }

    public int getDimensions() {
        return dimensions;
    }

    public List<Datum> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }
}
