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
 * Raised when a row does not have exactly the column names and types fixed by
 * the first row stored in a record variable.
 */
public class ShapeMismatchException extends VarStoreException {
    public ShapeMismatchException(String name, RowDescriptor expected, RowDescriptor actual) {
        super("new record structure " + actual + " differs from variable \""
                      + name + "\" structure " + expected, name);
    }
}
