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
 * <code>VarStoreException</code> is the superclass of all failures reported to
 * callers of the {@link Session} interface. A failed call never leaves the
 * store partially modified.
 * <p>
 * Where a failure concerns a specific package or variable, its name can be
 * obtained from {@link #getObjectName}.
 */
public class VarStoreException extends Exception {
    private final String objectName;

    public VarStoreException(String message) {
        this(message, (String) null);
    }

    public VarStoreException(String message, String objectName) {
        super(message);
        this.objectName = objectName;
    }

    public VarStoreException(String message, Throwable cause) {
        super(message, cause);
        this.objectName = null;
    }

    public VarStoreException(Throwable cause) {
        super(cause);
        this.objectName = null;
    }

    /**
     * Gets the name of the package or variable the failure refers to.
     *
     * @return the offending object name, or null if the failure does not
     * refer to a named object
     */
    public String getObjectName() {
        return objectName;
    }
}
