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

package com.varstore.store;

import com.varstore.core.Column;

/**
 * Hash key of a stored row: an immutable copy of its key column. Hashing and
 * comparison come from the column class bound to the key type, so null keys
 * hash alike and match only each other.
 */
final class RecordKey {
    private final Column key;
    private final int hash;

    RecordKey(Column key) {
        this.key = key.copy();
        this.hash = key.hashCode();
    }

    Column getColumn() {
        return key;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RecordKey && key.equals(((RecordKey) obj).key);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
