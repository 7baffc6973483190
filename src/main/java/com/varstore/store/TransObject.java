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

/**
 * A named object whose state is versioned by nesting level: a package or a
 * variable.
 *
 * @param <S> the state type
 */
public abstract class TransObject<S extends TransState> {
    private final String name;
    private final StateHistory<S> history = new StateHistory<>();
    private boolean deleted;

    protected TransObject(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public StateHistory<S> getHistory() {
        return history;
    }

    /**
     * Gets the current state of this object.
     *
     * @return the head of the history
     */
    public S getState() {
        return history.getHead();
    }

    /**
     * Checks whether this object currently exists, that is, it has a state
     * and it is not logically deleted.
     *
     * @return true if valid
     */
    public boolean isValid() {
        S state = history.getHead();
        return state != null && state.isValid();
    }

    /**
     * Checks whether this object has been evicted from the registry. An
     * evicted object is never used again.
     *
     * @return true if evicted
     */
    public boolean isDeleted() {
        return deleted;
    }

    void markDeleted() {
        deleted = true;
        history.clear();
    }
}
