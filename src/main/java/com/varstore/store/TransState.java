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
 * A version of a package or variable in its history. Each state carries the
 * nesting level at which it became current and whether the object was valid
 * (not logically deleted) in that version.
 */
public abstract class TransState {
    private boolean valid;
    private int level;

    protected TransState(boolean valid, int level) {
        this.valid = valid;
        this.level = level;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    /**
     * Creates an independent copy of this state stamped with the given level.
     *
     * @param level the nesting level of the copy
     * @return the copy
     */
    public abstract TransState copyState(int level);

    /**
     * Frees the resources held by this state once it is dropped from its
     * history.
     */
    public abstract void release();

    /**
     * Gets the estimated number of bytes held by this state.
     *
     * @return the size in bytes
     */
    public abstract long storeSize();
}
