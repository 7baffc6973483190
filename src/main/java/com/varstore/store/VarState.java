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
 * Variable version: validity plus the value of the variable, which is owned
 * by this state and deep-copied into every newer state.
 */
public class VarState extends TransState {
    static final int OVERHEAD = 24;

    private Value value;

    public VarState(Value value, int level) {
        super(true, level);
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    public void setValue(Value value) {
        if (this.value != null)
            this.value.release();
        this.value = value;
    }

    @Override
    public VarState copyState(int level) {
        VarState state = new VarState(value.copyValue(), level);
        state.setValid(isValid());
        return state;
    }

    @Override
    public void release() {
        if (value != null) {
            value.release();
            value = null;
        }
    }

    @Override
    public long storeSize() {
        return OVERHEAD + (value == null ? 0 : value.storeSize());
    }
}
