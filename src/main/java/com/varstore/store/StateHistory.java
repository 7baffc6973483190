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
 * The history of a package or variable: a stack of states, most recent on
 * top, with at most one state per open nesting level. The top of the stack
 * is the current state of the object.
 *
 * @param <S> the state type
 */
public class StateHistory<S extends TransState> {
    // This is the initial number of states allowed,
    // and the number of additional states allocated when more are needed.
    final static int ALLOC_STATES = 4;
    private TransState[] states = new TransState[ALLOC_STATES];
    private int nstates;

    public boolean isEmpty() {
        return nstates == 0;
    }

    public int size() {
        return nstates;
    }

    /**
     * Pushes a new current state.
     *
     * @param state the state
     */
    public void push(S state) {
        if (nstates == states.length) {
            // need room for more states
            TransState[] newArray = new TransState[states.length + ALLOC_STATES];
            System.arraycopy(states, 0, newArray, 0, states.length);
            states = newArray;
        }
        states[nstates++] = state;
    }

    /**
     * Gets the current state.
     *
     * @return the current state, or null if the history is empty
     */
    public S getHead() {
        return get(0);
    }

    /**
     * Gets the state that preceded the current one.
     *
     * @return the previous state, or null if there is none
     */
    public S getPrevious() {
        return get(1);
    }

    /**
     * Gets a state by its distance from the top of the stack.
     *
     * @param depth 0 for the current state, 1 for the one before it, etc.
     * @return the state, or null if the history is not that deep
     */
    @SuppressWarnings("unchecked")
    public S get(int depth) {
        if (depth >= nstates)
            return null;
        return (S) states[nstates - 1 - depth];
    }

    /**
     * Removes the current state and releases it, making the previous state
     * current.
     */
    public void pop() {
        TransState state = states[--nstates];
        states[nstates] = null;
        state.release();
    }

    /**
     * Removes the state that preceded the current one and releases it.
     */
    public void removePrevious() {
        TransState state = states[nstates - 2];
        states[nstates - 2] = states[nstates - 1];
        states[--nstates] = null;
        state.release();
    }

    /**
     * Releases every state.
     */
    public void clear() {
        while (nstates > 0)
            pop();
    }

    /**
     * Gets the estimated number of bytes held by every state in the history.
     *
     * @return the size in bytes
     */
    public long storeSize() {
        long size = 0;
        for (int i = 0; i < nstates; i++)
            size += states[i].storeSize();
        return size;
    }
}
