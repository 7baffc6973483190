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

package com.varstore.transaction;

import com.varstore.store.TransObject;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@link ChangesFrame} per open nesting level, the frame of level 1 at the
 * bottom. An object is recorded in at most one frame: the frame of the level
 * its current state is stamped with.
 */
class ChangesStack {
    private final List<ChangesFrame> frames = new ArrayList<>();

    int depth() {
        return frames.size();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }

    void push() {
        frames.add(new ChangesFrame());
    }

    ChangesFrame pop() {
        return frames.remove(frames.size() - 1);
    }

    ChangesFrame top() {
        return frames.get(frames.size() - 1);
    }

    /**
     * Removes every reference to the given object.
     *
     * @param obj the evicted object
     */
    void forget(TransObject<?> obj) {
        for (ChangesFrame frame : frames)
            frame.remove(obj);
    }
}
