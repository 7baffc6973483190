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

import com.varstore.store.PackageEntry;
import com.varstore.store.TransObject;
import com.varstore.store.VariableEntry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The packages and transactional variables whose current state belongs to
 * one nesting level. Variables and packages are kept apart so that variables
 * can be processed first.
 */
class ChangesFrame {
    private final Set<VariableEntry> variables = new LinkedHashSet<>();
    private final Set<PackageEntry> packages = new LinkedHashSet<>();

    /**
     * Adds an object to this frame.
     *
     * @param obj a package or variable
     * @return true if the object was not already in the frame
     */
    boolean add(TransObject<?> obj) {
        if (obj instanceof VariableEntry)
            return variables.add((VariableEntry) obj);
        return packages.add((PackageEntry) obj);
    }

    void remove(TransObject<?> obj) {
        if (!variables.remove(obj))
            packages.remove(obj);
    }

    List<VariableEntry> getVariables() {
        return new ArrayList<>(variables);
    }

    List<PackageEntry> getPackages() {
        return new ArrayList<>(packages);
    }

    int size() {
        return variables.size() + packages.size();
    }
}
