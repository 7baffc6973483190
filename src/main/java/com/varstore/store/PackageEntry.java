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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A package: a named group of variables. Regular and transactional variables
 * share one name space; the kind of each is recorded on the variable.
 */
public class PackageEntry extends TransObject<PackState> {
    private final Map<String, VariableEntry> variables;
    private int regularCount;

    PackageEntry(String name, int initialCapacity) {
        super(name);
        variables = new HashMap<>(initialCapacity);
    }

    /**
     * Looks up a variable by name, whether valid or not.
     *
     * @param name the variable name
     * @return the variable, or null if it is not registered
     */
    public VariableEntry getVariable(String name) {
        return variables.get(name);
    }

    VariableEntry addVariable(String name, char type, boolean record, VariableKind kind) {
        VariableEntry var = new VariableEntry(this, name, type, record, kind);
        variables.put(name, var);
        if (kind == VariableKind.REGULAR)
            regularCount++;
        return var;
    }

    void evictVariable(VariableEntry var) {
        if (variables.remove(var.getName()) != null && var.getKind() == VariableKind.REGULAR)
            regularCount--;
        var.markDeleted();
    }

    /**
     * Evicts every regular variable.
     */
    void clearRegular() {
        Iterator<VariableEntry> it = variables.values().iterator();
        while (it.hasNext()) {
            VariableEntry var = it.next();
            if (var.getKind() == VariableKind.REGULAR) {
                it.remove();
                var.markDeleted();
            }
        }
        regularCount = 0;
    }

    /**
     * Gets the number of regular variables registered in this package.
     *
     * @return the count
     */
    public int getRegularCount() {
        return regularCount;
    }

    /**
     * Gets all variables of this package, valid or not.
     *
     * @return a snapshot of the variables
     */
    public List<VariableEntry> getVariables() {
        return new ArrayList<>(variables.values());
    }

    /**
     * Gets the transactional variables of this package, valid or not.
     *
     * @return a snapshot of the transactional variables
     */
    public List<VariableEntry> getTransactionalVariables() {
        List<VariableEntry> list = new ArrayList<>();
        for (VariableEntry var : variables.values()) {
            if (var.isTransactional())
                list.add(var);
        }
        return list;
    }

    @Override
    void markDeleted() {
        for (VariableEntry var : variables.values())
            var.markDeleted();
        variables.clear();
        regularCount = 0;
        super.markDeleted();
    }

    @Override
    public String toString() {
        return getName();
    }
}
