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

import java.util.Objects;

/**
 * A package variable as reported by {@link Session#listPackagesAndVariables}.
 */
public final class VariableInfo {
    private final String packageName;
    private final String variableName;
    private final boolean transactional;

    public VariableInfo(String packageName, String variableName, boolean transactional) {
        this.packageName = packageName;
        this.variableName = variableName;
        this.transactional = transactional;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getVariableName() {
        return variableName;
    }

    public boolean isTransactional() {
        return transactional;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof VariableInfo))
            return false;
        VariableInfo o = (VariableInfo) obj;
        return packageName.equals(o.packageName) && variableName.equals(o.variableName)
                && transactional == o.transactional;
    }

    @Override
    public int hashCode() {
        return Objects.hash(packageName, variableName, transactional);
    }

    @Override
    public String toString() {
        return packageName + "." + variableName + (transactional ? " TRANSACTIONAL" : "");
    }
}
