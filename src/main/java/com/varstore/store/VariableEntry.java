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
 * A package variable. The type, the record flag and the kind are fixed by the
 * first declaration of the variable and stay fixed until it is evicted.
 */
public class VariableEntry extends TransObject<VarState> {
    /**
     * Type code reported for record variables.
     */
    public static final char RECORD_TYPE = 'R';

    private final PackageEntry owner;
    private final char type;
    private final boolean record;
    private final VariableKind kind;

    VariableEntry(PackageEntry owner, String name, char type, boolean record, VariableKind kind) {
        super(name);
        this.owner = owner;
        this.type = record ? RECORD_TYPE : type;
        this.record = record;
        this.kind = kind;
    }

    public PackageEntry getPackage() {
        return owner;
    }

    public char getType() {
        return type;
    }

    public boolean isRecord() {
        return record;
    }

    public VariableKind getKind() {
        return kind;
    }

    public boolean isTransactional() {
        return kind.isTransactional();
    }

    public Value getValue() {
        return getState().getValue();
    }

    @Override
    public String toString() {
        return owner.getName() + "." + getName();
    }
}
