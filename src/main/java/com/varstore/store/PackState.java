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
 * Package version: validity plus the number of valid transactional variables
 * held by the package.
 */
public class PackState extends TransState {
    static final int OVERHEAD = 16;

    private int transVarNum;

    public PackState(boolean valid, int transVarNum, int level) {
        super(valid, level);
        this.transVarNum = transVarNum;
    }

    public int getTransVarNum() {
        return transVarNum;
    }

    public void setTransVarNum(int transVarNum) {
        this.transVarNum = transVarNum;
    }

    @Override
    public PackState copyState(int level) {
        return new PackState(isValid(), transVarNum, level);
    }

    @Override
    public void release() {
    }

    @Override
    public long storeSize() {
        return OVERHEAD;
    }

    @Override
    public String toString() {
        return "PackState[valid=" + isValid() + ", transVarNum=" + transVarNum
                + ", level=" + getLevel() + "]";
    }
}
