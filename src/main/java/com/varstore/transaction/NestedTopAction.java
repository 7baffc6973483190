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

import com.varstore.api.Savepoint;

/**
 * NestedTopAction records the nesting level opened within a transaction so
 * that the transaction can later commit or roll back to the point at which
 * this NestedTopAction was created.
 */
public class NestedTopAction implements Savepoint {
    private final LocalTransactionHost host;
    private final long transId;
    private final int level;

    NestedTopAction(LocalTransactionHost host, long transId, int level) {
        this.host = host;
        this.transId = transId;
        this.level = level;
    }

    @Override
    public int getLevel() {
        return level;
    }

    LocalTransactionHost getHost() {
        return host;
    }

    long getTransId() {
        return transId;
    }

    @Override
    public String toString() {
        return "Savepoint[trans=" + transId + ", level=" + level + "]";
    }
}
