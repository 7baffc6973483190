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

/**
 * The source of nesting levels a store follows. Level 0 means no transaction
 * is in progress, level 1 is the top-level transaction, and every nested
 * level (savepoint or sub-transaction) adds one.
 * <p>
 * Hosts must deliver transitions to their listeners in strict LIFO order.
 */
public interface TransactionHost {
    /**
     * Gets the current nesting level.
     *
     * @return the nesting level, 0 when no transaction is in progress
     */
    int getNestLevel();

    void addTransactionListener(TransactionListener listener);

    void removeTransactionListener(TransactionListener listener);
}
