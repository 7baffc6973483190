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
 * Receives the nesting level transitions of a {@link TransactionHost}. Each
 * event is delivered while the host's nesting level is still (or already)
 * the level it concerns: a started level has been entered, and a committed or
 * aborted level has not yet been left.
 */
public interface TransactionListener {
    /**
     * A nested level was opened within a transaction.
     *
     * @param level the new nesting level, at least 2
     */
    void levelStarted(int level);

    /**
     * A nested level is being committed into its parent.
     *
     * @param level the committed level, at least 2
     */
    void levelCommitted(int level);

    /**
     * A nested level is being aborted.
     *
     * @param level the aborted level, at least 2
     */
    void levelAborted(int level);

    /**
     * The top-level transaction is committing.
     */
    void topCommitted();

    /**
     * The top-level transaction is aborting.
     */
    void topAborted();
}
