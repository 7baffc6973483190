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

import com.varstore.api.TransactionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * LocalTransactionHost drives nesting levels for a store used on its own:
 * it begins, commits and rolls back top-level transactions and the nested top
 * actions (savepoints) opened within them, and notifies its listeners of
 * every transition.
 * <p>
 * Savepoints follow SQL semantics. Committing a nested top action commits
 * every level opened at or after it; rolling back to one aborts those levels
 * and opens its level again, so it can be rolled back to repeatedly.
 */
public class LocalTransactionHost implements TransactionHost {
    private static final Logger logger = LogManager.getLogger(LocalTransactionHost.class);

    // This is the initial number of nested top actions allowed,
    // and the number of additional ones allocated when more are needed.
    final static int ALLOC_ACTIONS = 5;
    private final List<TransactionListener> listeners = new CopyOnWriteArrayList<>();
    private NestedTopAction[] actions = new NestedTopAction[ALLOC_ACTIONS];
    private int nactions;
    private int nestLevel;
    private long transId;

    @Override
    public int getNestLevel() {
        return nestLevel;
    }

    @Override
    public void addTransactionListener(TransactionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeTransactionListener(TransactionListener listener) {
        listeners.remove(listener);
    }

    public boolean isInTransaction() {
        return nestLevel > 0;
    }

    /**
     * Begins a new top-level transaction.
     *
     * @throws TransactionException if a transaction is already in progress
     */
    public void beginTransaction() throws TransactionException {
        if (nestLevel != 0)
            throw new TransactionException("Transaction already in progress.");
        nestLevel = 1;
        ++transId;
        logger.debug("Began transaction {}", transId);
    }

    /**
     * Commits the transaction, including every open nested top action.
     *
     * @throws TransactionException if no transaction is in progress
     */
    public void commitTransaction() throws TransactionException {
        checkInTransaction();
        try {
            while (nestLevel > 1)
                commitLevel();
            for (TransactionListener listener : listeners)
                listener.topCommitted();
        } finally {
            endTransaction();
        }
        logger.debug("Committed transaction {}", transId);
    }

    /**
     * Rolls back the transaction, including every open nested top action.
     *
     * @throws TransactionException if no transaction is in progress
     */
    public void rollbackTransaction() throws TransactionException {
        checkInTransaction();
        try {
            while (nestLevel > 1)
                abortLevel();
            for (TransactionListener listener : listeners)
                listener.topAborted();
        } finally {
            endTransaction();
        }
        logger.debug("Rolled back transaction {}", transId);
    }

    /**
     * Opens a new nesting level within the transaction.
     *
     * @return the savepoint marking the new level
     * @throws TransactionException if no transaction is in progress
     */
    public NestedTopAction beginNestedTopAction() throws TransactionException {
        checkInTransaction();
        NestedTopAction savePoint = new NestedTopAction(this, transId, nestLevel + 1);
        openLevel(savePoint);
        return savePoint;
    }

    /**
     * Commits the nested top action and every one opened after it into the
     * enclosing level.
     *
     * @param savePoint the nested top action
     * @throws TransactionException if the savepoint is no longer active
     */
    public void commitNestedTopAction(NestedTopAction savePoint) throws TransactionException {
        checkActive(savePoint);
        while (nestLevel >= savePoint.getLevel())
            commitLevel();
    }

    /**
     * Rolls back the nested top action and every one opened after it, then
     * opens the savepoint's level again.
     *
     * @param savePoint the nested top action
     * @throws TransactionException if the savepoint is no longer active
     */
    public void rollbackNestedTopAction(NestedTopAction savePoint) throws TransactionException {
        checkActive(savePoint);
        while (nestLevel >= savePoint.getLevel())
            abortLevel();
        openLevel(savePoint);
    }

    /**
     * Checks whether the given savepoint can still be committed or rolled
     * back to.
     *
     * @param savePoint the nested top action
     * @return true if it belongs to the current transaction and is open
     */
    public boolean isActive(NestedTopAction savePoint) {
        return savePoint.getHost() == this && savePoint.getTransId() == transId
                && nestLevel > 0 && savePoint.getLevel() <= nestLevel
                && actions[savePoint.getLevel() - 2] == savePoint;
    }

    private void openLevel(NestedTopAction savePoint) {
        if (nactions == actions.length) {
            // need room for more actions
            NestedTopAction[] newArray = new NestedTopAction[actions.length + ALLOC_ACTIONS];
            System.arraycopy(actions, 0, newArray, 0, actions.length);
            actions = newArray;
        }
        actions[nactions++] = savePoint;
        ++nestLevel;
        logger.debug("Started level {}", nestLevel);
        for (TransactionListener listener : listeners)
            listener.levelStarted(nestLevel);
    }

    private void commitLevel() {
        for (TransactionListener listener : listeners)
            listener.levelCommitted(nestLevel);
        closeLevel();
        logger.debug("Committed level {}", nestLevel + 1);
    }

    private void abortLevel() {
        for (TransactionListener listener : listeners)
            listener.levelAborted(nestLevel);
        closeLevel();
        logger.debug("Aborted level {}", nestLevel + 1);
    }

    private void closeLevel() {
        actions[--nactions] = null;
        --nestLevel;
    }

    private void endTransaction() {
        while (nactions > 0)
            actions[--nactions] = null;
        nestLevel = 0;
    }

    private void checkInTransaction() throws TransactionException {
        if (nestLevel == 0)
            throw new TransactionException("No transaction in progress.");
    }

    private void checkActive(NestedTopAction savePoint) throws TransactionException {
        checkInTransaction();
        if (!isActive(savePoint))
            throw new TransactionException("Savepoint " + savePoint + " is not active.");
    }
}
