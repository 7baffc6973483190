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

import com.varstore.store.PackState;
import com.varstore.store.PackageEntry;
import com.varstore.store.PackageRegistry;
import com.varstore.store.StateHistory;
import com.varstore.store.TransObject;
import com.varstore.store.TransState;
import com.varstore.store.VariableEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SavepointEngine versions packages and transactional variables by nesting
 * level. The first change to an object at a level pushes a copy of its state
 * stamped with that level and records the object in the level's frame of the
 * changes stack. When the level commits, each recorded object's current state
 * is merged into the parent level; when it aborts, the state is discarded and
 * the one before it becomes current again.
 * <p>
 * The changes stack only exists while some object has been changed in the
 * current transaction; level transitions are ignored while it does not.
 */
public class SavepointEngine implements TransactionListener {
    private static final Logger logger = LogManager.getLogger(SavepointEngine.class);

    private final TransactionHost host;
    private final PackageRegistry registry;
    private ChangesStack changesStack;

    public SavepointEngine(TransactionHost host, PackageRegistry registry) {
        this.host = host;
        this.registry = registry;
        host.addTransactionListener(this);
    }

    /**
     * Gets the current nesting level, which must be that of an open
     * transaction.
     *
     * @return the nesting level
     */
    public int getLevel() {
        int level = host.getNestLevel();
        if (level < 1)
            throw new IllegalStateException("No transaction in progress.");
        return level;
    }

    /**
     * Checks whether the object's current state belongs to the current
     * nesting level.
     *
     * @param obj a package or transactional variable
     * @return true if already changed at this level
     */
    public boolean isChangedAtCurrentLevel(TransObject<?> obj) {
        TransState state = obj.getState();
        return state != null && state.getLevel() == host.getNestLevel();
    }

    /**
     * Makes the object's current state belong to the current nesting level,
     * pushing a copy of its state if necessary, and records it in the
     * changes stack. Must be called before the current state is modified.
     *
     * @param obj a package or transactional variable
     */
    public void savepoint(TransObject<?> obj) {
        createSavepoint(obj);
        addToChangesStack(obj);
    }

    /**
     * Pushes a copy of the object's current state stamped with the current
     * level, unless the current state already has that level.
     *
     * @param obj a package or transactional variable
     */
    @SuppressWarnings("unchecked")
    public <S extends TransState> void createSavepoint(TransObject<S> obj) {
        int level = getLevel();
        if (isChangedAtCurrentLevel(obj))
            return;
        obj.getHistory().push((S) obj.getState().copyState(level));
        logger.trace("Savepoint of {} at level {}", obj, level);
    }

    /**
     * Records the object in the frame of the current level, creating frames
     * up to the current level first if needed.
     *
     * @param obj a package or transactional variable
     */
    public void addToChangesStack(TransObject<?> obj) {
        int level = getLevel();
        if (changesStack == null) {
            changesStack = new ChangesStack();
            logger.debug("Created changes stack at level {}", level);
        }
        if (changesStack.depth() > level)
            throw internalError("changes stack depth " + changesStack.depth()
                                        + " exceeds nesting level " + level);
        while (changesStack.depth() < level)
            changesStack.push();
        if (changesStack.top().add(obj))
            logger.trace("Registered {} in frame {}", obj, level);
    }

    /**
     * Evicts a variable, forgetting every reference to it.
     *
     * @param var the variable
     */
    public void evict(VariableEntry var) {
        if (changesStack != null)
            changesStack.forget(var);
        registry.evict(var);
    }

    /**
     * Evicts a package and its variables, forgetting every reference to them.
     *
     * @param pkg the package
     */
    public void evict(PackageEntry pkg) {
        if (changesStack != null) {
            for (VariableEntry var : pkg.getVariables())
                changesStack.forget(var);
            changesStack.forget(pkg);
        }
        registry.evict(pkg);
    }

    /**
     * Checks whether any object has been changed in the current transaction.
     *
     * @return true while the changes stack exists
     */
    public boolean hasChanges() {
        return changesStack != null;
    }

    /**
     * Gets the number of frames of the changes stack.
     *
     * @return the depth, 0 when there is no changes stack
     */
    public int getChangesDepth() {
        return changesStack == null ? 0 : changesStack.depth();
    }

    @Override
    public void levelStarted(int level) {
        if (changesStack == null)
            return;
        checkEvent(level, level - 1);
        changesStack.push();
    }

    @Override
    public void levelCommitted(int level) {
        if (changesStack == null)
            return;
        checkEvent(level, level);
        processChanges(Action.RELEASE);
    }

    @Override
    public void levelAborted(int level) {
        if (changesStack == null)
            return;
        checkEvent(level, level);
        processChanges(Action.ROLLBACK);
    }

    @Override
    public void topCommitted() {
        if (changesStack == null)
            return;
        checkEvent(1, 1);
        processChanges(Action.RELEASE);
    }

    @Override
    public void topAborted() {
        if (changesStack == null)
            return;
        checkEvent(1, 1);
        processChanges(Action.ROLLBACK);
    }

    private enum Action {
        RELEASE,
        ROLLBACK
    }

    private void processChanges(Action action) {
        int level = host.getNestLevel();
        ChangesFrame frame = changesStack.pop();
        logger.debug("{} of {} objects at level {}", action, frame.size(), level);

        // variables first: they consult their package's validity
        for (VariableEntry var : frame.getVariables()) {
            if (var.isDeleted())
                continue;
            if (action == Action.RELEASE)
                releaseSavepoint(var, level);
            else
                rollbackSavepoint(var, level);
        }
        for (PackageEntry pkg : frame.getPackages()) {
            if (pkg.isDeleted())
                continue;
            if (action == Action.RELEASE)
                releaseSavepoint(pkg, level);
            else
                rollbackSavepoint(pkg, level);
        }

        if (changesStack.isEmpty()) {
            changesStack = null;
            logger.debug("Dropped changes stack");
        }
    }

    private void releaseSavepoint(TransObject<?> obj, int level) {
        StateHistory<?> history = obj.getHistory();
        TransState state = history.getHead();
        checkLevel(obj, state, level);

        if (obj instanceof VariableEntry && !((VariableEntry) obj).getPackage().isValid())
            state.setValid(false);

        boolean hasParent = !changesStack.isEmpty();
        TransState previous = history.getPrevious();
        if (!state.isValid() && (previous == null || !hasParent)) {
            evict(obj);
            return;
        }

        if (previous != null && (!hasParent || previous.getLevel() == level - 1)) {
            // the parent's state is superseded by this one
            history.removePrevious();
            state.setLevel(level - 1);
        } else {
            state.setLevel(level - 1);
            if (hasParent)
                changesStack.top().add(obj);
        }
    }

    private void rollbackSavepoint(TransObject<?> obj, int level) {
        StateHistory<?> history = obj.getHistory();
        checkLevel(obj, history.getHead(), level);
        history.pop();

        if (obj instanceof PackageEntry) {
            PackageEntry pkg = (PackageEntry) obj;
            if (history.isEmpty() && pkg.getRegularCount() > 0) {
                // regular variables outlive the aborted creation of their package
                pkg.getHistory().push(new PackState(true, 0, level - 1));
                if (!changesStack.isEmpty())
                    changesStack.top().add(pkg);
                return;
            }
            if (!history.isEmpty() && !pkg.isValid() && pkg.getRegularCount() > 0) {
                // a removed package holds no regular variables
                registry.clearRegular(pkg);
            }
            if (!history.isEmpty() && pkg.isValid() && pkg.getState().getTransVarNum() == 0
                    && pkg.getRegularCount() == 0) {
                // the regular variables whose removal emptied the package stay removed
                invalidateEmptyPackage(pkg, level);
                return;
            }
        }
        if (history.isEmpty())
            evict(obj);
    }

    /**
     * Marks a package left without variables by a rollback as removed in the
     * parent level, or evicts it when the whole transaction is aborted.
     */
    private void invalidateEmptyPackage(PackageEntry pkg, int level) {
        if (changesStack.isEmpty()) {
            evict(pkg);
            return;
        }
        PackState state = pkg.getState();
        if (state.getLevel() != level - 1)
            pkg.getHistory().push(state.copyState(level - 1));
        pkg.getState().setValid(false);
        changesStack.top().add(pkg);
        logger.debug("Package {} has no variables left after rollback", pkg);
    }

    private void evict(TransObject<?> obj) {
        if (obj instanceof VariableEntry)
            evict((VariableEntry) obj);
        else
            evict((PackageEntry) obj);
    }

    private void checkEvent(int level, int expectedDepth) {
        if (level != host.getNestLevel())
            throw internalError("event for level " + level + " at nesting level "
                                        + host.getNestLevel());
        if (changesStack.depth() != expectedDepth)
            throw internalError("changes stack depth " + changesStack.depth()
                                        + " does not match level " + level);
    }

    private static void checkLevel(TransObject<?> obj, TransState state, int level) {
        if (state == null || state.getLevel() != level)
            throw internalError("state of " + obj + " has level "
                                        + (state == null ? "none" : state.getLevel())
                                        + " but the nesting level is " + level);
    }

    private static RuntimeException internalError(String message) {
        return new RuntimeException("Internal Error. " + message);
    }
}
