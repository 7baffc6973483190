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

import com.varstore.api.KindMismatchException;
import com.varstore.api.NotFoundException;
import com.varstore.api.PackageStats;
import com.varstore.api.RowDescriptor;
import com.varstore.core.Column;
import com.varstore.transaction.LocalTransactionHost;
import com.varstore.transaction.NestedTopAction;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

/**
 * Exercises the store directly against a local host, checking the histories
 * and the changes stack left behind by each transition.
 */
public class VariableStoreTest {

    LocalTransactionHost host;
    VariableStore store;

    @Before
    public void setUp() {
        host = new LocalTransactionHost();
        store = new VariableStore(host, 8, 16, Integer.MAX_VALUE);
    }

    private static Column intValue(int i) throws Exception {
        Column col = Column.createColumn('I', 0);
        col.setInt(i);
        return col;
    }

    private int getInt(String pkg, String name) throws Exception {
        return store.getScalar(pkg, name, 'I', true).getInt();
    }

    private VariableEntry variable(String pkg, String name) {
        return store.getRegistry().get(pkg).getVariable(name);
    }

    @Test
    public void testCommitLeavesSingleState() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        host.commitTransaction();

        host.beginTransaction();
        NestedTopAction sp = host.beginNestedTopAction();
        store.setScalar("p", "x", intValue(2), true);
        Assert.assertEquals(2, variable("p", "x").getHistory().size());
        Assert.assertEquals(2, store.getEngine().getChangesDepth());

        // the committed state moves to the parent level, the level 0 state stays below it
        host.commitNestedTopAction(sp);
        Assert.assertEquals(2, variable("p", "x").getHistory().size());
        Assert.assertEquals(1, variable("p", "x").getState().getLevel());
        Assert.assertEquals(1, store.getEngine().getChangesDepth());

        host.commitTransaction();
        VariableEntry x = variable("p", "x");
        Assert.assertEquals(1, x.getHistory().size());
        Assert.assertEquals(0, x.getState().getLevel());
        Assert.assertEquals(2, getInt("p", "x"));
        Assert.assertFalse(store.getEngine().hasChanges());
    }

    @Test
    public void testRollbackEvictsNewObjects() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        Assert.assertEquals(1, store.getRegistry().get("p").getState().getTransVarNum());
        PackageEntry pkg = store.getRegistry().get("p");
        host.rollbackTransaction();

        Assert.assertNull(store.getRegistry().get("p"));
        Assert.assertTrue(pkg.isDeleted());
        Assert.assertNull(store.getScalar("p", "x", 'I', false));
    }

    @Test
    public void testPackageOfRegularVariableSurvivesRollback() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "y", intValue(1), false);
        store.setScalar("p", "x", intValue(2), true);
        host.rollbackTransaction();

        PackageEntry pkg = store.getRegistry().get("p");
        Assert.assertTrue(pkg.isValid());
        Assert.assertEquals(0, pkg.getState().getTransVarNum());
        Assert.assertEquals(0, pkg.getState().getLevel());
        Assert.assertEquals(1, getInt("p", "y"));
        Assert.assertNull(pkg.getVariable("x"));
    }

    @Test
    public void testTransVarNumFollowsRemovals() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "a", intValue(1), true);
        store.setScalar("p", "b", intValue(2), true);
        store.setScalar("p", "c", intValue(3), false);
        host.commitTransaction();
        PackageEntry pkg = store.getRegistry().get("p");
        Assert.assertEquals(2, pkg.getState().getTransVarNum());
        Assert.assertEquals(1, pkg.getRegularCount());

        host.beginTransaction();
        store.removeVariable("p", "a");
        Assert.assertEquals(1, pkg.getState().getTransVarNum());
        store.removeVariable("p", "c");
        Assert.assertEquals(0, pkg.getRegularCount());
        Assert.assertTrue(pkg.isValid());
        store.removeVariable("p", "b");
        Assert.assertFalse(pkg.isValid());
        host.rollbackTransaction();

        // the regular variable stays removed, the others come back
        Assert.assertTrue(pkg.isValid());
        Assert.assertEquals(2, pkg.getState().getTransVarNum());
        Assert.assertEquals(1, getInt("p", "a"));
        Assert.assertFalse(store.existsVariable("p", "c"));
    }

    @Test
    public void testRemovePackageAndRevive() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        store.setScalar("p", "y", intValue(2), false);
        host.commitTransaction();

        host.beginTransaction();
        store.removePackage("p");
        Assert.assertFalse(store.existsPackage("p"));
        Assert.assertEquals(0, store.getRegistry().get("p").getRegularCount());

        store.setScalar("p", "z", intValue(3), true);
        PackageEntry pkg = store.getRegistry().get("p");
        Assert.assertTrue(pkg.isValid());
        Assert.assertEquals(1, pkg.getState().getTransVarNum());
        Assert.assertFalse(store.existsVariable("p", "x"));
        Assert.assertFalse(store.existsVariable("p", "y"));
        host.commitTransaction();

        Assert.assertNull(pkg.getVariable("x"));
        Assert.assertEquals(3, getInt("p", "z"));
        Assert.assertEquals(1, pkg.getHistory().size());
    }

    @Test
    public void testRemovePackageRolledBack() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        store.setScalar("p", "y", intValue(2), false);
        host.commitTransaction();

        host.beginTransaction();
        store.removePackage("p");
        try {
            store.getScalar("p", "x", 'I', true);
            throw new Exception("Was expecting an exception.");
        } catch (NotFoundException e) {
            Assert.assertEquals("p", e.getObjectName());
        }
        host.rollbackTransaction();

        Assert.assertTrue(store.existsPackage("p"));
        Assert.assertEquals(1, getInt("p", "x"));
        // regular variables are cleared when their package is removed
        Assert.assertFalse(store.existsVariable("p", "y"));
    }

    @Test
    public void testRemovedVariableRevivedWithFreshValue() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        store.setScalar("p", "keep", intValue(0), true);
        host.commitTransaction();

        host.beginTransaction();
        store.removeVariable("p", "x");
        RowDescriptor rd = new RowDescriptor(new String[]{"k"}, "I");
        try {
            store.declareRecordVariable("p", "x", rd, true);
            throw new Exception("Was expecting an exception.");
        } catch (KindMismatchException e) {
            Assert.assertEquals("x", e.getObjectName());
        }
        store.setScalar("p", "x", Column.createColumn('I', 0), true);
        Assert.assertTrue(store.getScalar("p", "x", 'I', true).isNull());
        Assert.assertEquals(2, store.getRegistry().get("p").getState().getTransVarNum());
        host.rollbackTransaction();

        Assert.assertEquals(1, getInt("p", "x"));
    }

    @Test
    public void testMemoryUsage() throws Exception {
        host.beginTransaction();
        store.setScalar("p", "x", intValue(1), true);
        host.commitTransaction();

        List<PackageStats> stats = store.packageMemoryUsage();
        Assert.assertEquals(1, stats.size());
        // package state + variable state + int value (null flag and 4 bytes)
        long single = PackState.OVERHEAD + VarState.OVERHEAD + 5;
        Assert.assertEquals(single, stats.get(0).getAllocatedBytes());

        host.beginTransaction();
        host.beginNestedTopAction();
        store.setScalar("p", "x", intValue(2), true);
        Assert.assertEquals(single + VarState.OVERHEAD + 5,
                            store.packageMemoryUsage().get(0).getAllocatedBytes());

        // removed packages are reported until they are evicted
        store.removePackage("p");
        Assert.assertEquals(1, store.packageMemoryUsage().size());
        Assert.assertTrue(store.listPackagesAndVariables().isEmpty());
        host.commitTransaction();
        Assert.assertTrue(store.packageMemoryUsage().isEmpty());
    }

    @Test
    public void testReadsNeedNoTransaction() throws Exception {
        Assert.assertFalse(store.existsPackage("p"));
        Assert.assertNull(store.getScalar("p", "x", 'I', false));
        Assert.assertTrue(store.listPackagesAndVariables().isEmpty());
    }
}
