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

package com.varstore.api.impl;

import com.varstore.api.*;
import com.varstore.config.VarStoreConfig;
import com.varstore.store.VariableStore;
import com.varstore.transaction.LocalTransactionHost;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class SessionTest {

    VarStore varStore;
    Session session;
    RowDescriptor people;

    @Before
    public void setUp() throws VarStoreException {
        varStore = VarStore.getInstance();
        session = varStore.createSession(new VarStoreConfig());
        people = new RowDescriptor(new String[]{"id", "name", "age"}, "IsI");
    }

    @After
    public void tearDown() throws VarStoreException {
        if (session.isInTransaction())
            session.rollback();
        session = null;
    }

    private Datum intDatum(int i) throws VarStoreException {
        Datum d = session.allocateDatum('I');
        d.setInt(i);
        return d;
    }

    private Datum stringDatum(String s) throws VarStoreException {
        Datum d = session.allocateDatum('s');
        d.setString(s);
        return d;
    }

    private void setInt(String pkg, String name, int i, boolean transactional) throws VarStoreException {
        session.setScalar(pkg, name, intDatum(i), transactional);
    }

    private int getInt(String pkg, String name) throws VarStoreException {
        return session.getScalar(pkg, name, 'I', true).getInt();
    }

    private Row person(int id, String name, int age) throws VarStoreException {
        Row row = session.allocateRow(people);
        row.setInt(0, id);
        row.setString(1, name);
        row.setInt(2, age);
        return row;
    }

    private String names(RowStream stream) throws VarStoreException {
        StringBuilder sb = new StringBuilder();
        Row row = stream.allocateRow();
        while (stream.fetchNext(row)) {
            if (sb.length() > 0)
                sb.append(',');
            sb.append(row.getString(1));
        }
        return sb.toString();
    }

    /**
     * Rolling back a savepoint restores the value it had when the savepoint
     * was set; releasing it keeps the new value.
     */
    @Test
    public void testRollbackAndRelease() throws Exception {
        setInt("p", "x", 1, true);

        Savepoint sp = session.setSavepoint();
        Assert.assertEquals(2, session.getNestLevel());
        setInt("p", "x", 2, true);
        session.rollback(sp);
        Assert.assertEquals(1, getInt("p", "x"));

        // the savepoint stays usable after a rollback to it
        Assert.assertEquals(2, session.getNestLevel());
        setInt("p", "x", 3, true);
        session.releaseSavepoint(sp);
        Assert.assertEquals(1, session.getNestLevel());
        session.commit();
        Assert.assertFalse(session.isInTransaction());
        Assert.assertEquals(3, getInt("p", "x"));

        // released savepoints can no longer be used
        try {
            session.rollback(sp);
            throw new Exception("Was expecting an exception.");
        } catch (TransactionException e) {
            Assert.assertFalse(session.isInTransaction());
        }
    }

    @Test
    public void testNestedRollback() throws Exception {
        setInt("p", "x", 1, true);
        session.begin();
        setInt("p", "x", 2, true);
        Savepoint sp = session.setSavepoint();
        setInt("p", "x", 3, true);
        session.rollback(sp);
        Assert.assertEquals(2, getInt("p", "x"));
        session.rollback();
        Assert.assertEquals(1, getInt("p", "x"));
    }

    @Test
    public void testRegularSurvivesRollback() throws Exception {
        setInt("p", "y", 1, false);
        session.begin();
        setInt("p", "y", 2, false);
        Savepoint sp = session.setSavepoint();
        setInt("p", "y", 3, false);
        session.rollback(sp);
        Assert.assertEquals(3, getInt("p", "y"));
        session.rollback();
        Assert.assertEquals(3, getInt("p", "y"));
    }

    @Test
    public void testStickyDeclarations() throws Exception {
        setInt("p", "v", 1, true);
        try {
            session.setScalar("p", "v", stringDatum("one"), true);
            throw new Exception("Was expecting an exception.");
        } catch (TypeMismatchException e) {
            Assert.assertEquals("v", e.getObjectName());
        }
        try {
            setInt("p", "v", 1, false);
            throw new Exception("Was expecting an exception.");
        } catch (TransactionalityConflictException e) {
            Assert.assertEquals("v", e.getObjectName());
        }
        try {
            session.getScalar("p", "v", 'l', true);
            throw new Exception("Was expecting an exception.");
        } catch (TypeMismatchException e) {
            Assert.assertEquals("v", e.getObjectName());
        }
        try {
            session.declareRecordVariable("p", "v", people, true);
            throw new Exception("Was expecting an exception.");
        } catch (KindMismatchException e) {
            Assert.assertEquals("v", e.getObjectName());
        }

        session.declareRecordVariable("p", "r", people, true);
        try {
            session.getScalar("p", "r", 'I', true);
            throw new Exception("Was expecting an exception.");
        } catch (KindMismatchException e) {
            Assert.assertEquals("r", e.getObjectName());
        }
        try {
            session.declareRecordVariable("p", "r", new RowDescriptor(new String[]{"id"}, "I"), true);
            throw new Exception("Was expecting an exception.");
        } catch (ShapeMismatchException e) {
            Assert.assertEquals("r", e.getObjectName());
        }
        Assert.assertEquals(1, getInt("p", "v"));
    }

    @Test
    public void testArgumentErrors() throws Exception {
        char[] chars = new char[VariableStore.NAME_MAX_BYTES];
        Arrays.fill(chars, 'n');
        String longest = new String(chars);
        setInt("p", longest, 1, true);
        Assert.assertTrue(session.existsVariable("p", longest));
        try {
            setInt("p", longest + "n", 1, true);
            throw new Exception("Was expecting an exception.");
        } catch (NameTooLongException e) {
            Assert.assertEquals(longest + "n", e.getObjectName());
        }
        try {
            setInt(null, "x", 1, true);
            throw new Exception("Was expecting an exception.");
        } catch (NullArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("package name"));
        }
        try {
            session.setScalar("p", "x", null, true);
            throw new Exception("Was expecting an exception.");
        } catch (NullArgumentException e) {
            Assert.assertFalse(session.existsVariable("p", "x"));
        }
        try {
            session.allocateDatum('x');
            throw new Exception("Was expecting an exception.");
        } catch (TypeException e) {
            Assert.assertTrue(e.getMessage().contains("'x'"));
        }
        try {
            session.commit();
            throw new Exception("Was expecting an exception.");
        } catch (TransactionException e) {
            Assert.assertFalse(session.isInTransaction());
        }
        try {
            session.getScalar("q", "x", 'I', true);
            throw new Exception("Was expecting an exception.");
        } catch (NotFoundException e) {
            Assert.assertEquals("q", e.getObjectName());
        }
        try {
            session.getScalar("p", "x", 'I', true);
            throw new Exception("Was expecting an exception.");
        } catch (NotFoundException e) {
            Assert.assertEquals("x", e.getObjectName());
        }
        Assert.assertNull(session.getScalar("p", "x", 'I', false));
    }

    @Test
    public void testAutoCommit() throws Exception {
        Assert.assertTrue(session.isAutoCommit());
        setInt("p", "x", 1, true);
        Assert.assertFalse(session.isInTransaction());

        // a failing call aborts its own transaction, nothing else
        try {
            session.insertRecord("p", "x", person(1, "ann", 30), true);
            throw new Exception("Was expecting an exception.");
        } catch (KindMismatchException e) {
            Assert.assertFalse(session.isInTransaction());
        }
        Assert.assertEquals(1, getInt("p", "x"));

        session.setAutoCommit(false);
        setInt("p", "x", 2, true);
        Assert.assertTrue(session.isInTransaction());
        setInt("p", "z", 3, true);
        session.rollback();
        Assert.assertEquals(1, getInt("p", "x"));
        Assert.assertFalse(session.existsVariable("p", "z"));
    }

    @Test
    public void testConfigCopiedAtCreation() throws Exception {
        VarStoreConfig config = new VarStoreConfig();
        config.setBigValueMaxLength(8);
        Session limited = varStore.createSession(config);
        config.setBigValueMaxLength(1000);
        config.setAutoCommit(false);

        Datum big = limited.allocateDatum('S');
        try {
            big.setString("more than eight bytes");
            throw new Exception("Was expecting an exception.");
        } catch (TypeException e) {
            Assert.assertTrue(big.isNull());
        }
        big.setString("eight!!!");
        limited.setScalar("p", "s", big, true);
        Assert.assertTrue(limited.isAutoCommit());
        Assert.assertFalse(limited.isInTransaction());
    }

    @Test
    public void testSessionsAreIndependent() throws Exception {
        Session other = varStore.createSession(new VarStoreConfig());
        setInt("p", "x", 1, true);
        Assert.assertFalse(other.existsPackage("p"));
    }

    @Test
    public void testRecordUpsert() throws Exception {
        session.insertRecord("p", "r", person(1, "ann", 30), true);
        session.insertRecord("p", "r", person(2, "bob", 40), true);
        session.insertRecord("p", "r", person(1, "amy", 31), true);

        try (RowStream stream = session.selectAll("p", "r")) {
            Assert.assertEquals("amy,bob", names(stream));
        }
        try (RowStream stream = session.selectByKey("p", "r", intDatum(1))) {
            Row row = stream.allocateRow();
            Assert.assertTrue(stream.fetchNext(row));
            Assert.assertEquals(31, row.getInt(2));
            Assert.assertFalse(stream.fetchNext(row));
        }

        Assert.assertTrue(session.updateRecord("p", "r", person(2, "ben", 41)));
        Assert.assertFalse(session.updateRecord("p", "r", person(3, "cat", 50)));
        Assert.assertFalse(session.deleteRecord("p", "r", intDatum(3)));
        Assert.assertTrue(session.deleteRecord("p", "r", intDatum(1)));
        try (RowStream stream = session.selectAll("p", "r")) {
            Assert.assertEquals("ben", names(stream));
        }

        try {
            session.deleteRecord("p", "r", stringDatum("1"));
            throw new Exception("Was expecting an exception.");
        } catch (TypeMismatchException e) {
            Assert.assertEquals("r", e.getObjectName());
        }
        try {
            session.selectAll("p", "nope");
            throw new Exception("Was expecting an exception.");
        } catch (NotFoundException e) {
            Assert.assertEquals("nope", e.getObjectName());
        }
    }

    @Test
    public void testNullKey() throws Exception {
        Row row = person(1, "nobody", 0);
        row.setNull(0, true);
        session.insertRecord("p", "r", row, true);
        session.insertRecord("p", "r", person(1, "ann", 30), true);

        Datum nullKey = session.allocateDatum('I');
        Assert.assertTrue(nullKey.isNull());
        try (RowStream stream = session.selectByKey("p", "r", nullKey)) {
            Assert.assertEquals("nobody", names(stream));
        }
        Assert.assertTrue(session.deleteRecord("p", "r", nullKey));
        try (RowStream stream = session.selectAll("p", "r")) {
            Assert.assertEquals("ann", names(stream));
        }
    }

    @Test
    public void testRecordRollback() throws Exception {
        session.insertRecord("p", "r", person(1, "ann", 30), true);
        session.insertRecord("p", "n", person(1, "ann", 30), false);

        session.begin();
        session.insertRecord("p", "r", person(2, "bob", 40), true);
        session.insertRecord("p", "n", person(2, "bob", 40), false);
        session.deleteRecord("p", "r", intDatum(1));
        session.rollback();

        try (RowStream stream = session.selectAll("p", "r")) {
            Assert.assertEquals("ann", names(stream));
        }
        try (RowStream stream = session.selectAll("p", "n")) {
            Assert.assertEquals("ann,bob", names(stream));
        }
    }

    @Test
    public void testSelectByKeys() throws Exception {
        for (int i = 1; i <= 3; i++)
            session.insertRecord("p", "r", person(i, "p" + i, 20 + i), true);

        RowStream stream = session.selectByKeys("p", "r", KeyArray.of(intDatum(3), intDatum(9), intDatum(1)));
        Assert.assertEquals("p3,p1", names(stream));
        stream.rewind();
        Assert.assertEquals("p3,p1", names(stream));

        // rows are looked up as they are fetched
        stream.rewind();
        session.deleteRecord("p", "r", intDatum(1));
        Assert.assertEquals("p3", names(stream));

        // a removed variable ends the stream
        stream.rewind();
        session.removeVariable("p", "r");
        Assert.assertEquals("", names(stream));

        stream.close();
        try {
            stream.rewind();
            throw new Exception("Was expecting an exception.");
        } catch (VarStoreException e) {
            Assert.assertEquals("RowStream closed.", e.getMessage());
        }

        KeyArray square = new KeyArray(2, Arrays.asList(intDatum(1), intDatum(2)));
        try {
            session.selectByKeys("missing", "r", square);
            throw new Exception("Was expecting an exception.");
        } catch (UnsupportedDimensionalityException e) {
            Assert.assertEquals("r", e.getObjectName());
        }

        session.declareRecordVariable("p", "r", people, true);
        try {
            session.selectByKeys("p", "r", square);
            throw new Exception("Was expecting an exception.");
        } catch (UnsupportedDimensionalityException e) {
            Assert.assertEquals("r", e.getObjectName());
        }
    }

    @Test
    public void testFetchIntoWrongRow() throws Exception {
        session.insertRecord("p", "r", person(1, "ann", 30), true);
        try (RowStream stream = session.selectAll("p", "r")) {
            Row other = session.allocateRow(new RowDescriptor(new String[]{"id"}, "I"));
            try {
                stream.fetchNext(other);
                throw new Exception("Was expecting an exception.");
            } catch (TypeException e) {
                Row row = stream.allocateRow();
                Assert.assertTrue(stream.fetchNext(row));
            }
        }
    }

    /**
     * Values are copied in and out, so neither the datum passed to a set nor
     * the one returned by a get aliases a stored value.
     */
    @Test
    public void testDeepCopyIsolation() throws Exception {
        Datum d = session.allocateDatum('A');
        d.setBytes(new byte[]{1, 2, 3});
        session.setScalar("p", "a", d, true);

        session.begin();
        Datum b = session.allocateDatum('A');
        b.setBytes(new byte[]{4, 5});
        session.setScalar("p", "a", b, true);
        d.setBytes(new byte[]{9});
        b.setBytes(new byte[]{9});
        Datum got = session.getScalar("p", "a", 'A', true);
        Assert.assertArrayEquals(new byte[]{4, 5}, got.getBytes());
        got.setBytes(new byte[]{7});
        Assert.assertArrayEquals(new byte[]{4, 5}, session.getScalar("p", "a", 'A', true).getBytes());
        session.rollback();

        Assert.assertArrayEquals(new byte[]{1, 2, 3}, session.getScalar("p", "a", 'A', true).getBytes());

        Row row = person(1, "ann", 30);
        session.insertRecord("p", "r", row, true);
        row.setString(1, "changed");
        try (RowStream stream = session.selectAll("p", "r")) {
            Assert.assertEquals("ann", names(stream));
        }
    }

    @Test
    public void testPackageEmptinessCascade() throws Exception {
        setInt("p", "x", 1, true);
        setInt("p", "y", 2, false);
        session.removeVariable("p", "x");
        Assert.assertTrue(session.existsPackage("p"));
        session.removeVariable("p", "y");
        Assert.assertFalse(session.existsPackage("p"));

        setInt("a", "x", 1, true);
        setInt("b", "y", 2, false);
        session.removeAllPackages();
        Assert.assertFalse(session.existsPackage("a"));
        Assert.assertFalse(session.existsPackage("b"));
        try {
            getInt("a", "x");
            throw new Exception("Was expecting an exception.");
        } catch (NotFoundException e) {
            Assert.assertEquals("a", e.getObjectName());
        }
        Assert.assertTrue(session.listPackagesAndVariables().isEmpty());
    }

    /**
     * Removing the last regular variable of a package is not undone by a
     * rollback, so the package stays removed as well.
     */
    @Test
    public void testEmptiedPackageStaysRemovedAfterRollback() throws Exception {
        setInt("p", "r", 1, false);
        session.begin();
        session.removeVariable("p", "r");
        Assert.assertFalse(session.existsPackage("p"));
        session.rollback();

        Assert.assertFalse(session.existsVariable("p", "r"));
        Assert.assertFalse(session.existsPackage("p"));
        Assert.assertTrue(session.packageMemoryUsage().isEmpty());

        setInt("q", "r", 1, false);
        session.begin();
        Savepoint sp = session.setSavepoint();
        session.removeVariable("q", "r");
        session.rollback(sp);
        Assert.assertFalse(session.existsPackage("q"));
        Assert.assertTrue(session.listPackagesAndVariables().isEmpty());

        // the package can be declared again in the same transaction
        setInt("q", "t", 2, true);
        Assert.assertTrue(session.existsPackage("q"));
        session.commit();
        Assert.assertEquals(2, getInt("q", "t"));
        Assert.assertFalse(session.existsVariable("q", "r"));
    }

    @Test
    public void testEmptiedPackageRemovedAtCommitAfterSavepointRollback() throws Exception {
        setInt("p", "r", 1, false);
        session.begin();
        Savepoint sp = session.setSavepoint();
        session.removeVariable("p", "r");
        session.rollback(sp);
        session.commit();

        Assert.assertFalse(session.existsPackage("p"));
        Assert.assertTrue(session.packageMemoryUsage().isEmpty());
    }

    @Test
    public void testRemovePackageRollback() throws Exception {
        setInt("p", "x", 1, true);
        setInt("p", "y", 2, false);
        session.begin();
        session.removePackage("p");
        Assert.assertFalse(session.existsPackage("p"));
        session.rollback();

        Assert.assertTrue(session.existsPackage("p"));
        Assert.assertEquals(1, getInt("p", "x"));
        Assert.assertFalse(session.existsVariable("p", "y"));
    }

    @Test
    public void testListAndMemoryUsage() throws Exception {
        setInt("q", "b", 1, true);
        setInt("p", "z", 1, false);
        setInt("q", "a", 1, false);

        List<VariableInfo> list = session.listPackagesAndVariables();
        Assert.assertEquals(Arrays.asList(new VariableInfo("p", "z", false),
                                          new VariableInfo("q", "a", false),
                                          new VariableInfo("q", "b", true)), list);

        List<PackageStats> stats = session.packageMemoryUsage();
        Assert.assertEquals(2, stats.size());
        Assert.assertEquals("p", stats.get(0).getPackageName());
        Assert.assertEquals("q", stats.get(1).getPackageName());
        Assert.assertTrue(stats.get(1).getAllocatedBytes() > stats.get(0).getAllocatedBytes());
    }

    @Test
    public void testExternalHost() throws Exception {
        LocalTransactionHost host = new LocalTransactionHost();
        Session attached = varStore.createSession(new VarStoreConfig(), host);
        try {
            attached.setScalar("p", "x", attached.allocateDatum('I'), true);
            throw new Exception("Was expecting an exception.");
        } catch (TransactionException e) {
            Assert.assertFalse(attached.isInTransaction());
        }
        try {
            attached.begin();
            throw new Exception("Was expecting an exception.");
        } catch (TransactionException e) {
            Assert.assertEquals(0, attached.getNestLevel());
        }

        host.beginTransaction();
        Datum d = attached.allocateDatum('I');
        d.setInt(1);
        attached.setScalar("p", "x", d, true);
        host.commitTransaction();

        host.beginTransaction();
        host.beginNestedTopAction();
        d.setInt(2);
        attached.setScalar("p", "x", d, true);
        Assert.assertEquals(2, attached.getNestLevel());
        host.rollbackTransaction();
        Assert.assertEquals(1, attached.getScalar("p", "x", 'I', true).getInt());
    }
}
