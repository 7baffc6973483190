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

import com.varstore.api.NoSuchRowException;
import com.varstore.api.RowDescriptor;
import com.varstore.core.Column;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

public class RecordSetTest {

    RowDescriptor descriptor;
    RecordSet records;

    @Before
    public void setUp() throws Exception {
        descriptor = new RowDescriptor(new String[]{"id", "name"}, "Is");
        records = new RecordSet(descriptor);
    }

    private Column[] row(Integer id, String name) throws Exception {
        Column[] row = Column.createColumns("Is", Integer.MAX_VALUE);
        if (id != null)
            row[0].setInt(id);
        row[1].setString(name);
        return row;
    }

    private Column key(Integer id) throws Exception {
        Column key = Column.createColumn('I', 0);
        if (id != null)
            key.setInt(id);
        return key;
    }

    @Test
    public void testInsertReplacesSameKey() throws Exception {
        records.insert(row(1, "one"));
        records.insert(row(2, "two"));
        records.insert(row(1, "uno"));

        Assert.assertEquals(2, records.size());
        Assert.assertEquals("uno", records.get(key(1))[1].getString());

        List<Column[]> rows = records.rows();
        Assert.assertEquals(1, rows.get(0)[0].getInt());
        Assert.assertEquals(2, rows.get(1)[0].getInt());
    }

    @Test
    public void testInsertCopiesRow() throws Exception {
        Column[] r = row(1, "one");
        records.insert(r);
        r[1].setString("changed");
        Assert.assertEquals("one", records.get(key(1))[1].getString());
    }

    @Test
    public void testUpdateAndDelete() throws Exception {
        records.insert(row(1, "one"));
        records.update(row(1, "eins"));
        Assert.assertEquals("eins", records.get(key(1))[1].getString());

        try {
            records.update(row(5, "five"));
            throw new Exception("Was expecting an exception.");
        } catch (NoSuchRowException e) {
            Assert.assertEquals(1, records.size());
        }

        Assert.assertFalse(records.delete(key(5)));
        Assert.assertTrue(records.delete(key(1)));
        Assert.assertEquals(0, records.size());
        Assert.assertNull(records.get(key(1)));
    }

    @Test
    public void testNullKey() throws Exception {
        records.insert(row(null, "nobody"));
        records.insert(row(0, "zero"));

        Assert.assertEquals(2, records.size());
        Assert.assertTrue(records.containsKey(key(null)));
        Assert.assertEquals("nobody", records.get(key(null))[1].getString());
        Assert.assertEquals("zero", records.get(key(0))[1].getString());

        Assert.assertTrue(records.delete(key(null)));
        Assert.assertFalse(records.containsKey(key(null)));
        Assert.assertTrue(records.containsKey(key(0)));
    }

    @Test
    public void testCopyValueIsIndependent() throws Exception {
        records.insert(row(1, "one"));
        records.insert(row(2, "two"));

        RecordSet copy = records.copyValue();
        records.insert(row(3, "three"));
        records.delete(key(1));

        Assert.assertEquals(2, copy.size());
        Assert.assertEquals("one", copy.get(key(1))[1].getString());
        Assert.assertNull(copy.get(key(3)));
        Assert.assertEquals(descriptor, copy.getDescriptor());
        Assert.assertNotSame(records.get(key(2)), copy.get(key(2)));
    }

    @Test
    public void testStoreSize() throws Exception {
        Assert.assertEquals(0, records.storeSize());
        records.insert(row(1, "ab"));
        // int: 1 + 4, small string: 1 + 2 + 1
        Assert.assertEquals(RecordSet.ROW_OVERHEAD + 5 + 4, records.storeSize());
        records.release();
        Assert.assertEquals(0, records.size());
    }
}
