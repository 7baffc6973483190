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

import com.varstore.api.Datum;
import com.varstore.api.KeyArray;
import com.varstore.api.NullArgumentException;
import com.varstore.api.PackageStats;
import com.varstore.api.Row;
import com.varstore.api.RowDescriptor;
import com.varstore.api.RowStream;
import com.varstore.api.Savepoint;
import com.varstore.api.Session;
import com.varstore.api.TransactionException;
import com.varstore.api.TypeException;
import com.varstore.api.UnsupportedDimensionalityException;
import com.varstore.api.VarStoreException;
import com.varstore.api.VariableInfo;
import com.varstore.config.VarStoreConfig;
import com.varstore.core.Column;
import com.varstore.store.RecordSet;
import com.varstore.store.VariableEntry;
import com.varstore.store.VariableStore;
import com.varstore.transaction.LocalTransactionHost;
import com.varstore.transaction.NestedTopAction;
import com.varstore.transaction.TransactionHost;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class SessionImpl implements Session {
    private static final Logger logger = LogManager.getLogger(SessionImpl.class);

    private final int bigValueMaxLength;
    private final TransactionHost host;
    private final LocalTransactionHost localHost;
    private final VariableStore store;
    private boolean autoCommit;

    public SessionImpl(VarStoreConfig config) {
        this(config, new LocalTransactionHost(), true);
    }

    public SessionImpl(VarStoreConfig config, TransactionHost host) {
        this(config, host, false);
    }

    private SessionImpl(VarStoreConfig config, TransactionHost host, boolean local) {
        this.bigValueMaxLength = config.getBigValueMaxLength();
        this.host = host;
        this.localHost = local ? (LocalTransactionHost) host : null;
        this.autoCommit = config.isAutoCommit();
        this.store = new VariableStore(host, config.getInitialPackageCapacity(),
                                       config.getInitialVariableCapacity(), bigValueMaxLength);
        logger.debug("Created session with {}", config);
    }

    @Override
    public Datum allocateDatum(char type) throws TypeException {
        return Column.createColumn(type, bigValueMaxLength);
    }

    @Override
    public Row allocateRow(RowDescriptor descriptor) throws TypeException {
        return new RowImpl(descriptor, bigValueMaxLength);
    }

    @Override
    public void setScalar(String packageName, String name, Datum value, boolean transactional)
            throws VarStoreException {
        Column column = toColumn(value, "value");
        execute("setScalar", () -> {
            store.setScalar(packageName, name, column, transactional);
            return null;
        });
    }

    @Override
    public Datum getScalar(String packageName, String name, char type, boolean strict)
            throws VarStoreException {
        return store.getScalar(packageName, name, type, strict);
    }

    @Override
    public void declareRecordVariable(String packageName, String name, RowDescriptor descriptor,
                                      boolean transactional) throws VarStoreException {
        if (descriptor == null)
            throw new NullArgumentException("row descriptor");
        execute("declareRecordVariable", () -> {
            store.declareRecordVariable(packageName, name, descriptor, transactional);
            return null;
        });
    }

    @Override
    public void insertRecord(String packageName, String name, Row row, boolean transactional)
            throws VarStoreException {
        RowImpl rowImpl = toRowImpl(row);
        execute("insertRecord", () -> {
            store.insertRecord(packageName, name, rowImpl.getColumns(), rowImpl.getDescriptor(), transactional);
            return null;
        });
    }

    @Override
    public boolean updateRecord(String packageName, String name, Row row) throws VarStoreException {
        RowImpl rowImpl = toRowImpl(row);
        return execute("updateRecord",
                       () -> store.updateRecord(packageName, name, rowImpl.getColumns(),
                                                rowImpl.getDescriptor()));
    }

    @Override
    public boolean deleteRecord(String packageName, String name, Datum key) throws VarStoreException {
        Column column = toColumn(key, "key");
        return execute("deleteRecord", () -> store.deleteRecord(packageName, name, column));
    }

    @Override
    public RowStream selectAll(String packageName, String name) throws VarStoreException {
        VariableEntry var = store.resolveRecordVariable(packageName, name);
        RecordSet records = (RecordSet) var.getValue();
        return new RecordSetStream(records.getDescriptor(), bigValueMaxLength, records.rows());
    }

    @Override
    public RowStream selectByKey(String packageName, String name, Datum key) throws VarStoreException {
        Column column = toColumn(key, "key");
        VariableEntry var = store.resolveRecordVariable(packageName, name);
        RecordSet records = (RecordSet) var.getValue();
        store.checkKeyType(var, records, column);
        Column[] row = records.get(column);
        List<Column[]> rows = row == null ? Collections.emptyList() : Collections.singletonList(row);
        return new RecordSetStream(records.getDescriptor(), bigValueMaxLength, rows);
    }

    @Override
    public RowStream selectByKeys(String packageName, String name, KeyArray keys) throws VarStoreException {
        if (keys == null)
            throw new NullArgumentException("key array");
        if (keys.getDimensions() > 1)
            throw new UnsupportedDimensionalityException(name, keys.getDimensions());
        VariableEntry var = store.resolveRecordVariable(packageName, name);
        RecordSet records = (RecordSet) var.getValue();
        List<Column> columns = new ArrayList<>(keys.size());
        for (Datum key : keys.getElements()) {
            Column column = toColumn(key, "key");
            store.checkKeyType(var, records, column);
            columns.add(column.copy());
        }
        return new KeyLookupStream(records.getDescriptor(), bigValueMaxLength, var, columns);
    }

    @Override
    public boolean existsVariable(String packageName, String name) throws VarStoreException {
        return store.existsVariable(packageName, name);
    }

    @Override
    public boolean existsPackage(String packageName) throws VarStoreException {
        return store.existsPackage(packageName);
    }

    @Override
    public void removeVariable(String packageName, String name) throws VarStoreException {
        execute("removeVariable", () -> {
            store.removeVariable(packageName, name);
            return null;
        });
    }

    @Override
    public void removePackage(String packageName) throws VarStoreException {
        execute("removePackage", () -> {
            store.removePackage(packageName);
            return null;
        });
    }

    @Override
    public void removeAllPackages() throws VarStoreException {
        execute("removeAllPackages", () -> {
            store.removeAllPackages();
            return null;
        });
    }

    @Override
    public List<VariableInfo> listPackagesAndVariables() {
        return store.listPackagesAndVariables();
    }

    @Override
    public List<PackageStats> packageMemoryUsage() {
        return store.packageMemoryUsage();
    }

    // Transaction control

    @Override
    public void begin() throws TransactionException {
        getLocalHost().beginTransaction();
    }

    @Override
    public void commit() throws TransactionException {
        getLocalHost().commitTransaction();
    }

    @Override
    public void rollback() throws TransactionException {
        getLocalHost().rollbackTransaction();
    }

    @Override
    public Savepoint setSavepoint() throws TransactionException {
        LocalTransactionHost local = getLocalHost();
        if (!local.isInTransaction())
            begin();
        return local.beginNestedTopAction();
    }

    @Override
    public void releaseSavepoint(Savepoint savepoint) throws TransactionException {
        getLocalHost().commitNestedTopAction(toNestedTopAction(savepoint));
    }

    @Override
    public void rollback(Savepoint savepoint) throws TransactionException {
        getLocalHost().rollbackNestedTopAction(toNestedTopAction(savepoint));
    }

    @Override
    public int getNestLevel() {
        return host.getNestLevel();
    }

    @Override
    public boolean isInTransaction() {
        return host.getNestLevel() > 0;
    }

    @Override
    public boolean isAutoCommit() {
        return autoCommit;
    }

    @Override
    public void setAutoCommit(boolean autoCommit) {
        this.autoCommit = autoCommit;
    }

    @FunctionalInterface
    private interface Operation<T> {
        T run() throws VarStoreException;
    }

    /**
     * Runs a changing operation within a transaction. Outside a transaction,
     * an auto-commit session runs it in a transaction of its own, and other
     * sessions begin the transaction and leave it open.
     */
    private <T> T execute(String operation, Operation<T> op) throws VarStoreException {
        if (localHost == null) {
            if (host.getNestLevel() < 1)
                throw new TransactionException("No transaction in progress on the host.");
            return op.run();
        }
        if (localHost.isInTransaction())
            return op.run();

        localHost.beginTransaction();
        if (!autoCommit)
            return op.run();

        boolean succeeded = false;
        try {
            T result = op.run();
            succeeded = true;
            return result;
        } finally {
            if (succeeded) {
                localHost.commitTransaction();
            } else {
                logger.warn("{} failed, rolling back its transaction", operation);
                localHost.rollbackTransaction();
            }
        }
    }

    private LocalTransactionHost getLocalHost() throws TransactionException {
        if (localHost == null)
            throw new TransactionException("Transactions are controlled by the host.");
        return localHost;
    }

    private NestedTopAction toNestedTopAction(Savepoint savepoint) throws TransactionException {
        if (!(savepoint instanceof NestedTopAction))
            throw new TransactionException("Unknown savepoint: " + savepoint);
        return (NestedTopAction) savepoint;
    }

    private static Column toColumn(Datum datum, String argument) throws VarStoreException {
        if (datum == null)
            throw new NullArgumentException(argument);
        if (!(datum instanceof Column))
            throw new TypeException("Datum was not allocated by a Session.");
        return (Column) datum;
    }

    private static RowImpl toRowImpl(Row row) throws VarStoreException {
        if (row == null)
            throw new NullArgumentException("record argument");
        if (!(row instanceof RowImpl))
            throw new TypeException("Row was not allocated by a Session.");
        return (RowImpl) row;
    }
}
