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
import com.varstore.api.NameTooLongException;
import com.varstore.api.NoSuchRowException;
import com.varstore.api.NotFoundException;
import com.varstore.api.NullArgumentException;
import com.varstore.api.PackageStats;
import com.varstore.api.RowDescriptor;
import com.varstore.api.ShapeMismatchException;
import com.varstore.api.TransactionalityConflictException;
import com.varstore.api.TypeException;
import com.varstore.api.TypeMismatchException;
import com.varstore.api.VarStoreException;
import com.varstore.api.VariableInfo;
import com.varstore.core.Column;
import com.varstore.transaction.SavepointEngine;
import com.varstore.transaction.TransactionHost;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * VariableStore holds the packages and variables of one session and
 * implements every operation on them. All arguments are validated before
 * anything is changed, so a call that fails leaves the store as it was.
 * <p>
 * Operations that change the store must be called with a transaction in
 * progress on the host; read operations may be called at any time.
 */
public class VariableStore {
    private static final Logger logger = LogManager.getLogger(VariableStore.class);

    /**
     * Maximum length of package and variable names in UTF-8 bytes.
     */
    public static final int NAME_MAX_BYTES = 62;

    private final PackageRegistry registry;
    private final SavepointEngine engine;
    private final int bigValueMaxLength;

    public VariableStore(TransactionHost host, int initialPackageCapacity, int initialVariableCapacity,
                         int bigValueMaxLength) {
        this.registry = new PackageRegistry(initialPackageCapacity, initialVariableCapacity);
        this.engine = new SavepointEngine(host, registry);
        this.bigValueMaxLength = bigValueMaxLength;
    }

    SavepointEngine getEngine() {
        return engine;
    }

    PackageRegistry getRegistry() {
        return registry;
    }

    // Scalar variables

    public void setScalar(String packageName, String name, Column value, boolean transactional)
            throws VarStoreException {
        validateNames(packageName, name);
        VariableKind kind = VariableKind.of(transactional);
        PackageEntry pkg = registry.get(packageName);
        if (pkg != null)
            checkDeclaration(pkg, name, value.getType(), false, kind);

        pkg = resolvePackage(packageName, true, false);
        VariableEntry var = declareVariable(pkg, name, value.getType(), false, kind, null);
        if (var.isTransactional())
            engine.savepoint(var);
        ((ScalarValue) var.getValue()).assign(value);
    }

    /**
     * Gets a copy of the value of a scalar variable.
     *
     * @return the value, or null when the variable does not exist and
     * <code>strict</code> is false
     */
    public Column getScalar(String packageName, String name, char type, boolean strict)
            throws VarStoreException {
        validateNames(packageName, name);
        checkType(type);
        PackageEntry pkg = resolvePackage(packageName, false, strict);
        if (pkg == null)
            return null;
        VariableEntry var = resolveVariable(pkg, name, type, false, strict);
        if (var == null)
            return null;
        return ((ScalarValue) var.getValue()).getColumn().copy();
    }

    // Record variables

    public void declareRecordVariable(String packageName, String name, RowDescriptor descriptor,
                                      boolean transactional) throws VarStoreException {
        validateNames(packageName, name);
        VariableKind kind = VariableKind.of(transactional);
        PackageEntry pkg = registry.get(packageName);
        if (pkg != null)
            checkRecordDeclaration(pkg, name, descriptor, kind);

        pkg = resolvePackage(packageName, true, false);
        declareVariable(pkg, name, VariableEntry.RECORD_TYPE, true, kind, descriptor);
    }

    public void insertRecord(String packageName, String name, Column[] row, RowDescriptor descriptor,
                             boolean transactional) throws VarStoreException {
        validateNames(packageName, name);
        VariableKind kind = VariableKind.of(transactional);
        PackageEntry pkg = registry.get(packageName);
        if (pkg != null)
            checkRecordDeclaration(pkg, name, descriptor, kind);

        pkg = resolvePackage(packageName, true, false);
        VariableEntry var = declareVariable(pkg, name, VariableEntry.RECORD_TYPE, true, kind, descriptor);
        if (var.isTransactional())
            engine.savepoint(var);
        ((RecordSet) var.getValue()).insert(row);
    }

    /**
     * Replaces the row with the same key as the given row.
     *
     * @return false if the variable holds no row with that key
     */
    public boolean updateRecord(String packageName, String name, Column[] row, RowDescriptor descriptor)
            throws VarStoreException {
        VariableEntry var = resolveRecordVariable(packageName, name);
        RecordSet records = (RecordSet) var.getValue();
        checkShape(var, records, descriptor);
        if (!records.containsKey(row[0]))
            return false;

        if (var.isTransactional())
            engine.savepoint(var);
        try {
            ((RecordSet) var.getValue()).update(row);
        } catch (NoSuchRowException e) {
            throw new NoSuchRowException(var.getName());
        }
        return true;
    }

    /**
     * Deletes the row with the given key.
     *
     * @return false if the variable holds no row with that key
     */
    public boolean deleteRecord(String packageName, String name, Column key) throws VarStoreException {
        VariableEntry var = resolveRecordVariable(packageName, name);
        RecordSet records = (RecordSet) var.getValue();
        checkKeyType(var, records, key);
        if (!records.containsKey(key))
            return false;

        if (var.isTransactional())
            engine.savepoint(var);
        return ((RecordSet) var.getValue()).delete(key);
    }

    /**
     * Resolves a valid record variable for reading its rows.
     *
     * @throws NotFoundException if the package or variable does not exist
     */
    public VariableEntry resolveRecordVariable(String packageName, String name) throws VarStoreException {
        validateNames(packageName, name);
        PackageEntry pkg = resolvePackage(packageName, false, true);
        return resolveVariable(pkg, name, VariableEntry.RECORD_TYPE, true, true);
    }

    /**
     * Checks that a key can be used to search the given record set.
     *
     * @throws TypeMismatchException if the key type differs from the type of
     *                               the key column
     */
    public void checkKeyType(VariableEntry var, RecordSet records, Column key) throws TypeMismatchException {
        if (key.getType() != records.getDescriptor().getKeyType())
            throw new TypeMismatchException("requested value type '" + key.getType()
                                                    + "' differs from variable \"" + var.getName()
                                                    + "\" key type '"
                                                    + records.getDescriptor().getKeyType() + "'",
                                            var.getName());
    }

    // Existence and removal

    public boolean existsVariable(String packageName, String name) throws VarStoreException {
        validateNames(packageName, name);
        PackageEntry pkg = registry.get(packageName);
        if (pkg == null || !pkg.isValid())
            return false;
        VariableEntry var = pkg.getVariable(name);
        return var != null && var.isValid();
    }

    public boolean existsPackage(String packageName) throws VarStoreException {
        validateName("package name", packageName);
        PackageEntry pkg = registry.get(packageName);
        return pkg != null && pkg.isValid();
    }

    public void removeVariable(String packageName, String name) throws VarStoreException {
        validateNames(packageName, name);
        PackageEntry pkg = resolvePackage(packageName, false, true);
        VariableEntry var = pkg.getVariable(name);
        if (var == null || !var.isValid())
            throw new NotFoundException("variable", name);

        if (var.isTransactional()) {
            engine.savepoint(var);
            var.getState().setValid(false);
            engine.savepoint(pkg);
            PackState state = pkg.getState();
            state.setTransVarNum(state.getTransVarNum() - 1);
        } else {
            engine.evict(var);
        }
        logger.debug("Removed variable {}.{}", packageName, name);

        if (pkg.getState().getTransVarNum() == 0 && pkg.getRegularCount() == 0) {
            engine.savepoint(pkg);
            pkg.getState().setValid(false);
            logger.debug("Package {} has no variables left", packageName);
        }
    }

    public void removePackage(String packageName) throws VarStoreException {
        validateName("package name", packageName);
        removePackage(resolvePackage(packageName, false, true));
    }

    public void removeAllPackages() {
        for (PackageEntry pkg : registry.getPackages()) {
            if (pkg.isValid())
                removePackage(pkg);
        }
    }

    private void removePackage(PackageEntry pkg) {
        engine.savepoint(pkg);
        pkg.getState().setValid(false);
        registry.clearRegular(pkg);
        logger.debug("Removed package {}", pkg.getName());
    }

    // Diagnostics

    public List<VariableInfo> listPackagesAndVariables() {
        List<VariableInfo> list = new ArrayList<>();
        for (PackageEntry pkg : registry.getPackages()) {
            if (!pkg.isValid())
                continue;
            for (VariableEntry var : pkg.getVariables()) {
                if (var.isValid())
                    list.add(new VariableInfo(pkg.getName(), var.getName(), var.isTransactional()));
            }
        }
        list.sort(Comparator.comparing(VariableInfo::getPackageName)
                          .thenComparing(VariableInfo::getVariableName));
        return list;
    }

    public List<PackageStats> packageMemoryUsage() {
        List<PackageStats> list = new ArrayList<>();
        for (PackageEntry pkg : registry.getPackages()) {
            long size = pkg.getHistory().storeSize();
            for (VariableEntry var : pkg.getVariables()) {
                if (var.isTransactional() || pkg.isValid())
                    size += var.getHistory().storeSize();
            }
            list.add(new PackageStats(pkg.getName(), size));
        }
        list.sort(Comparator.comparing(PackageStats::getPackageName));
        return list;
    }

    // Resolution

    /**
     * Looks up a package, creating or reviving it if asked to.
     *
     * @param name   the package name
     * @param create true to create a missing package or revive a removed one
     * @param strict true to fail if the package is missing and not created
     * @return the package, or null if missing and neither created nor strict
     * @throws NotFoundException if strict and the package is missing
     */
    PackageEntry resolvePackage(String name, boolean create, boolean strict) throws NotFoundException {
        PackageEntry pkg = registry.get(name);
        if (pkg != null && pkg.isValid())
            return pkg;
        if (create) {
            if (pkg == null) {
                pkg = registry.create(name, engine.getLevel());
                engine.addToChangesStack(pkg);
            } else {
                revive(pkg);
            }
            return pkg;
        }
        if (strict)
            throw new NotFoundException("package", name);
        return null;
    }

    private void revive(PackageEntry pkg) {
        engine.savepoint(pkg);
        pkg.getState().setValid(true);
        registry.clearRegular(pkg);
        for (VariableEntry var : pkg.getTransactionalVariables()) {
            if (var.isValid()) {
                engine.savepoint(var);
                var.getState().setValid(false);
            }
        }
        pkg.getState().setTransVarNum(0);
        logger.debug("Revived package {}", pkg.getName());
    }

    /**
     * Looks up a variable and checks it has the expected type and kind.
     *
     * @return the variable, or null if it is missing and not strict
     * @throws NotFoundException     if strict and the variable is missing
     * @throws KindMismatchException if the variable is a record variable and
     *                               a scalar is expected, or the reverse
     * @throws TypeMismatchException if the scalar type differs
     */
    VariableEntry resolveVariable(PackageEntry pkg, String name, char type, boolean record, boolean strict)
            throws VarStoreException {
        VariableEntry var = pkg.getVariable(name);
        if (var != null) {
            checkKindAndType(var, type, record);
            if (var.isValid())
                return var;
        }
        if (strict)
            throw new NotFoundException("variable", name);
        return null;
    }

    /**
     * Gets the variable with the given declaration, creating it, or reviving
     * it if it was removed. The declaration must have been checked.
     */
    private VariableEntry declareVariable(PackageEntry pkg, String name, char type, boolean record,
                                          VariableKind kind, RowDescriptor descriptor) throws TypeException {
        VariableEntry var = pkg.getVariable(name);
        if (var != null && var.isValid())
            return var;

        Value value = record ? new RecordSet(descriptor) : new ScalarValue(createColumn(type));
        if (var != null) {
            engine.savepoint(var);
            var.getState().setValid(true);
            var.getState().setValue(value);
            logger.debug("Revived variable {}", var);
        } else if (kind.isTransactional()) {
            var = registry.createVariable(pkg, name, type, record, kind, value, engine.getLevel());
            engine.addToChangesStack(var);
        } else {
            return registry.createVariable(pkg, name, type, record, kind, value, 0);
        }

        engine.savepoint(pkg);
        PackState state = pkg.getState();
        state.setTransVarNum(state.getTransVarNum() + 1);
        return var;
    }

    private Column createColumn(char type) throws TypeException {
        return Column.createColumn(type, bigValueMaxLength);
    }

    private void checkDeclaration(PackageEntry pkg, String name, char type, boolean record, VariableKind kind)
            throws VarStoreException {
        VariableEntry var = pkg.getVariable(name);
        if (var == null)
            return;
        if (var.getKind() != kind)
            throw new TransactionalityConflictException(name, var.isTransactional());
        checkKindAndType(var, type, record);
    }

    private void checkRecordDeclaration(PackageEntry pkg, String name, RowDescriptor descriptor,
                                        VariableKind kind) throws VarStoreException {
        checkDeclaration(pkg, name, VariableEntry.RECORD_TYPE, true, kind);
        VariableEntry var = pkg.getVariable(name);
        if (var != null && var.isValid() && pkg.isValid())
            checkShape(var, (RecordSet) var.getValue(), descriptor);
    }

    private static void checkKindAndType(VariableEntry var, char type, boolean record)
            throws VarStoreException {
        if (var.isRecord() != record)
            throw new KindMismatchException(var.getName(), var.isRecord());
        if (!record && var.getType() != type)
            throw new TypeMismatchException("variable \"" + var.getName() + "\" requires \""
                                                    + var.getType() + "\" value", var.getName());
    }

    private static void checkShape(VariableEntry var, RecordSet records, RowDescriptor descriptor)
            throws ShapeMismatchException {
        if (!records.getDescriptor().equals(descriptor))
            throw new ShapeMismatchException(var.getName(), records.getDescriptor(), descriptor);
    }

    private static void checkType(char type) throws TypeException {
        if (!Column.isValidType(type))
            throw new TypeException("Unrecognized type: '" + type + "'");
    }

    private static void validateNames(String packageName, String name) throws VarStoreException {
        validateName("package name", packageName);
        validateName("variable name", name);
    }

    private static void validateName(String argument, String name) throws VarStoreException {
        if (name == null)
            throw new NullArgumentException(argument);
        if (name.getBytes(StandardCharsets.UTF_8).length > NAME_MAX_BYTES)
            throw new NameTooLongException(name);
    }
}
