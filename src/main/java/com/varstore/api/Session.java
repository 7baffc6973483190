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

package com.varstore.api;

import java.util.List;

/**
 * <code>Session</code> is the interface to one store of package variables.
 * <p>
 * Variables are named by a package name and a variable name, and are either
 * scalar variables holding one {@link Datum} or record variables holding a set
 * of {@link Row}s keyed by their first column. A variable's type, whether it
 * is a record variable, and whether it is transactional are fixed when the
 * variable is first created.
 * <p>
 * Changes to transactional variables are undone when the transaction or
 * savepoint in which they were made is rolled back; changes to regular
 * variables are never undone.
 * <p>
 * Unless the session is attached to an external transaction host, it controls
 * transactions itself: {@link #begin}, {@link #commit} and {@link #rollback}
 * control the top-level transaction and {@link #setSavepoint} opens nested
 * levels within it. In auto-commit mode every changing call made outside a
 * transaction runs in a transaction of its own; otherwise such a call begins
 * a transaction that lasts until the next commit or rollback.
 * <p>
 * A session is not thread-safe.
 *
 * @see VarStore
 */
public interface Session {
    /**
     * Allocates a datum of the given type.
     *
     * @param type the type code
     * @return a null datum of that type
     * @throws TypeException if the type code is not recognized
     */
    Datum allocateDatum(char type) throws TypeException;

    /**
     * Allocates a row of the given shape.
     *
     * @param descriptor the row descriptor
     * @return a row with all columns null
     * @throws TypeException if a column type is not recognized
     */
    Row allocateRow(RowDescriptor descriptor) throws TypeException;

    /**
     * Sets the value of a scalar variable, creating the package and the
     * variable if they do not exist. The type of the variable is that of the
     * value.
     *
     * @param packageName   the package name
     * @param name          the variable name
     * @param value         the value; set it null to store a null value
     * @param transactional whether the variable is transactional
     * @throws VarStoreException if the variable exists with another type,
     *                           kind or transactionality, or a name is invalid
     */
    void setScalar(String packageName, String name, Datum value, boolean transactional)
            throws VarStoreException;

    /**
     * Gets the value of a scalar variable.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @param type        the expected type code
     * @param strict      whether a missing package or variable is an error
     * @return a copy of the value, or null if the variable does not exist and
     * <code>strict</code> is false
     * @throws VarStoreException if the variable has another type or kind, or
     *                           it is missing and <code>strict</code> is true
     */
    Datum getScalar(String packageName, String name, char type, boolean strict) throws VarStoreException;

    /**
     * Creates an empty record variable with the given row shape, or checks an
     * existing one against it.
     *
     * @param packageName   the package name
     * @param name          the variable name
     * @param descriptor    the row shape
     * @param transactional whether the variable is transactional
     * @throws VarStoreException if an existing variable differs in kind,
     *                           shape or transactionality
     */
    void declareRecordVariable(String packageName, String name, RowDescriptor descriptor,
                               boolean transactional) throws VarStoreException;

    /**
     * Inserts a row into a record variable, creating the package and variable
     * if they do not exist. A row with the same key is replaced.
     *
     * @param packageName   the package name
     * @param name          the variable name
     * @param row           the row
     * @param transactional whether the variable is transactional
     * @throws VarStoreException if the variable differs in kind, shape or
     *                           transactionality
     */
    void insertRecord(String packageName, String name, Row row, boolean transactional)
            throws VarStoreException;

    /**
     * Replaces the row with the same key as the given row.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @param row         the row
     * @return false if there is no row with that key
     * @throws VarStoreException if the variable is missing or differs in kind
     *                           or shape
     */
    boolean updateRecord(String packageName, String name, Row row) throws VarStoreException;

    /**
     * Deletes the row with the given key.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @param key         the key; a null datum matches the row with a null key
     * @return false if there is no row with that key
     * @throws VarStoreException if the variable is missing, is not a record
     *                           variable or has another key type
     */
    boolean deleteRecord(String packageName, String name, Datum key) throws VarStoreException;

    /**
     * Selects every row of a record variable, in no particular order.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @return a stream of the rows as of this call
     * @throws VarStoreException if the variable is missing or is not a record
     *                           variable
     */
    RowStream selectAll(String packageName, String name) throws VarStoreException;

    /**
     * Selects the row with the given key.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @param key         the key; a null datum matches the row with a null key
     * @return a stream of at most one row
     * @throws VarStoreException if the variable is missing, is not a record
     *                           variable or has another key type
     */
    RowStream selectByKey(String packageName, String name, Datum key) throws VarStoreException;

    /**
     * Selects the rows with the given keys, in the order of the keys. Keys
     * without a matching row are skipped.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @param keys        a one-dimensional array of keys
     * @return a stream of the matching rows
     * @throws VarStoreException if the variable is missing, is not a record
     *                           variable, has another key type, or the array
     *                           has more than one dimension
     */
    RowStream selectByKeys(String packageName, String name, KeyArray keys) throws VarStoreException;

    boolean existsVariable(String packageName, String name) throws VarStoreException;

    boolean existsPackage(String packageName) throws VarStoreException;

    /**
     * Removes a variable. When its package has no variables left, the
     * package is removed too.
     *
     * @param packageName the package name
     * @param name        the variable name
     * @throws VarStoreException if the package or variable does not exist
     */
    void removeVariable(String packageName, String name) throws VarStoreException;

    /**
     * Removes a package with all its variables.
     *
     * @param packageName the package name
     * @throws VarStoreException if the package does not exist
     */
    void removePackage(String packageName) throws VarStoreException;

    /**
     * Removes every package.
     *
     * @throws VarStoreException if no transaction can be started
     */
    void removeAllPackages() throws VarStoreException;

    /**
     * Lists every existing variable, ordered by package and variable name.
     *
     * @return the variables
     */
    List<VariableInfo> listPackagesAndVariables();

    /**
     * Estimates the memory held by each package, including packages removed
     * in a transaction that has not yet ended.
     *
     * @return the package sizes, ordered by package name
     */
    List<PackageStats> packageMemoryUsage();

    // Transaction control

    /**
     * Begins a transaction.
     *
     * @throws TransactionException if a transaction is already in progress or
     *                              transactions are controlled by a host
     */
    void begin() throws TransactionException;

    /**
     * Commits the transaction and every savepoint in it.
     *
     * @throws TransactionException if no transaction is in progress
     */
    void commit() throws TransactionException;

    /**
     * Rolls back the transaction and every savepoint in it.
     *
     * @throws TransactionException if no transaction is in progress
     */
    void rollback() throws TransactionException;

    /**
     * Opens a nested level within the transaction, beginning a transaction
     * first if none is in progress.
     *
     * @return the savepoint
     * @throws TransactionException if transactions are controlled by a host
     */
    Savepoint setSavepoint() throws TransactionException;

    /**
     * Commits every level opened at or after the savepoint into the enclosing
     * level.
     *
     * @param savepoint the savepoint
     * @throws TransactionException if the savepoint is no longer active
     */
    void releaseSavepoint(Savepoint savepoint) throws TransactionException;

    /**
     * Undoes every change made since the savepoint was set. The savepoint
     * stays active.
     *
     * @param savepoint the savepoint
     * @throws TransactionException if the savepoint is no longer active
     */
    void rollback(Savepoint savepoint) throws TransactionException;

    /**
     * Gets the current nesting level: 0 outside a transaction, 1 in a
     * transaction and one more for each open savepoint.
     *
     * @return the nesting level
     */
    int getNestLevel();

    boolean isInTransaction();

    boolean isAutoCommit();

    /**
     * Sets the auto-commit mode. Takes effect for the next transaction.
     *
     * @param autoCommit true for auto-commit
     */
    void setAutoCommit(boolean autoCommit);
}
