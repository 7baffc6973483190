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

/**
 * This package defines the public API of VarStore, a store of session
 * package variables whose changes follow the transactions and savepoints of
 * the session.
 *
 * <H2>VarStore API Overview</H2>
 * <ul>
 *     <li>{@link com.varstore.api.VarStore} -- singleton entry point; gives you a session</li>
 *     <li>{@link com.varstore.api.Session} -- set, get and remove package variables; transaction and savepoint
 *     control</li>
 *     <li>{@link com.varstore.api.Datum} -- a typed scalar value</li>
 *     <li>{@link com.varstore.api.Row}, {@link com.varstore.api.RowDescriptor} and
 *     {@link com.varstore.api.RowStream} -- the rows of record variables</li>
 * </ul>
 *
 * <H3>Variables</H3>
 * <p>
 * A variable is identified by a package name and a variable name. It is created by the first call that stores a
 * value in it, which also fixes its type, whether it is a scalar or a record variable, and whether it is
 * transactional. A package exists as long as it holds at least one variable.
 * <p>
 * Scalar variables hold one {@link com.varstore.api.Datum}, allocated with
 * {@link com.varstore.api.Session#allocateDatum}. Record variables hold a set of rows of a fixed shape, indexed by
 * their first column; inserting a row whose key is already present replaces that row.
 *
 * <H3>Transactions</H3>
 * <p>
 * Changes to transactional variables, and the creation and removal of packages and variables, are undone when the
 * enclosing transaction or savepoint is rolled back. Changes to the values of regular variables are never undone.
 * <ul>
 *     <li>{@link com.varstore.api.Session#begin}, <code>commit</code> and <code>rollback</code> control the
 *     top-level transaction.
 *     <li>{@link com.varstore.api.Session#setSavepoint} opens a nested level; releasing the savepoint commits the
 *     level into its parent, and rolling back to it undoes the level's changes.
 *     <li>In auto-commit mode (the default), a changing call made outside a transaction runs in a transaction of
 *     its own.
 * </ul>
 *
 * <H3>Errors</H3>
 * <p>
 * Every failure is reported as a {@link com.varstore.api.VarStoreException} naming the offending package or
 * variable, and leaves the store unchanged.
 */
package com.varstore.api;
