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

/**
 * <code>RowStream</code> defines methods to scan the rows returned by a select
 * on a record variable. The <code>RowStream</code> supports forward-only fetch
 * operations that return rows one-by-one. A {@link #rewind} method is
 * provided to allow scans to be repeated.
 * <p>
 * Rows are fetched lazily and copied into the row supplied by the caller, so
 * later changes to the variable never alter a row already fetched. After the
 * <code>RowStream</code> is no longer needed it should be closed by calling
 * {@link #close}, which invalidates it.
 *
 * @see Row
 */
public interface RowStream extends AutoCloseable {

    /**
     * Allocates a <code>Row</code> container that can be used to fetch rows
     * from the RowStream.
     *
     * @return a <code>Row</code> with the type structure of the row stream
     */
    Row allocateRow();

    /**
     * Fetches into the provided <code>Row</code> the next row in the stream of
     * rows from the underlying record variable.
     *
     * @param row the <code>Row</code> that will hold the returned value of the
     *            fetched row
     * @return true if a row is found, false if there are no more rows.
     * @throws VarStoreException if the stream is closed or the row has the
     *                           wrong shape
     */
    boolean fetchNext(Row row) throws VarStoreException;

    /**
     * Rewinds the <code>RowStream</code> to repeat the scan from its first row.
     *
     * @throws VarStoreException if the stream is closed
     */
    void rewind() throws VarStoreException;

    /**
     * Closes the <code>RowStream</code> and releases any resources associated
     * with it.
     */
    @Override
    void close();
}
