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

import com.varstore.api.impl.SessionImpl;
import com.varstore.config.VarStoreConfig;
import com.varstore.transaction.TransactionHost;

/**
 * VarStore provides a thread-safe entry point to package variable stores.
 * There can be only one instance of VarStore, so it is a singleton class. Use
 * {@link #getInstance()} to get the single instance.
 * <p>
 * Call the method {@link #createSession} to obtain a {@link Session} with a
 * store of its own. Sessions created without a configuration use the
 * configuration loaded from <code>varstore.yaml</code> on the classpath, or
 * the defaults.
 */
public class VarStore {
    private static final VarStore instance = new VarStore();
    private VarStoreConfig defaultConfig;

    private VarStore() {}

    /**
     * Gets the singleton instance of VarStore
     *
     * @return the singleton instance of VarStore
     */
    public static VarStore getInstance() {
        return instance;
    }

    /**
     * Gets the default configuration, loading it on first use.
     *
     * @return the default configuration
     */
    public synchronized VarStoreConfig getDefaultConfig() {
        if (defaultConfig == null)
            defaultConfig = VarStoreConfig.load();
        return defaultConfig;
    }

    /**
     * Creates a session with the default configuration.
     *
     * @return the new session
     */
    public Session createSession() {
        return createSession(getDefaultConfig());
    }

    /**
     * Creates a session with the given configuration that controls its own
     * transactions.
     *
     * @param config the configuration
     * @return the new session
     */
    public Session createSession(VarStoreConfig config) {
        config.validate();
        return new SessionImpl(config);
    }

    /**
     * Creates a session whose nesting levels are driven by an external
     * transaction host. The transaction control methods of the session
     * cannot be used, and changes must be made while the host has a
     * transaction in progress.
     *
     * @param config the configuration
     * @param host   the transaction host
     * @return the new session
     */
    public Session createSession(VarStoreConfig config, TransactionHost host) {
        config.validate();
        return new SessionImpl(config, host);
    }
}
