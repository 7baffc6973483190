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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The packages of one store, keyed by name. Entries stay registered while
 * they are logically deleted and are only evicted once nothing can restore
 * them.
 */
public class PackageRegistry {
    private static final Logger logger = LogManager.getLogger(PackageRegistry.class);

    private final Map<String, PackageEntry> packages;
    private final int initialVariableCapacity;

    public PackageRegistry(int initialPackageCapacity, int initialVariableCapacity) {
        this.packages = new HashMap<>(initialPackageCapacity);
        this.initialVariableCapacity = initialVariableCapacity;
    }

    /**
     * Looks up a package by name, whether valid or not.
     *
     * @param name the package name
     * @return the package, or null if it is not registered
     */
    public PackageEntry get(String name) {
        return packages.get(name);
    }

    /**
     * Registers a new package with a valid initial state stamped with the
     * given level.
     *
     * @param name  the package name
     * @param level the current nesting level
     * @return the new package
     */
    public PackageEntry create(String name, int level) {
        PackageEntry pkg = new PackageEntry(name, initialVariableCapacity);
        pkg.getHistory().push(new PackState(true, 0, level));
        packages.put(name, pkg);
        logger.debug("Created package {} at level {}", name, level);
        return pkg;
    }

    /**
     * Registers a new variable in the given package with an initial state
     * holding the given value.
     *
     * @param pkg    the owning package
     * @param name   the variable name
     * @param type   the type code
     * @param record true for a record variable
     * @param kind   regular or transactional
     * @param value  the initial value
     * @param level  the current nesting level, or 0 for regular variables
     * @return the new variable
     */
    public VariableEntry createVariable(PackageEntry pkg, String name, char type, boolean record,
                                        VariableKind kind, Value value, int level) {
        VariableEntry var = pkg.addVariable(name, type, record, kind);
        var.getHistory().push(new VarState(value, level));
        logger.debug("Created {} variable {} at level {}", kind, var, level);
        return var;
    }

    /**
     * Removes a package, all its variables and all its history.
     *
     * @param pkg the package
     */
    public void evict(PackageEntry pkg) {
        if (packages.get(pkg.getName()) == pkg)
            packages.remove(pkg.getName());
        pkg.markDeleted();
        logger.debug("Evicted package {}", pkg.getName());
    }

    /**
     * Removes a variable and all its history.
     *
     * @param var the variable
     */
    public void evict(VariableEntry var) {
        var.getPackage().evictVariable(var);
        logger.debug("Evicted variable {}", var);
    }

    /**
     * Removes every regular variable of a package.
     *
     * @param pkg the package
     */
    public void clearRegular(PackageEntry pkg) {
        pkg.clearRegular();
    }

    /**
     * Gets every registered package, valid or not.
     *
     * @return a snapshot of the packages
     */
    public List<PackageEntry> getPackages() {
        return new ArrayList<>(packages.values());
    }

    public int size() {
        return packages.size();
    }
}
