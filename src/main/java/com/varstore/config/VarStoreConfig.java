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

package com.varstore.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of a VarStore session, loaded from YAML. Every property is
 * optional:
 * <pre>
 * autoCommit: true
 * initialPackageCapacity: 8
 * initialVariableCapacity: 16
 * bigValueMaxLength: 2147483647
 * </pre>
 */
public class VarStoreConfig {
    private static final Logger logger = LogManager.getLogger(VarStoreConfig.class);

    /**
     * Name of the classpath resource read by {@link #load()}.
     */
    public static final String RESOURCE_NAME = "varstore.yaml";

    private boolean autoCommit = true;
    private int initialPackageCapacity = 8;
    private int initialVariableCapacity = 16;
    private int bigValueMaxLength = Integer.MAX_VALUE;

    /**
     * Loads the configuration from the <code>varstore.yaml</code> classpath
     * resource, or returns the defaults when there is no such resource.
     *
     * @return the configuration
     */
    public static VarStoreConfig load() {
        InputStream is = VarStoreConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME);
        if (is == null) {
            logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
            return new VarStoreConfig();
        }
        try (InputStream in = is) {
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    /**
     * Loads the configuration from a YAML file.
     *
     * @param path the file
     * @return the configuration
     * @throws IOException if the file cannot be read
     */
    public static VarStoreConfig load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    /**
     * Parses the configuration from a YAML stream. An empty document yields
     * the defaults.
     *
     * @param is the stream
     * @return the configuration
     * @throws IllegalArgumentException if the document is malformed or a value
     *                                  is out of range
     */
    public static VarStoreConfig parse(InputStream is) {
        Yaml yaml = new Yaml(new Constructor(VarStoreConfig.class, new LoaderOptions()));
        VarStoreConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid VarStore configuration: " + e.getMessage(), e);
        }
        if (config == null)
            config = new VarStoreConfig();
        config.validate();
        logger.debug("Loaded configuration {}", config);
        return config;
    }

    /**
     * Checks that every value is in range.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        checkPositive("initialPackageCapacity", initialPackageCapacity);
        checkPositive("initialVariableCapacity", initialVariableCapacity);
        checkPositive("bigValueMaxLength", bigValueMaxLength);
    }

    private static void checkPositive(String property, int value) {
        if (value <= 0)
            throw new IllegalArgumentException(property + " must be positive: " + value);
    }

    public boolean isAutoCommit() {
        return autoCommit;
    }

    public void setAutoCommit(boolean autoCommit) {
        this.autoCommit = autoCommit;
    }

    public int getInitialPackageCapacity() {
        return initialPackageCapacity;
    }

    public void setInitialPackageCapacity(int initialPackageCapacity) {
        this.initialPackageCapacity = initialPackageCapacity;
    }

    public int getInitialVariableCapacity() {
        return initialVariableCapacity;
    }

    public void setInitialVariableCapacity(int initialVariableCapacity) {
        this.initialVariableCapacity = initialVariableCapacity;
    }

    public int getBigValueMaxLength() {
        return bigValueMaxLength;
    }

    public void setBigValueMaxLength(int bigValueMaxLength) {
        this.bigValueMaxLength = bigValueMaxLength;
    }

    @Override
    public String toString() {
        return "VarStoreConfig[autoCommit=" + autoCommit
                + ", initialPackageCapacity=" + initialPackageCapacity
                + ", initialVariableCapacity=" + initialVariableCapacity
                + ", bigValueMaxLength=" + bigValueMaxLength + "]";
    }
}
