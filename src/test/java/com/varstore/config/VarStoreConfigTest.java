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

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class VarStoreConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaults() {
        VarStoreConfig config = new VarStoreConfig();
        Assert.assertTrue(config.isAutoCommit());
        Assert.assertEquals(8, config.getInitialPackageCapacity());
        Assert.assertEquals(16, config.getInitialVariableCapacity());
        Assert.assertEquals(Integer.MAX_VALUE, config.getBigValueMaxLength());
    }

    @Test
    public void testLoadWithoutResourceUsesDefaults() {
        VarStoreConfig config = VarStoreConfig.load();
        Assert.assertTrue(config.isAutoCommit());
        Assert.assertEquals(8, config.getInitialPackageCapacity());
    }

    @Test
    public void testParseResource() throws Exception {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("varstore-test.yaml")) {
            Assert.assertNotNull(is);
            VarStoreConfig config = VarStoreConfig.parse(is);
            Assert.assertFalse(config.isAutoCommit());
            Assert.assertEquals(4, config.getInitialPackageCapacity());
            Assert.assertEquals(32, config.getInitialVariableCapacity());
            Assert.assertEquals(1024, config.getBigValueMaxLength());
        }
    }

    @Test
    public void testParsePartialAndEmpty() {
        VarStoreConfig config = VarStoreConfig.parse(yaml("bigValueMaxLength: 500\n"));
        Assert.assertEquals(500, config.getBigValueMaxLength());
        Assert.assertTrue(config.isAutoCommit());

        config = VarStoreConfig.parse(yaml(""));
        Assert.assertEquals(16, config.getInitialVariableCapacity());
    }

    @Test
    public void testLoadFile() throws Exception {
        Path path = folder.newFile("varstore.yaml").toPath();
        Files.write(path, "autoCommit: false\ninitialPackageCapacity: 2\n".getBytes(StandardCharsets.UTF_8));
        VarStoreConfig config = VarStoreConfig.load(path);
        Assert.assertFalse(config.isAutoCommit());
        Assert.assertEquals(2, config.getInitialPackageCapacity());
    }

    @Test
    public void testInvalidValues() throws Exception {
        try {
            VarStoreConfig.parse(yaml("initialPackageCapacity: 0\n"));
            throw new Exception("Was expecting an exception.");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("initialPackageCapacity"));
        }
        try {
            VarStoreConfig.parse(yaml("noSuchProperty: 1\n"));
            throw new Exception("Was expecting an exception.");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().startsWith("Invalid VarStore configuration"));
        }
    }
}
