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
 * The memory held by one package as reported by
 * {@link Session#packageMemoryUsage}. The size is an estimate.
 */
public final class PackageStats {
    private final String packageName;
    private final long allocatedBytes;

    public PackageStats(String packageName, long allocatedBytes) {
        this.packageName = packageName;
        this.allocatedBytes = allocatedBytes;
    }

    public String getPackageName() {
        return packageName;
    }

    public long getAllocatedBytes() {
        return allocatedBytes;
    }

    @Override
    public String toString() {
        return packageName + ": " + allocatedBytes + " bytes";
    }
}
