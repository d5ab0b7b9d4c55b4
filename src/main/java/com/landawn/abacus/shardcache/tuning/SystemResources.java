/*
 * Copyright (C) 2025 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.shardcache.tuning;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

import com.landawn.abacus.util.N;

/**
 * The system resources the sizing recommendations are derived from.
 *
 * @param cpuCores the number of available processors
 * @param totalMemory the total physical memory in bytes
 * @param availableMemory the memory in bytes the recommendations may plan for
 * @param maxFileDescriptors the maximum number of open file descriptors
 * @see PerformanceTuning
 */
public record SystemResources(int cpuCores, long totalMemory, long availableMemory, int maxFileDescriptors) {

    static final int DEFAULT_MAX_FILE_DESCRIPTORS = 1024;

    public SystemResources {
        N.checkArgument(cpuCores > 0, "cpuCores must be positive: {}", cpuCores);
        N.checkArgument(totalMemory >= 0, "totalMemory can't be negative: {}", totalMemory);
        N.checkArgument(availableMemory >= 0, "availableMemory can't be negative: {}", availableMemory);
        N.checkArgument(maxFileDescriptors >= 0, "maxFileDescriptors can't be negative: {}", maxFileDescriptors);
    }

    /**
     * Detects the resources of the running system. Physical memory and the descriptor limit are read from the
     * platform MXBean when it exposes them; otherwise the JVM's maximum heap and {@value #DEFAULT_MAX_FILE_DESCRIPTORS}
     * descriptors are assumed. The available memory is taken to be the total memory.
     *
     * @return the detected resources
     */
    public static SystemResources detect() {
        final int cpuCores = Runtime.getRuntime().availableProcessors();
        final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

        long totalMemory = Runtime.getRuntime().maxMemory();
        int maxFileDescriptors = DEFAULT_MAX_FILE_DESCRIPTORS;

        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs && sunOs.getTotalMemorySize() > 0) {
            totalMemory = sunOs.getTotalMemorySize();
        }

        if (os instanceof com.sun.management.UnixOperatingSystemMXBean unixOs && unixOs.getMaxFileDescriptorCount() > 0) {
            maxFileDescriptors = (int) Math.min(Integer.MAX_VALUE, unixOs.getMaxFileDescriptorCount());
        }

        return new SystemResources(cpuCores, totalMemory, totalMemory, maxFileDescriptors);
    }

    /**
     * More than 4 GiB of memory.
     *
     * @return whether this is a high-memory system
     */
    public boolean hasHighMemory() {
        return totalMemory > PerformanceTuning.HIGH_MEMORY_THRESHOLD;
    }

    /**
     * More than 4 cores.
     *
     * @return whether this is a many-core system
     */
    public boolean hasManyCores() {
        return cpuCores > 4;
    }
}
