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

import java.util.Locale;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * Recommends sizing parameters from the system resources: the shard count of a cache, plus the network backlog,
 * event queue size and connection limit of a server embedding it. Every recommendation is clamped to documented
 * bounds and has a companion validator.
 *
 * <p>The functions are pure over a {@link SystemResources}; only {@link #optimizeDefaults()} and
 * {@link #validateConfig(int, int, int, int)} detect the resources themselves. A {@code ShardedCache} built
 * without an explicit shard count consults {@link #optimizeDefaults()} once, at construction.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * PerformanceConfig config = PerformanceTuning.optimizeDefaults();
 * PerformanceTuning.logRecommendations(config);
 *
 * ShardedCache cache = ShardedCache.builder().nshards(config.nshards()).build();
 * }</pre>
 */
public final class PerformanceTuning {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceTuning.class);

    public static final int MIN_BACKLOG = 256;
    public static final int MAX_BACKLOG = 16384;
    public static final int MIN_QUEUE_SIZE = 64;
    public static final int MAX_QUEUE_SIZE = 4096;
    public static final int MIN_MAX_CONNS = 128;
    public static final int MAX_MAX_CONNS = 131072;
    public static final int MIN_SHARDS = 32;
    public static final int MAX_SHARDS = 131072;

    public static final long HIGH_MEMORY_THRESHOLD = 4L * 1024 * 1024 * 1024;
    public static final long MEDIUM_MEMORY_THRESHOLD = 2L * 1024 * 1024 * 1024;
    public static final long LOW_MEMORY_THRESHOLD = 512L * 1024 * 1024;

    /** Approximate memory cost of one connection, in bytes. */
    public static final int MEMORY_PER_CONNECTION = 12288;

    /** Approximate memory cost of one empty shard, in bytes. */
    public static final int MEMORY_PER_SHARD = 2048;

    // connections never go below this, whatever the resources
    private static final int MAX_CONNS_FLOOR = 2048;

    private static final int RESERVED_FILE_DESCRIPTORS = 256;

    private PerformanceTuning() {
        // singleton for utility class.
    }

    /**
     * 256 per core, scaled by memory (x1.5 above 4 GiB, x0.75 below 2 GiB) and by core count (x1.25 above 4 cores).
     *
     * @param resources the system resources
     * @return a backlog in {@code [MIN_BACKLOG, MAX_BACKLOG]}
     */
    public static int calcOptimalBacklog(final SystemResources resources) {
        int optimal = 256 * resources.cpuCores();

        if (resources.hasHighMemory()) {
            optimal = (int) (optimal * 1.5);
        } else if (resources.totalMemory() < MEDIUM_MEMORY_THRESHOLD) {
            optimal = (int) (optimal * 0.75);
        }

        if (resources.hasManyCores()) {
            optimal = (int) (optimal * 1.25);
        }

        return clamp(optimal, MIN_BACKLOG, MAX_BACKLOG);
    }

    /**
     * 64 events per core (128 above 4 GiB, 32 below 2 GiB), then x1.2 from 8 cores and another x1.3 from 16 cores.
     *
     * @param resources the system resources
     * @return a queue size in {@code [MIN_QUEUE_SIZE, MAX_QUEUE_SIZE]}
     */
    public static int calcOptimalQueueSize(final SystemResources resources) {
        final int cores = resources.cpuCores();
        int optimal = cores * 64;

        if (resources.hasHighMemory()) {
            optimal = cores * 128;
        } else if (resources.totalMemory() < MEDIUM_MEMORY_THRESHOLD) {
            optimal = cores * 32;
        }

        if (cores >= 8) {
            optimal = (int) (optimal * 1.2);
        }

        if (cores >= 16) {
            optimal = (int) (optimal * 1.3);
        }

        return clamp(optimal, MIN_QUEUE_SIZE, MAX_QUEUE_SIZE);
    }

    /**
     * The smaller of the memory limit ({@value #MEMORY_PER_CONNECTION} bytes per connection) and the descriptor limit
     * (minus 256 reserved), scaled to 85%, 75% or 65% depending on memory and cores, then boosted x1.1 from 8 cores
     * and another x1.15 from 16 cores. Never below 2048.
     *
     * @param resources the system resources
     * @return a connection limit in {@code [MIN_MAX_CONNS, MAX_MAX_CONNS]}
     */
    public static int calcOptimalMaxConns(final SystemResources resources) {
        final long memoryLimit = resources.availableMemory() / MEMORY_PER_CONNECTION;
        final long fdLimit = (long) resources.maxFileDescriptors() - RESERVED_FILE_DESCRIPTORS;
        final long calculatedLimit = Math.min(memoryLimit, fdLimit);

        long optimal;

        if (resources.hasHighMemory() && resources.hasManyCores()) {
            optimal = (long) (calculatedLimit * 0.85);
        } else if (resources.hasHighMemory() || resources.hasManyCores()) {
            optimal = (long) (calculatedLimit * 0.75);
        } else {
            optimal = (long) (calculatedLimit * 0.65);
        }

        if (resources.cpuCores() >= 8) {
            optimal = (long) (optimal * 1.1);
        }

        if (resources.cpuCores() >= 16) {
            optimal = (long) (optimal * 1.15);
        }

        optimal = Math.max(optimal, MAX_CONNS_FLOOR);

        return (int) clamp(optimal, MIN_MAX_CONNS, MAX_MAX_CONNS);
    }

    /**
     * 128 shards per thread, doubled above 4 GiB and halved below 2 GiB, then x1.5 from 16 cores or x1.25 from 8 cores.
     * Capped so the shards use at most a quarter of the available memory, and aligned to a power of two: the lower
     * one when it is within 75% of the computed count, the upper one otherwise.
     *
     * @param resources the system resources
     * @param nthreads the number of threads operating on the cache
     * @return a shard count in {@code [MIN_SHARDS, MAX_SHARDS]}
     */
    public static int calcOptimalShards(final SystemResources resources, final int nthreads) {
        N.checkArgument(nthreads > 0, "nthreads must be positive: {}", nthreads);

        long optimal = (long) nthreads * 128;

        if (resources.hasHighMemory()) {
            optimal = optimal * 2;
        } else if (resources.totalMemory() < MEDIUM_MEMORY_THRESHOLD) {
            optimal = optimal / 2;
        }

        if (resources.cpuCores() >= 16) {
            optimal = (long) (optimal * 1.5);
        } else if (resources.cpuCores() >= 8) {
            optimal = (long) (optimal * 1.25);
        }

        final long availableForShards = resources.availableMemory() / 4;

        if (optimal * MEMORY_PER_SHARD > availableForShards) {
            optimal = availableForShards / MEMORY_PER_SHARD;
        }

        optimal = Math.min(optimal, MAX_SHARDS);

        long powerOf2 = 1;

        while (powerOf2 < optimal) {
            powerOf2 *= 2;
        }

        optimal = powerOf2 / 2 >= optimal * 0.75 ? powerOf2 / 2 : powerOf2;

        return (int) clamp(optimal, MIN_SHARDS, MAX_SHARDS);
    }

    public static boolean validateBacklog(final int backlog) {
        return backlog >= MIN_BACKLOG && backlog <= MAX_BACKLOG;
    }

    public static boolean validateQueueSize(final int queueSize) {
        return queueSize >= MIN_QUEUE_SIZE && queueSize <= MAX_QUEUE_SIZE;
    }

    /**
     * Checks the bounds, and that the connections need less than half of the available memory.
     *
     * @param maxConns the connection limit
     * @param availableMemory the available memory in bytes
     * @return whether the value is acceptable
     */
    public static boolean validateMaxConns(final int maxConns, final long availableMemory) {
        if (maxConns < MIN_MAX_CONNS || maxConns > MAX_MAX_CONNS) {
            return false;
        }

        return (long) maxConns * MEMORY_PER_CONNECTION < availableMemory * 0.5;
    }

    /**
     * Checks the bounds, and that there are between 4 and 8192 shards per thread.
     *
     * @param nshards the shard count
     * @param nthreads the number of threads
     * @return whether the value is acceptable
     */
    public static boolean validateShards(final int nshards, final int nthreads) {
        if (nshards < MIN_SHARDS || nshards > MAX_SHARDS || nthreads <= 0) {
            return false;
        }

        final int ratio = nshards / nthreads;

        return ratio >= 4 && ratio <= 8192;
    }

    /**
     * Validates a complete configuration against the detected resources.
     *
     * @see #validateConfig(SystemResources, int, int, int, int)
     */
    public static boolean validateConfig(final int backlog, final int queueSize, final int maxConns, final int nshards) {
        return validateConfig(SystemResources.detect(), backlog, queueSize, maxConns, nshards);
    }

    /**
     * Validates a complete configuration. When it is valid, a warning is logged for every value below half of its
     * recommendation.
     *
     * @param resources the system resources
     * @param backlog the network backlog
     * @param queueSize the event queue size
     * @param maxConns the connection limit
     * @param nshards the shard count
     * @return whether every value passes its validator
     */
    public static boolean validateConfig(final SystemResources resources, final int backlog, final int queueSize, final int maxConns,
            final int nshards) {
        final boolean valid = validateBacklog(backlog) && validateQueueSize(queueSize) && validateMaxConns(maxConns, resources.availableMemory())
                && validateShards(nshards, resources.cpuCores());

        if (valid && logger.isWarnEnabled()) {
            warnIfLow("backlog", backlog, calcOptimalBacklog(resources));
            warnIfLow("queuesize", queueSize, calcOptimalQueueSize(resources));
            warnIfLow("maxconns", maxConns, calcOptimalMaxConns(resources));
            warnIfLow("shards", nshards, calcOptimalShards(resources, resources.cpuCores()));
        }

        return valid;
    }

    public static PerformanceConfig optimizeDefaults() {
        return optimizeDefaults(SystemResources.detect());
    }

    /**
     * Computes every recommendation, using one thread per core for the shard count.
     *
     * @param resources the system resources
     * @return the recommended configuration
     */
    public static PerformanceConfig optimizeDefaults(final SystemResources resources) {
        N.checkArgNotNull(resources, "resources");

        final int backlog = calcOptimalBacklog(resources);
        final int queueSize = calcOptimalQueueSize(resources);
        final int maxConns = calcOptimalMaxConns(resources);
        final int nshards = calcOptimalShards(resources, resources.cpuCores());

        final String summary = String.format(Locale.ROOT, "Auto-tuned for %d cores, %.1fGB memory: backlog=%d, queuesize=%d, maxconns=%d, shards=%d",
                resources.cpuCores(), resources.totalMemory() / (1024.0 * 1024.0 * 1024.0), backlog, queueSize, maxConns, nshards);

        return new PerformanceConfig(backlog, queueSize, maxConns, nshards, true, summary);
    }

    public static void logRecommendations(final PerformanceConfig config) {
        N.checkArgNotNull(config, "config");

        if (logger.isInfoEnabled()) {
            logger.info("Performance tuning recommendations:");
            logger.info("  Backlog: " + config.backlog() + " (network accept queue)");
            logger.info("  Queue Size: " + config.queueSize() + " (event processing queue)");
            logger.info("  Max Connections: " + config.maxConns() + " (concurrent client limit)");
            logger.info("  Shards: " + config.nshards() + " (hashmap partitions)");

            if (config.summary() != null) {
                logger.info("  " + config.summary());
            }
        }
    }

    private static void warnIfLow(final String name, final int value, final int optimal) {
        if (value < optimal * 0.5) {
            logger.warn("Performance warning: " + name + " (" + value + ") is significantly below optimal (" + optimal + ")");
        }
    }

    private static long clamp(final long value, final long min, final long max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int clamp(final int value, final int min, final int max) {
        return Math.max(min, Math.min(max, value));
    }
}
