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

package com.landawn.abacus.shardcache;

/**
 * An immutable snapshot of cache statistics at a specific point in time.
 *
 * <p>The values are sums of per-shard counters read without taking the shard locks, so a snapshot taken while
 * other threads mutate the cache is not a consistent cut across shards. Each shard's own counters are updated
 * under that shard's lock. The statistics are diagnostic and never used by the cache for correctness decisions.</p>
 *
 * <p><b>Statistics Categories:</b>
 * <ul>
 *   <li><b>Layout:</b> {@code nshards()} - fixed number of shards</li>
 *   <li><b>Content:</b> {@code count()} - stored entries, {@code size()} - approximate bytes of keys, values and metadata</li>
 *   <li><b>Activity:</b> {@code total()} - store, load and delete calls since creation</li>
 *   <li><b>Memory:</b> {@code maxMemory()} - configured limit, {@code 0} when unlimited</li>
 *   <li><b>Eviction:</b> {@code expiredCount()}, {@code lowMemoryCount()}, {@code clearedCount()} - removals by reason</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * CacheStats stats = cache.stats();
 *
 * if (stats.maxMemory() > 0) {
 *     double usage = (double) stats.size() / stats.maxMemory() * 100;
 *     System.out.printf("Memory usage: %d/%d bytes (%.1f%%)%n", stats.size(), stats.maxMemory(), usage);
 * }
 *
 * if (stats.lowMemoryCount() > 0) {
 *     System.out.println("Entries dropped under memory pressure: " + stats.lowMemoryCount());
 * }
 * }</pre>
 *
 * @param nshards the number of shards
 * @param count the number of stored entries, including expired entries not yet swept
 * @param size the approximate number of bytes held by the stored entries
 * @param total the number of store, load and delete operations since the cache was created
 * @param maxMemory the configured memory limit in bytes, {@code 0} if unlimited
 * @param expiredCount the number of entries removed because they expired
 * @param lowMemoryCount the number of entries removed under memory pressure
 * @param clearedCount the number of entries removed by clear or close
 * @see Cache#stats()
 */
public record CacheStats(int nshards, long count, long size, long total, long maxMemory, long expiredCount, long lowMemoryCount, long clearedCount) {

    /**
     * Returns the total number of entries removed by the cache itself.
     *
     * @return the sum of the eviction counters
     */
    public long evictionCount() {
        return expiredCount + lowMemoryCount + clearedCount;
    }
}
