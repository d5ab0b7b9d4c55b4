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
 * Receives a notification for every entry the cache removes on its own: expired entries dropped by a sweep or
 * on access, entries dropped under memory pressure, and entries removed by a clear.
 * Explicit deletes are not reported.
 *
 * <p>Notifications are delivered synchronously on the thread that triggered the removal, before that call returns,
 * after the owning shard's lock has been released. A listener cannot veto or alter the removal; an exception it
 * throws is logged and otherwise ignored.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * ShardedCache cache = ShardedCache.builder()
 *     .evicted((reason, entry) -> System.out.println(reason + ": " + new String(entry.key())))
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface EvictionListener {

    /**
     * Called once for each entry removed by the cache.
     *
     * @param reason why the entry was removed
     * @param entry a snapshot of the removed entry; {@link CacheEntry#time()} is the time of the removal
     */
    void onEvicted(EvictionReason reason, CacheEntry entry);
}
