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
 * Receives the entry found by {@link Cache#load(byte[], LoadVisitor)} and may ask for a mutation of that entry.
 *
 * <p>The visitor runs while the entry's shard is locked, and the returned {@link LoadAction} is applied under
 * the same lock before {@code load} returns, so a read-modify-write through a visitor cannot lose an update
 * to a concurrent writer of the same key.</p>
 *
 * <p>Calling the cache from a visitor is allowed for keys of the same shard. Touching a key of another shard can
 * deadlock against a thread doing the mirror-image call. A nested call that removes the visited entry
 * turns the returned action into a no-op.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // read the CAS stamp
 * long[] cas = new long[1];
 * cache.load(key, entry -> {
 *     cas[0] = entry.cas();
 *     return LoadAction.none();
 * });
 *
 * // increment a counter in place
 * cache.load(key, entry -> LoadAction.replace(increment(entry.value())));
 * }</pre>
 */
@FunctionalInterface
public interface LoadVisitor {

    LoadAction visit(CacheEntry entry);
}
