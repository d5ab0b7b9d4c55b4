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
 * Visits live entries during {@link Cache#iterate(EntryVisitor)}.
 * The visitor runs while the shard of the visited entry is locked. Calling the cache for a key of another shard
 * from a visitor can deadlock against a thread doing the mirror-image call.
 */
@FunctionalInterface
public interface EntryVisitor {

    IterAction visit(CacheEntry entry);
}
