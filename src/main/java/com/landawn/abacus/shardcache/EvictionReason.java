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
 * Why an entry was removed by the cache itself rather than by an explicit delete.
 *
 * @see EvictionListener
 */
public enum EvictionReason {

    /** The entry's expiration time passed. */
    EXPIRED,

    /** The entry was dropped to make room under the configured memory limit, or by {@link Cache#shrink(long)}. */
    LOW_MEMORY,

    /** The entry was removed by {@link Cache#clear()} or when the cache was closed. */
    CLEARED
}
