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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An immutable snapshot of a cache entry, handed to visitors and eviction listeners.
 * The stored entry itself never leaves its shard; {@link #key()} and {@link #value()} return copies.
 *
 * @param shard the index of the shard owning the entry
 * @param time the time, in ticker nanoseconds, at which the snapshot was taken
 * @param key the key bytes
 * @param value the value bytes
 * @param expires the absolute expiration time in ticker nanoseconds, or {@code 0} if the entry never expires
 * @param flags the caller-supplied flags, returned unchanged
 * @param cas the CAS stamp, or {@code 0} if CAS tracking is disabled
 */
public record CacheEntry(int shard, long time, byte[] key, byte[] value, long expires, int flags, long cas) {

    @Override
    public byte[] key() {
        return key.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    /**
     * Returns the length of the key without copying it.
     *
     * @return the key length in bytes
     */
    public int keyLength() {
        return key.length;
    }

    /**
     * Returns the length of the value without copying it.
     *
     * @return the value length in bytes
     */
    public int valueLength() {
        return value.length;
    }

    public boolean hasExpiration() {
        return expires > 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (obj instanceof CacheEntry other) {
            return shard == other.shard && time == other.time && expires == other.expires && flags == other.flags && cas == other.cas
                    && Arrays.equals(key, other.key) && Arrays.equals(value, other.value);
        }

        return false;
    }

    @Override
    public int hashCode() {
        int h = 17;
        h = 31 * h + shard;
        h = 31 * h + Arrays.hashCode(key);
        h = 31 * h + Arrays.hashCode(value);
        h = 31 * h + Long.hashCode(expires);
        h = 31 * h + flags;
        return 31 * h + Long.hashCode(cas);
    }

    @Override
    public String toString() {
        return "{shard=" + shard + ", key=" + new String(key, StandardCharsets.UTF_8) + ", valueLength=" + value.length + ", expires=" + expires
                + ", flags=" + flags + ", cas=" + cas + "}";
    }
}
