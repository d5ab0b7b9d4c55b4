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

import java.util.Arrays;

/**
 * Hash-table key wrapping the key bytes together with their 64-bit hash.
 * The low bits of the hash select the shard, the high bits feed {@link #hashCode()}, so keys that share a shard
 * still spread over that shard's table.
 */
final class Key {

    final byte[] bytes;

    final long hash;

    Key(final byte[] bytes, final long hash) {
        this.bytes = bytes;
        this.hash = hash;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (obj instanceof Key other) {
            return hash == other.hash && Arrays.equals(bytes, other.bytes);
        }

        return false;
    }

    @Override
    public int hashCode() {
        return (int) (hash >>> 32);
    }

    @Override
    public String toString() {
        return "Key[" + bytes.length + " bytes]";
    }
}
