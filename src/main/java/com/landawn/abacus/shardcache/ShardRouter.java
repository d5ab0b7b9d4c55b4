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

import java.util.function.IntFunction;

import com.landawn.abacus.util.N;

/**
 * Owns the fixed array of shards and maps every key to exactly one of them.
 *
 * <p>The shard index is a pure function of the key bytes and the shard count: the low bits of a 64-bit hash,
 * masked when the shard count is a power of two and reduced modulo the count otherwise. The shard count never
 * changes, so a key stays in the same shard for the lifetime of the cache.</p>
 */
final class ShardRouter {

    private static final long SEED = 0x9E3779B97F4A7C15L;
    private static final long C1 = 0x87C37B91114253D5L;
    private static final long C2 = 0x4CF5AD432745937FL;

    private final Shard[] shards;

    // -1 when the shard count is not a power of two
    private final int mask;

    ShardRouter(final int nshards, final IntFunction<Shard> shardFactory) {
        N.checkArgument(nshards >= 1, "The shard count must be >= 1: {}", nshards);

        this.shards = new Shard[nshards];
        this.mask = (nshards & (nshards - 1)) == 0 ? nshards - 1 : -1;

        for (int i = 0; i < nshards; i++) {
            shards[i] = shardFactory.apply(i);
        }
    }

    /**
     * Hashes the key bytes, murmur3 style: 8-byte blocks mixed into the state, then the tail, then a final avalanche.
     *
     * @param data the key bytes
     * @return the 64-bit hash
     */
    static long hash(final byte[] data) {
        final int len = data.length;
        long h = SEED ^ (len * C1);
        int i = 0;

        for (; i + 8 <= len; i += 8) {
            long k = (data[i] & 0xFFL) | (data[i + 1] & 0xFFL) << 8 | (data[i + 2] & 0xFFL) << 16 | (data[i + 3] & 0xFFL) << 24
                    | (data[i + 4] & 0xFFL) << 32 | (data[i + 5] & 0xFFL) << 40 | (data[i + 6] & 0xFFL) << 48 | (data[i + 7] & 0xFFL) << 56;

            k *= C1;
            k = Long.rotateLeft(k, 31);
            k *= C2;

            h ^= k;
            h = Long.rotateLeft(h, 27) * 5 + 0x52DCE729;
        }

        if (i < len) {
            long k = 0;

            for (int shift = 0; i < len; i++, shift += 8) {
                k |= (data[i] & 0xFFL) << shift;
            }

            k *= C1;
            k = Long.rotateLeft(k, 31);
            k *= C2;
            h ^= k;
        }

        return fmix64(h);
    }

    private static long fmix64(long h) {
        h ^= h >>> 33;
        h *= 0xFF51AFD7ED558CCDL;
        h ^= h >>> 33;
        h *= 0xC4CEB9FE1A85EC53L;
        h ^= h >>> 33;

        return h;
    }

    int shardIndex(final long hash) {
        return mask >= 0 ? (int) (hash & mask) : (int) Math.floorMod(hash, (long) shards.length);
    }

    int shardIndex(final byte[] key) {
        return shardIndex(hash(key));
    }

    /**
     * Wraps a copy of the caller's key bytes, so later changes to the caller's array can't reach the table.
     */
    Key keyOf(final byte[] key) {
        return new Key(key.clone(), hash(key));
    }

    /**
     * Wraps the key bytes without copying, for lookups that never store the key.
     */
    Key probeOf(final byte[] key) {
        return new Key(key, hash(key));
    }

    Shard shardFor(final Key key) {
        return shards[shardIndex(key.hash)];
    }

    Shard shard(final int index) {
        return shards[index];
    }

    int nshards() {
        return shards.length;
    }
}
