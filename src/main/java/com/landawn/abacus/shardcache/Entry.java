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

import java.util.Comparator;

/**
 * A stored entry. Owned by exactly one {@link Shard}; every field except {@link #key} and {@link #seq} is only
 * read or written while that shard is locked. The value array is replaced on update, never modified in place,
 * so snapshots may share it.
 */
final class Entry {

    /**
     * Approximate bytes of bookkeeping charged per entry on top of its key and value.
     */
    static final int OVERHEAD = 64;

    /**
     * Order of the expiration index: earliest expiration first, ties broken by insertion sequence.
     */
    static final Comparator<Entry> EXPIRY_ORDER = Comparator.comparingLong((Entry e) -> e.expires).thenComparingLong(e -> e.seq);

    final Key key;

    final long seq;

    byte[] value;

    int flags;

    // absolute ticker nanos, 0 = never
    long expires;

    long cas;

    Entry(final Key key, final byte[] value, final int flags, final long expires, final long cas, final long seq) {
        this.key = key;
        this.value = value;
        this.flags = flags;
        this.expires = expires;
        this.cas = cas;
        this.seq = seq;
    }

    static long sizeOf(final int keyLength, final int valueLength) {
        return (long) keyLength + valueLength + OVERHEAD;
    }

    /**
     * Absolute expiration of a relative ttl, saturated at {@link Long#MAX_VALUE}.
     *
     * @return {@code 0} if {@code ttl} is {@code 0}
     */
    static long expiresAt(final long now, final long ttl) {
        if (ttl <= 0) {
            return 0;
        }

        return now > 0 && ttl > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttl;
    }

    long size() {
        return sizeOf(key.bytes.length, value.length);
    }

    boolean isExpired(final long now) {
        return expires > 0 && expires <= now;
    }

    CacheEntry snapshot(final int shard, final long now) {
        return new CacheEntry(shard, now, key.bytes, value, expires, flags, cas);
    }
}
