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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * One independent partition of the cache: a hash table in insertion order, an expiration index, a CAS counter
 * and the shard's counters, all guarded by the shard's monitor.
 *
 * <p>Every mutation runs entirely inside one {@code synchronized} method, so it is applied completely or not at
 * all. Removals the cache makes on its own are appended to the caller's eviction sink (when there is one) and
 * reported after the monitor is released. The counters are written under the monitor and read without it.</p>
 */
final class Shard {

    private static final int INITIAL_CAPACITY = 16;

    final int index;

    private final boolean useCas;

    // 0 = unlimited
    private final long memoryLimit;

    private final Map<Key, Entry> table;

    private final NavigableSet<Entry> expiryIndex = new TreeSet<>(Entry.EXPIRY_ORDER);

    private long lastCas;

    private long lastSeq;

    private volatile int count;

    private volatile long bytes;

    private volatile long total;

    private volatile long expiredCount;

    private volatile long lowMemoryCount;

    private volatile long clearedCount;

    Shard(final int index, final boolean useCas, final int loadFactor, final long memoryLimit) {
        this.index = index;
        this.useCas = useCas;
        this.memoryLimit = memoryLimit;
        this.table = new LinkedHashMap<>(INITIAL_CAPACITY, loadFactor / 100f);
    }

    synchronized Result store(final Key key, final byte[] value, final StoreOptions options, final long now, final List<Eviction> sink) {
        total++;

        Entry entry = table.get(key);

        if (entry != null && entry.isExpired(now)) {
            evict(entry, EvictionReason.EXPIRED, now, sink);
            entry = null;
        }

        final long required = Entry.sizeOf(key.bytes.length, value.length);

        if (entry == null) {
            if (options.casOp() || options.xx()) {
                return Result.NOT_FOUND;
            }

            if (!reserve(required, required, null, now, sink)) {
                return Result.NO_MEMORY;
            }

            insert(key, value, options.flags(), options.expiresAt(now));

            return Result.INSERTED;
        }

        if (options.nx()) {
            return Result.FOUND;
        }

        if (options.casOp() && entry.cas != options.cas()) {
            return Result.CAS_MISMATCH;
        }

        if (!reserve(required, required - entry.size(), entry, now, sink)) {
            return Result.NO_MEMORY;
        }

        update(entry, value, options.flags(), options.keepTtl() ? entry.expires : options.expiresAt(now));

        return Result.REPLACED;
    }

    synchronized Result load(final Key key, final LoadVisitor visitor, final long now, final List<Eviction> sink) {
        total++;

        final Entry entry = table.get(key);

        // expired entries stay in place until a sweep, but are invisible
        if (entry == null || entry.isExpired(now)) {
            return Result.NOT_FOUND;
        }

        if (visitor == null) {
            return Result.FOUND;
        }

        final LoadAction action = visitor.visit(entry.snapshot(index, now));

        // the visitor may have removed the entry through a nested call on this shard
        if (action == null || action.kind() == LoadAction.Kind.NONE || table.get(key) != entry) {
            return Result.FOUND;
        }

        if (action.kind() == LoadAction.Kind.DELETE) {
            unlink(entry);
            return Result.FOUND;
        }

        final byte[] value = action.value();
        final long required = Entry.sizeOf(key.bytes.length, value.length);

        if (!reserve(required, required - entry.size(), entry, now, sink)) {
            return Result.NO_MEMORY;
        }

        update(entry, value, action.flags(entry.flags), action.expires(entry.expires, now));

        return Result.FOUND;
    }

    synchronized Result delete(final Key key, final DeleteOptions options, final long now, final List<Eviction> sink) {
        total++;

        final Entry entry = table.get(key);

        if (entry == null) {
            return Result.NOT_FOUND;
        }

        if (entry.isExpired(now)) {
            evict(entry, EvictionReason.EXPIRED, now, sink);
            return Result.NOT_FOUND;
        }

        if (options.casOp() && entry.cas != options.cas()) {
            return Result.CAS_MISMATCH;
        }

        unlink(entry);

        return Result.DELETED;
    }

    /**
     * Visits the live entries in insertion order.
     *
     * @return {@code false} if the visitor stopped the iteration
     */
    synchronized boolean iterate(final EntryVisitor visitor, final long now) {
        if (table.isEmpty()) {
            return true;
        }

        // the visitor may delete entries, through its return value or a nested call
        final Entry[] entries = table.values().toArray(new Entry[0]);

        for (final Entry entry : entries) {
            if (entry.isExpired(now) || table.get(entry.key) != entry) {
                continue;
            }

            final IterAction action = visitor.visit(entry.snapshot(index, now));

            if (action == IterAction.STOP) {
                return false;
            } else if (action == IterAction.DELETE && table.get(entry.key) == entry) {
                unlink(entry);
            }
        }

        return true;
    }

    synchronized SweepResult sweep(final long now, final List<Eviction> sink) {
        long swept = 0;

        while (!expiryIndex.isEmpty()) {
            final Entry first = expiryIndex.first();

            if (!first.isExpired(now)) {
                break;
            }

            evict(first, EvictionReason.EXPIRED, now, sink);
            swept++;
        }

        return new SweepResult(swept, table.size());
    }

    /**
     * Counts expired entries without removing them.
     */
    synchronized int countExpired(final long now) {
        int expired = 0;

        for (final Entry entry : expiryIndex) {
            if (!entry.isExpired(now)) {
                break;
            }

            expired++;
        }

        return expired;
    }

    synchronized int clear(final long now, final List<Eviction> sink) {
        final int removed = table.size();

        if (sink != null) {
            for (final Entry entry : table.values()) {
                sink.add(new Eviction(EvictionReason.CLEARED, entry.snapshot(index, now)));
            }
        }

        table.clear();
        expiryIndex.clear();
        bytes = 0;
        count = 0;
        clearedCount += removed;

        return removed;
    }

    /**
     * Evicts one entry: the earliest expired one if any, otherwise the oldest one.
     *
     * @return {@code false} if the shard is empty
     */
    synchronized boolean evictOne(final long now, final List<Eviction> sink) {
        Entry victim = firstExpired(null, now);
        EvictionReason reason = EvictionReason.EXPIRED;

        if (victim == null) {
            victim = oldest(null);
            reason = EvictionReason.LOW_MEMORY;
        }

        if (victim == null) {
            return false;
        }

        evict(victim, reason, now, sink);

        return true;
    }

    int count() {
        return count;
    }

    long bytes() {
        return bytes;
    }

    long total() {
        return total;
    }

    long expiredCount() {
        return expiredCount;
    }

    long lowMemoryCount() {
        return lowMemoryCount;
    }

    long clearedCount() {
        return clearedCount;
    }

    private long nextCas() {
        return useCas ? ++lastCas : 0;
    }

    /**
     * Makes room for {@code delta} more bytes under the memory limit, evicting expired entries first and then the
     * oldest ones. {@code keep} is never evicted.
     *
     * @return {@code false} if an entry of {@code required} bytes can never fit in this shard
     */
    private boolean reserve(final long required, final long delta, final Entry keep, final long now, final List<Eviction> sink) {
        if (memoryLimit <= 0) {
            return true;
        }

        if (required > memoryLimit) {
            return false;
        }

        while (bytes + delta > memoryLimit) {
            Entry victim = firstExpired(keep, now);
            EvictionReason reason = EvictionReason.EXPIRED;

            if (victim == null) {
                victim = oldest(keep);
                reason = EvictionReason.LOW_MEMORY;
            }

            if (victim == null) {
                return false;
            }

            evict(victim, reason, now, sink);
        }

        return true;
    }

    private Entry firstExpired(final Entry keep, final long now) {
        for (final Entry entry : expiryIndex) {
            if (!entry.isExpired(now)) {
                return null;
            }

            if (entry != keep) {
                return entry;
            }
        }

        return null;
    }

    private Entry oldest(final Entry keep) {
        final Iterator<Entry> iter = table.values().iterator();

        while (iter.hasNext()) {
            final Entry entry = iter.next();

            if (entry != keep) {
                return entry;
            }
        }

        return null;
    }

    private void insert(final Key key, final byte[] value, final int flags, final long expires) {
        final Entry entry = new Entry(key, value, flags, expires, nextCas(), ++lastSeq);

        table.put(key, entry);

        if (expires > 0) {
            expiryIndex.add(entry);
        }

        bytes += entry.size();
        count = table.size();
    }

    private void update(final Entry entry, final byte[] value, final int flags, final long expires) {
        final long oldSize = entry.size();

        // the index is ordered by expiration, so the entry must leave it before that changes
        if (entry.expires > 0) {
            expiryIndex.remove(entry);
        }

        entry.value = value;
        entry.flags = flags;
        entry.expires = expires;
        entry.cas = nextCas();

        if (expires > 0) {
            expiryIndex.add(entry);
        }

        bytes += entry.size() - oldSize;
    }

    private void unlink(final Entry entry) {
        table.remove(entry.key);

        if (entry.expires > 0) {
            expiryIndex.remove(entry);
        }

        bytes -= entry.size();
        count = table.size();
    }

    private void evict(final Entry entry, final EvictionReason reason, final long now, final List<Eviction> sink) {
        unlink(entry);

        switch (reason) {
            case EXPIRED:
                expiredCount++;
                break;

            case LOW_MEMORY:
                lowMemoryCount++;
                break;

            default:
                clearedCount++;
        }

        if (sink != null) {
            sink.add(new Eviction(reason, entry.snapshot(index, now)));
        }
    }
}
