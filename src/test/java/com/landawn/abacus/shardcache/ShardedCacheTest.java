/*
 * Copyright (c) 2025, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.shardcache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.landawn.abacus.util.N;

public class ShardedCacheTest {

    private final List<String> evictions = new ArrayList<>();

    private ManualTicker ticker;

    private ShardedCache cache;

    @BeforeEach
    public void setUp() {
        evictions.clear();
        ticker = new ManualTicker(1_000_000L);
        cache = ShardedCache.builder().nshards(4).useCas(true).ticker(ticker).evicted((reason, entry) -> {
            synchronized (evictions) {
                evictions.add(reason + ":" + str(entry.key()));
            }
        }).build();
    }

    private static byte[] bytes(final String str) {
        return str.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(final byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private String getString(final String key) {
        return cache.get(bytes(key)).map(ShardedCacheTest::str).orElse(null);
    }

    @Test
    public void test_store_load() {
        assertEquals(Result.INSERTED, cache.store(bytes("a"), bytes("1")));
        assertEquals("1", getString("a"));

        assertEquals(Result.REPLACED, cache.store(bytes("a"), bytes("2")));
        assertEquals("2", getString("a"));

        assertNull(getString("b"));
        assertTrue(cache.containsKey(bytes("a")));
        assertFalse(cache.containsKey(bytes("b")));
        assertEquals(Result.NOT_FOUND, cache.load(bytes("b"), null));
        assertEquals(Result.FOUND, cache.load(bytes("a"), null));
        assertEquals(1, cache.count());
    }

    @Test
    public void test_store_copiesArguments() {
        final byte[] key = bytes("k");
        final byte[] value = bytes("v1");

        cache.store(key, value);
        value[0] = 'x';
        key[0] = 'z';

        assertEquals("v1", getString("k"));

        final byte[] read = cache.get(bytes("k")).get();
        read[0] = 'y';
        assertEquals("v1", getString("k"));
    }

    @Test
    public void test_emptyKeyAndValue() {
        assertEquals(Result.INSERTED, cache.store(new byte[0], new byte[0]));
        assertArrayEquals(new byte[0], cache.get(new byte[0]).get());
        assertEquals(Entry.OVERHEAD, cache.size());
    }

    @Test
    public void test_entryMetadata() {
        cache.store(bytes("k"), bytes("value"), new StoreOptions().flags(42).ttl(500));

        final CacheEntry entry = cache.getEntry(bytes("k")).get();
        N.println(entry);

        assertEquals(cache.shardOf(bytes("k")), entry.shard());
        assertEquals(ticker.read(), entry.time());
        assertEquals("k", str(entry.key()));
        assertEquals("value", str(entry.value()));
        assertEquals(5, entry.valueLength());
        assertEquals(42, entry.flags());
        assertEquals(ticker.read() + 500, entry.expires());
        assertTrue(entry.hasExpiration());
        assertTrue(entry.cas() > 0);
    }

    @Test
    public void test_cas() {
        assertEquals(Result.INSERTED, cache.store(bytes("k"), bytes("v1")));
        final long c1 = cache.getEntry(bytes("k")).get().cas();

        assertEquals(Result.REPLACED, cache.store(bytes("k"), bytes("v2"), new StoreOptions().casOp(true).cas(c1)));
        final long c2 = cache.getEntry(bytes("k")).get().cas();
        assertTrue(c2 > c1);
        assertEquals("v2", getString("k"));

        // stale stamp
        assertEquals(Result.CAS_MISMATCH, cache.store(bytes("k"), bytes("v3"), new StoreOptions().casOp(true).cas(c1)));
        assertEquals("v2", getString("k"));
        assertEquals(c2, cache.getEntry(bytes("k")).get().cas());

        assertEquals(Result.NOT_FOUND, cache.store(bytes("missing"), bytes("v"), new StoreOptions().casOp(true).cas(c1)));
        assertFalse(cache.containsKey(bytes("missing")));
    }

    @Test
    public void test_cas_disabled() {
        final ShardedCache plain = ShardedCache.builder().nshards(2).ticker(ticker).build();

        plain.store(bytes("k"), bytes("v1"));
        plain.store(bytes("k"), bytes("v2"));

        assertFalse(plain.isCasEnabled());
        assertEquals(0, plain.getEntry(bytes("k")).get().cas());
    }

    @Test
    public void test_nx_xx() {
        assertEquals(Result.NOT_FOUND, cache.store(bytes("k"), bytes("v0"), new StoreOptions().xx(true)));
        assertFalse(cache.containsKey(bytes("k")));

        assertEquals(Result.INSERTED, cache.store(bytes("k"), bytes("v1"), new StoreOptions().nx(true)));
        assertEquals(Result.FOUND, cache.store(bytes("k"), bytes("v2"), new StoreOptions().nx(true)));
        assertEquals("v1", getString("k"));

        assertEquals(Result.REPLACED, cache.store(bytes("k"), bytes("v3"), new StoreOptions().xx(true)));
        assertEquals("v3", getString("k"));

        assertThrows(IllegalArgumentException.class, () -> cache.store(bytes("k"), bytes("v"), new StoreOptions().nx(true).xx(true)));
    }

    @Test
    public void test_invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> cache.store(null, bytes("v")));
        assertThrows(IllegalArgumentException.class, () -> cache.store(bytes("k"), null));
        assertThrows(IllegalArgumentException.class, () -> cache.store(bytes("k"), bytes("v"), null));
        assertThrows(IllegalArgumentException.class, () -> cache.store(bytes("k"), bytes("v"), new StoreOptions().ttl(-1)));
        assertThrows(IllegalArgumentException.class, () -> cache.delete(null));
        assertThrows(IllegalArgumentException.class, () -> cache.load(null, null));
        assertThrows(IllegalArgumentException.class, () -> cache.iterate(4, entry -> IterAction.CONTINUE));
        assertThrows(IllegalArgumentException.class, () -> cache.count(-1));
        assertThrows(IllegalArgumentException.class, () -> cache.sweepPoll(0));
        assertThrows(IllegalArgumentException.class, () -> ShardedCache.builder().nshards(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ShardedCache.builder().nshards(2).loadFactor(0).build());
    }

    @Test
    public void test_ttl_lazyExpiration() {
        cache.store(bytes("k"), bytes("v"), new StoreOptions().ttl(100));
        cache.store(bytes("forever"), bytes("v"));

        ticker.advance(99);
        assertEquals("v", getString("k"));

        ticker.advance(1);
        assertNull(getString("k"));
        assertFalse(cache.containsKey(bytes("k")));

        // still resident until swept
        assertEquals(2, cache.count());
        assertTrue(evictions.isEmpty());

        final SweepResult result = cache.sweep();
        assertEquals(1, result.swept());
        assertEquals(1, result.kept());
        assertEquals(1, cache.count());
        assertEquals(List.of("EXPIRED:k"), evictions);

        // nothing left to sweep, nothing notified twice
        assertEquals(0, cache.sweep().swept());
        assertEquals(1, evictions.size());
    }

    @Test
    public void test_ttl_timeUnit() {
        cache.store(bytes("k"), bytes("v"), 5, TimeUnit.SECONDS);
        assertEquals(ticker.read() + TimeUnit.SECONDS.toNanos(5), cache.getEntry(bytes("k")).get().expires());

        ticker.advance(TimeUnit.SECONDS.toNanos(5));
        assertNull(getString("k"));
    }

    @Test
    public void test_absoluteExpiration() {
        cache.store(bytes("k"), bytes("v"), new StoreOptions().expires(ticker.read() + 10));
        assertEquals(ticker.read() + 10, cache.getEntry(bytes("k")).get().expires());

        ticker.advance(10);
        assertNull(getString("k"));
    }

    @Test
    public void test_keepTtl() {
        cache.store(bytes("k"), bytes("v1"), new StoreOptions().ttl(100));
        final long expires = cache.getEntry(bytes("k")).get().expires();

        ticker.advance(50);
        cache.store(bytes("k"), bytes("v2"), new StoreOptions().keepTtl(true));
        assertEquals(expires, cache.getEntry(bytes("k")).get().expires());

        cache.store(bytes("k"), bytes("v3"));
        assertEquals(0, cache.getEntry(bytes("k")).get().expires());

        ticker.advance(1000);
        assertEquals("v3", getString("k"));
    }

    @Test
    public void test_storeOverExpiredEntry() {
        cache.store(bytes("k"), bytes("old"), new StoreOptions().ttl(10));
        ticker.advance(10);

        assertEquals(Result.INSERTED, cache.store(bytes("k"), bytes("new")));
        assertEquals(List.of("EXPIRED:k"), evictions);
        assertEquals("new", getString("k"));
        assertEquals(1, cache.count());
    }

    @Test
    public void test_deleteExpiredEntry() {
        cache.store(bytes("k"), bytes("v"), new StoreOptions().ttl(10));
        ticker.advance(20);

        assertEquals(Result.NOT_FOUND, cache.delete(bytes("k")));
        assertEquals(List.of("EXPIRED:k"), evictions);
        assertEquals(0, cache.count());
    }

    @Test
    public void test_delete() {
        cache.store(bytes("k"), bytes("v"));

        assertEquals(Result.DELETED, cache.delete(bytes("k")));
        assertEquals(Result.NOT_FOUND, cache.delete(bytes("k")));
        assertNull(getString("k"));

        // explicit deletes are not evictions
        assertTrue(evictions.isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    public void test_guardedDelete() {
        cache.store(bytes("k"), bytes("v"));
        final long cas = cache.getEntry(bytes("k")).get().cas();

        assertEquals(Result.CAS_MISMATCH, cache.delete(bytes("k"), new DeleteOptions().casOp(true).cas(cas + 1)));
        assertTrue(cache.containsKey(bytes("k")));

        assertEquals(Result.DELETED, cache.delete(bytes("k"), new DeleteOptions().casOp(true).cas(cas)));
        assertFalse(cache.containsKey(bytes("k")));
    }

    @Test
    public void test_loadVisitor_replaceAndDelete() {
        cache.store(bytes("k"), bytes("v1"), new StoreOptions().flags(7).ttl(100));
        final CacheEntry before = cache.getEntry(bytes("k")).get();

        assertEquals(Result.FOUND, cache.load(bytes("k"), entry -> LoadAction.replace(bytes(str(entry.value()) + "+"))));

        final CacheEntry after = cache.getEntry(bytes("k")).get();
        assertEquals("v1+", str(after.value()));
        assertEquals(7, after.flags());
        assertEquals(before.expires(), after.expires());
        assertNotEquals(before.cas(), after.cas());

        assertEquals(Result.FOUND, cache.load(bytes("k"), entry -> LoadAction.replace(bytes("v2"), 9, 0)));
        assertEquals(9, cache.getEntry(bytes("k")).get().flags());
        assertFalse(cache.getEntry(bytes("k")).get().hasExpiration());

        assertEquals(Result.FOUND, cache.load(bytes("k"), entry -> LoadAction.delete()));
        assertFalse(cache.containsKey(bytes("k")));
        assertTrue(evictions.isEmpty());

        assertEquals(Result.NOT_FOUND, cache.load(bytes("k"), entry -> LoadAction.delete()));
    }

    @Test
    public void test_loadVisitor_nestedDeleteDiscardsAction() {
        final ShardedCache single = ShardedCache.builder().nshards(1).ticker(ticker).evicted((reason, entry) -> {
            evictions.add(reason + ":" + str(entry.key()));
        }).build();

        single.store(bytes("k"), bytes("v"));

        assertEquals(Result.FOUND, single.load(bytes("k"), entry -> {
            single.delete(bytes("k"));
            return LoadAction.replace(bytes("ghost"), 0, 100);
        }));

        assertEquals(0, single.count());
        assertEquals(0, single.size());

        single.store(bytes("k"), bytes("live"));
        ticker.advance(200);

        assertEquals(0, single.sweep().swept());
        assertEquals("live", single.get(bytes("k")).map(ShardedCacheTest::str).orElse(null));
        assertEquals(1, single.count());
        assertEquals(Entry.sizeOf(1, 4), single.size());
        assertTrue(evictions.isEmpty());
    }

    @Test
    public void test_loadVisitor_nestedReinsertKeepsNewEntry() {
        final ShardedCache single = ShardedCache.builder().nshards(1).ticker(ticker).build();

        single.store(bytes("k"), bytes("v"));

        single.load(bytes("k"), entry -> {
            single.delete(bytes("k"));
            single.store(bytes("k"), bytes("fresh"));
            return LoadAction.delete();
        });

        assertEquals("fresh", single.get(bytes("k")).map(ShardedCacheTest::str).orElse(null));
        assertEquals(1, single.count());
        assertEquals(Entry.sizeOf(1, 5), single.size());
    }

    @Test
    public void test_hugeTtlSaturates() {
        cache.store(bytes("k"), bytes("v"), new StoreOptions().ttl(Long.MAX_VALUE));
        assertEquals(Long.MAX_VALUE, cache.getEntry(bytes("k")).get().expires());

        cache.store(bytes("d"), bytes("v"), Long.MAX_VALUE, TimeUnit.DAYS);
        assertEquals(Long.MAX_VALUE, cache.getEntry(bytes("d")).get().expires());

        cache.load(bytes("k"), entry -> LoadAction.replace(bytes("v2"), 0, Long.MAX_VALUE - 1));
        assertEquals(Long.MAX_VALUE, cache.getEntry(bytes("k")).get().expires());

        ticker.advance(TimeUnit.DAYS.toNanos(365 * 100));
        assertEquals("v2", getString("k"));
        assertEquals("v", getString("d"));
        assertEquals(0, cache.sweep().swept());
    }

    @Test
    public void test_loadVisitor_noneLeavesEntryUntouched() {
        cache.store(bytes("k"), bytes("v"));
        final long cas = cache.getEntry(bytes("k")).get().cas();

        assertEquals(Result.FOUND, cache.load(bytes("k"), entry -> LoadAction.none()));
        assertEquals(Result.FOUND, cache.load(bytes("k"), entry -> null));
        assertEquals(cas, cache.getEntry(bytes("k")).get().cas());
    }

    @Test
    public void test_clear() {
        for (int i = 0; i < 100; i++) {
            cache.store(bytes("k" + i), bytes("v" + i));
        }

        assertEquals(100, cache.clear());
        assertEquals(0, cache.count());
        assertEquals(0, cache.size());
        assertEquals(100, evictions.size());

        final Set<String> keys = new HashSet<>();

        for (final String eviction : evictions) {
            assertTrue(eviction.startsWith("CLEARED:"));
            keys.add(eviction);
        }

        assertEquals(100, keys.size());
        assertEquals(100, cache.stats().clearedCount());
    }

    @Test
    public void test_clearShard() {
        for (int i = 0; i < 100; i++) {
            cache.store(bytes("k" + i), bytes("v" + i));
        }

        final long inShard0 = cache.count(0);
        assertEquals(inShard0, cache.clear(0));
        assertEquals(0, cache.count(0));
        assertEquals(100 - inShard0, cache.count());
    }

    @Test
    public void test_iterate() {
        for (int i = 0; i < 50; i++) {
            cache.store(bytes("k" + i), bytes("v" + i));
        }

        final Set<String> seen = new HashSet<>();

        assertEquals(Result.FINISHED, cache.iterate(entry -> {
            seen.add(str(entry.key()));
            return IterAction.CONTINUE;
        }));

        assertEquals(50, seen.size());

        final int[] visited = new int[1];

        assertEquals(Result.CANCELED, cache.iterate(entry -> {
            visited[0]++;
            return IterAction.STOP;
        }));

        assertEquals(1, visited[0]);
    }

    @Test
    public void test_iterate_shardInInsertionOrder() {
        final ShardedCache single = ShardedCache.builder().nshards(1).ticker(ticker).build();

        for (int i = 0; i < 10; i++) {
            single.store(bytes("k" + i), bytes("v"));
        }

        // a replace keeps the original position
        single.store(bytes("k3"), bytes("v2"));

        final List<String> order = new ArrayList<>();

        single.iterate(0, entry -> {
            order.add(str(entry.key()));
            return IterAction.CONTINUE;
        });

        assertEquals(List.of("k0", "k1", "k2", "k3", "k4", "k5", "k6", "k7", "k8", "k9"), order);
    }

    @Test
    public void test_iterate_skipsExpiredAndDeletes() {
        for (int i = 0; i < 20; i++) {
            cache.store(bytes("k" + i), bytes("v"), new StoreOptions().ttl(i % 2 == 0 ? 0 : 10));
        }

        ticker.advance(10);

        final int[] visited = new int[1];

        cache.iterate(entry -> {
            visited[0]++;
            return str(entry.key()).endsWith("0") ? IterAction.DELETE : IterAction.CONTINUE;
        });

        assertEquals(10, visited[0]);

        // k0 and k10 deleted, odd keys expired but not swept
        assertFalse(cache.containsKey(bytes("k0")));
        assertFalse(cache.containsKey(bytes("k10")));
        assertEquals(18, cache.count());
        assertTrue(evictions.isEmpty());
    }

    @Test
    public void test_iterate_visitorMayCallCache() {
        for (int i = 0; i < 10; i++) {
            cache.store(bytes("k" + i), bytes("v"));
        }

        cache.iterate(entry -> {
            cache.delete(entry.key());
            return IterAction.CONTINUE;
        });

        assertEquals(0, cache.count());
    }

    @Test
    public void test_counters() {
        assertEquals(4, cache.nshards());
        assertEquals(0, cache.total());

        cache.store(bytes("ab"), bytes("1234"));
        cache.get(bytes("ab"));
        cache.get(bytes("zz"));
        cache.delete(bytes("zz"));

        assertEquals(4, cache.total());
        assertEquals(1, cache.count());
        assertEquals(2 + 4 + Entry.OVERHEAD, cache.size());

        final int shard = cache.shardOf(bytes("ab"));
        assertEquals(1, cache.count(shard));
        assertEquals(cache.size(), cache.size(shard));

        long total = 0;

        for (int i = 0; i < cache.nshards(); i++) {
            total += cache.total(i);
        }

        assertEquals(cache.total(), total);

        cache.store(bytes("ab"), bytes("12"));
        assertEquals(2 + 2 + Entry.OVERHEAD, cache.size());
    }

    @Test
    public void test_stats() {
        cache.store(bytes("a"), bytes("1"), new StoreOptions().ttl(5));
        cache.store(bytes("b"), bytes("2"));
        ticker.advance(5);
        cache.sweep();
        cache.clear();

        final CacheStats stats = cache.stats();
        N.println(stats);

        assertEquals(4, stats.nshards());
        assertEquals(0, stats.count());
        assertEquals(1, stats.expiredCount());
        assertEquals(1, stats.clearedCount());
        assertEquals(0, stats.lowMemoryCount());
        assertEquals(2, stats.evictionCount());
    }

    @Test
    public void test_lowMemory() {
        final long entrySize = Entry.sizeOf(2, 10);
        final ShardedCache limited = ShardedCache.builder().nshards(1).maxMemory(entrySize * 3).ticker(ticker).evicted((reason, entry) -> {
            evictions.add(reason + ":" + str(entry.key()));
        }).build();

        limited.store(bytes("k1"), new byte[10]);
        limited.store(bytes("k2"), new byte[10]);
        limited.store(bytes("k3"), new byte[10]);
        assertTrue(evictions.isEmpty());

        assertEquals(Result.INSERTED, limited.store(bytes("k4"), new byte[10]));
        assertEquals(List.of("LOW_MEMORY:k1"), evictions);
        assertEquals(3, limited.count());
        assertTrue(limited.size() <= limited.maxMemory());

        assertEquals(Result.NO_MEMORY, limited.store(bytes("big"), new byte[(int) (entrySize * 3)]));
        assertEquals(3, limited.count());
        assertEquals(1, limited.stats().lowMemoryCount());
    }

    @Test
    public void test_lowMemory_prefersExpired() {
        final long entrySize = Entry.sizeOf(2, 10);
        final ShardedCache limited = ShardedCache.builder().nshards(1).maxMemory(entrySize * 2).ticker(ticker).evicted((reason, entry) -> {
            evictions.add(reason + ":" + str(entry.key()));
        }).build();

        limited.store(bytes("k1"), new byte[10]);
        limited.store(bytes("k2"), new byte[10], new StoreOptions().ttl(5));
        ticker.advance(5);

        limited.store(bytes("k3"), new byte[10]);
        assertEquals(List.of("EXPIRED:k2"), evictions);
        assertTrue(limited.containsKey(bytes("k1")));
    }

    @Test
    public void test_shrink() {
        final ShardedCache small = ShardedCache.builder().nshards(2).ticker(ticker).build();

        for (int i = 0; i < 10; i++) {
            small.store(bytes("k" + i), new byte[8]);
        }

        final long entrySize = Entry.sizeOf(2, 8);

        assertEquals(6, small.shrink(entrySize * 4));
        assertEquals(4, small.count());
        assertEquals(0, small.shrink(entrySize * 4));
        assertEquals(4, small.shrink(0));
        assertEquals(0, small.size());
    }

    @Test
    public void test_sweepPoll() {
        final ShardedCache single = ShardedCache.builder().nshards(1).ticker(ticker).build();

        assertEquals(0.0, single.sweepPoll(10));

        single.store(bytes("a"), bytes("1"), new StoreOptions().ttl(5));
        single.store(bytes("b"), bytes("1"), new StoreOptions().ttl(5));
        single.store(bytes("c"), bytes("1"));
        single.store(bytes("d"), bytes("1"), new StoreOptions().ttl(50));

        ticker.advance(5);
        assertEquals(0.5, single.sweepPoll(10));

        // polling removes nothing
        assertEquals(4, single.count());
        assertEquals(2, single.sweep(0).swept());
        assertEquals(0.0, single.sweepPoll(1));
    }

    @Test
    public void test_listenerFailureDoesNotBreakCache() {
        final ShardedCache failing = ShardedCache.builder().nshards(2).ticker(ticker).evicted((reason, entry) -> {
            throw new IllegalStateException("listener failure");
        }).build();

        failing.store(bytes("a"), bytes("1"), new StoreOptions().ttl(1));
        failing.store(bytes("b"), bytes("2"));
        ticker.advance(1);

        assertEquals(1, failing.sweep().swept());
        assertEquals(1, failing.clear());
        assertEquals(0, failing.count());
    }

    @Test
    public void test_listenerMayReenterCache() {
        final ShardedCache[] holder = new ShardedCache[1];
        holder[0] = ShardedCache.builder().nshards(1).ticker(ticker).evicted((reason, entry) -> {
            holder[0].store(bytes("evicted:" + str(entry.key())), entry.value());
        }).build();

        holder[0].store(bytes("a"), bytes("1"), new StoreOptions().ttl(1));
        ticker.advance(1);
        holder[0].sweep();

        assertEquals("1", holder[0].get(bytes("evicted:a")).map(ShardedCacheTest::str).orElse(null));
    }

    @Test
    public void test_properties() {
        assertNull(cache.setProperty("name", "sessions"));
        assertEquals("sessions", cache.getProperty("name"));
        assertEquals("sessions", cache.setProperty("name", "users"));
        assertEquals("users", cache.removeProperty("name"));
        assertNull(cache.getProperty("name"));
    }

    @Test
    public void test_close() {
        cache.store(bytes("a"), bytes("1"));
        cache.close();

        assertTrue(cache.isClosed());
        assertEquals(List.of("CLEARED:a"), evictions);
        assertEquals(0, cache.count());

        assertThrows(IllegalStateException.class, () -> cache.store(bytes("a"), bytes("1")));
        assertThrows(IllegalStateException.class, () -> cache.get(bytes("a")));
        assertThrows(IllegalStateException.class, () -> cache.delete(bytes("a")));
        assertThrows(IllegalStateException.class, () -> cache.begin());
        assertThrows(IllegalStateException.class, () -> cache.sweep());

        // idempotent
        cache.close();
        assertEquals(1, evictions.size());
    }

    @Test
    public void test_closeMarksClosedBeforeClearing() {
        final ShardedCache[] holder = new ShardedCache[1];
        final List<Boolean> closedWhenNotified = new ArrayList<>();

        holder[0] = ShardedCache.builder().nshards(2).ticker(ticker).evicted((reason, entry) -> {
            closedWhenNotified.add(holder[0].isClosed());
            assertThrows(IllegalStateException.class, () -> holder[0].store(bytes("late"), bytes("v")));
        }).build();

        holder[0].store(bytes("a"), bytes("1"));
        holder[0].store(bytes("b"), bytes("2"));
        holder[0].close();

        assertEquals(List.of(true, true), closedWhenNotified);
        assertEquals(0, holder[0].count());
    }

    @Test
    public void test_autoTunedShardCount() {
        final ShardedCache tuned = ShardedCache.builder().build();

        try {
            assertTrue(tuned.nshards() >= 32);
            assertEquals(1, Integer.bitCount(tuned.nshards()));
        } finally {
            tuned.close();
        }
    }
}
