/*
 * Copyright (c) 2025, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.shardcache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Profiler;

public class ShardedCacheConcurrencyTest {

    private static byte[] longBytes(final long value) {
        return ByteBuffer.allocate(8).putLong(value).array();
    }

    private static long toLong(final byte[] bytes) {
        return ByteBuffer.wrap(bytes).getLong();
    }

    @Test
    public void test_casIncrement() throws Exception {
        final ShardedCache cache = ShardedCache.builder().nshards(16).useCas(true).build();
        final byte[] key = "counter".getBytes(StandardCharsets.UTF_8);
        cache.store(key, longBytes(0));

        final int threadNum = 8;
        final int loopNum = 2000;
        final ExecutorService executor = Executors.newFixedThreadPool(threadNum);
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicLong mismatches = new AtomicLong();
        final List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threadNum; t++) {
            futures.add(executor.submit(() -> {
                start.await();

                for (int i = 0; i < loopNum; i++) {
                    while (true) {
                        final CacheEntry entry = cache.getEntry(key).get();
                        final byte[] next = longBytes(toLong(entry.value()) + 1);

                        if (cache.store(key, next, new StoreOptions().casOp(true).cas(entry.cas())) == Result.REPLACED) {
                            break;
                        }

                        mismatches.incrementAndGet();
                    }
                }

                return null;
            }));
        }

        start.countDown();

        for (final Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        executor.shutdown();

        N.println("CAS retries: " + mismatches.get());
        assertEquals((long) threadNum * loopNum, toLong(cache.get(key).get()));
    }

    @Test
    public void test_concurrentStoreDeleteKeepsCountersConsistent() throws Exception {
        final ShardedCache cache = ShardedCache.builder().nshards(8).build();
        final int threadNum = 8;
        final int keysPerThread = 5000;
        final ExecutorService executor = Executors.newFixedThreadPool(threadNum);
        final List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threadNum; t++) {
            final int thread = t;

            futures.add(executor.submit(() -> {
                for (int i = 0; i < keysPerThread; i++) {
                    cache.store(("t" + thread + ":" + i).getBytes(StandardCharsets.UTF_8), new byte[16]);
                }

                // odd keys go away again
                for (int i = 1; i < keysPerThread; i += 2) {
                    cache.delete(("t" + thread + ":" + i).getBytes(StandardCharsets.UTF_8));
                }

                return null;
            }));
        }

        for (final Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        executor.shutdown();

        final long expected = (long) threadNum * keysPerThread / 2;
        final long[] visited = new long[1];
        final long[] bytes = new long[1];

        cache.iterate(entry -> {
            visited[0]++;
            bytes[0] += entry.keyLength() + entry.valueLength() + Entry.OVERHEAD;
            return IterAction.CONTINUE;
        });

        assertEquals(expected, cache.count());
        assertEquals(expected, visited[0]);
        assertEquals(bytes[0], cache.size());
        assertEquals((long) threadNum * keysPerThread * 3 / 2, cache.total());
    }

    @Test
    public void test_clearWhileWriting() throws Exception {
        final AtomicLong cleared = new AtomicLong();
        final ShardedCache cache = ShardedCache.builder().nshards(4).evicted((reason, entry) -> cleared.incrementAndGet()).build();
        final AtomicLong stored = new AtomicLong();
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        final List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < 4; t++) {
            final int thread = t;

            futures.add(executor.submit(() -> {
                for (int i = 0; i < 10000; i++) {
                    if (cache.store(("t" + thread + ":" + i).getBytes(StandardCharsets.UTF_8), new byte[4]) == Result.INSERTED) {
                        stored.incrementAndGet();
                    }
                }

                return null;
            }));
        }

        long clearedByCall = 0;

        for (int i = 0; i < 20; i++) {
            clearedByCall += cache.clear();
        }

        for (final Future<?> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }

        executor.shutdown();

        // every stored entry is either still there or was reported exactly once
        assertEquals(clearedByCall, cleared.get());
        assertEquals(stored.get(), cleared.get() + cache.count());
    }

    @Test
    public void test_perf() {
        final ShardedCache cache = ShardedCache.builder().nshards(64).useCas(true).build();

        Profiler.run(8, 10000, 1, () -> {
            final byte[] key = ("key:" + ThreadLocalRandom.current().nextInt(10000)).getBytes(StandardCharsets.UTF_8);

            cache.store(key, key);
            cache.get(key);

            if (ThreadLocalRandom.current().nextInt(10) == 0) {
                cache.delete(key);
            }
        }).printResult();

        assertTrue(cache.count() <= 10000);
        assertTrue(cache.total() > 0);
    }
}
