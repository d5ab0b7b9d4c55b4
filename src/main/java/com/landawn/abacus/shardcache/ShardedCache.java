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

import java.util.List;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.shardcache.tuning.PerformanceTuning;
import com.landawn.abacus.util.N;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * The sharded cache engine. Keys are routed by hash to a fixed array of shards; each shard is an independent
 * hash table with its own lock, CAS counter and expiration index.
 *
 * <p><b>Concurrency:</b> every operation locks exactly one shard, except {@link #sweep()}, {@link #clear()},
 * {@link #shrink(long)} and {@link #iterate(EntryVisitor)}, which lock the shards one after the other. Operations
 * on keys in different shards never block each other; operations on the same key are applied in the order they
 * acquire the shard lock. The cache starts no threads: expired entries disappear from reads immediately and are
 * physically removed by the next sweep, clear, or write to the same key.</p>
 *
 * <p><b>Counters:</b> {@link #count()}, {@link #size()} and {@link #total()} sum per-shard counters without locking,
 * so under concurrent writes they are approximate snapshots rather than a consistent cut.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * ShardedCache cache = ShardedCache.builder()
 *     .nshards(64)
 *     .useCas(true)
 *     .maxMemory(256L * 1024 * 1024)
 *     .evicted((reason, entry) -> log(reason, entry))
 *     .build();
 *
 * cache.store(key, value, new StoreOptions().ttl(10, TimeUnit.MINUTES));
 *
 * long cas = cache.getEntry(key).get().cas();
 * if (cache.store(key, newValue, new StoreOptions().casOp(true).cas(cas)) == Result.CAS_MISMATCH) {
 *     // someone else won, reload and retry
 * }
 * }</pre>
 *
 * @see Cache
 * @see Batch
 */
public final class ShardedCache extends AbstractCache {

    private static final Logger logger = LoggerFactory.getLogger(ShardedCache.class);

    /**
     * Default load factor of the shard tables, in percent.
     */
    public static final int DEFAULT_LOAD_FACTOR = 75;

    private final ShardRouter router;

    private final EvictionManager evictionManager;

    private final Ticker ticker;

    private final boolean useCas;

    private final long maxMemory;

    private volatile boolean closed;

    ShardedCache(final int nshards, final boolean useCas, final EvictionListener evicted, final int loadFactor, final long maxMemory,
            final Ticker ticker) {
        N.checkArgument(nshards >= 0, "The shard count can't be negative: {}", nshards);
        N.checkArgument(loadFactor > 0 && loadFactor <= 100, "The load factor must be > 0 and <= 100: {}", loadFactor);
        N.checkArgument(maxMemory >= 0, "maxMemory can't be negative: {}", maxMemory);

        final int shardCount = nshards == 0 ? PerformanceTuning.optimizeDefaults().nshards() : nshards;

        N.checkArgument(maxMemory == 0 || maxMemory >= shardCount, "maxMemory {} is too small for {} shards", maxMemory, shardCount);

        final long memoryPerShard = maxMemory / shardCount;

        this.router = new ShardRouter(shardCount, i -> new Shard(i, useCas, loadFactor, memoryPerShard));
        this.evictionManager = new EvictionManager(router, evicted);
        this.ticker = ticker == null ? Ticker.systemTicker() : ticker;
        this.useCas = useCas;
        this.maxMemory = maxMemory;

        if (logger.isInfoEnabled()) {
            logger.info("Created ShardedCache with " + shardCount + (nshards == 0 ? " (auto-tuned)" : "") + " shards, cas=" + useCas + ", maxMemory="
                    + (maxMemory == 0 ? "unlimited" : maxMemory));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Result store(final byte[] key, final byte[] value, final StoreOptions options) {
        checkOpen();
        checkStoreArgs(key, value, options);

        final Key k = router.keyOf(key);
        final List<Eviction> sink = evictionManager.sink();

        try {
            return router.shardFor(k).store(k, value.clone(), options, ticker.read(), sink);
        } finally {
            evictionManager.notify(sink);
        }
    }

    @Override
    public Result load(final byte[] key, final LoadVisitor visitor) {
        checkOpen();
        N.checkArgNotNull(key, "key");

        final Key k = router.probeOf(key);
        final List<Eviction> sink = evictionManager.sink();

        try {
            return router.shardFor(k).load(k, visitor, ticker.read(), sink);
        } finally {
            evictionManager.notify(sink);
        }
    }

    @Override
    public Result delete(final byte[] key, final DeleteOptions options) {
        checkOpen();
        checkDeleteArgs(key, options);

        final Key k = router.probeOf(key);
        final List<Eviction> sink = evictionManager.sink();

        try {
            return router.shardFor(k).delete(k, options, ticker.read(), sink);
        } finally {
            evictionManager.notify(sink);
        }
    }

    @Override
    public Result iterate(final int shard, final EntryVisitor visitor) {
        checkOpen();
        checkShard(shard);
        N.checkArgNotNull(visitor, "visitor");

        return router.shard(shard).iterate(visitor, ticker.read()) ? Result.FINISHED : Result.CANCELED;
    }

    @Override
    public SweepResult sweep() {
        checkOpen();

        return evictionManager.sweep(ticker.read());
    }

    @Override
    public SweepResult sweep(final int shard) {
        checkOpen();
        checkShard(shard);

        return evictionManager.sweep(shard, ticker.read());
    }

    @Override
    public double sweepPoll(final int samples) {
        checkOpen();
        N.checkArgument(samples > 0, "samples must be positive: {}", samples);

        return evictionManager.sweepPoll(samples, ticker.read());
    }

    @Override
    public long shrink(final long targetSize) {
        checkOpen();
        N.checkArgument(targetSize >= 0, "targetSize can't be negative: {}", targetSize);

        return evictionManager.shrink(targetSize, ticker.read());
    }

    @Override
    public long clear() {
        checkOpen();

        return evictionManager.clear(ticker.read());
    }

    @Override
    public long clear(final int shard) {
        checkOpen();
        checkShard(shard);

        return evictionManager.clear(shard, ticker.read());
    }

    @Override
    public long count() {
        long count = 0;

        for (int i = 0, n = router.nshards(); i < n; i++) {
            count += router.shard(i).count();
        }

        return count;
    }

    @Override
    public long count(final int shard) {
        checkShard(shard);

        return router.shard(shard).count();
    }

    @Override
    public long size() {
        return evictionManager.size();
    }

    @Override
    public long size(final int shard) {
        checkShard(shard);

        return router.shard(shard).bytes();
    }

    @Override
    public long total() {
        long total = 0;

        for (int i = 0, n = router.nshards(); i < n; i++) {
            total += router.shard(i).total();
        }

        return total;
    }

    @Override
    public long total(final int shard) {
        checkShard(shard);

        return router.shard(shard).total();
    }

    @Override
    public int nshards() {
        return router.nshards();
    }

    @Override
    public int shardOf(final byte[] key) {
        N.checkArgNotNull(key, "key");

        return router.shardIndex(key);
    }

    @Override
    long now() {
        return ticker.read();
    }

    @Override
    public boolean isCasEnabled() {
        return useCas;
    }

    public long maxMemory() {
        return maxMemory;
    }

    @Override
    public CacheStats stats() {
        long count = 0;
        long size = 0;
        long total = 0;
        long expired = 0;
        long lowMemory = 0;
        long cleared = 0;

        for (int i = 0, n = router.nshards(); i < n; i++) {
            final Shard shard = router.shard(i);

            count += shard.count();
            size += shard.bytes();
            total += shard.total();
            expired += shard.expiredCount();
            lowMemory += shard.lowMemoryCount();
            cleared += shard.clearedCount();
        }

        return new CacheStats(router.nshards(), count, size, total, maxMemory, expired, lowMemory, cleared);
    }

    /**
     * Marks the cache closed, then clears it shard by shard. An operation that passed its open check before the
     * cache was marked closed may still complete concurrently with the clear.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }

        closed = true;

        evictionManager.clear(ticker.read());

        if (logger.isInfoEnabled()) {
            logger.info("Closed ShardedCache with " + router.nshards() + " shards");
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private void checkShard(final int shard) {
        N.checkArgument(shard >= 0 && shard < router.nshards(), "Invalid shard index: {}, the cache has {} shards", shard, router.nshards());
    }

    /**
     * Configuration of a {@link ShardedCache}. Every option is fixed once the cache is built.
     *
     * <ul>
     * <li>{@code nshards} - number of shards; {@code 0} (the default) takes the count recommended by
     *     {@link PerformanceTuning#optimizeDefaults()}</li>
     * <li>{@code useCas} - assign CAS stamps on every write</li>
     * <li>{@code evicted} - eviction listener, may be {@code null}</li>
     * <li>{@code loadFactor} - shard table load factor in percent, {@value ShardedCache#DEFAULT_LOAD_FACTOR} by default</li>
     * <li>{@code maxMemory} - limit on {@link ShardedCache#size()} in bytes, split evenly over the shards; {@code 0} means unlimited</li>
     * <li>{@code ticker} - time source, the system clock by default</li>
     * </ul>
     */
    @Data
    @Accessors(chain = true, fluent = true)
    public static class Builder {

        public Builder() {
            // Default constructor with default values
        }

        private int nshards;

        private boolean useCas;

        private EvictionListener evicted;

        private int loadFactor = DEFAULT_LOAD_FACTOR;

        private long maxMemory;

        private Ticker ticker;

        public ShardedCache build() {
            return new ShardedCache(nshards, useCas, evicted, loadFactor, maxMemory, ticker);
        }
    }
}
