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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ExceptionUtil;

/**
 * Removes expired and surplus entries shard by shard and delivers the eviction notifications.
 *
 * <p>Nothing here runs on its own: every sweep, clear or shrink happens on the caller's thread, one shard lock at
 * a time, and the notifications collected under a shard's lock are delivered right after that lock is released.</p>
 */
final class EvictionManager {

    private static final Logger logger = LoggerFactory.getLogger(EvictionManager.class);

    private final ShardRouter router;

    private final EvictionListener listener;

    EvictionManager(final ShardRouter router, final EvictionListener listener) {
        this.router = router;
        this.listener = listener;
    }

    /**
     * Returns a fresh sink for the removals of one shard operation, or {@code null} when nobody listens, in which
     * case the shards skip building snapshots.
     */
    List<Eviction> sink() {
        return listener == null ? null : new ArrayList<>();
    }

    void notify(final List<Eviction> sink) {
        if (sink == null || sink.isEmpty()) {
            return;
        }

        for (final Eviction eviction : sink) {
            try {
                listener.onEvicted(eviction.reason(), eviction.entry());
            } catch (final RuntimeException e) {
                // the removal already happened, the listener can't undo it
                if (logger.isWarnEnabled()) {
                    logger.warn("Eviction listener failed for an entry in shard " + eviction.entry().shard() + " (" + eviction.reason() + "): "
                            + ExceptionUtil.getErrorMessage(e));
                }
            }
        }
    }

    SweepResult sweep(final long now) {
        SweepResult result = SweepResult.EMPTY;

        for (int i = 0, n = router.nshards(); i < n; i++) {
            result = result.plus(sweep(i, now));
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Swept " + result.swept() + " expired entries, kept " + result.kept());
        }

        return result;
    }

    SweepResult sweep(final int shard, final long now) {
        final List<Eviction> sink = sink();

        try {
            return router.shard(shard).sweep(now, sink);
        } finally {
            notify(sink);
        }
    }

    /**
     * Estimates the share of expired entries from up to {@code samples} randomly chosen shards.
     *
     * @return a value between {@code 0.0} and {@code 1.0}
     */
    double sweepPoll(final int samples, final long now) {
        final int nshards = router.nshards();
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        long expired = 0;
        long seen = 0;

        for (int i = 0, n = Math.min(samples, nshards); i < n; i++) {
            final Shard shard = router.shard(n == nshards ? i : random.nextInt(nshards));

            expired += shard.countExpired(now);
            seen += shard.count();
        }

        return seen == 0 ? 0.0 : (double) expired / seen;
    }

    long clear(final long now) {
        long cleared = 0;

        // shard by shard, not one atomic cut-over
        for (int i = 0, n = router.nshards(); i < n; i++) {
            cleared += clear(i, now);
        }

        return cleared;
    }

    long clear(final int shard, final long now) {
        final List<Eviction> sink = sink();

        try {
            return router.shard(shard).clear(now, sink);
        } finally {
            notify(sink);
        }
    }

    /**
     * Evicts entries round-robin over the shards, expired ones first within each shard, until the aggregate size is
     * at or below {@code targetSize}.
     *
     * @return the number of entries evicted
     */
    long shrink(final long targetSize, final long now) {
        final int nshards = router.nshards();
        long evicted = 0;

        while (size() > targetSize) {
            boolean progress = false;

            for (int i = 0; i < nshards && size() > targetSize; i++) {
                final List<Eviction> sink = sink();

                try {
                    if (router.shard(i).evictOne(now, sink)) {
                        evicted++;
                        progress = true;
                    }
                } finally {
                    notify(sink);
                }
            }

            if (!progress) {
                break;
            }
        }

        if (evicted > 0 && logger.isDebugEnabled()) {
            logger.debug("Shrunk cache to " + size() + " bytes by evicting " + evicted + " entries");
        }

        return evicted;
    }

    long size() {
        long size = 0;

        for (int i = 0, n = router.nshards(); i < n; i++) {
            size += router.shard(i).bytes();
        }

        return size;
    }
}
