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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.u.Optional;

/**
 * A staging log of writes against a cache. Stores and deletes issued on a batch are recorded, not applied, and
 * stay invisible to every reader of the cache until {@link #commit()}.
 *
 * <p>{@link #commit()} applies the staged operations in the order they were staged, each one through the
 * cache's ordinary single-shard path. Every operation is atomic for its key, but the batch as a whole is not a
 * snapshot: a concurrent reader may see some of its keys committed before others.</p>
 *
 * <p>A batch is used once. After {@link #commit()} it is consumed, and closing it without a commit discards the
 * staged operations, so nothing of an abandoned batch ever becomes visible. A batch is not thread-safe; it
 * belongs to the thread that began it.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * try (Batch batch = cache.begin()) {
 *     for (Item item : items) {
 *         batch.store(item.key(), item.bytes());
 *     }
 *
 *     batch.delete(staleKey);
 *
 *     if (valid) {
 *         List<Result> results = batch.commit();
 *     }
 * } // discarded here unless committed
 * }</pre>
 */
public final class Batch implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Batch.class);

    private enum State {
        OPEN, COMMITTED, DISCARDED
    }

    private final AbstractCache cache;

    private final List<StagedOp> staged = new ArrayList<>();

    private State state = State.OPEN;

    Batch(final AbstractCache cache) {
        this.cache = cache;
    }

    public Batch store(final byte[] key, final byte[] value) {
        return store(key, value, new StoreOptions());
    }

    public Batch store(final byte[] key, final byte[] value, final long ttl, final TimeUnit unit) {
        N.checkArgNotNull(unit, "unit");

        return store(key, value, new StoreOptions().ttl(ttl, unit));
    }

    /**
     * Stages a store. The arguments are validated and copied now; the outcome is only known after {@link #commit()}.
     *
     * @param key the key
     * @param value the value
     * @param options the store options
     * @return this batch
     * @throws IllegalArgumentException if the arguments are invalid
     * @throws IllegalStateException if the batch was committed or discarded
     */
    public Batch store(final byte[] key, final byte[] value, final StoreOptions options) {
        checkOpen();
        AbstractCache.checkStoreArgs(key, value, options);

        staged.add(new StagedOp(key.clone(), value.clone(), options.copy(), null));

        return this;
    }

    public Batch delete(final byte[] key) {
        return delete(key, new DeleteOptions());
    }

    public Batch delete(final byte[] key, final DeleteOptions options) {
        checkOpen();
        AbstractCache.checkDeleteArgs(key, options);

        staged.add(new StagedOp(key.clone(), null, null, options.copy()));

        return this;
    }

    /**
     * Reads through the batch: the value {@code key} would have if the batch were committed now. The staged writes
     * of {@code key} are replayed over the current cache entry in staging order, honoring their {@code nx},
     * {@code xx}, CAS and expiration options. A CAS-guarded write that follows another staged write of the same key
     * is treated as a mismatch when CAS is enabled, since the stamp the earlier write gets is only assigned at commit.
     * Memory limits are not taken into account.
     *
     * @param key the key
     * @return the value, or an empty Optional if the key would be absent or expired
     */
    public Optional<byte[]> get(final byte[] key) {
        checkOpen();
        N.checkArgNotNull(key, "key");

        final long now = cache.now();
        final CacheEntry current = cache.getEntry(key).orElse(null);

        byte[] value = current == null ? null : current.value();
        long expires = current == null ? 0 : current.expires();
        long cas = current == null ? 0 : current.cas();
        boolean casKnown = current != null;

        for (final StagedOp op : staged) {
            if (!Arrays.equals(op.key(), key)) {
                continue;
            }

            if (value != null && isExpired(expires, now)) {
                value = null;
            }

            if (op.isDelete()) {
                final DeleteOptions options = op.deleteOptions();

                if (value != null && (!options.casOp() || (casKnown && options.cas() == cas))) {
                    value = null;
                }

                continue;
            }

            final StoreOptions options = op.storeOptions();

            final boolean applies = value == null ? !options.casOp() && !options.xx()
                    : !options.nx() && (!options.casOp() || (casKnown && options.cas() == cas));

            if (!applies) {
                continue;
            }

            expires = value != null && options.keepTtl() ? expires : options.expiresAt(now);
            value = op.value();
            cas = 0;
            casKnown = !cache.isCasEnabled();
        }

        return value == null || isExpired(expires, now) ? Optional.empty() : Optional.of(value.clone());
    }

    public int pending() {
        return staged.size();
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isCommitted() {
        return state == State.COMMITTED;
    }

    /**
     * Applies the staged operations in order and consumes the batch.
     *
     * @return the result of each staged operation, in staging order
     * @throws IllegalStateException if the batch was already committed or discarded, or the cache has been closed
     */
    public List<Result> commit() {
        checkOpen();

        if (cache.isClosed()) {
            throw new IllegalStateException("Cache has been closed");
        }

        state = State.COMMITTED;

        final List<Result> results = new ArrayList<>(staged.size());

        for (final StagedOp op : staged) {
            results.add(op.isDelete() ? cache.delete(op.key(), op.deleteOptions()) : cache.store(op.key(), op.value(), op.storeOptions()));
        }

        staged.clear();

        return Collections.unmodifiableList(results);
    }

    /**
     * Discards the staged operations unless the batch was committed.
     */
    @Override
    public void close() {
        if (state != State.OPEN) {
            return;
        }

        state = State.DISCARDED;

        if (!staged.isEmpty() && logger.isDebugEnabled()) {
            logger.debug("Discarding batch with " + staged.size() + " staged operations");
        }

        staged.clear();
    }

    private static boolean isExpired(final long expires, final long now) {
        return expires > 0 && expires <= now;
    }

    private void checkOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Batch has been " + (state == State.COMMITTED ? "committed" : "discarded"));
        }
    }

    private record StagedOp(byte[] key, byte[] value, StoreOptions storeOptions, DeleteOptions deleteOptions) {

        boolean isDelete() {
            return value == null;
        }
    }
}
