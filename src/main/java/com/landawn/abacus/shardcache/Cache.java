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

import java.io.Closeable;
import java.util.concurrent.TimeUnit;

import com.landawn.abacus.util.Properties;
import com.landawn.abacus.util.u.Optional;

/**
 * The operation surface of a sharded, in-process byte cache.
 * Keys and values are byte arrays; both are copied on the way in and out, so callers may reuse their arrays.
 *
 * <br><br>
 * Key features:
 * <ul>
 * <li>Fixed set of independently locked shards; operations on different shards never block each other</li>
 * <li>Optional compare-and-swap stamps for optimistic concurrency</li>
 * <li>Per-entry time-to-live with lazy expiration on read and explicit sweeping</li>
 * <li>Eviction notifications for expired, low-memory and cleared entries</li>
 * <li>Batches that stage writes and commit them key by key</li>
 * <li>Cancellable iteration over all live entries</li>
 * </ul>
 *
 * <p>Negative outcomes are reported as {@link Result} codes, never thrown. Invalid arguments are rejected with
 * {@link IllegalArgumentException}, and any operation on a closed cache throws {@link IllegalStateException}.</p>
 *
 * <br>
 * Example usage:
 * <pre>{@code
 * try (Cache cache = ShardedCache.builder().nshards(16).useCas(true).build()) {
 *     cache.store(key, value);
 *     cache.store(session, token, 30, TimeUnit.MINUTES);
 *
 *     byte[] cached = cache.get(key).orElse(null);
 *
 *     try (Batch batch = cache.begin()) {
 *         batch.store(k1, v1).store(k2, v2).delete(k3);
 *         batch.commit();
 *     }
 *
 *     cache.sweep();
 * }
 * }</pre>
 *
 * @see ShardedCache
 * @see CacheFactory
 */
public interface Cache extends Closeable {

    /**
     * Stores a permanent entry with flags {@code 0}, inserting or replacing unconditionally.
     *
     * @param key the key
     * @param value the value
     * @return {@link Result#INSERTED} or {@link Result#REPLACED}, or {@link Result#NO_MEMORY} if the entry does not fit
     * @throws IllegalArgumentException if {@code key} or {@code value} is null
     * @throws IllegalStateException if the cache has been closed
     */
    Result store(byte[] key, byte[] value);

    /**
     * Stores an entry that expires {@code ttl} after now.
     *
     * @param key the key
     * @param value the value
     * @param ttl the time-to-live, {@code 0} for no expiration
     * @param unit the unit of {@code ttl}
     * @return {@link Result#INSERTED} or {@link Result#REPLACED}, or {@link Result#NO_MEMORY} if the entry does not fit
     * @throws IllegalArgumentException if {@code key} or {@code value} is null, or {@code ttl} is negative
     * @throws IllegalStateException if the cache has been closed
     */
    Result store(byte[] key, byte[] value, long ttl, TimeUnit unit);

    /**
     * Stores an entry under the given options.
     *
     * <p><b>Behavior:</b></p>
     * <ul>
     * <li>Absent key: inserted, {@link Result#INSERTED}; with {@code casOp} or {@code xx}, nothing is stored and the
     *     result is {@link Result#NOT_FOUND}</li>
     * <li>Present key: value, flags and expiration overwritten, new CAS stamp, {@link Result#REPLACED};
     *     with {@code nx}, nothing changes and the result is {@link Result#FOUND}</li>
     * <li>Present key with {@code casOp}: replaced only if the current stamp equals {@code cas},
     *     otherwise {@link Result#CAS_MISMATCH}</li>
     * <li>An expired entry counts as absent; it is evicted with {@link EvictionReason#EXPIRED} first</li>
     * </ul>
     *
     * @param key the key
     * @param value the value
     * @param options the store options
     * @return the outcome
     * @throws IllegalArgumentException if an argument is null, a time option is negative, or both {@code nx} and
     *         {@code xx} are set
     * @throws IllegalStateException if the cache has been closed
     */
    Result store(byte[] key, byte[] value, StoreOptions options);

    /**
     * Looks up a key and hands the live entry to {@code visitor}, which may ask for a replace or a delete that is
     * applied under the same shard lock before this method returns.
     *
     * @param key the key
     * @param visitor receives the entry, may be {@code null} to only test for presence
     * @return {@link Result#FOUND}, {@link Result#NOT_FOUND} if the key is absent or expired, or
     *         {@link Result#NO_MEMORY} if a requested replace does not fit
     * @throws IllegalArgumentException if {@code key} is null
     * @throws IllegalStateException if the cache has been closed
     */
    Result load(byte[] key, LoadVisitor visitor);

    /**
     * Returns a copy of the value stored under {@code key}.
     *
     * @param key the key
     * @return the value, or an empty Optional if the key is absent or expired
     */
    Optional<byte[]> get(byte[] key);

    /**
     * Returns a snapshot of the entry stored under {@code key}, including its flags, expiration and CAS stamp.
     *
     * @param key the key
     * @return the entry, or an empty Optional if the key is absent or expired
     */
    Optional<CacheEntry> getEntry(byte[] key);

    boolean containsKey(byte[] key);

    /**
     * Removes an entry. Explicit deletes are not reported to the eviction listener.
     *
     * @param key the key
     * @return {@link Result#DELETED} or {@link Result#NOT_FOUND}
     */
    Result delete(byte[] key);

    /**
     * Removes an entry, optionally guarded by its CAS stamp.
     *
     * @param key the key
     * @param options the delete options
     * @return {@link Result#DELETED}, {@link Result#NOT_FOUND}, or {@link Result#CAS_MISMATCH}
     */
    Result delete(byte[] key, DeleteOptions options);

    /**
     * Starts a batch. Writes staged on the batch stay invisible to this cache until {@link Batch#commit()}, and are
     * dropped if the batch is closed without a commit.
     *
     * @return a new open batch bound to this cache
     * @throws IllegalStateException if the cache has been closed
     */
    Batch begin();

    /**
     * Visits every live entry, shard by shard and in insertion order within a shard.
     *
     * @param visitor returns {@link IterAction#STOP} to end the iteration early
     * @return {@link Result#FINISHED}, or {@link Result#CANCELED} if the visitor stopped the iteration
     */
    Result iterate(EntryVisitor visitor);

    Result iterate(int shard, EntryVisitor visitor);

    /**
     * Removes every expired entry, notifying {@link EvictionReason#EXPIRED} for each.
     *
     * @return the number of entries swept and kept
     */
    SweepResult sweep();

    SweepResult sweep(int shard);

    /**
     * Estimates, without removing anything, the share of stored entries that are expired.
     *
     * @param samples the number of shards to sample
     * @return a value between {@code 0.0} and {@code 1.0}
     */
    double sweepPoll(int samples);

    /**
     * Evicts entries with {@link EvictionReason#LOW_MEMORY} (expired ones with {@link EvictionReason#EXPIRED})
     * until {@link #size()} is at or below {@code targetSize}.
     *
     * @param targetSize the size to shrink to, in bytes
     * @return the number of entries evicted
     */
    long shrink(long targetSize);

    /**
     * Removes every entry, notifying {@link EvictionReason#CLEARED} for each. Shards are cleared one after the other.
     *
     * @return the number of entries removed
     */
    long clear();

    long clear(int shard);

    /**
     * Returns the number of stored entries, including expired entries that have not been swept yet.
     *
     * @return the entry count
     */
    long count();

    long count(int shard);

    /**
     * Returns the approximate number of bytes held by keys, values and per-entry metadata.
     *
     * @return the size in bytes
     */
    long size();

    long size(int shard);

    /**
     * Returns the number of store, load and delete operations since the cache was created.
     *
     * @return the operation count
     */
    long total();

    long total(int shard);

    int nshards();

    /**
     * Whether writes assign CAS stamps. When disabled, every stamp is {@code 0}.
     *
     * @return {@code true} if CAS stamps are assigned
     */
    boolean isCasEnabled();

    /**
     * Returns the index of the shard that owns {@code key}.
     *
     * @param key the key
     * @return a value in {@code [0, nshards())}
     */
    int shardOf(byte[] key);

    CacheStats stats();

    Properties<String, Object> getProperties();

    <T> T getProperty(String propName);

    <T> T setProperty(String propName, Object propValue);

    <T> T removeProperty(String propName);

    /**
     * Marks the cache closed, then clears it, notifying {@link EvictionReason#CLEARED} for every entry.
     * Closing an already closed cache has no effect.
     */
    @Override
    void close();

    boolean isClosed();
}
