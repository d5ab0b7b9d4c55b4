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

import java.util.concurrent.TimeUnit;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Options of a store operation. All options are off by default, which makes a store an unconditional upsert of a
 * permanent entry with flags {@code 0}.
 *
 * <ul>
 * <li>{@code ttl} - time-to-live in nanoseconds from the store; {@code 0} means the entry never expires</li>
 * <li>{@code expires} - absolute expiration time in ticker nanoseconds; takes precedence over {@code ttl} when positive</li>
 * <li>{@code keepTtl} - on replace, keep the existing entry's expiration instead of computing a new one</li>
 * <li>{@code flags} - opaque bits returned unchanged on read</li>
 * <li>{@code casOp} / {@code cas} - only replace an existing entry whose CAS stamp equals {@code cas}</li>
 * <li>{@code nx} - only insert; an existing live entry yields {@link Result#FOUND}</li>
 * <li>{@code xx} - only replace; a missing entry yields {@link Result#NOT_FOUND}</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * cache.store(key, value, new StoreOptions().ttl(30, TimeUnit.SECONDS).flags(7));
 *
 * // optimistic update
 * Result result = cache.store(key, newValue, new StoreOptions().casOp(true).cas(loadedCas));
 * if (result == Result.CAS_MISMATCH) {
 *     // reload and retry
 * }
 * }</pre>
 */
@Data
@Accessors(chain = true, fluent = true)
public class StoreOptions {

    private long ttl;

    private long expires;

    private boolean keepTtl;

    private int flags;

    private boolean casOp;

    private long cas;

    private boolean nx;

    private boolean xx;

    public StoreOptions() {
        // all options off
    }

    /**
     * Sets the time-to-live in the given unit.
     *
     * @param duration the time-to-live, {@code 0} for no expiration
     * @param unit the unit of {@code duration}
     * @return this
     */
    public StoreOptions ttl(final long duration, final TimeUnit unit) {
        return ttl(unit.toNanos(duration));
    }

    /**
     * The absolute expiration this store assigns: {@code expires} if set, otherwise {@code ttl} after {@code now}.
     */
    long expiresAt(final long now) {
        return expires > 0 ? expires : Entry.expiresAt(now, ttl);
    }

    StoreOptions copy() {
        return new StoreOptions().ttl(ttl).expires(expires).keepTtl(keepTtl).flags(flags).casOp(casOp).cas(cas).nx(nx).xx(xx);
    }
}
