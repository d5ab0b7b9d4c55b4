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

import com.landawn.abacus.util.N;

/**
 * The mutation a {@link LoadVisitor} asks for on the entry it was given. It is evaluated by the shard under the
 * same lock as the lookup.
 *
 * <ul>
 * <li>{@link #none()} leaves the entry untouched</li>
 * <li>{@link #replace(byte[])} and its overloads overwrite the value and assign a new CAS stamp</li>
 * <li>{@link #delete()} removes the entry, as an explicit delete</li>
 * </ul>
 */
public final class LoadAction {

    /**
     * The kind of mutation.
     */
    public enum Kind {
        NONE, REPLACE, DELETE
    }

    private static final LoadAction NONE = new LoadAction(Kind.NONE, null, 0, false, 0, false);

    private static final LoadAction DELETE = new LoadAction(Kind.DELETE, null, 0, false, 0, false);

    private final Kind kind;
    private final byte[] value;
    private final int flags;
    private final boolean replaceFlags;
    private final long ttl;
    private final boolean replaceTtl;

    private LoadAction(final Kind kind, final byte[] value, final int flags, final boolean replaceFlags, final long ttl, final boolean replaceTtl) {
        this.kind = kind;
        this.value = value;
        this.flags = flags;
        this.replaceFlags = replaceFlags;
        this.ttl = ttl;
        this.replaceTtl = replaceTtl;
    }

    public static LoadAction none() {
        return NONE;
    }

    public static LoadAction delete() {
        return DELETE;
    }

    /**
     * Replaces the value, keeping the entry's flags and expiration.
     *
     * @param value the new value, copied
     * @return the action
     * @throws IllegalArgumentException if {@code value} is null
     */
    public static LoadAction replace(final byte[] value) {
        N.checkArgNotNull(value, "value");

        return new LoadAction(Kind.REPLACE, value.clone(), 0, false, 0, false);
    }

    /**
     * Replaces the value and the flags, keeping the entry's expiration.
     *
     * @param value the new value, copied
     * @param flags the new flags
     * @return the action
     * @throws IllegalArgumentException if {@code value} is null
     */
    public static LoadAction replace(final byte[] value, final int flags) {
        N.checkArgNotNull(value, "value");

        return new LoadAction(Kind.REPLACE, value.clone(), flags, true, 0, false);
    }

    /**
     * Replaces the value, the flags and the expiration.
     *
     * @param value the new value, copied
     * @param flags the new flags
     * @param ttl the new time-to-live in nanoseconds measured from the load, {@code 0} for no expiration
     * @return the action
     * @throws IllegalArgumentException if {@code value} is null or {@code ttl} is negative
     */
    public static LoadAction replace(final byte[] value, final int flags, final long ttl) {
        N.checkArgNotNull(value, "value");
        N.checkArgument(ttl >= 0, "ttl can't be negative: {}", ttl);

        return new LoadAction(Kind.REPLACE, value.clone(), flags, true, ttl, true);
    }

    public Kind kind() {
        return kind;
    }

    byte[] value() {
        return value;
    }

    int flags(final int current) {
        return replaceFlags ? flags : current;
    }

    long expires(final long current, final long now) {
        if (!replaceTtl) {
            return current;
        }

        return Entry.expiresAt(now, ttl);
    }

    @Override
    public String toString() {
        return kind == Kind.REPLACE ? "REPLACE(" + value.length + " bytes)" : kind.name();
    }
}
