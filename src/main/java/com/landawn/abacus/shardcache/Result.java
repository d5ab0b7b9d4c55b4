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

/**
 * Outcome of a cache operation. Negative outcomes such as {@link #NOT_FOUND} or {@link #CAS_MISMATCH}
 * are ordinary results that callers are expected to branch on; they are never thrown.
 *
 * <ul>
 * <li>{@link #INSERTED} - a store created a new entry</li>
 * <li>{@link #REPLACED} - a store overwrote an existing entry</li>
 * <li>{@link #FOUND} - a load found a live entry, or a store with {@code nx} found one already present</li>
 * <li>{@link #NOT_FOUND} - the key is absent or expired</li>
 * <li>{@link #DELETED} - a delete removed the entry</li>
 * <li>{@link #CAS_MISMATCH} - a CAS-guarded mutation saw a different stamp; nothing was changed</li>
 * <li>{@link #NO_MEMORY} - the entry does not fit under the configured memory limit; nothing was changed</li>
 * <li>{@link #FINISHED} - an iteration visited every live entry</li>
 * <li>{@link #CANCELED} - an iteration was stopped by its visitor</li>
 * </ul>
 *
 * @see Cache#store(byte[], byte[], StoreOptions)
 * @see Cache#load(byte[], LoadVisitor)
 * @see Cache#delete(byte[], DeleteOptions)
 * @see Cache#iterate(EntryVisitor)
 */
public enum Result {

    INSERTED,

    REPLACED,

    FOUND,

    NOT_FOUND,

    DELETED,

    CAS_MISMATCH,

    NO_MEMORY,

    FINISHED,

    CANCELED;

    /**
     * Returns {@code true} if this result means the entry was written by a store.
     *
     * @return {@code true} for {@link #INSERTED} and {@link #REPLACED}
     */
    public boolean isStored() {
        return this == INSERTED || this == REPLACED;
    }
}
