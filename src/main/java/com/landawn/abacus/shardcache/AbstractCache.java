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

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Properties;
import com.landawn.abacus.util.u.Optional;

/**
 * Base class implementing the convenience overloads of {@link Cache} on top of the option-taking operations, plus
 * the property bag.
 */
public abstract class AbstractCache implements Cache {

    protected final Properties<String, Object> properties = new Properties<>();

    protected AbstractCache() {
    }

    @Override
    public Result store(final byte[] key, final byte[] value) {
        return store(key, value, new StoreOptions());
    }

    @Override
    public Result store(final byte[] key, final byte[] value, final long ttl, final TimeUnit unit) {
        N.checkArgNotNull(unit, "unit");

        return store(key, value, new StoreOptions().ttl(ttl, unit));
    }

    @Override
    public Optional<byte[]> get(final byte[] key) {
        final Optional<CacheEntry> entry = getEntry(key);

        return entry.isPresent() ? Optional.of(entry.get().value()) : Optional.empty();
    }

    @Override
    public Optional<CacheEntry> getEntry(final byte[] key) {
        final CacheEntry[] holder = new CacheEntry[1];

        load(key, entry -> {
            holder[0] = entry;
            return LoadAction.none();
        });

        return Optional.ofNullable(holder[0]);
    }

    @Override
    public boolean containsKey(final byte[] key) {
        return load(key, null) == Result.FOUND;
    }

    @Override
    public Result delete(final byte[] key) {
        return delete(key, new DeleteOptions());
    }

    @Override
    public Batch begin() {
        checkOpen();

        return new Batch(this);
    }

    @Override
    public Result iterate(final EntryVisitor visitor) {
        for (int i = 0, n = nshards(); i < n; i++) {
            if (iterate(i, visitor) == Result.CANCELED) {
                return Result.CANCELED;
            }
        }

        return Result.FINISHED;
    }

    @Override
    public Properties<String, Object> getProperties() {
        return properties;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T getProperty(final String propName) {
        return (T) properties.get(propName);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T setProperty(final String propName, final Object propValue) {
        return (T) properties.put(propName, propValue);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> T removeProperty(final String propName) {
        return (T) properties.remove(propName);
    }

    /**
     * Current reading of the time source used for expiration.
     */
    abstract long now();

    protected void checkOpen() {
        if (isClosed()) {
            throw new IllegalStateException("Cache has been closed");
        }
    }

    static void checkStoreArgs(final byte[] key, final byte[] value, final StoreOptions options) {
        N.checkArgNotNull(key, "key");
        N.checkArgNotNull(value, "value");
        N.checkArgNotNull(options, "options");
        N.checkArgument(options.ttl() >= 0, "ttl can't be negative: {}", options.ttl());
        N.checkArgument(options.expires() >= 0, "expires can't be negative: {}", options.expires());
        N.checkArgument(!(options.nx() && options.xx()), "nx and xx can't both be set");
    }

    static void checkDeleteArgs(final byte[] key, final DeleteOptions options) {
        N.checkArgNotNull(key, "key");
        N.checkArgNotNull(options, "options");
    }
}
