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
import com.landawn.abacus.util.Numbers;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.TypeAttrParser;

/**
 * Factory methods for {@link ShardedCache}, either programmatic or from a provider string so that the cache can be
 * configured from a properties file.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // auto-tuned shard count, no CAS
 * Cache cache = CacheFactory.createCache();
 *
 * // 128 shards with CAS stamps
 * Cache casCache = CacheFactory.createCache(128, true);
 *
 * // 64 shards, CAS, load factor 80%, 1 GiB memory limit
 * Cache limited = CacheFactory.createCache("ShardedCache(64, true, 80, 1073741824)");
 * }</pre>
 *
 * @see ShardedCache.Builder
 */
public final class CacheFactory {

    /**
     * Provider name accepted by {@link #createCache(String)}.
     */
    public static final String SHARDED_CACHE = "ShardedCache";

    private CacheFactory() {
    }

    /**
     * Creates a cache with the recommended shard count, CAS disabled and no eviction listener.
     *
     * @return a new cache
     */
    public static ShardedCache createCache() {
        return ShardedCache.builder().build();
    }

    /**
     * @param nshards the number of shards, {@code 0} for the recommended count
     * @return a new cache
     * @throws IllegalArgumentException if {@code nshards} is negative
     */
    public static ShardedCache createCache(final int nshards) {
        return ShardedCache.builder().nshards(nshards).build();
    }

    /**
     * @param nshards the number of shards, {@code 0} for the recommended count
     * @param useCas whether to assign CAS stamps
     * @return a new cache
     * @throws IllegalArgumentException if {@code nshards} is negative
     */
    public static ShardedCache createCache(final int nshards, final boolean useCas) {
        return ShardedCache.builder().nshards(nshards).useCas(useCas).build();
    }

    /**
     * @param nshards the number of shards, {@code 0} for the recommended count
     * @param useCas whether to assign CAS stamps
     * @param evicted the eviction listener, may be {@code null}
     * @return a new cache
     * @throws IllegalArgumentException if {@code nshards} is negative
     */
    public static ShardedCache createCache(final int nshards, final boolean useCas, final EvictionListener evicted) {
        return ShardedCache.builder().nshards(nshards).useCas(useCas).evicted(evicted).build();
    }

    /**
     * Creates a cache from a provider specification of the form
     * {@code ShardedCache(nshards[, useCas[, loadFactor[, maxMemory]]])}. The provider name is case-insensitive.
     *
     * <p>Examples: {@code ShardedCache(0)}, {@code ShardedCache(256, true)}, {@code ShardedCache(64, false, 90, 536870912)}.</p>
     *
     * @param provider the provider specification
     * @return a new cache
     * @throws IllegalArgumentException if the provider is empty, names another cache, has no or too many parameters,
     *         or one of them is not a valid number or boolean
     */
    public static ShardedCache createCache(final String provider) {
        N.checkArgument(Strings.isNotBlank(provider), "Provider specification can't be empty");

        final TypeAttrParser attrResult = TypeAttrParser.parse(provider);
        final String className = attrResult.getClassName();
        final String[] parameters = attrResult.getParameters();

        if (!SHARDED_CACHE.equalsIgnoreCase(Strings.trim(className))) {
            throw new IllegalArgumentException("Unsupported cache provider: " + className);
        }

        if (N.isEmpty(parameters)) {
            throw new IllegalArgumentException("Invalid provider specification: missing parameters");
        }

        if (parameters.length > 4) {
            throw new IllegalArgumentException("Unsupported parameters: " + Strings.join(parameters));
        }

        final ShardedCache.Builder builder = ShardedCache.builder();

        try {
            builder.nshards(Numbers.toInt(Strings.trim(parameters[0])));

            if (parameters.length > 1) {
                builder.useCas(parseBoolean(parameters[1]));
            }

            if (parameters.length > 2) {
                builder.loadFactor(Numbers.toInt(Strings.trim(parameters[2])));
            }

            if (parameters.length > 3) {
                builder.maxMemory(Numbers.toLong(Strings.trim(parameters[3])));
            }
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric parameter in: " + provider, e);
        }

        return builder.build();
    }

    private static boolean parseBoolean(final String str) {
        final String value = Strings.trim(str);

        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        } else {
            throw new IllegalArgumentException("Invalid boolean parameter: " + str);
        }
    }
}
