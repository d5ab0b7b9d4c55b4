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

import java.time.Instant;

/**
 * Time source for expiration, in nanoseconds. Expiration timestamps are absolute values of this ticker.
 */
@FunctionalInterface
public interface Ticker {

    long read();

    /**
     * Returns a ticker reading the wall clock as nanoseconds since the epoch.
     *
     * @return the system ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            final Instant now = Instant.now();

            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        }
    }
}
