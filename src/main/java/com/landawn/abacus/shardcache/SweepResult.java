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
 * Counts reported by a sweep.
 *
 * @param swept the number of expired entries removed
 * @param kept the number of entries left in the swept shards
 */
public record SweepResult(long swept, long kept) {

    static final SweepResult EMPTY = new SweepResult(0, 0);

    SweepResult plus(final SweepResult other) {
        return new SweepResult(swept + other.swept, kept + other.kept);
    }
}
