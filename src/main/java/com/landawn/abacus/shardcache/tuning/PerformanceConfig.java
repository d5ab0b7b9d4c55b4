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

package com.landawn.abacus.shardcache.tuning;

/**
 * Recommended sizing parameters.
 *
 * @param backlog the network accept queue length
 * @param queueSize the event processing queue size
 * @param maxConns the concurrent client limit
 * @param nshards the number of cache shards
 * @param autoTuned whether the values were derived from detected resources
 * @param summary a one-line human-readable description
 */
public record PerformanceConfig(int backlog, int queueSize, int maxConns, int nshards, boolean autoTuned, String summary) {
}
