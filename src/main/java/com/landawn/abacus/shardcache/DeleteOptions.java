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

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Options of a delete operation. When {@code casOp} is set, the entry is only removed if its CAS stamp equals
 * {@code cas}; otherwise the delete yields {@link Result#CAS_MISMATCH} and the entry is kept.
 */
@Data
@Accessors(chain = true, fluent = true)
public class DeleteOptions {

    private boolean casOp;

    private long cas;

    public DeleteOptions() {
        // unguarded
    }

    DeleteOptions copy() {
        return new DeleteOptions().casOp(casOp).cas(cas);
    }
}
