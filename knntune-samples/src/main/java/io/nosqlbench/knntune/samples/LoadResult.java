/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.knntune.samples;

import java.util.List;

/// The outcome of [SampleStoreLoader#load]: the store built from the valid records and every
/// record which was rejected on the way.
///
/// @param store the loaded store
/// @param rejected the rejected records, in input order
public record LoadResult(SampleStore store, List<InvalidRecordException> rejected) {

    public LoadResult {
        rejected = List.copyOf(rejected);
    }

    /// @return true if any record was skipped
    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}
