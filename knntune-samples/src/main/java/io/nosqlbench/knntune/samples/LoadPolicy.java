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

/// What [SampleStoreLoader] does with a record that fails validation
public enum LoadPolicy {
    /// Log the record, keep it in the rejected list, and continue with the next one
    SKIP_INVALID,
    /// Throw the first [InvalidRecordException] and build no store
    ABORT
}
