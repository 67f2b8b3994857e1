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

final class SampleFormat {

    private SampleFormat() {
    }

    static String features(Sample sample) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < sample.dimensions(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(sample.feature(i));
        }
        return sb.append(']').toString();
    }
}
