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

package io.nosqlbench.knntune.command.common;

import io.nosqlbench.knntune.samples.LoadPolicy;
import io.nosqlbench.knntune.samples.StoreMode;
import io.nosqlbench.knntune.tuning.ShareMode;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared options controlling where loaded samples live, how trials see them, and what happens to
 * invalid input records.
 */
public class StoreOption {

    @CommandLine.Option(
        names = {"--store"},
        description = "Where samples are kept: HEAP or MAPPED (default: ${DEFAULT-VALUE})",
        defaultValue = "HEAP"
    )
    private StoreMode storeMode = StoreMode.HEAP;

    @CommandLine.Option(
        names = {"--share"},
        description = "How trials read samples: SHARED or COPY (default: ${DEFAULT-VALUE})",
        defaultValue = "SHARED"
    )
    private ShareMode shareMode = ShareMode.SHARED;

    @CommandLine.Option(
        names = {"--policy"},
        description = "Invalid record handling: SKIP_INVALID or ABORT (default: ${DEFAULT-VALUE})",
        defaultValue = "SKIP_INVALID"
    )
    private LoadPolicy policy = LoadPolicy.SKIP_INVALID;

    @CommandLine.Option(
        names = {"--mapped-dir"},
        description = "Directory for mapped sample files (default: the system temp directory)"
    )
    private Path mappedDirectory;

    public StoreMode getStoreMode() {
        return storeMode;
    }

    public ShareMode getShareMode() {
        return shareMode;
    }

    public LoadPolicy getPolicy() {
        return policy;
    }

    /**
     * Gets the directory for mapped sample files.
     */
    public Path getMappedDirectory() {
        return mappedDirectory != null ? mappedDirectory : Paths.get(System.getProperty("java.io.tmpdir"));
    }
}
