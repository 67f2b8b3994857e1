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

package io.nosqlbench.knntune.command;

import io.nosqlbench.knntune.command.classify.CMD_classify;
import io.nosqlbench.knntune.command.tune.CMD_tune;
import picocli.CommandLine;

/// Entry point for the knntune command line.
@CommandLine.Command(name = "knntune",
    mixinStandardHelpOptions = true,
    version = "knntune 0.1.0",
    description = "Tune and run a k-nearest-neighbor classifier over labelled samples",
    subcommands = {CMD_tune.class, CMD_classify.class, CommandLine.HelpCommand.class},
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:warning", "2:error"})
public class CMD_knntune {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /// @param args the command line
    /// @return the exit code
    public static int run(String... args) {
        return newCommandLine().execute(args);
    }

    /// @return a command line configured the way [#main] runs it
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_knntune())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }
}
