package io.tabstats.command;

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

import io.tabstats.command.subcommands.CMD_tabstats_analyze;
import io.tabstats.command.subcommands.CMD_tabstats_detect;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Per-column statistics for CSV tables
///
/// This is the top level command which serves as the entry point for all sub-commands.
@CommandLine.Command(name = "tabstats",
    header = "Summarize the columns of a CSV table",
    description = "Detects the type of every column and computes per-column statistics, "
        + "optionally per group of rows",
    subcommands = {
        CommandLine.HelpCommand.class,
        CMD_tabstats_analyze.class,
        CMD_tabstats_detect.class
    })
public class CMD_tabstats implements Callable<Integer> {

    /// Run a tabstats command
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return the command line of tabstats with all of its subcommands
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_tabstats()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /// Print help information, since no subcommand was given
    ///
    /// @return 0
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
