package io.tabstats.command.subcommands;

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

import io.tabstats.command.common.DetectionOption;
import io.tabstats.command.common.InputFileOption;
import io.tabstats.command.common.VerbosityOption;
import io.tabstats.engine.AnalysisConfig;
import io.tabstats.engine.InputNotFoundException;
import io.tabstats.engine.TabularStatsAnalyzer;
import io.tabstats.engine.json.AnalysisResultWriter;
import io.tabstats.engine.types.ColumnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.Map;
import java.util.concurrent.Callable;

/// Print the detected type of every column of a CSV file
///
/// Only the detection sample is read. The result is a JSON object mapping each column
/// name to `numeric`, `categorical` or `list`.
@CommandLine.Command(name = "detect",
    header = "Detect the column types of a CSV file",
    description = "Reads the leading sample rows and prints the detected type of every column as JSON",
    mixinStandardHelpOptions = true,
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0: success",
        "1: input file not found",
        "2: invalid option value",
        "3: unexpected failure"
    })
public class CMD_tabstats_detect implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_tabstats_detect.class);

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private DetectionOption detectionOption = new DetectionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        AnalysisConfig config;
        try {
            verbosityOption.apply();
            inputFileOption.validate();
            config = detectionOption.applyTo(AnalysisConfig.builder()).build();
        } catch (InputNotFoundException e) {
            return fail(CMD_tabstats_analyze.EXIT_INPUT_NOT_FOUND, e.getMessage());
        } catch (IllegalStateException | IllegalArgumentException e) {
            return fail(CMD_tabstats_analyze.EXIT_INVALID_CONFIG, e.getMessage());
        }

        try {
            Map<String, ColumnType> types = new TabularStatsAnalyzer(config).detect(inputFileOption.getInputPath());
            spec.commandLine().getOut().println(new AnalysisResultWriter().writeString(types));
            spec.commandLine().getOut().flush();
            return CMD_tabstats_analyze.EXIT_SUCCESS;
        } catch (InputNotFoundException e) {
            return fail(CMD_tabstats_analyze.EXIT_INPUT_NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.debug("Type detection on {} failed", inputFileOption, e);
            return fail(CMD_tabstats_analyze.EXIT_FAILURE,
                "Type detection on " + inputFileOption + " failed: " + e.getMessage());
        }
    }

    private int fail(int exitCode, String message) {
        spec.commandLine().getErr().println("Error: " + message);
        return exitCode;
    }
}
