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
import io.tabstats.command.common.GroupByOption;
import io.tabstats.command.common.InputFileOption;
import io.tabstats.command.common.OutputFileOption;
import io.tabstats.command.common.ParallelExecutionOption;
import io.tabstats.command.common.VerbosityOption;
import io.tabstats.engine.AnalysisConfig;
import io.tabstats.engine.InputNotFoundException;
import io.tabstats.engine.TabularStatsAnalyzer;
import io.tabstats.engine.UnknownGroupColumnException;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.json.AnalysisResultWriter;
import io.tabstats.engine.result.AnalysisResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Compute per-column statistics of a CSV file and write them as JSON
///
/// Column types are detected from a leading sample of rows. Numeric columns report count,
/// mean, min, max and sample standard deviation; categorical and list-valued columns report
/// their value counts and most common values. With `--group-by` every distinct combination
/// of the grouping columns gets its own statistics.
///
/// The output file is only written when the whole table was analyzed.
@CommandLine.Command(name = "analyze",
    header = "Compute per-column statistics of a CSV file",
    description = "Detects column types, scans every row once and writes the statistics as JSON",
    mixinStandardHelpOptions = true,
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {
        "0: success",
        "1: input file not found",
        "2: invalid configuration (unknown group column, output exists without --force, bad option)",
        "3: unexpected failure"
    })
public class CMD_tabstats_analyze implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_tabstats_analyze.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_INPUT_NOT_FOUND = 1;
    static final int EXIT_INVALID_CONFIG = 2;
    static final int EXIT_FAILURE = 3;

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private GroupByOption groupByOption = new GroupByOption();

    @CommandLine.Mixin
    private DetectionOption detectionOption = new DetectionOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"--exclude"},
        paramLabel = "<column>",
        split = ",",
        description = "Columns to leave out of the analysis, comma separated")
    private List<String> excluded = new ArrayList<>();

    @CommandLine.Option(names = {"--top-k"},
        paramLabel = "<k>",
        description = "Number of most common values reported per column (default: ${DEFAULT-VALUE})",
        defaultValue = "" + StatisticsFinalizer.DEFAULT_TOP_K)
    private int topK = StatisticsFinalizer.DEFAULT_TOP_K;

    @CommandLine.Option(names = {"--limit"},
        paramLabel = "<rows>",
        description = "Read at most this many data rows, 0 for all (default: ${DEFAULT-VALUE})",
        defaultValue = "0")
    private long limit = 0;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        AnalysisConfig config;
        try {
            verbosityOption.apply();
            inputFileOption.validate();
            outputFileOption.validate();
            config = buildConfig();
        } catch (InputNotFoundException e) {
            return fail(EXIT_INPUT_NOT_FOUND, e.getMessage());
        } catch (IllegalStateException | IllegalArgumentException e) {
            return fail(EXIT_INVALID_CONFIG, e.getMessage());
        }

        try {
            AnalysisResult result = new TabularStatsAnalyzer(config).analyze(inputFileOption.getInputPath());
            new AnalysisResultWriter().write(result, outputFileOption.getOutputPath());
            return EXIT_SUCCESS;
        } catch (InputNotFoundException e) {
            return fail(EXIT_INPUT_NOT_FOUND, e.getMessage());
        } catch (UnknownGroupColumnException e) {
            return fail(EXIT_INVALID_CONFIG, e.getMessage());
        } catch (Exception e) {
            logger.debug("Analysis of {} failed", inputFileOption, e);
            return fail(EXIT_FAILURE, "Analysis of " + inputFileOption + " failed: " + e.getMessage());
        }
    }

    private AnalysisConfig buildConfig() {
        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) exceeds available cores ({}). This may cause contention.",
                parallelExecutionOption.getExplicitThreads(), Runtime.getRuntime().availableProcessors());
        }
        AnalysisConfig.Builder builder = AnalysisConfig.builder()
            .groupBy(groupByOption.getGroupBy())
            .excludedColumns(excludedColumns())
            .topK(topK)
            .rowLimit(limit)
            .threads(parallelExecutionOption.getOptimalThreadCount())
            .chunkSize(parallelExecutionOption.getChunkSize());
        AnalysisConfig config = detectionOption.applyTo(builder).build();
        logger.debug("Configuration: {}", config);
        return config;
    }

    private List<String> excludedColumns() {
        List<String> columns = new ArrayList<>();
        for (String column : excluded) {
            if (!column.isBlank()) {
                columns.add(column.trim());
            }
        }
        return columns;
    }

    private int fail(int exitCode, String message) {
        spec.commandLine().getErr().println("Error: " + message);
        return exitCode;
    }
}
