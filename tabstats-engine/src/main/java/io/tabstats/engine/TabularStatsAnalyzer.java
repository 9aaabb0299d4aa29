package io.tabstats.engine;

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

import io.tabstats.engine.accumulate.ColumnAccumulators;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.csv.CsvTableReader;
import io.tabstats.engine.group.ColumnLayout;
import io.tabstats.engine.result.AnalysisResult;
import io.tabstats.engine.stream.ParallelStatsScanner;
import io.tabstats.engine.stream.RowScanner;
import io.tabstats.engine.stream.StatsScanner;
import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.ColumnTypeDetector;
import io.tabstats.engine.types.ListLiteralParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/// Computes per-column statistics of a CSV table in one pass.
///
/// ## Run
///
/// 1. read the header and check that every grouping column exists
/// 2. buffer the leading sample rows and detect column types on them
/// 3. replay the sample, then stream the remaining rows into a scanner
/// 4. finalize every (group, column) once the input ends
///
/// Only the sample is ever buffered; memory after that depends on the number of groups
/// and distinct tokens, not on the number of rows.
///
/// ## Early termination
///
/// A configured row limit, or a call to [#requestStop()] from any thread, ends the scan
/// between two rows. The statistics then cover exactly the rows read so far.
///
/// ```java
/// AnalysisConfig config = AnalysisConfig.builder().groupBy("country").build();
/// AnalysisResult result = new TabularStatsAnalyzer(config).analyze(Path.of("ads.csv"));
/// new AnalysisResultWriter().write(result, Path.of("ads-stats.json"));
/// ```
public final class TabularStatsAnalyzer {

    private static final Logger logger = LogManager.getLogger(TabularStatsAnalyzer.class);

    private final AnalysisConfig config;
    private final ColumnTypeDetector detector;
    private final ColumnAccumulators accumulators;
    private final StatisticsFinalizer finalizer;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /// @param config the settings of this run
    public TabularStatsAnalyzer(AnalysisConfig config) {
        ListLiteralParser literalParser = new ListLiteralParser();
        this.config = config;
        this.detector = new ColumnTypeDetector(config.sampleSize(), config.threshold(), literalParser);
        this.accumulators = new ColumnAccumulators(literalParser);
        this.finalizer = new StatisticsFinalizer(config.topK());
    }

    /// Analyze a CSV file.
    /// @param input the CSV file
    /// @return the result tree
    /// @throws InputNotFoundException if the file does not exist
    /// @throws UnknownGroupColumnException if a grouping column is not in the header
    /// @throws IOException if the file cannot be read or is not valid CSV
    public AnalysisResult analyze(Path input) throws IOException {
        logger.info("Analyzing {}", input);
        try (CsvTableReader reader = CsvTableReader.open(input, config.delimiter())) {
            return analyze(reader);
        }
    }

    /// Analyze an open CSV table from its first data row on.
    /// @param reader a reader positioned after the header
    /// @return the result tree
    /// @throws UnknownGroupColumnException if a grouping column is not in the header
    /// @throws IOException if the input cannot be read or is not valid CSV
    public AnalysisResult analyze(CsvTableReader reader) throws IOException {
        List<String> header = reader.getHeader();
        ColumnLayout.validateGroupColumns(header, config.groupBy());

        List<String[]> sample = readSample(reader);
        Map<String, ColumnType> types = detectTypes(header, sample);
        ColumnLayout layout = new ColumnLayout(header, types, config.groupBy(), config.excludedColumns());

        if (layout.isGrouped()) {
            logger.info("Performing grouped analysis, grouping by: {}", config.groupBy());
        } else {
            logger.info("Performing overall analysis (no grouping)");
        }

        try (RowScanner scanner = newScanner()) {
            scanner.initialize(layout);
            logger.info("Starting data processing...");
            long read = 0;
            for (String[] row : sample) {
                if (shouldStop(read)) {
                    break;
                }
                scanner.accept(row);
                read++;
            }
            String[] row;
            while (!shouldStop(read) && (row = reader.nextRow()) != null) {
                scanner.accept(row);
                read++;
            }
            if (stopRequested.get()) {
                logger.warn("Scan stopped on request after {} data rows; statistics cover those rows only", read);
            } else if (config.rowLimit() > 0 && read >= config.rowLimit()) {
                logger.info("Row limit of {} reached; remaining rows were not read", config.rowLimit());
            }
            return scanner.complete();
        }
    }

    /// Detect column types without accumulating anything.
    /// @param input the CSV file
    /// @return the type of every header column, in header order
    /// @throws InputNotFoundException if the file does not exist
    /// @throws IOException if the file cannot be read or is not valid CSV
    public Map<String, ColumnType> detect(Path input) throws IOException {
        try (CsvTableReader reader = CsvTableReader.open(input, config.delimiter())) {
            return detectTypes(reader.getHeader(), readSample(reader));
        }
    }

    /// Ask a running scan to stop after the current row. Safe to call from any thread.
    public void requestStop() {
        stopRequested.set(true);
    }

    /// @return true once [#requestStop()] was called
    public boolean isStopRequested() {
        return stopRequested.get();
    }

    private List<String[]> readSample(CsvTableReader reader) throws IOException {
        long limit = config.rowLimit() > 0 ? Math.min(config.rowLimit(), config.sampleSize()) : config.sampleSize();
        List<String[]> sample = new ArrayList<>();
        String[] row;
        while (sample.size() < limit && (row = reader.nextRow()) != null) {
            sample.add(row);
        }
        return sample;
    }

    private Map<String, ColumnType> detectTypes(List<String> header, List<String[]> sample) {
        logger.info("Starting column type detection on {} sample row(s)...", sample.size());
        Map<String, ColumnType> types = detector.detect(header, sample);
        Map<String, String> labels = new LinkedHashMap<>();
        types.forEach((name, type) -> labels.put(name, type.label()));
        logger.info("Column type detection complete: {}", labels);
        return types;
    }

    private RowScanner newScanner() {
        if (config.isParallel()) {
            return new ParallelStatsScanner(accumulators, finalizer, config.threads(), config.chunkSize());
        }
        return new StatsScanner(accumulators, finalizer);
    }

    private boolean shouldStop(long read) {
        return stopRequested.get() || (config.rowLimit() > 0 && read >= config.rowLimit());
    }
}
