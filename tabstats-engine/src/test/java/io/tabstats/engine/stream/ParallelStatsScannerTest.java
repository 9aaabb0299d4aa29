package io.tabstats.engine.stream;

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
import io.tabstats.engine.group.ColumnLayout;
import io.tabstats.engine.result.AnalysisResult;
import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.ListLiteralParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelStatsScannerTest {

    private static final List<String> HEADER = List.of("region", "amount", "tag", "channels");
    private static final Map<String, ColumnType> TYPES = Map.of(
        "region", ColumnType.CATEGORICAL,
        "amount", ColumnType.NUMERIC,
        "tag", ColumnType.CATEGORICAL,
        "channels", ColumnType.LIST_VALUED);
    private static final String[] REGIONS = {"north", "south", "east", "west"};
    private static final String[] CHANNELS = {"['web']", "['web', 'mail']", "['store']", "[]", "not a list"};

    private final ColumnAccumulators factory = new ColumnAccumulators(new ListLiteralParser());
    private final StatisticsFinalizer finalizer = new StatisticsFinalizer(3);

    private static List<String[]> rows(int count) {
        Random random = new Random(42);
        List<String[]> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (i % 97 == 0) {
                rows.add(new String[]{"short"});
                continue;
            }
            rows.add(new String[]{
                REGIONS[random.nextInt(REGIONS.length)],
                random.nextInt(10) == 0 ? "" : Integer.toString(random.nextInt(1000)),
                "t" + random.nextInt(12),
                CHANNELS[random.nextInt(CHANNELS.length)]
            });
        }
        return rows;
    }

    private static AnalysisResult run(RowScanner scanner, ColumnLayout layout, List<String[]> rows) {
        try (scanner) {
            scanner.initialize(layout);
            for (String[] row : rows) {
                scanner.accept(row);
            }
            return scanner.complete();
        }
    }

    @ParameterizedTest
    @CsvSource({"1,1", "2,7", "4,100", "3,5000", "8,64"})
    void matchesTheSequentialScan(int threads, int chunkSize) {
        ColumnLayout layout = new ColumnLayout(HEADER, TYPES, List.of("region"), Set.of());
        List<String[]> rows = rows(2000);

        AnalysisResult sequential = run(new StatsScanner(factory, finalizer), layout, rows);
        ParallelStatsScanner parallel = new ParallelStatsScanner(factory, finalizer, threads, chunkSize);
        AnalysisResult chunked = run(parallel, layout, rows);

        assertThat(chunked.getMetadata()).isEqualTo(sequential.getMetadata());
        assertThat(chunked.getGroups()).isEqualTo(sequential.getGroups());
        assertThat(chunked.getGroups().keySet()).containsExactlyElementsOf(sequential.getGroups().keySet());
        assertThat(parallel.getRowsSkipped()).isEqualTo(21);
        assertThat(chunked.getMetadata().totalRowsProcessed()).isEqualTo(2000 - 21);
    }

    @Test
    void overallScanOfAnEmptyTable() {
        ColumnLayout layout = new ColumnLayout(HEADER, TYPES, List.of(), Set.of());

        AnalysisResult result = run(new ParallelStatsScanner(factory, finalizer, 2, 10), layout, List.of());

        assertThat(result.getMetadata().totalRowsProcessed()).isZero();
        assertThat(result.getOverall()).containsOnlyKeys("region", "amount", "tag", "channels");
    }

    @Test
    void closeWithoutCompleteReleasesWorkers() {
        ColumnLayout layout = new ColumnLayout(HEADER, TYPES, List.of(), Set.of());
        ParallelStatsScanner scanner = new ParallelStatsScanner(factory, finalizer, 2, 1);
        scanner.initialize(layout);
        rows(50).forEach(scanner::accept);

        scanner.close();

        assertThat(scanner.getState()).isNotEqualTo(ScanState.FINALIZED);
    }

    @Test
    void rejectsBadSizing() {
        assertThatThrownBy(() -> new ParallelStatsScanner(factory, finalizer, 0, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParallelStatsScanner(factory, finalizer, 2, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
