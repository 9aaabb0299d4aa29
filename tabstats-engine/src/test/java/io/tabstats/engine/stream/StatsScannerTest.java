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
import io.tabstats.engine.group.GroupKey;
import io.tabstats.engine.result.AnalysisResult;
import io.tabstats.engine.result.ColumnStatistics;
import io.tabstats.engine.result.FrequencyStatistics;
import io.tabstats.engine.result.NumericStatistics;
import io.tabstats.engine.result.TokenFrequency;
import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.ListLiteralParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatsScannerTest {

    private static final List<String> HEADER = List.of("country", "spend", "platforms");
    private static final Map<String, ColumnType> TYPES = Map.of(
        "country", ColumnType.CATEGORICAL,
        "spend", ColumnType.NUMERIC,
        "platforms", ColumnType.LIST_VALUED);

    private static final String[][] ROWS = {
        {"US", "5", "['fb', 'ig']"},
        {"US", "15", "['fb']"},
        {"FR", "100", "[]"},
    };

    private static StatsScanner scanner() {
        return new StatsScanner(new ColumnAccumulators(new ListLiteralParser()), new StatisticsFinalizer());
    }

    private static ColumnLayout layout(String... groupBy) {
        return new ColumnLayout(HEADER, TYPES, List.of(groupBy), Set.of());
    }

    private static AnalysisResult scan(ColumnLayout layout, String[]... rows) {
        StatsScanner scanner = scanner();
        scanner.initialize(layout);
        for (String[] row : rows) {
            scanner.accept(row);
        }
        return scanner.complete();
    }

    @Nested
    class Lifecycle {

        @Test
        void movesThroughStates() {
            StatsScanner scanner = scanner();
            assertThat(scanner.getState()).isEqualTo(ScanState.UNINITIALIZED);

            scanner.initialize(layout());
            assertThat(scanner.getState()).isEqualTo(ScanState.TYPES_DETECTED);

            scanner.accept(ROWS[0]);
            assertThat(scanner.getState()).isEqualTo(ScanState.ACCUMULATING);

            scanner.complete();
            assertThat(scanner.getState()).isEqualTo(ScanState.FINALIZED);
        }

        @Test
        void rejectsRowsBeforeInitialize() {
            assertThatThrownBy(() -> scanner().accept(ROWS[0]))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("UNINITIALIZED");
        }

        @Test
        void rejectsRowsAfterComplete() {
            StatsScanner scanner = scanner();
            scanner.initialize(layout());
            scanner.complete();

            assertThatThrownBy(() -> scanner.accept(ROWS[0])).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(scanner::complete).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void initializesOnce() {
            StatsScanner scanner = scanner();
            scanner.initialize(layout());

            assertThatThrownBy(() -> scanner.initialize(layout())).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void overallAnalysisMeasuresEveryColumn() {
        AnalysisResult result = scan(layout(), ROWS);

        assertThat(result.getMetadata().totalRowsProcessed()).isEqualTo(3);
        assertThat(result.getMetadata().analysisType()).isEqualTo("overall");
        Map<String, ColumnStatistics> overall = result.getOverall();
        assertThat(overall).containsOnlyKeys("country", "spend", "platforms");

        FrequencyStatistics country = (FrequencyStatistics) overall.get("country");
        assertThat(country.mostCommon()).containsExactly(new TokenFrequency("US", 2), new TokenFrequency("FR", 1));

        FrequencyStatistics platforms = (FrequencyStatistics) overall.get("platforms");
        assertThat(platforms.count()).isEqualTo(3);
        assertThat(platforms.mostCommon()).containsExactly(new TokenFrequency("fb", 2), new TokenFrequency("ig", 1));
    }

    @Test
    void groupedAnalysisSplitsByKey() {
        AnalysisResult result = scan(layout("country"), ROWS);

        assertThat(result.getMetadata().groupedBy()).containsExactly("country");
        assertThat(result.getGroups().keySet()).containsExactly(GroupKey.of("US"), GroupKey.of("FR"));

        NumericStatistics us = (NumericStatistics) result.getGroup(GroupKey.of("US")).get("spend");
        assertThat(us.count()).isEqualTo(2);
        assertThat(us.mean()).isEqualTo(10.0);
        assertThat(us.stdev()).isCloseTo(7.0711, within(1e-4));

        NumericStatistics fr = (NumericStatistics) result.getGroup(GroupKey.of("FR")).get("spend");
        assertThat(fr.count()).isEqualTo(1);
        assertThat(fr.mean()).isEqualTo(100.0);
        assertThat(fr.stdev()).isZero();

        assertThat(result.getGroup(GroupKey.of("US"))).doesNotContainKey("country");
        assertThatThrownBy(result::getOverall).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void groupStatisticsMatchAnOverallScanOfTheSubset() {
        AnalysisResult grouped = scan(layout("country"), ROWS);
        AnalysisResult usOnly = scan(layout(), ROWS[0], ROWS[1]);

        Map<String, ColumnStatistics> us = grouped.getGroup(GroupKey.of("US"));
        assertThat(us.get("spend")).isEqualTo(usOnly.getOverall().get("spend"));
        assertThat(us.get("platforms")).isEqualTo(usOnly.getOverall().get("platforms"));
    }

    @Test
    void shortRowsAreSkippedAndCounted() {
        StatsScanner scanner = scanner();
        scanner.initialize(layout());
        scanner.accept(ROWS[0]);
        scanner.accept(new String[]{"US", "7"});

        AnalysisResult result = scanner.complete();

        assertThat(scanner.getRowsSkipped()).isEqualTo(1);
        assertThat(result.getMetadata().totalRowsProcessed()).isEqualTo(1);
        assertThat(result.getOverall().get("spend").count()).isEqualTo(1);
    }

    @Test
    void longerRowsAreAccepted() {
        AnalysisResult result = scan(layout(), new String[]{"US", "1", "[]", "extra"});

        assertThat(result.getMetadata().totalRowsProcessed()).isEqualTo(1);
    }

    @Test
    void emptyTableStillReportsEveryColumn() {
        AnalysisResult result = scan(layout());

        assertThat(result.getMetadata().totalRowsProcessed()).isZero();
        assertThat(result.getOverall().get("spend")).isEqualTo(NumericStatistics.EMPTY);
        assertThat(((FrequencyStatistics) result.getOverall().get("country")).mostCommon()).isEmpty();
    }

    @Test
    void emptyGroupedTableHasNoGroups() {
        AnalysisResult result = scan(layout("country"));

        assertThat(result.getGroups()).isEmpty();
    }

    @Test
    void combineMatchesASinglePass() {
        ColumnLayout layout = layout("country");
        StatsScanner first = scanner();
        first.initialize(layout);
        first.accept(ROWS[0]);
        StatsScanner second = scanner();
        second.initialize(layout);
        second.accept(ROWS[1]);
        second.accept(ROWS[2]);

        first.combine(second);

        assertThat(second.getState()).isEqualTo(ScanState.FINALIZED);
        AnalysisResult combined = first.complete();
        AnalysisResult single = scan(layout, ROWS);
        assertThat(combined.getGroups()).isEqualTo(single.getGroups());
        assertThat(combined.getMetadata()).isEqualTo(single.getMetadata());
    }

    @Test
    void combineRequiresTheSameLayout() {
        StatsScanner first = scanner();
        first.initialize(layout());
        StatsScanner second = scanner();
        second.initialize(layout());

        assertThatThrownBy(() -> first.combine(second)).isInstanceOf(IllegalArgumentException.class);
    }
}
