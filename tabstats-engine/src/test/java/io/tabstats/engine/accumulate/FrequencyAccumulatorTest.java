package io.tabstats.engine.accumulate;

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

import io.tabstats.engine.result.FrequencyStatistics;
import io.tabstats.engine.result.TokenFrequency;
import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.ListLiteralParser;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrequencyAccumulatorTest {

    private final StatisticsFinalizer finalizer = new StatisticsFinalizer();

    @Nested
    class Categorical {

        @Test
        void countsExactValues() {
            FrequencyAccumulator acc = new FrequencyAccumulator();
            acc.ingest("a");
            acc.ingest("a");
            acc.ingest("b");

            FrequencyStatistics stats = finalizer.finishFrequency(acc);

            assertThat(stats.type()).isEqualTo(ColumnType.CATEGORICAL);
            assertThat(stats.count()).isEqualTo(3);
            assertThat(stats.uniqueCount()).isEqualTo(2);
            assertThat(stats.mostCommon()).containsExactly(
                new TokenFrequency("a", 2), new TokenFrequency("b", 1));
        }

        @Test
        void valuesAreNotNormalized() {
            FrequencyAccumulator acc = new FrequencyAccumulator();
            acc.ingest("US");
            acc.ingest("us");
            acc.ingest(" US");

            assertThat(acc.getUniqueCount()).isEqualTo(3);
        }

        @Test
        void combineAddsCountsAndAppendsNewTokens() {
            FrequencyAccumulator left = new FrequencyAccumulator();
            left.ingest("x");
            left.ingest("y");
            FrequencyAccumulator right = new FrequencyAccumulator();
            right.ingest("z");
            right.ingest("x");

            left.combine(right);

            assertThat(left.getTotalCount()).isEqualTo(4);
            assertThat(left.getCount("x")).isEqualTo(2);
            assertThat(left.getTallies()).extracting(TokenTally::getToken).containsExactly("x", "y", "z");
        }

        @Test
        void combineRejectsListValued() {
            FrequencyAccumulator acc = new FrequencyAccumulator();
            assertThatThrownBy(() -> acc.combine(new ListValuedAccumulator(new ListLiteralParser())))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class ListValued {

        private final ListLiteralParser parser = new ListLiteralParser();

        @Test
        void explodesElements() {
            ListValuedAccumulator acc = new ListValuedAccumulator(parser);
            acc.ingest("[\"fb\",\"ig\"]");
            acc.ingest("[\"fb\"]");

            FrequencyStatistics stats = finalizer.finishFrequency(acc);

            assertThat(stats.type()).isEqualTo(ColumnType.LIST_VALUED);
            assertThat(stats.count()).isEqualTo(3);
            assertThat(stats.mostCommon()).containsExactly(
                new TokenFrequency("fb", 2), new TokenFrequency("ig", 1));
        }

        @Test
        void unparsableValueCountsAsOneToken() {
            ListValuedAccumulator acc = new ListValuedAccumulator(parser);
            acc.ingest("['fb']");
            acc.ingest("[broken");

            assertThat(acc.getCount("[broken")).isEqualTo(1);
            assertThat(acc.getFallbackCount()).isEqualTo(1);
            assertThat(acc.getTotalCount()).isEqualTo(2);
        }

        @Test
        void emptyListContributesNothing() {
            ListValuedAccumulator acc = new ListValuedAccumulator(parser);
            acc.ingest("[]");

            assertThat(acc.getTotalCount()).isZero();
            assertThat(acc.getFallbackCount()).isZero();
        }

        @Test
        void mappingCountsKeys() {
            ListValuedAccumulator acc = new ListValuedAccumulator(parser);
            acc.ingest("{'fb': 10, 'ig': 2}");

            assertThat(acc.getCount("fb")).isEqualTo(1);
            assertThat(acc.getCount("ig")).isEqualTo(1);
        }

        @Test
        void combineKeepsFallbackCounts() {
            ListValuedAccumulator left = new ListValuedAccumulator(parser);
            left.ingest("oops");
            ListValuedAccumulator right = new ListValuedAccumulator(parser);
            right.ingest("oops");
            right.ingest("['a']");

            left.combine(right);

            assertThat(left.getCount("oops")).isEqualTo(2);
            assertThat(left.getFallbackCount()).isEqualTo(2);
        }
    }
}
