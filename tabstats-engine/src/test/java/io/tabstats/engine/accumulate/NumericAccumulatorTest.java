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

import io.tabstats.engine.result.NumericStatistics;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NumericAccumulatorTest {

    private final StatisticsFinalizer finalizer = new StatisticsFinalizer();

    @Test
    void ignoresUnparsableValues() {
        NumericAccumulator acc = new NumericAccumulator();
        for (String v : new String[] {"10", "20", "30", "bad"}) {
            acc.ingest(v);
        }

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.count()).isEqualTo(3);
        assertThat(stats.mean()).isCloseTo(20.0, within(1e-9));
        assertThat(stats.min()).isEqualTo(10.0);
        assertThat(stats.max()).isEqualTo(30.0);
        assertThat(stats.stdev()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void emptyAccumulatorReportsZeros() {
        NumericAccumulator acc = new NumericAccumulator();
        acc.ingest("n/a");

        assertThat(acc.getMin()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(acc.finish(finalizer)).isEqualTo(NumericStatistics.EMPTY);
    }

    @Test
    void onlyNanValuesReportZeroRange() {
        NumericAccumulator acc = new NumericAccumulator();
        acc.ingest("nan");

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.min()).isEqualTo(0.0);
        assertThat(stats.max()).isEqualTo(0.0);
        assertThat(stats.min()).isLessThanOrEqualTo(stats.max());
    }

    @Test
    void nanDoesNotDisturbTheRange() {
        NumericAccumulator acc = new NumericAccumulator();
        for (String v : new String[] {"nan", "4", "NaN", "-2"}) {
            acc.ingest(v);
        }

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.count()).isEqualTo(4);
        assertThat(stats.min()).isEqualTo(-2.0);
        assertThat(stats.max()).isEqualTo(4.0);
    }

    @Test
    void onlyInfiniteValuesKeepTheirRange() {
        NumericAccumulator acc = new NumericAccumulator();
        acc.ingest("inf");
        acc.ingest("Infinity");

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.min()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(stats.max()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void singleValueHasZeroStdev() {
        NumericAccumulator acc = new NumericAccumulator();
        acc.add(42.0);

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.count()).isEqualTo(1);
        assertThat(stats.mean()).isEqualTo(42.0);
        assertThat(stats.stdev()).isEqualTo(0.0);
    }

    @Test
    void constantValuesNeverGoNegative() {
        NumericAccumulator acc = new NumericAccumulator();
        for (int i = 0; i < 1000; i++) {
            acc.add(0.1);
        }

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.stdev()).isGreaterThanOrEqualTo(0.0).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void meanLiesWithinRange() {
        Random random = new Random(7);
        NumericAccumulator acc = new NumericAccumulator();
        for (int i = 0; i < 500; i++) {
            acc.add(random.nextGaussian() * 50 + 3);
        }

        NumericStatistics stats = finalizer.finishNumeric(acc);

        assertThat(stats.mean()).isCloseTo(acc.getSum() / acc.getCount(), within(1e-12));
        assertThat(stats.min()).isLessThanOrEqualTo(stats.mean());
        assertThat(stats.max()).isGreaterThanOrEqualTo(stats.mean());
        assertThat(stats.stdev()).isGreaterThan(0.0);
    }

    @Test
    void combineEqualsSinglePass() {
        double[] values = {3.0, -1.5, 8.25, 0.0, 12.0, 7.5, -4.0};
        NumericAccumulator whole = new NumericAccumulator();
        NumericAccumulator left = new NumericAccumulator();
        NumericAccumulator right = new NumericAccumulator();
        for (int i = 0; i < values.length; i++) {
            whole.add(values[i]);
            (i < 3 ? left : right).add(values[i]);
        }

        left.combine(right);

        NumericStatistics expected = finalizer.finishNumeric(whole);
        NumericStatistics actual = finalizer.finishNumeric(left);
        assertThat(actual.count()).isEqualTo(expected.count());
        assertThat(actual.mean()).isCloseTo(expected.mean(), within(1e-9));
        assertThat(actual.stdev()).isCloseTo(expected.stdev(), within(1e-9));
        assertThat(actual.min()).isEqualTo(-4.0);
        assertThat(actual.max()).isEqualTo(12.0);
    }

    @Test
    void combineWithEmptyKeepsState() {
        NumericAccumulator acc = new NumericAccumulator();
        acc.add(1.0);
        acc.add(3.0);

        acc.combine(new NumericAccumulator());

        assertThat(acc.getCount()).isEqualTo(2);
        assertThat(acc.getMin()).isEqualTo(1.0);
        assertThat(acc.getMax()).isEqualTo(3.0);
    }

    @Test
    void combineRejectsOtherVariants() {
        NumericAccumulator acc = new NumericAccumulator();
        assertThatThrownBy(() -> acc.combine(new FrequencyAccumulator()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("categorical");
    }
}
