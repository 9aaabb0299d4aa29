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

import io.tabstats.engine.result.ColumnStatistics;
import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.NumericValues;

/// Count, sum, sum of squares and range of a numeric column.
///
/// The power sums are kept instead of a running mean so that partial accumulators from
/// independent chunks merge by plain addition. Values that do not parse as numbers are
/// ignored without touching any counter.
public final class NumericAccumulator implements ColumnAccumulator {

    private long count = 0;
    private double sum = 0.0;
    private double sumSq = 0.0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    @Override
    public ColumnType type() {
        return ColumnType.NUMERIC;
    }

    @Override
    public void ingest(String rawValue) {
        NumericValues.tryParse(rawValue).ifPresent(this::add);
    }

    /// Adds a single parsed value.
    /// @param value the value to add
    public void add(double value) {
        count++;
        sum += value;
        sumSq += value * value;
        // NaN counts toward the moments but never moves the range
        if (value <= min) min = value;
        if (value >= max) max = value;
    }

    @Override
    public void combine(ColumnAccumulator other) {
        if (!(other instanceof NumericAccumulator numeric)) {
            throw new IllegalArgumentException("Cannot combine a numeric accumulator with a " + other.type().label() + " one");
        }
        this.count += numeric.count;
        this.sum += numeric.sum;
        this.sumSq += numeric.sumSq;
        this.min = Math.min(this.min, numeric.min);
        this.max = Math.max(this.max, numeric.max);
    }

    @Override
    public ColumnStatistics finish(StatisticsFinalizer finalizer) {
        return finalizer.finishNumeric(this);
    }

    /// @return the number of values added
    public long getCount() {
        return count;
    }

    /// @return the sum of values added
    public double getSum() {
        return sum;
    }

    /// @return the sum of squared values added
    public double getSumOfSquares() {
        return sumSq;
    }

    /// @return the smallest non-NaN value added, or +Infinity if none
    public double getMin() {
        return min;
    }

    /// @return the largest non-NaN value added, or -Infinity if none
    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("NumericAccumulator[n=%d, sum=%.4f, range=[%.4f, %.4f]]", count, sum, min, max);
    }
}
