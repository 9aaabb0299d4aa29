package io.tabstats.engine.result;

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

import io.tabstats.engine.types.ColumnType;

/// Moments of a numeric column. All fields are zero when no value was counted.
///
/// @param count the number of values that parsed as numbers
/// @param mean the arithmetic mean
/// @param min the smallest value
/// @param max the largest value
/// @param stdev the sample standard deviation, zero for fewer than two values
public record NumericStatistics(long count, double mean, double min, double max, double stdev)
    implements ColumnStatistics {

    /// statistics of a column that never saw a numeric value
    public static final NumericStatistics EMPTY = new NumericStatistics(0, 0.0, 0.0, 0.0, 0.0);

    @Override
    public ColumnType type() {
        return ColumnType.NUMERIC;
    }
}
