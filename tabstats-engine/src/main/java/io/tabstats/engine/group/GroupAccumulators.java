package io.tabstats.engine.group;

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

import io.tabstats.engine.accumulate.ColumnAccumulator;
import io.tabstats.engine.accumulate.ColumnAccumulators;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.result.ColumnStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// One accumulator per measured column, for a single group.
public final class GroupAccumulators {

    private final List<ColumnLayout.MeasuredColumn> columns;
    private final ColumnAccumulator[] accumulators;

    /// @param layout the shared column layout
    /// @param factory creates an accumulator per column type
    public GroupAccumulators(ColumnLayout layout, ColumnAccumulators factory) {
        this.columns = layout.getMeasured();
        this.accumulators = new ColumnAccumulator[columns.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = factory.create(columns.get(i).type());
        }
    }

    /// Ingest every non-empty measured value of a row.
    /// @param row a data row at least as wide as the header
    public void ingest(String[] row) {
        for (int i = 0; i < accumulators.length; i++) {
            String value = row[columns.get(i).index()];
            if (value != null && !value.isEmpty()) {
                accumulators[i].ingest(value);
            }
        }
    }

    /// Merge another group's accumulators, column by column.
    /// @param other accumulators built from the same layout
    public void combine(GroupAccumulators other) {
        if (other.accumulators.length != accumulators.length) {
            throw new IllegalArgumentException("Cannot combine accumulators of different layouts");
        }
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i].combine(other.accumulators[i]);
        }
    }

    /// @param name a measured column name
    /// @return its accumulator, or null if the column is not measured
    public ColumnAccumulator get(String name) {
        for (int i = 0; i < accumulators.length; i++) {
            if (columns.get(i).name().equals(name)) {
                return accumulators[i];
            }
        }
        return null;
    }

    /// @param finalizer the finalizer holding reporting options
    /// @return the statistics of every measured column, in header order
    public Map<String, ColumnStatistics> finish(StatisticsFinalizer finalizer) {
        Map<String, ColumnStatistics> stats = new LinkedHashMap<>();
        for (int i = 0; i < accumulators.length; i++) {
            stats.put(columns.get(i).name(), accumulators[i].finish(finalizer));
        }
        return stats;
    }
}
