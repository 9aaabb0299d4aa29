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

import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.types.ColumnTypeDetector;

import java.util.List;

/// Immutable settings of one analysis run.
///
/// @param groupBy grouping columns in key order, empty for an overall analysis
/// @param excludedColumns columns never measured
/// @param sampleSize leading data rows used for type detection
/// @param threshold majority share needed to classify a column as numeric or list-valued
/// @param topK number of most common tokens reported for discrete columns
/// @param threads scanner threads; 1 scans sequentially
/// @param chunkSize rows per chunk when scanning in parallel
/// @param rowLimit maximum number of data rows read, 0 for no limit
/// @param delimiter the CSV column separator
public record AnalysisConfig(
    List<String> groupBy,
    List<String> excludedColumns,
    int sampleSize,
    double threshold,
    int topK,
    int threads,
    int chunkSize,
    long rowLimit,
    char delimiter
) {

    /// rows per chunk of a parallel scan by default
    public static final int DEFAULT_CHUNK_SIZE = 10_000;

    public AnalysisConfig {
        groupBy = List.copyOf(groupBy);
        excludedColumns = List.copyOf(excludedColumns);
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive: " + sampleSize);
        }
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (rowLimit < 0) {
            throw new IllegalArgumentException("rowLimit must not be negative: " + rowLimit);
        }
    }

    /// @return the settings of an overall, sequential analysis with default options
    public static AnalysisConfig defaults() {
        return builder().build();
    }

    /// @return a builder starting from the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return true if rows are partitioned by grouping columns
    public boolean isGrouped() {
        return !groupBy.isEmpty();
    }

    /// @return true if more than one scanner thread is used
    public boolean isParallel() {
        return threads > 1;
    }

    /// Builder for [AnalysisConfig].
    public static final class Builder {
        private List<String> groupBy = List.of();
        private List<String> excludedColumns = List.of();
        private int sampleSize = ColumnTypeDetector.DEFAULT_SAMPLE_SIZE;
        private double threshold = ColumnTypeDetector.DEFAULT_THRESHOLD;
        private int topK = StatisticsFinalizer.DEFAULT_TOP_K;
        private int threads = 1;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private long rowLimit = 0;
        private char delimiter = ',';

        private Builder() {
        }

        public Builder groupBy(List<String> groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder groupBy(String... groupBy) {
            return groupBy(List.of(groupBy));
        }

        public Builder excludedColumns(List<String> excludedColumns) {
            this.excludedColumns = excludedColumns;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder rowLimit(long rowLimit) {
            this.rowLimit = rowLimit;
            return this;
        }

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(groupBy, excludedColumns, sampleSize, threshold, topK,
                threads, chunkSize, rowLimit, delimiter);
        }
    }
}
