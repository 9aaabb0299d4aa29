package io.tabstats.engine.types;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Classifies every column of a table from a bounded prefix of its rows.
///
/// For each column the non-empty sampled values are tallied twice: once for values that
/// parse as numbers, and once for the remaining values that parse as list or mapping
/// literals. A column whose numeric share reaches the threshold is [ColumnType#NUMERIC];
/// otherwise one whose literal share reaches it is [ColumnType#LIST_VALUED]; anything else,
/// including a column with no non-empty sampled value at all, is [ColumnType#CATEGORICAL].
///
/// Empty values are left out of the denominator. Rows shorter than the header still
/// contribute the values they have. The result only depends on the sample content, so
/// detecting twice on the same sample yields the same mapping.
public final class ColumnTypeDetector {

    private static final Logger logger = LogManager.getLogger(ColumnTypeDetector.class);

    /// number of leading data rows examined by default
    public static final int DEFAULT_SAMPLE_SIZE = 100;
    /// share of non-empty values that must agree on a type by default
    public static final double DEFAULT_THRESHOLD = 0.8;

    private final int sampleSize;
    private final double threshold;
    private final ListLiteralParser literalParser;

    /// create a detector with the default sample size and threshold
    public ColumnTypeDetector() {
        this(DEFAULT_SAMPLE_SIZE, DEFAULT_THRESHOLD, new ListLiteralParser());
    }

    /// @param sampleSize the number of leading rows to examine, at least 1
    /// @param threshold the majority share in `(0, 1]`
    /// @param literalParser the parser deciding what counts as a list literal
    public ColumnTypeDetector(int sampleSize, double threshold, ListLiteralParser literalParser) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive: " + sampleSize);
        }
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
        }
        this.sampleSize = sampleSize;
        this.threshold = threshold;
        this.literalParser = literalParser;
    }

    /// Classify all header columns.
    ///
    /// Only the first `sampleSize` rows of `rows` are examined. A column name that
    /// occurs twice in the header keeps the classification of its first occurrence.
    ///
    /// @param header the column names in input order
    /// @param rows the leading data rows
    /// @return an unmodifiable mapping in header order
    public Map<String, ColumnType> detect(List<String> header, List<String[]> rows) {
        List<String[]> sample = rows.size() > sampleSize ? rows.subList(0, sampleSize) : rows;
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            if (types.containsKey(header.get(i))) {
                logger.warn("Duplicate column name '{}' at position {}, keeping the first", header.get(i), i);
                continue;
            }
            types.put(header.get(i), classify(header.get(i), i, sample));
        }
        return Collections.unmodifiableMap(types);
    }

    private ColumnType classify(String name, int index, List<String[]> sample) {
        int nonEmpty = 0;
        int numeric = 0;
        int literal = 0;
        for (String[] row : sample) {
            if (row.length <= index) {
                continue;
            }
            String value = row[index];
            if (value == null || value.isEmpty()) {
                continue;
            }
            nonEmpty++;
            if (NumericValues.isNumeric(value)) {
                numeric++;
            } else if (literalParser.isLiteral(value)) {
                literal++;
            }
        }

        ColumnType type;
        if (nonEmpty == 0) {
            type = ColumnType.CATEGORICAL;
        } else if ((double) numeric / nonEmpty >= threshold) {
            type = ColumnType.NUMERIC;
        } else if ((double) literal / nonEmpty >= threshold) {
            type = ColumnType.LIST_VALUED;
        } else {
            type = ColumnType.CATEGORICAL;
        }
        logger.debug("column '{}': {} non-empty, {} numeric, {} literal -> {}",
            name, nonEmpty, numeric, literal, type.label());
        return type;
    }
}
