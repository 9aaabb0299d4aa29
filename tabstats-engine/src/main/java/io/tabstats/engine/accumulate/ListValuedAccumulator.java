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

import io.tabstats.engine.types.ColumnType;
import io.tabstats.engine.types.ListLiteralParser;

import java.util.List;
import java.util.Optional;

/// Token frequency table of a list-valued column.
///
/// Each raw value is exploded: every element of the list literal (or key of the mapping
/// literal) counts once. A value that does not parse as a literal is counted as a single
/// token holding the whole raw string.
public final class ListValuedAccumulator extends FrequencyAccumulator {

    private final ListLiteralParser parser;
    private long fallbacks = 0;

    /// @param parser the literal parser shared by all list-valued columns
    public ListValuedAccumulator(ListLiteralParser parser) {
        super(ColumnType.LIST_VALUED);
        this.parser = parser;
    }

    @Override
    public void ingest(String rawValue) {
        Optional<List<String>> tokens = parser.tokens(rawValue);
        if (tokens.isPresent()) {
            for (String token : tokens.get()) {
                increment(token, 1);
            }
        } else {
            fallbacks++;
            increment(rawValue, 1);
        }
    }

    @Override
    public void combine(ColumnAccumulator other) {
        super.combine(other);
        fallbacks += ((ListValuedAccumulator) other).fallbacks;
    }

    /// @return the number of raw values counted whole because they did not parse
    public long getFallbackCount() {
        return fallbacks;
    }
}
