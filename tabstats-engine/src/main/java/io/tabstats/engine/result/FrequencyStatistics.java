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

import java.util.List;

/// Token frequencies of a categorical or list-valued column.
///
/// @param type either [ColumnType#CATEGORICAL] or [ColumnType#LIST_VALUED]
/// @param count the total number of tokens counted
/// @param uniqueCount the number of distinct tokens
/// @param mostCommon the most frequent tokens, most frequent first
public record FrequencyStatistics(ColumnType type, long count, long uniqueCount, List<TokenFrequency> mostCommon)
    implements ColumnStatistics {

    public FrequencyStatistics {
        if (!type.isDiscrete()) {
            throw new IllegalArgumentException("Frequency statistics cannot describe a " + type.label() + " column");
        }
        mostCommon = List.copyOf(mostCommon);
    }
}
