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

/// Creates fresh accumulators for detected column types.
public final class ColumnAccumulators {

    private final ListLiteralParser literalParser;

    /// @param literalParser the parser handed to list-valued accumulators
    public ColumnAccumulators(ListLiteralParser literalParser) {
        this.literalParser = literalParser;
    }

    /// @param type a detected column type
    /// @return a new, empty accumulator for that type
    public ColumnAccumulator create(ColumnType type) {
        return switch (type) {
            case NUMERIC -> new NumericAccumulator();
            case CATEGORICAL -> new FrequencyAccumulator();
            case LIST_VALUED -> new ListValuedAccumulator(literalParser);
        };
    }
}
