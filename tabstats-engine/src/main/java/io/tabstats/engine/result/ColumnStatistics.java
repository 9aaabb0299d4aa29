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

/// Finalized statistics for one column within one group.
public sealed interface ColumnStatistics permits NumericStatistics, FrequencyStatistics {

    /// @return the type of the column these statistics describe
    ColumnType type();

    /// @return the number of values (numeric) or tokens (discrete) counted
    long count();
}
