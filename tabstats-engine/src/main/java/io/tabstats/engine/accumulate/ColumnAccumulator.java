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

/// Running state for one column within one group.
///
/// ## Lifecycle
///
/// ```
/// 1. ingest(value)      - once per non-empty cell value, in row order
/// 2. combine(other)     - optionally, to fold in a partial from another chunk
/// 3. finish(finalizer)  - once, after the last row
/// ```
///
/// Accumulators only ever grow: counts increase, min and max widen. Memory per
/// accumulator does not depend on the number of rows, except for the token table of the
/// discrete variants, which grows with the number of distinct tokens.
///
/// Implementations are not thread-safe. Parallel scans use one accumulator per chunk and
/// merge with [#combine(ColumnAccumulator)].
public interface ColumnAccumulator {

    /// @return the column type this accumulator was created for
    ColumnType type();

    /// Fold one raw cell value into the running state. Values the variant cannot use are
    /// ignored or recovered, never thrown.
    /// @param rawValue a non-empty raw cell value
    void ingest(String rawValue);

    /// Fold another accumulator of the same variant into this one.
    ///
    /// The result is the same as if this accumulator had also ingested every value the
    /// other one saw, after its own. The other accumulator must not be used afterwards.
    ///
    /// @param other an accumulator of the same type
    /// @throws IllegalArgumentException if the other accumulator has another type
    void combine(ColumnAccumulator other);

    /// Produce the reported statistics.
    /// @param finalizer the finalizer holding reporting options
    /// @return the finalized statistics
    ColumnStatistics finish(StatisticsFinalizer finalizer);
}
