package io.tabstats.engine.stream;

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

import io.tabstats.engine.group.ColumnLayout;
import io.tabstats.engine.result.AnalysisResult;

/// Consumes the data rows of one table and produces its result tree.
///
/// ## Lifecycle
///
/// ```
/// 1. initialize(layout)  - once, with the detected column types
/// 2. accept(row)         - once per data row, in input order
/// 3. complete()          - once, to finalize every (group, column)
/// ```
///
/// Calls out of this order throw [IllegalStateException]. Scanners are driven by a single
/// thread; a scanner that uses worker threads internally releases them in [#close()].
public interface RowScanner extends AutoCloseable {

    /// Install the column layout. Moves the scanner to [ScanState#TYPES_DETECTED].
    /// @param layout the layout with detected types
    void initialize(ColumnLayout layout);

    /// Accumulate one data row. Rows shorter than the header are skipped and counted
    /// as malformed.
    /// @param row the raw cell values
    void accept(String[] row);

    /// Finalize all accumulators. Moves the scanner to [ScanState#FINALIZED].
    /// @return the result tree
    AnalysisResult complete();

    /// @return the current lifecycle state
    ScanState getState();

    /// @return rows skipped because they were shorter than the header; exact once complete
    long getRowsSkipped();

    @Override
    default void close() {
    }
}
