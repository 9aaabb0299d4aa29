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

import java.util.List;

/// Run-level facts reported next to the statistics.
///
/// @param totalRowsProcessed rows accumulated, malformed rows excluded
/// @param groupedBy the grouping columns, empty for an overall analysis
public record AnalysisMetadata(long totalRowsProcessed, List<String> groupedBy) {

    public AnalysisMetadata {
        groupedBy = List.copyOf(groupedBy);
    }

    /// @return true when rows were partitioned by grouping columns
    public boolean isGrouped() {
        return !groupedBy.isEmpty();
    }

    /// @return `grouped` or `overall`
    public String analysisType() {
        return isGrouped() ? "grouped" : "overall";
    }
}
