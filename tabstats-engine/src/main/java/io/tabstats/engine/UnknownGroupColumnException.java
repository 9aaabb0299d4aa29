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

import java.util.List;

/// Thrown before any row is accumulated when a grouping column is not in the header.
public class UnknownGroupColumnException extends TabStatsException {

    private final List<String> missingColumns;

    /// @param missingColumns the configured grouping columns absent from the header
    /// @param header the header that was read
    public UnknownGroupColumnException(List<String> missingColumns, List<String> header) {
        super("Group-by column(s) " + missingColumns + " not found in CSV header " + header);
        this.missingColumns = List.copyOf(missingColumns);
    }

    /// @return the configured grouping columns absent from the header
    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
