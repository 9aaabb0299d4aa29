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

/// Base type for the fatal, configuration-time failures of an analysis run.
///
/// Per-row and per-value problems never surface as exceptions; they are recovered
/// where they occur and only show up in counters and logs.
public class TabStatsException extends RuntimeException {

    /// @param message description of the failure
    public TabStatsException(String message) {
        super(message);
    }

    /// @param message description of the failure
    /// @param cause underlying cause
    public TabStatsException(String message, Throwable cause) {
        super(message, cause);
    }
}
