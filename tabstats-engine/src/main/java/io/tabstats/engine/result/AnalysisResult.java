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

import io.tabstats.engine.group.GroupKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// The immutable result tree of one analysis run.
///
/// Groups are kept in first-seen order and columns in header order. An overall analysis
/// holds exactly one group, keyed by [GroupKey#EMPTY].
public final class AnalysisResult {

    private final AnalysisMetadata metadata;
    private final Map<GroupKey, Map<String, ColumnStatistics>> groups;

    /// @param metadata run-level facts
    /// @param groups per-group column statistics
    public AnalysisResult(AnalysisMetadata metadata, Map<GroupKey, Map<String, ColumnStatistics>> groups) {
        this.metadata = metadata;
        Map<GroupKey, Map<String, ColumnStatistics>> copy = new LinkedHashMap<>();
        groups.forEach((key, columns) -> copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(columns))));
        this.groups = Collections.unmodifiableMap(copy);
    }

    /// @return run-level facts
    public AnalysisMetadata getMetadata() {
        return metadata;
    }

    /// @return per-group column statistics in first-seen order
    public Map<GroupKey, Map<String, ColumnStatistics>> getGroups() {
        return groups;
    }

    /// @param key a group key
    /// @return the column statistics of that group, or an empty map if it never occurred
    public Map<String, ColumnStatistics> getGroup(GroupKey key) {
        return groups.getOrDefault(key, Map.of());
    }

    /// @return the column statistics of the single implicit group of an overall analysis
    /// @throws IllegalStateException if this result is grouped
    public Map<String, ColumnStatistics> getOverall() {
        if (metadata.isGrouped()) {
            throw new IllegalStateException("A grouped result has no overall section");
        }
        return getGroup(GroupKey.EMPTY);
    }

    @Override
    public String toString() {
        return "AnalysisResult[" + metadata.analysisType() + ", rows=" + metadata.totalRowsProcessed()
            + ", groups=" + groups.size() + "]";
    }
}
