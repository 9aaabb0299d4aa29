package io.tabstats.engine.group;

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

import io.tabstats.engine.accumulate.ColumnAccumulators;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.result.ColumnStatistics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Maps group keys to their accumulator sets, creating a set on first sight of a key.
///
/// Groups keep first-seen order. Memory is one accumulator per (group, measured column).
public final class GroupRouter {

    private final ColumnLayout layout;
    private final ColumnAccumulators factory;
    private final Map<GroupKey, GroupAccumulators> groups = new LinkedHashMap<>();

    /// @param layout the shared column layout
    /// @param factory creates accumulators for new groups
    public GroupRouter(ColumnLayout layout, ColumnAccumulators factory) {
        this.layout = layout;
        this.factory = factory;
    }

    /// @param key a group key
    /// @return the accumulators of that group, created if the key is new
    public GroupAccumulators route(GroupKey key) {
        return groups.computeIfAbsent(key, k -> new GroupAccumulators(layout, factory));
    }

    /// Merge another router by key union. Keys new to this router are appended in the
    /// other router's order. The other router must not be used afterwards.
    /// @param other a router over the same layout
    public void combine(GroupRouter other) {
        other.groups.forEach((key, accumulators) -> {
            GroupAccumulators mine = groups.get(key);
            if (mine == null) {
                groups.put(key, accumulators);
            } else {
                mine.combine(accumulators);
            }
        });
    }

    /// @return the number of distinct groups seen
    public int size() {
        return groups.size();
    }

    /// @return the accumulator sets in first-seen order
    public Map<GroupKey, GroupAccumulators> getGroups() {
        return Collections.unmodifiableMap(groups);
    }

    /// @param finalizer the finalizer holding reporting options
    /// @return finalized statistics per group, in first-seen order
    public Map<GroupKey, Map<String, ColumnStatistics>> finish(StatisticsFinalizer finalizer) {
        Map<GroupKey, Map<String, ColumnStatistics>> result = new LinkedHashMap<>();
        groups.forEach((key, accumulators) -> result.put(key, accumulators.finish(finalizer)));
        return result;
    }
}
