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

import io.tabstats.engine.UnknownGroupColumnException;
import io.tabstats.engine.types.ColumnType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Which header positions are grouping columns and which are measured, with their types.
///
/// A column is measured unless it is a grouping column or excluded by name; a name that
/// occurs more than once in the header is measured at its first position only. The
/// layout is immutable and shared by every group and every chunk of a scan.
public final class ColumnLayout {

    /// A measured column.
    ///
    /// @param name the column name
    /// @param index the position in the header
    /// @param type the detected type
    public record MeasuredColumn(String name, int index, ColumnType type) {
    }

    private final List<String> header;
    private final List<String> groupBy;
    private final int[] groupIndexes;
    private final List<MeasuredColumn> measured;

    /// @param header the column names in input order
    /// @param types the detected type of every header column
    /// @param groupBy the grouping columns, empty for an overall analysis
    /// @param excluded columns never to measure
    /// @throws UnknownGroupColumnException if a grouping column is not in the header
    public ColumnLayout(List<String> header, Map<String, ColumnType> types,
                        List<String> groupBy, Collection<String> excluded) {
        this.header = List.copyOf(header);
        this.groupBy = List.copyOf(groupBy);
        this.groupIndexes = resolveGroupIndexes(this.header, this.groupBy);

        Set<String> skipped = new HashSet<>(groupBy);
        skipped.addAll(excluded);
        Set<String> seen = new LinkedHashSet<>();
        List<MeasuredColumn> columns = new ArrayList<>();
        for (int i = 0; i < this.header.size(); i++) {
            String name = this.header.get(i);
            if (skipped.contains(name) || !seen.add(name)) {
                continue;
            }
            columns.add(new MeasuredColumn(name, i, types.getOrDefault(name, ColumnType.CATEGORICAL)));
        }
        this.measured = Collections.unmodifiableList(columns);
    }

    /// Fails fast on grouping columns missing from a header, before types are detected.
    /// @param header the column names in input order
    /// @param groupBy the grouping columns
    /// @throws UnknownGroupColumnException if a grouping column is not in the header
    public static void validateGroupColumns(List<String> header, List<String> groupBy) {
        resolveGroupIndexes(header, groupBy);
    }

    private static int[] resolveGroupIndexes(List<String> header, List<String> groupBy) {
        int[] indexes = new int[groupBy.size()];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < groupBy.size(); i++) {
            indexes[i] = header.indexOf(groupBy.get(i));
            if (indexes[i] < 0) {
                missing.add(groupBy.get(i));
            }
        }
        if (!missing.isEmpty()) {
            throw new UnknownGroupColumnException(missing, header);
        }
        return indexes;
    }

    /// @return the column names in input order
    public List<String> getHeader() {
        return header;
    }

    /// @return the number of header columns; shorter rows are malformed
    public int width() {
        return header.size();
    }

    /// @return the grouping columns
    public List<String> getGroupBy() {
        return groupBy;
    }

    /// @return true if rows are partitioned by grouping columns
    public boolean isGrouped() {
        return groupIndexes.length > 0;
    }

    /// @param row a data row at least [#width()] long
    /// @return the key of the group the row belongs to
    public GroupKey keyOf(String[] row) {
        return GroupKey.fromRow(row, groupIndexes);
    }

    /// @return the measured columns in header order
    public List<MeasuredColumn> getMeasured() {
        return measured;
    }
}
