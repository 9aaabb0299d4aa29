package io.tabstats.command.common;

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

import picocli.CommandLine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Shared grouping option. {@code -g country,state} partitions rows by the values of the
 * named columns; without it the whole table is one group.
 */
public class GroupByOption {

    @CommandLine.Option(
        names = {"-g", "--group-by"},
        paramLabel = "<column>",
        split = ",",
        description = "Columns to group by, comma separated, in key order"
    )
    private List<String> groupBy = new ArrayList<>();

    /**
     * @return the grouping columns in key order, trimmed, without blanks
     * @throws IllegalArgumentException if a column is named twice
     */
    public List<String> getGroupBy() {
        List<String> columns = new ArrayList<>();
        for (String column : groupBy) {
            String name = column.trim();
            if (!name.isEmpty()) {
                columns.add(name);
            }
        }
        if (new LinkedHashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Group-by columns must be distinct: " + columns);
        }
        return columns;
    }

    public boolean isGrouped() {
        return !getGroupBy().isEmpty();
    }
}
