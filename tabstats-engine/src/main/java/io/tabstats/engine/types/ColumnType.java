package io.tabstats.engine.types;

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

/// The classification assigned to every column once per dataset.
public enum ColumnType {
    /// values parse as floating point numbers, reported as moments
    NUMERIC("numeric"),
    /// values are opaque strings, reported as frequencies
    CATEGORICAL("categorical"),
    /// values are list or mapping literals, exploded into per-element frequencies
    LIST_VALUED("list");

    private final String label;

    ColumnType(String label) {
        this.label = label;
    }

    /// @return the lower case label used in logs and JSON output
    public String label() {
        return label;
    }

    /// @return true for the variants reported as token frequencies
    public boolean isDiscrete() {
        return this != NUMERIC;
    }
}
