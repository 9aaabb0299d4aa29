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

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/// Lenient recognition of numeric cell values.
///
/// Accepts decimal and scientific notation with optional surrounding whitespace, and the
/// special values `nan`, `inf` and `infinity` (any case, optionally signed). Rejects the
/// forms that [Double#parseDouble] accepts but a CSV author would not mean as a number,
/// such as hex floats and `d`/`f` type suffixes.
public final class NumericValues {

    private static final Pattern DECIMAL = Pattern.compile(
        "[+-]?(\\d+(_\\d+)*\\.?(\\d+(_\\d+)*)?|\\.\\d+(_\\d+)*)([eE][+-]?\\d+(_\\d+)*)?");

    private NumericValues() {
    }

    /// Parse a raw cell value.
    /// @param raw the raw value, may be null
    /// @return the parsed value, or empty when the value is not numeric
    public static OptionalDouble tryParse(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String value = raw.strip();
        if (value.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (DECIMAL.matcher(value).matches()) {
            return OptionalDouble.of(Double.parseDouble(value.replace("_", "")));
        }
        return special(value);
    }

    /// @param raw the raw value, may be null
    /// @return true if [#tryParse(String)] would yield a value
    public static boolean isNumeric(String raw) {
        return tryParse(raw).isPresent();
    }

    private static OptionalDouble special(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        if (negative || lower.startsWith("+")) {
            lower = lower.substring(1);
        }
        switch (lower) {
            case "nan":
                return OptionalDouble.of(Double.NaN);
            case "inf":
            case "infinity":
                return OptionalDouble.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            default:
                return OptionalDouble.empty();
        }
    }
}
