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

import java.util.Arrays;
import java.util.List;

/// The tuple of grouping-column values identifying one partition of rows.
///
/// Equal tuples denote the same group. An overall analysis uses [#EMPTY].
public final class GroupKey {

    /// key of the single implicit group of an ungrouped analysis
    public static final GroupKey EMPTY = new GroupKey(new String[0]);

    private final String[] values;
    private final int hash;

    private GroupKey(String[] values) {
        this.values = values;
        this.hash = Arrays.hashCode(values);
    }

    /// @param values the grouping-column values in configured order
    /// @return a key over a copy of the values
    public static GroupKey of(String... values) {
        return values.length == 0 ? EMPTY : new GroupKey(values.clone());
    }

    /// Extract the key of a row.
    /// @param row a data row
    /// @param indexes the header positions of the grouping columns
    /// @return the key of the row
    public static GroupKey fromRow(String[] row, int[] indexes) {
        if (indexes.length == 0) {
            return EMPTY;
        }
        String[] values = new String[indexes.length];
        for (int i = 0; i < indexes.length; i++) {
            values[i] = row[indexes[i]];
        }
        return new GroupKey(values);
    }

    /// @return the values in configured order
    public List<String> values() {
        return List.of(values);
    }

    /// @return the number of values
    public int size() {
        return values.length;
    }

    /// Render the key as a tuple literal, e.g. `('US',)` or `('US', 'NY')`.
    ///
    /// Values are single-quoted unless they contain a single quote and no double quote.
    /// Backslash and the active quote are escaped. Non-printable characters become hex
    /// escapes of two, four or eight digits depending on the code point, e.g. `\x00`.
    /// This is the form used as the key of each group in JSON output.
    ///
    /// @return the tuple literal
    public String render() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            quote(values[i], sb);
        }
        if (values.length == 1) {
            sb.append(',');
        }
        return sb.append(')').toString();
    }

    private static void quote(String value, StringBuilder sb) {
        char q = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        sb.append(q);
        value.codePoints().forEach(cp -> {
            switch (cp) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (cp == q) {
                        sb.append('\\').append(q);
                    } else if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (cp <= 0xff) {
                        sb.append(String.format("\\x%02x", cp));
                    } else if (cp <= 0xffff) {
                        sb.append(String.format("\\u%04x", cp));
                    } else {
                        sb.append(String.format("\\U%08x", cp));
                    }
                }
            }
        });
        sb.append(q);
    }

    /// Space is the only separator that prints as itself.
    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                Character.UNASSIGNED, Character.SPACE_SEPARATOR, Character.LINE_SEPARATOR,
                Character.PARAGRAPH_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return render();
    }
}
