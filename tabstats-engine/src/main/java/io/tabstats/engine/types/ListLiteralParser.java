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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/// Parses bracketed or braced cell values into the tokens they explode into.
///
/// Cells written by scripting tools often carry single-quoted literals such as
/// `['facebook', 'instagram']`, so the underlying Jackson parser runs with single quotes,
/// trailing commas and non-numeric numbers allowed. Only a value that starts with `[`
/// and ends with `]`, or starts with `{` and ends with `}`, is considered at all.
///
/// Tokens are the list elements, or the keys of a mapping. Strings yield their content,
/// other scalars their literal text, `null` the text `null`, and nested containers their
/// compact JSON text.
///
/// Instances are immutable and thread-safe.
public final class ListLiteralParser {

    private static final JsonFactory LENIENT = JsonFactory.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
        .build();

    private final ObjectMapper mapper;

    /// create a parser with lenient literal rules
    public ListLiteralParser() {
        this.mapper = new ObjectMapper(LENIENT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /// Checks only the enclosing brackets, not the content.
    /// @param raw the raw cell value
    /// @return true if the value is shaped like a list or mapping literal
    public static boolean isBracketed(String raw) {
        if (raw == null || raw.length() < 2) {
            return false;
        }
        char first = raw.charAt(0);
        char last = raw.charAt(raw.length() - 1);
        return (first == '[' && last == ']') || (first == '{' && last == '}');
    }

    /// @param raw the raw cell value
    /// @return true if the value is a list or mapping literal that parses
    public boolean isLiteral(String raw) {
        return tokens(raw).isPresent();
    }

    /// Parse a literal into its tokens.
    /// @param raw the raw cell value
    /// @return the tokens in literal order, or empty when the value is not a parsable literal
    public Optional<List<String>> tokens(String raw) {
        if (!isBracketed(raw)) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        List<String> tokens = new ArrayList<>(node.size());
        if (node.isArray()) {
            for (JsonNode element : node) {
                tokens.add(tokenOf(element));
            }
        } else if (node.isObject()) {
            Iterator<String> names = node.fieldNames();
            names.forEachRemaining(tokens::add);
        } else {
            return Optional.empty();
        }
        return Optional.of(tokens);
    }

    private static String tokenOf(JsonNode element) {
        if (element.isTextual()) {
            return element.textValue();
        }
        if (element.isNull()) {
            return "null";
        }
        if (element.isContainerNode()) {
            return element.toString();
        }
        return element.asText();
    }
}
