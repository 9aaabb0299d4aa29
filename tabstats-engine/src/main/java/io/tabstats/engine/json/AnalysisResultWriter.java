package io.tabstats.engine.json;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tabstats.engine.group.GroupKey;
import io.tabstats.engine.result.AnalysisMetadata;
import io.tabstats.engine.result.AnalysisResult;
import io.tabstats.engine.result.ColumnStatistics;
import io.tabstats.engine.result.FrequencyStatistics;
import io.tabstats.engine.result.NumericStatistics;
import io.tabstats.engine.result.TokenFrequency;
import io.tabstats.engine.types.ColumnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/// Serializes result trees as pretty-printed JSON.
///
/// Output layout:
///
/// ```json
/// {
///     "analysis_metadata": {"total_rows_processed": 3, "analysis_type": "grouped", "grouped_by": ["country"]},
///     "grouped_analysis": {
///         "('US',)": {
///             "spend": {"count": 2, "mean": 10.0, "min": 5.0, "max": 15.0, "stdev": 7.07},
///             "tag": {"count": 2, "unique_count": 1, "most_common": [["a", 2]]}
///         }
///     }
/// }
/// ```
///
/// An overall analysis writes `overall_analysis` with the columns directly beneath it.
/// Non-finite numbers, which JSON cannot represent, are written as the strings `NaN`,
/// `Infinity` and `-Infinity`.
public final class AnalysisResultWriter {

    private static final Logger logger = LogManager.getLogger(AnalysisResultWriter.class);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    /// create a writer with 4-space indentation
    public AnalysisResultWriter() {
        this.mapper = new ObjectMapper();
        DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                .withObjectEmptySeparator("")
                .withArrayEmptySeparator(""));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = mapper.writer(printer);
    }

    /// @param result a result tree
    /// @return the JSON document of the result
    public ObjectNode toJson(AnalysisResult result) {
        ObjectNode root = mapper.createObjectNode();
        AnalysisMetadata metadata = result.getMetadata();
        ObjectNode meta = root.putObject("analysis_metadata");
        meta.put("total_rows_processed", metadata.totalRowsProcessed());
        meta.put("analysis_type", metadata.analysisType());
        if (metadata.isGrouped()) {
            ArrayNode groupedBy = meta.putArray("grouped_by");
            metadata.groupedBy().forEach(groupedBy::add);
            ObjectNode grouped = root.putObject("grouped_analysis");
            result.getGroups().forEach((key, columns) -> putColumns(grouped.putObject(key.render()), columns));
        } else {
            putColumns(root.putObject("overall_analysis"), result.getGroup(GroupKey.EMPTY));
        }
        return root;
    }

    /// @param types detected column types in header order
    /// @return a JSON object mapping each column to its type label
    public ObjectNode toJson(Map<String, ColumnType> types) {
        ObjectNode node = mapper.createObjectNode();
        types.forEach((name, type) -> node.put(name, type.label()));
        return node;
    }

    /// @param result a result tree
    /// @return the pretty-printed JSON text
    /// @throws JsonProcessingException if serialization fails
    public String writeString(AnalysisResult result) throws JsonProcessingException {
        return writer.writeValueAsString(toJson(result));
    }

    /// @param types detected column types in header order
    /// @return the pretty-printed JSON text
    /// @throws JsonProcessingException if serialization fails
    public String writeString(Map<String, ColumnType> types) throws JsonProcessingException {
        return writer.writeValueAsString(toJson(types));
    }

    /// Write a result to a file, all or nothing.
    ///
    /// The document goes to a temporary file in the target directory first and is then
    /// moved over the target, so readers never see a partial document and a failed write
    /// leaves any previous file untouched.
    ///
    /// @param result a result tree
    /// @param target the destination file
    /// @throws IOException if the file cannot be written
    public void write(AnalysisResult result, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + absolute.getFileName() + ".", ".tmp");
        try {
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writer.writeValue(out, toJson(result));
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        logger.info("Analysis complete! Results saved to '{}'", target);
    }

    private void putColumns(ObjectNode parent, Map<String, ColumnStatistics> columns) {
        columns.forEach((name, stats) -> {
            ObjectNode node = parent.putObject(name);
            if (stats instanceof NumericStatistics numeric) {
                node.put("count", numeric.count());
                putNumber(node, "mean", numeric.mean());
                putNumber(node, "min", numeric.min());
                putNumber(node, "max", numeric.max());
                putNumber(node, "stdev", numeric.stdev());
            } else if (stats instanceof FrequencyStatistics frequency) {
                node.put("count", frequency.count());
                node.put("unique_count", frequency.uniqueCount());
                ArrayNode mostCommon = node.putArray("most_common");
                for (TokenFrequency entry : frequency.mostCommon()) {
                    mostCommon.addArray().add(entry.token()).add(entry.frequency());
                }
            }
        });
    }

    private static void putNumber(ObjectNode node, String field, double value) {
        if (Double.isFinite(value)) {
            node.put(field, value);
        } else if (Double.isNaN(value)) {
            node.put(field, "NaN");
        } else {
            node.put(field, value > 0 ? "Infinity" : "-Infinity");
        }
    }
}
