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

import io.tabstats.engine.AnalysisConfig;
import io.tabstats.engine.types.ColumnTypeDetector;
import picocli.CommandLine;

/**
 * Shared options controlling how the CSV is read and how column types are detected.
 */
public class DetectionOption {

    @CommandLine.Option(
        names = {"--sample-size"},
        paramLabel = "<rows>",
        description = "Leading data rows used to detect column types (default: ${DEFAULT-VALUE})",
        defaultValue = "" + ColumnTypeDetector.DEFAULT_SAMPLE_SIZE
    )
    private int sampleSize = ColumnTypeDetector.DEFAULT_SAMPLE_SIZE;

    @CommandLine.Option(
        names = {"--threshold"},
        paramLabel = "<ratio>",
        description = "Share of non-empty sample values that must parse for a column to be "
            + "numeric or list-valued (default: ${DEFAULT-VALUE})",
        defaultValue = "" + ColumnTypeDetector.DEFAULT_THRESHOLD
    )
    private double threshold = ColumnTypeDetector.DEFAULT_THRESHOLD;

    @CommandLine.Option(
        names = {"--delimiter"},
        paramLabel = "<char>",
        description = "Column separator, a single character or 'tab' (default: ${DEFAULT-VALUE})",
        defaultValue = ","
    )
    private String delimiter = ",";

    /**
     * @return the column separator
     * @throws IllegalArgumentException if the option is not a single character
     */
    public char getDelimiter() {
        if ("tab".equalsIgnoreCase(delimiter) || "\\t".equals(delimiter)) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }

    /**
     * Copy these options into a configuration builder.
     *
     * @param builder the builder to fill
     * @return the same builder
     */
    public AnalysisConfig.Builder applyTo(AnalysisConfig.Builder builder) {
        return builder.sampleSize(sampleSize).threshold(threshold).delimiter(getDelimiter());
    }
}
