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

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared output option. Provides the required {@code -o/--output} JSON file and the
 * {@code -f/--force} overwrite flag.
 */
public class OutputFileOption {

    /**
     * The JSON file a command writes, with its overwrite permission.
     *
     * @param path  the output file path (never null)
     * @param force whether an existing file may be replaced
     */
    public record OutputFile(Path path, boolean force) {

        public OutputFile {
            if (path == null) {
                throw new IllegalArgumentException("Output path cannot be null");
            }
        }

        /**
         * Checks if the output file exists and force is not set.
         */
        public boolean existsWithoutForce() {
            return Files.exists(path) && !force;
        }

        @Override
        public String toString() {
            return force ? path + " (force)" : path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "<dest.json>",
        description = "The JSON file to write the statistics to",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Replace the output file if it already exists"
    )
    private boolean force = false;

    /**
     * Gets the OutputFile record constructed from the options.
     */
    public OutputFile getOutputFile() {
        return new OutputFile(outputPath, force);
    }

    /**
     * Gets the output file path.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * Validates the output file, checking for existence without force flag.
     *
     * @throws IllegalStateException if the file exists and force is not set
     */
    public void validate() {
        if (getOutputFile().existsWithoutForce()) {
            throw new IllegalStateException(
                "Output file already exists: " + outputPath + ". Use --force to overwrite."
            );
        }
    }

    @Override
    public String toString() {
        return getOutputFile().toString();
    }
}
