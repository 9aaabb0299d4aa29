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

import io.tabstats.engine.InputNotFoundException;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared input option. Provides the required {@code -i/--input} CSV file.
 */
public class InputFileOption {

    /**
     * The CSV file a command reads.
     *
     * @param path the input file path (never null)
     */
    public record InputFile(Path path) {

        public InputFile {
            if (path == null) {
                throw new IllegalArgumentException("Input path cannot be null");
            }
        }

        /**
         * Checks if the input file exists as a regular file.
         */
        public boolean exists() {
            return Files.isRegularFile(path);
        }

        /**
         * Validates that the input file exists.
         *
         * @throws InputNotFoundException if it does not
         */
        public void validate() {
            if (!exists()) {
                throw new InputNotFoundException(path);
            }
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "<source.csv>",
        description = "The CSV file to read; the first row is the header",
        required = true
    )
    private Path inputPath;

    /**
     * Gets the InputFile record constructed from the options.
     */
    public InputFile getInputFile() {
        return new InputFile(inputPath);
    }

    /**
     * Gets the input file path.
     */
    public Path getInputPath() {
        return inputPath;
    }

    /**
     * Validates the input file exists.
     *
     * @throws InputNotFoundException if it does not
     */
    public void validate() {
        getInputFile().validate();
    }

    @Override
    public String toString() {
        return inputPath != null ? inputPath.toString() : "null";
    }
}
