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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags, mapped onto the
 * root log level.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug detail, including per-column detection results"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log warnings and errors only"
    )
    private boolean quiet = false;

    /**
     * @return the root log level these flags select, or null to keep the configured one
     */
    public Level getLogLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.WARN;
        }
        return null;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * Validate the flags and set the root log level they select.
     */
    public void apply() {
        validate();
        Level level = getLogLevel();
        if (level != null) {
            Configurator.setRootLevel(level);
        }
    }
}
