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
import picocli.CommandLine;

/**
 * Shared parallel scanning options. Provides {@code -p/--parallel}, {@code --threads} and
 * {@code --chunk-size}.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Scan in parallel (auto-sizes based on available CPU cores)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of scanner threads (default: 1, or all cores but one with --parallel)"
    )
    private Integer explicitThreads;

    @CommandLine.Option(
        names = {"--chunk-size"},
        paramLabel = "<rows>",
        description = "Rows per chunk when scanning in parallel (default: ${DEFAULT-VALUE})",
        defaultValue = "" + AnalysisConfig.DEFAULT_CHUNK_SIZE
    )
    private int chunkSize = AnalysisConfig.DEFAULT_CHUNK_SIZE;

    public boolean isParallel() {
        return parallel;
    }

    /**
     * @return the thread count, or null if auto-detect should be used
     */
    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Calculates the thread count. Auto-detection leaves one core free.
     *
     * @return the thread count, 1 for a sequential scan
     */
    public int getOptimalThreadCount() {
        if (explicitThreads != null) {
            return explicitThreads;
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        } else {
            return 1;
        }
    }

    /**
     * Checks if the user explicitly specified more threads than available cores.
     *
     * @return true if thread count exceeds available cores
     */
    public boolean exceedsAvailableCores() {
        return explicitThreads != null && explicitThreads > Runtime.getRuntime().availableProcessors();
    }
}
