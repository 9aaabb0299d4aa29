package io.tabstats.engine.stream;

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

import io.tabstats.engine.TabStatsException;
import io.tabstats.engine.accumulate.ColumnAccumulators;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.group.ColumnLayout;
import io.tabstats.engine.result.AnalysisResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Scanner that accumulates chunks of rows on a thread pool and merges the partials.
///
/// ## Chunking
///
/// Rows are buffered into chunks of `chunkSize`. Each full chunk is handed to a worker,
/// which scans it with its own [StatsScanner] over the shared layout. Partial scanners
/// are folded into the result scanner strictly in chunk order, so token tie-break order
/// and group order come out exactly as in a sequential scan; only the floating point sums
/// may differ in their last bits.
///
/// ```
///   rows ──> [chunk 0] ──> worker ──> partial 0 ─┐
///            [chunk 1] ──> worker ──> partial 1 ─┼──> fold in order ──> complete()
///            [chunk 2] ──> worker ──> partial 2 ─┘
/// ```
///
/// At most `2 × threads` chunks are in flight; beyond that the oldest is awaited and
/// folded before the next one is submitted, which bounds buffered rows.
///
/// A failure inside a worker surfaces from the next fold as its original runtime
/// exception, or wrapped in a [TabStatsException].
public final class ParallelStatsScanner implements RowScanner {

    private static final Logger logger = LogManager.getLogger(ParallelStatsScanner.class);

    private final ColumnAccumulators factory;
    private final StatisticsFinalizer finalizer;
    private final int threads;
    private final int chunkSize;
    private final Deque<Future<StatsScanner>> inFlight = new ArrayDeque<>();
    private final StatsScanner merged;

    private ExecutorService executor;
    private ColumnLayout layout;
    private List<String[]> chunk;
    private int chunksSubmitted = 0;

    /// @param factory creates the accumulators of new groups
    /// @param finalizer turns accumulators into statistics on completion
    /// @param threads number of worker threads, at least 1
    /// @param chunkSize rows per chunk, at least 1
    public ParallelStatsScanner(ColumnAccumulators factory, StatisticsFinalizer finalizer, int threads, int chunkSize) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.factory = factory;
        this.finalizer = finalizer;
        this.threads = threads;
        this.chunkSize = chunkSize;
        this.merged = new StatsScanner(factory, finalizer);
    }

    @Override
    public void initialize(ColumnLayout layout) {
        merged.initialize(layout);
        this.layout = layout;
        this.chunk = new ArrayList<>(chunkSize);
        this.executor = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        logger.debug("Scanning with {} thread(s), {} rows per chunk", threads, chunkSize);
    }

    @Override
    public void accept(String[] row) {
        ScanState state = merged.getState();
        if (state != ScanState.TYPES_DETECTED && state != ScanState.ACCUMULATING) {
            throw new IllegalStateException("Cannot accept rows in state " + state);
        }
        chunk.add(row);
        if (chunk.size() >= chunkSize) {
            submitChunk();
        }
    }

    private void submitChunk() {
        List<String[]> rows = chunk;
        chunk = new ArrayList<>(chunkSize);
        ColumnLayout shared = layout;
        inFlight.addLast(executor.submit(() -> {
            StatsScanner partial = new StatsScanner(factory, finalizer);
            partial.initialize(shared);
            for (String[] row : rows) {
                partial.accept(row);
            }
            return partial;
        }));
        chunksSubmitted++;
        while (inFlight.size() > 2 * threads) {
            foldOldest();
        }
    }

    private void foldOldest() {
        Future<StatsScanner> future = inFlight.removeFirst();
        try {
            merged.combine(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TabStatsException("Interrupted while waiting for a chunk to be scanned", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TabStatsException("Chunk scan failed: " + e.getCause(), e.getCause());
        }
    }

    @Override
    public AnalysisResult complete() {
        ScanState state = merged.getState();
        if (state != ScanState.TYPES_DETECTED && state != ScanState.ACCUMULATING) {
            throw new IllegalStateException("Cannot complete in state " + state);
        }
        try {
            if (!chunk.isEmpty()) {
                submitChunk();
            }
            while (!inFlight.isEmpty()) {
                foldOldest();
            }
            logger.debug("Folded {} chunk(s)", chunksSubmitted);
            return merged.complete();
        } finally {
            close();
        }
    }

    @Override
    public ScanState getState() {
        return merged.getState();
    }

    @Override
    public long getRowsSkipped() {
        return merged.getRowsSkipped();
    }

    /// Cancels chunks still in flight and stops the worker threads.
    @Override
    public void close() {
        for (Future<StatsScanner> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "tabstats-scan-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
