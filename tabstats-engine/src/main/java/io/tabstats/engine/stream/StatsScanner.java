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

import io.tabstats.engine.accumulate.ColumnAccumulator;
import io.tabstats.engine.accumulate.ColumnAccumulators;
import io.tabstats.engine.accumulate.ListValuedAccumulator;
import io.tabstats.engine.accumulate.StatisticsFinalizer;
import io.tabstats.engine.group.ColumnLayout;
import io.tabstats.engine.group.GroupAccumulators;
import io.tabstats.engine.group.GroupKey;
import io.tabstats.engine.group.GroupRouter;
import io.tabstats.engine.result.AnalysisMetadata;
import io.tabstats.engine.result.AnalysisResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Sequential, single-pass scanner.
///
/// Each accepted row is routed to the accumulators of its group and every non-empty
/// measured value is ingested. An ungrouped scan routes everything to the implicit
/// [GroupKey#EMPTY] group, which is created up front so that even an empty table reports
/// every measured column.
///
/// Two scanners over the same layout can be merged with [#combine(StatsScanner)]; the
/// parallel scanner relies on this to fold chunk results.
///
/// Not thread-safe.
public final class StatsScanner implements RowScanner {

    private static final Logger logger = LogManager.getLogger(StatsScanner.class);

    private final ColumnAccumulators factory;
    private final StatisticsFinalizer finalizer;

    private ScanState state = ScanState.UNINITIALIZED;
    private ColumnLayout layout;
    private GroupRouter router;
    private long rowsProcessed = 0;
    private long rowsSkipped = 0;

    /// @param factory creates the accumulators of new groups
    /// @param finalizer turns accumulators into statistics on completion
    public StatsScanner(ColumnAccumulators factory, StatisticsFinalizer finalizer) {
        this.factory = factory;
        this.finalizer = finalizer;
    }

    @Override
    public void initialize(ColumnLayout layout) {
        requireState(ScanState.UNINITIALIZED, "initialize");
        this.layout = layout;
        this.router = new GroupRouter(layout, factory);
        if (!layout.isGrouped()) {
            router.route(GroupKey.EMPTY);
        }
        state = ScanState.TYPES_DETECTED;
    }

    @Override
    public void accept(String[] row) {
        if (state != ScanState.TYPES_DETECTED && state != ScanState.ACCUMULATING) {
            throw new IllegalStateException("Cannot accept rows in state " + state);
        }
        state = ScanState.ACCUMULATING;
        if (row.length < layout.width()) {
            rowsSkipped++;
            return;
        }
        router.route(layout.keyOf(row)).ingest(row);
        rowsProcessed++;
    }

    /// Fold a scanner over a later part of the same table into this one.
    ///
    /// Afterwards this scanner holds what it would hold had it accepted the other
    /// scanner's rows after its own. The other scanner is finalized without a result and
    /// must not be used again.
    ///
    /// @param other a scanner initialized with the same layout
    public void combine(StatsScanner other) {
        if (state == ScanState.UNINITIALIZED || state == ScanState.FINALIZED) {
            throw new IllegalStateException("Cannot combine into a scanner in state " + state);
        }
        if (other.state == ScanState.UNINITIALIZED || other.state == ScanState.FINALIZED) {
            throw new IllegalStateException("Cannot combine from a scanner in state " + other.state);
        }
        if (other.layout != layout) {
            throw new IllegalArgumentException("Cannot combine scanners over different layouts");
        }
        router.combine(other.router);
        rowsProcessed += other.rowsProcessed;
        rowsSkipped += other.rowsSkipped;
        if (other.state == ScanState.ACCUMULATING) {
            state = ScanState.ACCUMULATING;
        }
        other.state = ScanState.FINALIZED;
    }

    @Override
    public AnalysisResult complete() {
        if (state != ScanState.TYPES_DETECTED && state != ScanState.ACCUMULATING) {
            throw new IllegalStateException("Cannot complete in state " + state);
        }
        state = ScanState.FINALIZED;
        logger.info("Data processing complete: {} rows processed, {} malformed rows skipped, {} group(s)",
            rowsProcessed, rowsSkipped, router.size());
        if (logger.isDebugEnabled()) {
            logger.debug("{} list value(s) did not parse and were counted whole", listFallbacks());
        }
        AnalysisMetadata metadata = new AnalysisMetadata(rowsProcessed, layout.getGroupBy());
        return new AnalysisResult(metadata, router.finish(finalizer));
    }

    private long listFallbacks() {
        long fallbacks = 0;
        for (GroupAccumulators group : router.getGroups().values()) {
            for (ColumnLayout.MeasuredColumn column : layout.getMeasured()) {
                ColumnAccumulator acc = group.get(column.name());
                if (acc instanceof ListValuedAccumulator list) {
                    fallbacks += list.getFallbackCount();
                }
            }
        }
        return fallbacks;
    }

    private void requireState(ScanState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " in state " + state);
        }
    }

    @Override
    public ScanState getState() {
        return state;
    }

    @Override
    public long getRowsSkipped() {
        return rowsSkipped;
    }
}
