package io.tabstats.engine.accumulate;

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

import io.tabstats.engine.result.ColumnStatistics;
import io.tabstats.engine.types.ColumnType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Token frequency table of a categorical column.
///
/// Every raw value is one token. Tokens remember the order in which they were first
/// seen; the finalizer uses it to break frequency ties, which keeps `most_common`
/// deterministic.
///
/// The table holds one entry per distinct token, so memory grows with the cardinality of
/// the column (times the number of groups). There is no cap.
public class FrequencyAccumulator implements ColumnAccumulator {

    private final ColumnType type;
    private final Map<String, TokenTally> tallies = new LinkedHashMap<>();
    private long total = 0;

    /// create an accumulator for a categorical column
    public FrequencyAccumulator() {
        this(ColumnType.CATEGORICAL);
    }

    /// @param type the discrete column type this table counts for
    protected FrequencyAccumulator(ColumnType type) {
        if (!type.isDiscrete()) {
            throw new IllegalArgumentException("Frequency tables only count discrete columns, not " + type.label());
        }
        this.type = type;
    }

    @Override
    public ColumnType type() {
        return type;
    }

    @Override
    public void ingest(String rawValue) {
        increment(rawValue, 1);
    }

    /// Count a token.
    /// @param token the token
    /// @param amount how many occurrences to add
    protected final void increment(String token, long amount) {
        tallies.computeIfAbsent(token, t -> new TokenTally(t, tallies.size())).add(amount);
        total += amount;
    }

    @Override
    public void combine(ColumnAccumulator other) {
        if (!(other instanceof FrequencyAccumulator frequency) || other.type() != type) {
            throw new IllegalArgumentException(
                "Cannot combine a " + type.label() + " accumulator with a " + other.type().label() + " one");
        }
        for (TokenTally tally : frequency.tallies.values()) {
            increment(tally.getToken(), tally.getCount());
        }
    }

    @Override
    public ColumnStatistics finish(StatisticsFinalizer finalizer) {
        return finalizer.finishFrequency(this);
    }

    /// @return the total number of tokens counted
    public long getTotalCount() {
        return total;
    }

    /// @return the number of distinct tokens
    public int getUniqueCount() {
        return tallies.size();
    }

    /// @param token a token
    /// @return how often it was counted, 0 if never
    public long getCount(String token) {
        TokenTally tally = tallies.get(token);
        return tally == null ? 0 : tally.getCount();
    }

    /// @return all tallies in first-seen order
    public Collection<TokenTally> getTallies() {
        return Collections.unmodifiableCollection(tallies.values());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type.label() + ", total=" + total + ", unique=" + tallies.size() + "]";
    }
}
