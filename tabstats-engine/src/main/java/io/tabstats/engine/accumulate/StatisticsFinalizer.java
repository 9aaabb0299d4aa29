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

import io.tabstats.engine.result.FrequencyStatistics;
import io.tabstats.engine.result.NumericStatistics;
import io.tabstats.engine.result.TokenFrequency;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/// Turns accumulated state into reported statistics.
///
/// Numeric columns report the mean and the Bessel-corrected sample standard deviation,
/// computed from the power sums as `max(0, sumSq/n - mean²) * n/(n-1)`. The clamp absorbs
/// the small negative values that cancellation can produce for near-constant columns.
///
/// Discrete columns report their `topK` most frequent tokens, ties going to the token seen
/// first.
public final class StatisticsFinalizer {

    /// number of most common tokens reported by default
    public static final int DEFAULT_TOP_K = 5;

    private static final Comparator<TokenTally> RANKING =
        Comparator.comparingLong(TokenTally::getCount).reversed()
            .thenComparingLong(TokenTally::getIdx);

    private final int topK;

    /// create a finalizer reporting the default number of most common tokens
    public StatisticsFinalizer() {
        this(DEFAULT_TOP_K);
    }

    /// @param topK the number of most common tokens to report, at least 1
    public StatisticsFinalizer(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        this.topK = topK;
    }

    /// @param acc a numeric accumulator
    /// @return its moments, all zero when it counted nothing; min and max are zero when
    ///     every counted value was NaN
    public NumericStatistics finishNumeric(NumericAccumulator acc) {
        long count = acc.getCount();
        if (count == 0) {
            return NumericStatistics.EMPTY;
        }
        double mean = acc.getSum() / count;
        double stdev = 0.0;
        if (count > 1) {
            double variance = Math.max(0.0, acc.getSumOfSquares() / count - mean * mean);
            stdev = Math.sqrt(variance * ((double) count / (count - 1)));
        }
        boolean ranged = acc.getMin() <= acc.getMax();
        return new NumericStatistics(count, mean,
            ranged ? acc.getMin() : 0.0, ranged ? acc.getMax() : 0.0, stdev);
    }

    /// @param acc a categorical or list-valued accumulator
    /// @return its totals and most common tokens
    public FrequencyStatistics finishFrequency(FrequencyAccumulator acc) {
        return new FrequencyStatistics(acc.type(), acc.getTotalCount(), acc.getUniqueCount(), mostCommon(acc));
    }

    private List<TokenFrequency> mostCommon(FrequencyAccumulator acc) {
        // min-heap on the ranking, holding the best topK seen so far
        PriorityQueue<TokenTally> best = new PriorityQueue<>(topK + 1, RANKING.reversed());
        for (TokenTally tally : acc.getTallies()) {
            best.offer(tally);
            if (best.size() > topK) {
                best.poll();
            }
        }
        List<TokenTally> ranked = new ArrayList<>(best);
        ranked.sort(RANKING);
        List<TokenFrequency> result = new ArrayList<>(ranked.size());
        for (TokenTally tally : ranked) {
            result.add(new TokenFrequency(tally.getToken(), tally.getCount()));
        }
        return result;
    }
}
