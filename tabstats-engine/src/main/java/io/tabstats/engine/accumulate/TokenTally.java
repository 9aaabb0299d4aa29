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

/// Count of a single token, plus the ordinal at which the token was first seen.
public final class TokenTally {

    private final String token;
    private final long idx;
    private long count;

    /// @param token the token
    /// @param idx the first-insertion ordinal of the token within its accumulator
    TokenTally(String token, long idx) {
        this.token = token;
        this.idx = idx;
    }

    /// @return the token
    public String getToken() {
        return token;
    }

    /// @return the first-insertion ordinal, lower is earlier
    public long getIdx() {
        return idx;
    }

    /// @return how often the token was counted
    public long getCount() {
        return count;
    }

    void add(long amount) {
        this.count += amount;
    }
}
