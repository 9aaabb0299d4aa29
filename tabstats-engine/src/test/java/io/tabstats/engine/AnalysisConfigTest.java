package io.tabstats.engine;

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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisConfigTest {

    @Test
    void defaultsDescribeASequentialOverallRun() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.isGrouped()).isFalse();
        assertThat(config.isParallel()).isFalse();
        assertThat(config.sampleSize()).isEqualTo(100);
        assertThat(config.threshold()).isEqualTo(0.8);
        assertThat(config.topK()).isEqualTo(5);
        assertThat(config.chunkSize()).isEqualTo(AnalysisConfig.DEFAULT_CHUNK_SIZE);
        assertThat(config.rowLimit()).isZero();
        assertThat(config.delimiter()).isEqualTo(',');
    }

    @Test
    void copiesGroupColumns() {
        List<String> groupBy = new ArrayList<>(List.of("country"));
        AnalysisConfig config = AnalysisConfig.builder().groupBy(groupBy).threads(4).build();
        groupBy.add("state");

        assertThat(config.groupBy()).containsExactly("country");
        assertThat(config.isGrouped()).isTrue();
        assertThat(config.isParallel()).isTrue();
    }

    @Test
    void rejectsOutOfRangeSettings() {
        assertThatThrownBy(() -> AnalysisConfig.builder().sampleSize(0).build())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("sampleSize");
        assertThatThrownBy(() -> AnalysisConfig.builder().threshold(1.5).build())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("threshold");
        assertThatThrownBy(() -> AnalysisConfig.builder().threshold(0.0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().topK(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().threads(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().rowLimit(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
