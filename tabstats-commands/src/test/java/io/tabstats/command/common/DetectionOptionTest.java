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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DetectionOption")
class DetectionOptionTest {

    @CommandLine.Command(name = "test")
    static class TestCommand {
        @CommandLine.Mixin
        DetectionOption detectionOption = new DetectionOption();
    }

    private static DetectionOption parse(String... args) {
        TestCommand command = new TestCommand();
        new CommandLine(command).parseArgs(args);
        return command.detectionOption;
    }

    @Test
    @DisplayName("should default to the detector defaults")
    void defaults() {
        AnalysisConfig config = parse().applyTo(AnalysisConfig.builder()).build();

        assertThat(config.sampleSize()).isEqualTo(100);
        assertThat(config.threshold()).isEqualTo(0.8);
        assertThat(config.delimiter()).isEqualTo(',');
    }

    @Test
    @DisplayName("should accept named and single character delimiters")
    void delimiters() {
        assertThat(parse("--delimiter", "tab").getDelimiter()).isEqualTo('\t');
        assertThat(parse("--delimiter", "TAB").getDelimiter()).isEqualTo('\t');
        assertThat(parse("--delimiter", "\\t").getDelimiter()).isEqualTo('\t');
        assertThat(parse("--delimiter", ";").getDelimiter()).isEqualTo(';');
        assertThat(parse("--delimiter", "|").getDelimiter()).isEqualTo('|');
    }

    @Test
    @DisplayName("should reject multi character delimiters")
    void rejectsLongDelimiter() {
        DetectionOption option = parse("--delimiter", "::");

        assertThatThrownBy(option::getDelimiter).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should carry sample size and threshold")
    void carriesValues() {
        AnalysisConfig config = parse("--sample-size", "7", "--threshold", "0.5")
            .applyTo(AnalysisConfig.builder()).build();

        assertThat(config.sampleSize()).isEqualTo(7);
        assertThat(config.threshold()).isEqualTo(0.5);
    }
}
