package com.linlay.archinsight.runtime;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RunIdGeneratorTest {

    @Test
    void encodeShouldUseBase36TimestampAndPaddedSequence() {
        assertThat(RunIdGenerator.encode(35L, 0)).isEqualTo("insight_z00");
        assertThat(RunIdGenerator.encode(36L, 35)).isEqualTo("insight_100z");
        assertThat(RunIdGenerator.encode(1700000000000L, 1296))
                .isEqualTo("insight_" + Long.toString(1700000000000L, 36) + "00");
    }

    @Test
    void nextRunIdShouldBeUniqueWithinBurst() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            ids.add(RunIdGenerator.nextRunId());
        }
        assertThat(ids).hasSize(500);
        assertThat(ids).allMatch(id -> id.matches("^insight_[0-9a-z]+$"));
    }
}
