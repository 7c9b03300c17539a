package com.walkerbrain.portal.global.common.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class TimeConfigTest {

    @Test
    void defaultClockRunsInUtc() {
        Clock clock = TimeConfig.clockFor("");

        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void pinnedClockNeverMoves() {
        Clock clock = TimeConfig.clockFor(" 2025-03-01T09:00:00Z ");

        assertThat(clock.instant()).isEqualTo(Instant.parse("2025-03-01T09:00:00Z"));
        assertThat(clock.instant()).isEqualTo(clock.instant());
    }
}
