package com.invoice.submission.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RequestedPeriodProviderTest {

    @Test
    void reportsThePreviousCalendarMonth() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

        assertThat(new RequestedPeriodProvider(clock).currentRequestedPeriod()).isEqualTo("SEPTEMBER 2026");
    }

    @Test
    void wrapsAroundTheYear() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-03T00:00:00Z"), ZoneOffset.UTC);

        assertThat(new RequestedPeriodProvider(clock).currentRequestedPeriod()).isEqualTo("DECEMBER 2024");
    }
}
