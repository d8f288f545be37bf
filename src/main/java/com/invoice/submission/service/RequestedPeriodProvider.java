package com.invoice.submission.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Default "Requested month" for the form header: the calendar month before today,
 * e.g. "SEPTEMBER 2026" during October 2026.
 */
@Component
public class RequestedPeriodProvider {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private final Clock clock;

    public RequestedPeriodProvider(Clock clock) {
        this.clock = clock;
    }

    public String currentRequestedPeriod() {
        return LocalDate.now(clock).minusMonths(1).format(FORMAT).toUpperCase(Locale.ENGLISH);
    }
}
