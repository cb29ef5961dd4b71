package io.b2mash.yahrzeit.schedule;

import java.time.LocalDate;

/** Totals of one sweep run. */
public record SweepResult(
    LocalDate sweepDate, int subjectsScanned, int entriesCreated, int rolledOver, int failed) {}
