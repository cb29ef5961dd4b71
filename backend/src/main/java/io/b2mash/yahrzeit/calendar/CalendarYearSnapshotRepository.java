package io.b2mash.yahrzeit.calendar;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CalendarYearSnapshotRepository
    extends JpaRepository<CalendarYearSnapshot, Integer> {}
