package io.b2mash.yahrzeit.calendar;

import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists year tables outside the caller's transaction, so a failed snapshot write never rolls
 * back the sweep or request that triggered the lookup.
 */
@Service
public class CalendarSnapshotStore {

  private final CalendarYearSnapshotRepository repository;
  private final Clock clock;

  public CalendarSnapshotStore(CalendarYearSnapshotRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void store(HebrewYearTable table, String source) {
    repository.save(new CalendarYearSnapshot(table, source, clock.instant()));
  }

  @Transactional(readOnly = true)
  public Optional<CalendarYearSnapshot> find(int hebrewYear) {
    return repository.findById(hebrewYear);
  }
}
