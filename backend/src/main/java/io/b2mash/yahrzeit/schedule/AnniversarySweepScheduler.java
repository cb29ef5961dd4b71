package io.b2mash.yahrzeit.schedule;

import io.b2mash.yahrzeit.calendar.DateComputationException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the anniversary sweep once a day. A run is skipped when another one is in progress, in this
 * process or on another instance. Each subject is processed independently: a subject whose dates
 * cannot be computed is flagged stale and keeps its stored occurrence, and a temporary failure
 * leaves it for the next run.
 */
@Component
public class AnniversarySweepScheduler {

  private static final Logger log = LoggerFactory.getLogger(AnniversarySweepScheduler.class);

  static final String JOB_NAME = "anniversary-sweep";

  private final AnniversarySweepService sweepService;
  private final JobLockService jobLockService;
  private final SchedulerProperties properties;
  private final Clock clock;
  private final ReentrantLock runLock = new ReentrantLock();

  public AnniversarySweepScheduler(
      AnniversarySweepService sweepService,
      JobLockService jobLockService,
      SchedulerProperties properties,
      Clock clock) {
    this.sweepService = sweepService;
    this.jobLockService = jobLockService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${yahrzeit.schedule.cron:0 15 0 * * *}", zone = "${yahrzeit.zone:UTC}")
  public void scheduledSweep() {
    runSweep(LocalDate.now(clock))
        .ifPresentOrElse(
            result -> log.debug("Scheduled sweep finished: {}", result),
            () -> log.info("Scheduled sweep skipped; another sweep is running"));
  }

  /** Runs one sweep for {@code today}; empty when another sweep holds the run-lock. */
  public Optional<SweepResult> runSweep(LocalDate today) {
    if (!runLock.tryLock()) {
      return Optional.empty();
    }
    try {
      if (!jobLockService.tryAcquire(JOB_NAME, properties.lockLease())) {
        return Optional.empty();
      }
      try {
        return Optional.of(sweep(today));
      } finally {
        jobLockService.release(JOB_NAME);
      }
    } finally {
      runLock.unlock();
    }
  }

  private SweepResult sweep(LocalDate today) {
    log.info("Anniversary sweep started for {}", today);
    var subjectIds = sweepService.findSubjectsDue(today);
    int created = 0;
    int rolledOver = 0;
    int failed = 0;

    for (var subjectId : subjectIds) {
      try {
        var stored = sweepService.sweepStoredOccurrence(subjectId, today);
        created += stored.entriesCreated();
        if (stored.rolloverDue()) {
          var outcome = sweepService.rollOver(subjectId, today);
          created += outcome.entriesCreated();
          if (outcome.rolledOver()) {
            rolledOver++;
          }
        }
      } catch (DateComputationException | DataAccessException e) {
        failed++;
        log.warn("Subject {} left for the next sweep: {}", subjectId, e.getMessage());
      } catch (RuntimeException e) {
        failed++;
        log.error("Failed to sweep subject {}", subjectId, e);
        markStale(subjectId, e);
      }
    }

    var result = new SweepResult(today, subjectIds.size(), created, rolledOver, failed);
    log.info(
        "Anniversary sweep completed for {}: {} subjects scanned, {} entries created,"
            + " {} rolled over, {} failed",
        today,
        result.subjectsScanned(),
        result.entriesCreated(),
        result.rolledOver(),
        result.failed());
    return result;
  }

  private void markStale(UUID subjectId, RuntimeException cause) {
    try {
      sweepService.markStale(subjectId, cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Could not mark subject {} stale", subjectId, e);
    }
  }
}
