package io.b2mash.yahrzeit.schedule;

import io.b2mash.yahrzeit.exception.ResourceConflictException;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/schedule")
public class ScheduleController {

  private final AnniversarySweepScheduler sweepScheduler;
  private final Clock clock;

  public ScheduleController(AnniversarySweepScheduler sweepScheduler, Clock clock) {
    this.sweepScheduler = sweepScheduler;
    this.clock = clock;
  }

  /** Runs a sweep now, optionally as of another date. */
  @PostMapping("/sweep")
  public ResponseEntity<SweepResult> sweep(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate date) {
    LocalDate today = date != null ? date : LocalDate.now(clock);
    return sweepScheduler
        .runSweep(today)
        .map(ResponseEntity::ok)
        .orElseThrow(
            () -> new ResourceConflictException("Sweep running", "Another sweep is in progress"));
  }
}
