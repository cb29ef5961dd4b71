package io.b2mash.yahrzeit.notification;

/** What one worker did with one ledger entry. */
public enum DispatchOutcome {
  SENT,
  RETRY_SCHEDULED,
  FAILED,
  CANCELLED,
  /** Another worker claimed the entry first, or it changed state while this worker held it. */
  SKIPPED,
  ERROR
}
