package io.b2mash.yahrzeit.ledger;

import io.b2mash.yahrzeit.exception.InvalidStateException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a ledger entry. Every persisted transition is a compare-and-set on the current
 * status, so the allowed edges below are the only ones any query ever performs.
 */
public enum LedgerStatus {
  /** Created by the sweep; waiting for {@code scheduledFor}. */
  PENDING,
  /** Eligible for dispatch once {@code nextRetryAt} (if set) has passed. */
  DUE,
  /** Claimed by one dispatch worker; recovered back to DUE if the claim goes stale. */
  IN_FLIGHT,
  /** Accepted by the channel. Terminal. */
  SENT,
  /** Permanently rejected or out of attempts. Terminal. */
  FAILED,
  /** Subject deleted or recipient no longer eligible before sending. Terminal. */
  CANCELLED;

  private static final Set<LedgerStatus> NON_TERMINAL = EnumSet.of(PENDING, DUE, IN_FLIGHT);
  private static final Set<LedgerStatus> UNCLAIMED = EnumSet.of(PENDING, DUE);

  public boolean isTerminal() {
    return !NON_TERMINAL.contains(this);
  }

  public boolean canTransitionTo(LedgerStatus target) {
    return switch (this) {
      case PENDING -> target == DUE || target == CANCELLED;
      case DUE -> target == IN_FLIGHT || target == CANCELLED;
      case IN_FLIGHT -> target == SENT || target == FAILED || target == DUE || target == CANCELLED;
      case SENT, FAILED, CANCELLED -> false;
    };
  }

  public void requireTransitionTo(LedgerStatus target) {
    if (!canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid ledger transition", "Cannot move a ledger entry from " + this + " to " + target);
    }
  }

  /**
   * Statuses that bulk cancellation may touch. An IN_FLIGHT entry belongs to the worker sending it,
   * which settles it as sent, failed or cancelled.
   */
  public static Set<LedgerStatus> unclaimed() {
    return EnumSet.copyOf(UNCLAIMED);
  }
}
