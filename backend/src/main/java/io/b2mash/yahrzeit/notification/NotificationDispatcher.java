package io.b2mash.yahrzeit.notification;

import io.b2mash.yahrzeit.ledger.LedgerService;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains due ledger entries. Each poll promotes entries whose send time has come, recovers
 * abandoned claims, then hands a batch of due entries to the worker pool and waits for it. Retries
 * are picked up by a later poll once their {@code next_retry_at} has passed.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final LedgerService ledgerService;
  private final LedgerEntryProcessor processor;
  private final DispatchProperties properties;
  private final Executor dispatchExecutor;
  private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

  public NotificationDispatcher(
      LedgerService ledgerService,
      LedgerEntryProcessor processor,
      DispatchProperties properties,
      @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
    this.ledgerService = ledgerService;
    this.processor = processor;
    this.properties = properties;
    this.dispatchExecutor = dispatchExecutor;
  }

  @Scheduled(
      fixedDelayString = "${yahrzeit.dispatch.poll-interval-ms:30000}",
      initialDelayString = "${yahrzeit.dispatch.initial-delay-ms:10000}")
  public void poll() {
    try {
      dispatchDue();
    } catch (RuntimeException e) {
      log.error("Dispatch poll failed", e);
    }
  }

  public DispatchSummary dispatchDue() {
    int promoted = ledgerService.promoteDue();
    var recovery =
        ledgerService.recoverStaleClaims(properties.inFlightTimeout(), properties.maxAttempts());
    var ids = ledgerService.findDispatchableIds(properties.batchSize());

    var futures = new ArrayList<CompletableFuture<DispatchOutcome>>(ids.size());
    for (var id : ids) {
      futures.add(
          CompletableFuture.supplyAsync(
                  () -> processor.process(id, workerId()), dispatchExecutor)
              .exceptionally(
                  e -> {
                    log.error("Worker failed for ledger entry {}", id, e);
                    return DispatchOutcome.ERROR;
                  }));
    }

    Map<DispatchOutcome, Integer> outcomes = new EnumMap<>(DispatchOutcome.class);
    for (var future : futures) {
      outcomes.merge(future.join(), 1, Integer::sum);
    }

    var summary = new DispatchSummary(promoted, recovery.requeued(), ids.size(), outcomes);
    if (!ids.isEmpty() || promoted > 0) {
      log.info(
          "Dispatch poll: {} promoted, {} requeued, {} dispatched, outcomes {}",
          promoted,
          recovery.requeued(),
          ids.size(),
          outcomes);
    }
    return summary;
  }

  private String workerId() {
    return instanceId + "/" + Thread.currentThread().getName();
  }

  public record DispatchSummary(
      int promoted, int requeued, int dispatched, Map<DispatchOutcome, Integer> outcomes) {

    public int count(DispatchOutcome outcome) {
      return outcomes.getOrDefault(outcome, 0);
    }
  }
}
