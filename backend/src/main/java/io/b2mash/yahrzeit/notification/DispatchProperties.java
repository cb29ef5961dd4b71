package io.b2mash.yahrzeit.notification;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Dispatcher settings. The poll interval is read directly by the scheduled method from {@code
 * yahrzeit.dispatch.poll-interval-ms}.
 *
 * @param workers size of the worker pool
 * @param batchSize most entries fetched per poll
 * @param maxAttempts attempts after which a retryable failure becomes terminal
 * @param inFlightTimeout age after which an unfinished claim is considered abandoned
 * @param backoffBase delay before the second attempt
 * @param backoffCap longest delay between attempts
 * @param backoffJitter relative jitter applied to each delay, between 0 and 1
 */
@ConfigurationProperties(prefix = "yahrzeit.dispatch")
public record DispatchProperties(
    Integer workers,
    Integer batchSize,
    Integer maxAttempts,
    Duration inFlightTimeout,
    Duration backoffBase,
    Duration backoffCap,
    Double backoffJitter) {

  public DispatchProperties {
    if (workers == null) {
      workers = 4;
    }
    if (batchSize == null) {
      batchSize = 50;
    }
    if (maxAttempts == null) {
      maxAttempts = 5;
    }
    if (inFlightTimeout == null) {
      inFlightTimeout = Duration.ofMinutes(10);
    }
    if (backoffBase == null) {
      backoffBase = Duration.ofMinutes(5);
    }
    if (backoffCap == null) {
      backoffCap = Duration.ofHours(2);
    }
    if (backoffJitter == null) {
      backoffJitter = 0.2;
    }
    if (workers < 1 || batchSize < 1 || maxAttempts < 1) {
      throw new IllegalArgumentException("Dispatch workers, batch size and attempts must be > 0");
    }
    if (backoffJitter < 0 || backoffJitter > 1) {
      throw new IllegalArgumentException("Backoff jitter must be between 0 and 1");
    }
  }
}
