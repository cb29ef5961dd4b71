package io.b2mash.yahrzeit.notification;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Exponential backoff: {@code base * 2^(attempt-1)}, capped, then spread by a random jitter. */
@Component
public class RetryBackoffPolicy {

  private static final Duration MIN_DELAY = Duration.ofSeconds(1);

  private final Duration base;
  private final Duration cap;
  private final double jitter;
  private final DoubleSupplier random;

  @Autowired
  public RetryBackoffPolicy(DispatchProperties properties) {
    this(
        properties.backoffBase(),
        properties.backoffCap(),
        properties.backoffJitter(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  RetryBackoffPolicy(Duration base, Duration cap, double jitter, DoubleSupplier random) {
    this.base = base;
    this.cap = cap;
    this.jitter = jitter;
    this.random = random;
  }

  /** Delay before the attempt following failed attempt number {@code attempt} (1-based). */
  public Duration delayAfter(int attempt) {
    int exponent = Math.max(0, attempt - 1);
    long capMillis = cap.toMillis();
    long delayMillis =
        exponent >= 31 ? capMillis : Math.min(capMillis, base.toMillis() * (1L << exponent));
    // random() in [0, 1) maps to a factor in [1 - jitter, 1 + jitter)
    double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
    long jittered = Math.round(delayMillis * factor);
    return Duration.ofMillis(Math.max(MIN_DELAY.toMillis(), jittered));
  }
}
