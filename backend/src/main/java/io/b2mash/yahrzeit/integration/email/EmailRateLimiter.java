package io.b2mash.yahrzeit.integration.email;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Hourly send budget for email: a per-address limit and an aggregate limit per provider. Counters
 * live in Caffeine and expire an hour after their first write.
 */
@Service
public class EmailRateLimiter {

  private final int perAddressLimit;
  private final int aggregateLimit;
  private final Cache<String, AtomicInteger> addressCounters;
  private final Cache<String, AtomicInteger> aggregateCounters;

  @Autowired
  public EmailRateLimiter(
      @Value("${yahrzeit.email.rate-limit.per-address:10}") int perAddressLimit,
      @Value("${yahrzeit.email.rate-limit.aggregate:2000}") int aggregateLimit) {
    this(perAddressLimit, aggregateLimit, Ticker.systemTicker());
  }

  EmailRateLimiter(int perAddressLimit, int aggregateLimit, Ticker ticker) {
    this.perAddressLimit = perAddressLimit;
    this.aggregateLimit = aggregateLimit;
    this.addressCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10_000)
            .ticker(ticker)
            .build();
    this.aggregateCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(10)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(String address, String providerId) {
    var addressCounter =
        addressCounters.get(providerId + ":" + address, k -> new AtomicInteger(0));
    if (addressCounter.incrementAndGet() > perAddressLimit) {
      addressCounter.decrementAndGet();
      return false;
    }

    var aggregate = aggregateCounters.get(providerId, k -> new AtomicInteger(0));
    if (aggregate.incrementAndGet() > aggregateLimit) {
      aggregate.decrementAndGet();
      addressCounter.decrementAndGet();
      return false;
    }
    return true;
  }
}
