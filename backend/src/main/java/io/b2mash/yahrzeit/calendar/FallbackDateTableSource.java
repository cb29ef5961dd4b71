package io.b2mash.yahrzeit.calendar;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Caching front for the live {@link DateTableSource}. Fresh tables are cached in memory and
 * persisted as last-known-good snapshots. When the live source fails, the persisted snapshot for
 * the same year is served with a staleness warning; if there is none the failure surfaces as {@link
 * DateComputationException}. Tables for a different year are never substituted.
 */
public class FallbackDateTableSource implements DateTableSource {

  private static final Logger log = LoggerFactory.getLogger(FallbackDateTableSource.class);

  private static final Duration STALE_RETRY_INTERVAL = Duration.ofMinutes(5);

  private final DateTableSource live;
  private final CalendarSnapshotStore snapshotStore;
  private final Cache<Integer, HebrewYearTable> freshTables;
  private final Cache<Integer, HebrewYearTable> staleTables;

  public FallbackDateTableSource(
      DateTableSource live, CalendarSnapshotStore snapshotStore, int cacheSize) {
    this(live, snapshotStore, cacheSize, Ticker.systemTicker());
  }

  FallbackDateTableSource(
      DateTableSource live, CalendarSnapshotStore snapshotStore, int cacheSize, Ticker ticker) {
    this.live = live;
    this.snapshotStore = snapshotStore;
    this.freshTables = Caffeine.newBuilder().maximumSize(cacheSize).ticker(ticker).build();
    // Stale entries expire quickly so the live source is retried while it stays down.
    this.staleTables =
        Caffeine.newBuilder()
            .maximumSize(cacheSize)
            .expireAfterWrite(STALE_RETRY_INTERVAL)
            .ticker(ticker)
            .build();
  }

  @Override
  public String sourceId() {
    return live.sourceId();
  }

  @Override
  public HebrewYearTable lookup(int hebrewYear) {
    var cached = freshTables.getIfPresent(hebrewYear);
    if (cached != null) {
      return cached;
    }
    var stale = staleTables.getIfPresent(hebrewYear);
    if (stale != null) {
      return stale;
    }

    HebrewYearTable table;
    try {
      table = live.lookup(hebrewYear);
    } catch (UnsupportedDateRangeException e) {
      throw e;
    } catch (RuntimeException e) {
      return fallBack(hebrewYear, e);
    }

    freshTables.put(hebrewYear, table);
    persist(table);
    return table;
  }

  private HebrewYearTable fallBack(int hebrewYear, RuntimeException cause) {
    var snapshot = snapshotStore.find(hebrewYear);
    if (snapshot.isEmpty()) {
      log.error(
          "Date table source '{}' failed for Hebrew year {} and no snapshot exists",
          live.sourceId(),
          hebrewYear,
          cause);
      if (cause instanceof DateComputationException dce) {
        throw dce;
      }
      throw new DateComputationException(
          "No date table available for Hebrew year " + hebrewYear, cause);
    }
    var table = snapshot.get().toTable();
    log.warn(
        "Date table source '{}' unavailable ({}); serving stale snapshot for Hebrew year {} fetched"
            + " at {}",
        live.sourceId(),
        cause.getMessage(),
        hebrewYear,
        snapshot.get().getFetchedAt());
    staleTables.put(hebrewYear, table);
    return table;
  }

  private void persist(HebrewYearTable table) {
    try {
      snapshotStore.store(table, live.sourceId());
    } catch (DataAccessException e) {
      log.warn("Failed to persist date table snapshot for Hebrew year {}", table.year(), e);
    }
  }
}
