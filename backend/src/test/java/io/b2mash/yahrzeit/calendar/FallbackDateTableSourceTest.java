package io.b2mash.yahrzeit.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class FallbackDateTableSourceTest {

  private FlakySource live;
  private CalendarSnapshotStore snapshotStore;
  private FakeTicker ticker;
  private FallbackDateTableSource source;

  @BeforeEach
  void setUp() {
    live = new FlakySource();
    snapshotStore = mock(CalendarSnapshotStore.class);
    when(snapshotStore.find(anyInt())).thenReturn(Optional.empty());
    ticker = new FakeTicker();
    source = new FallbackDateTableSource(live, snapshotStore, 16, ticker);
  }

  @Test
  void lookup_cachesFreshTableAndPersistsSnapshot() {
    var first = source.lookup(5784);
    var second = source.lookup(5784);

    assertThat(second).isSameAs(first);
    assertThat(live.calls.get()).isEqualTo(1);
    verify(snapshotStore).store(first, "flaky");
  }

  @Test
  void lookup_servesSnapshotWhenLiveSourceFails() {
    var snapshot = snapshotOf(5785);
    when(snapshotStore.find(5785)).thenReturn(Optional.of(snapshot));
    live.failing = true;

    var table = source.lookup(5785);

    assertThat(table.year()).isEqualTo(5785);
    assertThat(table.lengthInDays()).isEqualTo(355);
    verify(snapshotStore, never()).store(any(), anyString());
  }

  @Test
  void lookup_withoutSnapshot_throwsDateComputationException() {
    live.failing = true;

    assertThatThrownBy(() -> source.lookup(5786))
        .isInstanceOf(DateComputationException.class)
        .hasMessageContaining("5786");
  }

  @Test
  void lookup_neverSubstitutesSnapshotOfAnotherYear() {
    var other = snapshotOf(5785);
    when(snapshotStore.find(5785)).thenReturn(Optional.of(other));
    live.failing = true;

    assertThatThrownBy(() -> source.lookup(5786)).isInstanceOf(DateComputationException.class);
  }

  @Test
  void staleTable_isRetriedAgainstLiveSourceAfterInterval() {
    var snapshot = snapshotOf(5785);
    when(snapshotStore.find(5785)).thenReturn(Optional.of(snapshot));
    live.failing = true;
    source.lookup(5785);
    source.lookup(5785);
    assertThat(live.calls.get()).isEqualTo(1);

    live.failing = false;
    ticker.advance(6, TimeUnit.MINUTES);
    source.lookup(5785);

    assertThat(live.calls.get()).isEqualTo(2);
    verify(snapshotStore).store(any(), anyString());
  }

  @Test
  void unsupportedRange_isNotMaskedBySnapshot() {
    assertThatThrownBy(() -> source.lookup(6100))
        .isInstanceOf(UnsupportedDateRangeException.class);
    verify(snapshotStore, never()).find(6100);
  }

  @Test
  void snapshotWriteFailure_doesNotFailLookup() {
    doThrow(new DataAccessResourceFailureException("db down"))
        .when(snapshotStore)
        .store(any(), anyString());

    assertThat(source.lookup(5784).year()).isEqualTo(5784);
  }

  private static CalendarYearSnapshot snapshotOf(int year) {
    return new CalendarYearSnapshot(
        new ArithmeticDateTableSource().lookup(year),
        "remote",
        Instant.parse("2024-01-01T00:00:00Z"));
  }

  private static class FlakySource implements DateTableSource {

    private final ArithmeticDateTableSource delegate = new ArithmeticDateTableSource();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean failing;

    @Override
    public String sourceId() {
      return "flaky";
    }

    @Override
    public HebrewYearTable lookup(int hebrewYear) {
      calls.incrementAndGet();
      if (failing) {
        throw new IllegalStateException("converter unavailable");
      }
      return delegate.lookup(hebrewYear);
    }
  }

  private static class FakeTicker implements Ticker {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(long amount, TimeUnit unit) {
      nanos.addAndGet(unit.toNanos(amount));
    }
  }
}
