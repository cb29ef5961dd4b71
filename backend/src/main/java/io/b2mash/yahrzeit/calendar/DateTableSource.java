package io.b2mash.yahrzeit.calendar;

/**
 * Read-only lookup of Hebrew year tables. Implementations may compute tables locally or fetch them
 * from a remote service; callers treat every implementation as potentially slow and cacheable.
 */
public interface DateTableSource {

  /** Identifier recorded alongside persisted snapshots (e.g., "arithmetic", "remote"). */
  String sourceId();

  /**
   * Returns the table for the given Hebrew year.
   *
   * @throws UnsupportedDateRangeException if the year is outside the supported range
   * @throws DateComputationException if the table cannot be obtained right now
   */
  HebrewYearTable lookup(int hebrewYear);
}
