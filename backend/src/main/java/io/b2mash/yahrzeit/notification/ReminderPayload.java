package io.b2mash.yahrzeit.notification;

import java.time.LocalDate;

/**
 * Channel-agnostic reminder content, built when the ledger entry is created and stored with it.
 * Channels render it into their own format at send time.
 *
 * @param subjectName display name of the person being remembered
 * @param recipientName how the recipient is addressed; may be null
 * @param occurrenceDate Gregorian date of the anniversary
 * @param hebrewDate anniversary date in transliterated form, e.g. "22 Tevet 5784"
 * @param hebrewDateHebrew anniversary date in Hebrew script
 * @param daysBefore lead time the reminder was scheduled with
 */
public record ReminderPayload(
    String subjectName,
    String recipientName,
    LocalDate occurrenceDate,
    String hebrewDate,
    String hebrewDateHebrew,
    int daysBefore) {}
