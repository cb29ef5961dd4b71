package io.b2mash.yahrzeit.notification;

import io.b2mash.yahrzeit.calendar.HebrewCalendarConverter;
import io.b2mash.yahrzeit.calendar.HebrewDateFormatter;
import io.b2mash.yahrzeit.recipient.Recipient;
import io.b2mash.yahrzeit.subject.Subject;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/** Builds the reminder content stored with a ledger entry when it is created. */
@Component
public class ReminderContentFactory {

  private final HebrewCalendarConverter converter;
  private final HebrewDateFormatter formatter;

  public ReminderContentFactory(HebrewCalendarConverter converter, HebrewDateFormatter formatter) {
    this.converter = converter;
    this.formatter = formatter;
  }

  public ReminderPayload create(
      Subject subject, Recipient recipient, LocalDate occurrence, int leadDays) {
    var hebrew = converter.toHebrew(occurrence);
    return new ReminderPayload(
        subject.getDisplayName(),
        recipient.getDisplayName(),
        occurrence,
        formatter.formatEnglish(hebrew),
        formatter.formatHebrew(hebrew),
        leadDays);
  }
}
