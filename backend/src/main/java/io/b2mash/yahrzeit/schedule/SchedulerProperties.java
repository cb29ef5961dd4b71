package io.b2mash.yahrzeit.schedule;

import java.time.Duration;
import java.time.LocalTime;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

/**
 * Anniversary sweep settings.
 *
 * @param leadDays days before an occurrence that reminders go out, unless a recipient overrides it
 * @param horizonDays extra days ahead of the send date at which entries are already created
 * @param graceDays days after an elapsed occurrence during which missed entries are still created
 * @param sendTime local time of day, in the application zone, reminders are scheduled for
 * @param lockLease how long one instance holds the sweep lease
 */
@ConfigurationProperties(prefix = "yahrzeit.schedule")
public record SchedulerProperties(
    Integer leadDays,
    Integer horizonDays,
    Integer graceDays,
    @DateTimeFormat(pattern = "HH:mm") LocalTime sendTime,
    Duration lockLease) {

  public SchedulerProperties {
    if (leadDays == null) {
      leadDays = 14;
    }
    if (horizonDays == null) {
      horizonDays = 2;
    }
    if (graceDays == null) {
      graceDays = 7;
    }
    if (sendTime == null) {
      sendTime = LocalTime.of(9, 0);
    }
    if (lockLease == null) {
      lockLease = Duration.ofMinutes(30);
    }
    if (leadDays < 0 || horizonDays < 0 || graceDays < 0) {
      throw new IllegalArgumentException("Sweep windows must not be negative");
    }
  }
}
