package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.integration.messaging.GroupMessageProvider;
import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class GroupMessageNotificationChannel implements NotificationChannel {

  private static final DateTimeFormatter LONG_DATE =
      DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", Locale.ENGLISH);

  private final GroupMessageProvider provider;

  public GroupMessageNotificationChannel(GroupMessageProvider provider) {
    this.provider = provider;
  }

  @Override
  public ChannelKind kind() {
    return ChannelKind.GROUP_MESSAGE;
  }

  @Override
  public DeliveryReceipt send(String address, ReminderPayload payload) {
    var result = provider.send(address, formatText(payload));
    return DeliveryReceipt.fromResult(ChannelKind.GROUP_MESSAGE, provider.providerId(), result);
  }

  static String formatText(ReminderPayload payload) {
    var text = new StringBuilder();
    text.append("Yahrzeit reminder: the yahrzeit of ")
        .append(payload.subjectName())
        .append(" falls on ")
        .append(payload.occurrenceDate().format(LONG_DATE))
        .append(" (")
        .append(payload.hebrewDate());
    if (payload.hebrewDateHebrew() != null) {
      text.append(" / ").append(payload.hebrewDateHebrew());
    }
    text.append("). It begins at sundown on ")
        .append(payload.occurrenceDate().minusDays(1).format(LONG_DATE))
        .append('.');
    return text.toString();
  }
}
