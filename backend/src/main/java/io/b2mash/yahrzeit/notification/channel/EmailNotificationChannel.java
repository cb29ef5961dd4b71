package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.integration.email.EmailMessage;
import io.b2mash.yahrzeit.integration.email.EmailProvider;
import io.b2mash.yahrzeit.integration.email.EmailRateLimiter;
import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.notification.template.EmailTemplateRenderer;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  static final String TEMPLATE = "yahrzeit-reminder";

  private static final DateTimeFormatter LONG_DATE =
      DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", Locale.ENGLISH);

  private final EmailProvider emailProvider;
  private final EmailTemplateRenderer templateRenderer;
  private final EmailRateLimiter rateLimiter;
  private final String replyTo;

  public EmailNotificationChannel(
      EmailProvider emailProvider,
      EmailTemplateRenderer templateRenderer,
      EmailRateLimiter rateLimiter,
      @Value("${yahrzeit.email.reply-to:}") String replyTo) {
    this.emailProvider = emailProvider;
    this.templateRenderer = templateRenderer;
    this.rateLimiter = rateLimiter;
    this.replyTo = replyTo == null || replyTo.isBlank() ? null : replyTo;
  }

  @Override
  public ChannelKind kind() {
    return ChannelKind.EMAIL;
  }

  @Override
  public DeliveryReceipt send(String address, ReminderPayload payload) {
    if (!rateLimiter.tryAcquire(address, emailProvider.providerId())) {
      log.warn("Email rate limit reached for {}", address);
      throw new ChannelTransientException(ChannelKind.EMAIL, "Hourly email limit reached");
    }
    var rendered = templateRenderer.render(TEMPLATE, templateContext(payload));
    var result = emailProvider.sendEmail(EmailMessage.of(address, rendered, replyTo));
    return DeliveryReceipt.fromResult(ChannelKind.EMAIL, emailProvider.providerId(), result);
  }

  static Map<String, Object> templateContext(ReminderPayload payload) {
    var context = new HashMap<String, Object>();
    String occurrence = payload.occurrenceDate().format(LONG_DATE);
    context.put("subject", "Yahrzeit of " + payload.subjectName() + " on " + occurrence);
    context.put("subjectName", payload.subjectName());
    context.put("recipientName", payload.recipientName());
    context.put("occurrenceDate", occurrence);
    context.put("eveningBefore", payload.occurrenceDate().minusDays(1).format(LONG_DATE));
    context.put("hebrewDate", payload.hebrewDate());
    context.put("hebrewDateHebrew", payload.hebrewDateHebrew());
    context.put("daysBefore", payload.daysBefore());
    return context;
  }
}
