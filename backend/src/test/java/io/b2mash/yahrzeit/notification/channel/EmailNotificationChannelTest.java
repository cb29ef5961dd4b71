package io.b2mash.yahrzeit.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.yahrzeit.integration.SendResult;
import io.b2mash.yahrzeit.integration.email.EmailMessage;
import io.b2mash.yahrzeit.integration.email.EmailProvider;
import io.b2mash.yahrzeit.integration.email.EmailRateLimiter;
import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.notification.template.EmailTemplateRenderer;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class EmailNotificationChannelTest {

  private static final ReminderPayload PAYLOAD =
      new ReminderPayload(
          "Miriam Levy",
          "Ruth",
          LocalDate.of(2024, 1, 3),
          "22 Tevet 5784",
          "כ״ב טבת תשפ״ד",
          14);

  private EmailProvider emailProvider;
  private EmailNotificationChannel channel;

  @BeforeEach
  void setUp() {
    emailProvider = mock(EmailProvider.class);
    when(emailProvider.providerId()).thenReturn("smtp");
    channel =
        new EmailNotificationChannel(
            emailProvider,
            new EmailTemplateRenderer(),
            new EmailRateLimiter(1, 100),
            "office@example.com");
  }

  @Test
  void send_rendersReminderAndReturnsReceipt() {
    when(emailProvider.sendEmail(any())).thenReturn(SendResult.sent("msg-1"));

    var receipt = channel.send("ruth@example.com", PAYLOAD);

    assertThat(receipt).isEqualTo(new DeliveryReceipt("smtp", "msg-1"));
    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    var message = captor.getValue();
    assertThat(message.to()).isEqualTo("ruth@example.com");
    assertThat(message.replyTo()).isEqualTo("office@example.com");
    assertThat(message.subject())
        .isEqualTo("Yahrzeit of Miriam Levy on Wednesday, 3 January 2024");
    assertThat(message.htmlBody()).contains("Dear Ruth,").contains("22 Tevet 5784");
    assertThat(message.plainTextBody()).contains("Tuesday, 2 January 2024");
  }

  @Test
  void send_throwsPermanentWhenProviderRejects() {
    when(emailProvider.sendEmail(any())).thenReturn(SendResult.rejected("550 no such user"));

    assertThatThrownBy(() -> channel.send("ruth@example.com", PAYLOAD))
        .isInstanceOf(ChannelPermanentException.class)
        .hasMessage("550 no such user");
  }

  @Test
  void send_throwsTransientWhenProviderFailsRetryably() {
    when(emailProvider.sendEmail(any())).thenReturn(SendResult.retryable("Connection refused"));

    assertThatThrownBy(() -> channel.send("ruth@example.com", PAYLOAD))
        .isInstanceOfSatisfying(
            ChannelTransientException.class,
            e -> assertThat(e.getChannelKind()).isEqualTo(ChannelKind.EMAIL));
  }

  @Test
  void send_throwsTransientWhenRateLimited() {
    when(emailProvider.sendEmail(any())).thenReturn(SendResult.sent("msg-1"));
    channel.send("ruth@example.com", PAYLOAD);

    assertThatThrownBy(() -> channel.send("ruth@example.com", PAYLOAD))
        .isInstanceOf(ChannelTransientException.class)
        .hasMessage("Hourly email limit reached");
    verify(emailProvider).sendEmail(any());
  }

  @Test
  void send_blankReplyToIsOmitted() {
    var noReplyTo =
        new EmailNotificationChannel(
            emailProvider, new EmailTemplateRenderer(), new EmailRateLimiter(10, 100), " ");
    when(emailProvider.sendEmail(any())).thenReturn(SendResult.sent("msg-2"));

    noReplyTo.send("ruth@example.com", PAYLOAD);

    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    assertThat(captor.getValue().replyTo()).isNull();
  }

  @Test
  void templateContext_containsDatesAndNames() {
    var context = EmailNotificationChannel.templateContext(PAYLOAD);

    assertThat(context)
        .containsEntry("subjectName", "Miriam Levy")
        .containsEntry("recipientName", "Ruth")
        .containsEntry("occurrenceDate", "Wednesday, 3 January 2024")
        .containsEntry("eveningBefore", "Tuesday, 2 January 2024")
        .containsEntry("hebrewDate", "22 Tevet 5784")
        .containsEntry("daysBefore", 14);
  }

  @Test
  void kind_isEmail() {
    assertThat(channel.kind()).isEqualTo(ChannelKind.EMAIL);
    verify(emailProvider, never()).sendEmail(any());
  }
}
