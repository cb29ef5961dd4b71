package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.recipient.ChannelKind;

/**
 * Uniform send contract for reminder delivery. Implementations render the payload into their own
 * format.
 */
public interface NotificationChannel {

  ChannelKind kind();

  /**
   * Sends one reminder.
   *
   * @throws ChannelTransientException when the send may succeed if retried later
   * @throws ChannelPermanentException when the address can never be delivered to
   */
  DeliveryReceipt send(String address, ReminderPayload payload);
}
