package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.integration.SendResult;
import io.b2mash.yahrzeit.recipient.ChannelKind;

/** Proof of a successful send: the provider used and its message id, when it reports one. */
public record DeliveryReceipt(String providerId, String externalId) {

  /** Turns a provider result into a receipt, or into the matching channel exception. */
  static DeliveryReceipt fromResult(ChannelKind kind, String providerId, SendResult result) {
    if (result.success()) {
      return new DeliveryReceipt(providerId, result.providerMessageId());
    }
    if (result.permanent()) {
      throw new ChannelPermanentException(kind, result.errorMessage());
    }
    throw new ChannelTransientException(kind, result.errorMessage());
  }
}
