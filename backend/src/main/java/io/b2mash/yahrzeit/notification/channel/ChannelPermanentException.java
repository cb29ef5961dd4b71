package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.recipient.ChannelKind;

/** The address was rejected outright; the entry fails and the recipient is deactivated. */
public class ChannelPermanentException extends ChannelException {

  public ChannelPermanentException(ChannelKind channelKind, String message) {
    super(channelKind, message);
  }
}
