package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.recipient.ChannelKind;

/** Throttling, timeouts and server-side errors; the entry is retried with backoff. */
public class ChannelTransientException extends ChannelException {

  public ChannelTransientException(ChannelKind channelKind, String message) {
    super(channelKind, message);
  }
}
