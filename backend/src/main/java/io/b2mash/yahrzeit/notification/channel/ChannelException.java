package io.b2mash.yahrzeit.notification.channel;

import io.b2mash.yahrzeit.recipient.ChannelKind;

/** A failed send. Subclasses tell the dispatcher whether to retry. */
public abstract class ChannelException extends RuntimeException {

  private final ChannelKind channelKind;

  protected ChannelException(ChannelKind channelKind, String message) {
    super(message);
    this.channelKind = channelKind;
  }

  public ChannelKind getChannelKind() {
    return channelKind;
  }
}
