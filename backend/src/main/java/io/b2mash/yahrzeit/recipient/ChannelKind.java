package io.b2mash.yahrzeit.recipient;

/** Delivery channel a recipient is reached through. */
public enum ChannelKind {
  EMAIL,
  /** A pre-provisioned group on a messaging app, addressed by its handle. */
  GROUP_MESSAGE
}
