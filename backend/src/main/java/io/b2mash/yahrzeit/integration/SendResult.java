package io.b2mash.yahrzeit.integration;

/**
 * Outcome of one send. On failure, {@code permanent} tells whether retrying the same message to the
 * same address can ever succeed.
 */
public record SendResult(
    boolean success, String providerMessageId, String errorMessage, boolean permanent) {

  public static SendResult sent(String providerMessageId) {
    return new SendResult(true, providerMessageId, null, false);
  }

  public static SendResult retryable(String errorMessage) {
    return new SendResult(false, null, errorMessage, false);
  }

  public static SendResult rejected(String errorMessage) {
    return new SendResult(false, null, errorMessage, true);
  }
}
