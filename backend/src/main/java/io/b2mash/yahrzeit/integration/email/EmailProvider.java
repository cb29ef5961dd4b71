package io.b2mash.yahrzeit.integration.email;

import io.b2mash.yahrzeit.integration.SendResult;

/** Port for sending emails via an external provider (SMTP, or a logging no-op). */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /**
   * Send an email message. Delivery failures are reported in the result, classified as permanent
   * or retryable, rather than thrown.
   */
  SendResult sendEmail(EmailMessage message);
}
