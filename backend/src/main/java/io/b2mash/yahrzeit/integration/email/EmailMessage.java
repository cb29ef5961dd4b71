package io.b2mash.yahrzeit.integration.email;

import java.util.Objects;

/** Provider-agnostic email payload: recipient, subject, HTML and plain-text bodies. */
public record EmailMessage(
    String to, String subject, String htmlBody, String plainTextBody, String replyTo) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
  }

  public static EmailMessage of(String to, RenderedEmail rendered, String replyTo) {
    return new EmailMessage(
        to, rendered.subject(), rendered.htmlBody(), rendered.plainTextBody(), replyTo);
  }
}
