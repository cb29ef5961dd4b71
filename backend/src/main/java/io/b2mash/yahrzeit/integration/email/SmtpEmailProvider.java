package io.b2mash.yahrzeit.integration.email;

import io.b2mash.yahrzeit.integration.SendResult;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.MimeMessage;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP-based email provider that sends emails via {@link JavaMailSender}. Only active when {@code
 * spring.mail.host} is configured.
 *
 * <p>A failure is permanent when the address is malformed or the server rejects it with a 5xx
 * reply. Connection, authentication and 4xx failures are retryable.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private static final Pattern REPLY_CODE = Pattern.compile("^\\s*([2-5]\\d\\d)\\b");

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(
      JavaMailSender mailSender,
      @Value("${yahrzeit.email.sender-address}") String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      populateMessage(helper, message);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return SendResult.sent(messageId);
    } catch (MailException | MessagingException e) {
      boolean permanent = isPermanent(e);
      log.error(
          "Failed to send SMTP email to {} ({}): {}",
          message.to(),
          permanent ? "permanent" : "retryable",
          e.getMessage());
      return permanent ? SendResult.rejected(e.getMessage()) : SendResult.retryable(e.getMessage());
    }
  }

  static boolean isPermanent(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      // Our credentials, not the recipient's address
      if (t instanceof MailAuthenticationException || t instanceof AuthenticationFailedException) {
        return false;
      }
    }
    Integer code = firstReplyCode(failure, 0);
    if (code != null) {
      return code >= 500;
    }
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof AddressException || t instanceof MailParseException) {
        return true;
      }
      if (t instanceof SendFailedException sendFailed
          && sendFailed.getInvalidAddresses() != null
          && sendFailed.getInvalidAddresses().length > 0) {
        return true;
      }
      if (t instanceof MailSendException mailSend) {
        for (Exception nested : mailSend.getMessageExceptions()) {
          if (isPermanent(nested)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /** First SMTP reply code found in the cause chain, including per-message failures. */
  private static Integer firstReplyCode(Throwable failure, int depth) {
    for (Throwable t = failure; t != null && depth < 10; t = t.getCause(), depth++) {
      Integer code = replyCode(t.getMessage());
      if (code != null) {
        return code;
      }
      if (t instanceof MailSendException mailSend) {
        for (Exception nested : mailSend.getMessageExceptions()) {
          Integer nestedCode = firstReplyCode(nested, depth + 1);
          if (nestedCode != null) {
            return nestedCode;
          }
        }
      }
    }
    return null;
  }

  private static Integer replyCode(String message) {
    if (message == null) {
      return null;
    }
    Matcher matcher = REPLY_CODE.matcher(message);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
    helper.setFrom(senderAddress);
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody(), false);
    }
    if (message.replyTo() != null) {
      helper.setReplyTo(message.replyTo());
    }
  }
}
