package io.b2mash.yahrzeit.integration.messaging;

import io.b2mash.yahrzeit.integration.SendResult;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Fallback when no gateway is configured. Logs the message instead of sending it. */
@Component
@ConditionalOnMissingBean(HttpGroupMessageProvider.class)
public class NoOpGroupMessageProvider implements GroupMessageProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpGroupMessageProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult send(String groupHandle, String text) {
    log.info("NoOp group message: would post {} characters to {}", text.length(), groupHandle);
    return SendResult.sent("NOOP-" + UUID.randomUUID());
  }
}
