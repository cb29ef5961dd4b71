package io.b2mash.yahrzeit.integration.messaging;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Group-message gateway. The HTTP provider is only created when {@code base-url} is set.
 *
 * @param baseUrl gateway root URL
 * @param token bearer token sent with every request
 * @param path endpoint that accepts {@code {"to": .., "text": ..}}
 * @param timeout connect and read timeout
 */
@ConfigurationProperties(prefix = "yahrzeit.channels.group-message")
public record GroupMessageProperties(String baseUrl, String token, String path, Duration timeout) {

  public GroupMessageProperties {
    if (path == null || path.isBlank()) {
      path = "/messages";
    }
    if (timeout == null) {
      timeout = Duration.ofSeconds(10);
    }
  }
}
