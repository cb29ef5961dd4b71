package io.b2mash.yahrzeit.calendar;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Date-table configuration. When {@code remote.base-url} is blank the tables are computed locally.
 *
 * @param remote optional remote converter service
 * @param cacheSize number of year tables kept in memory
 */
@ConfigurationProperties(prefix = "yahrzeit.calendar")
public record CalendarProperties(Remote remote, Integer cacheSize) {

  public CalendarProperties {
    if (remote == null) {
      remote = new Remote(null, null);
    }
    if (cacheSize == null) {
      cacheSize = 256;
    }
  }

  public record Remote(String baseUrl, Duration timeout) {

    public Remote {
      if (timeout == null) {
        timeout = Duration.ofSeconds(5);
      }
    }

    public boolean isConfigured() {
      return baseUrl != null && !baseUrl.isBlank();
    }
  }
}
