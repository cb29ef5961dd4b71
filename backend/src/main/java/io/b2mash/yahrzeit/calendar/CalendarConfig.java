package io.b2mash.yahrzeit.calendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the date-table chain: a remote converter when one is configured, otherwise local
 * arithmetic, always behind the caching fallback.
 */
@Configuration
@EnableConfigurationProperties(CalendarProperties.class)
public class CalendarConfig {

  private static final Logger log = LoggerFactory.getLogger(CalendarConfig.class);

  @Bean
  public DateTableSource dateTableSource(
      CalendarProperties properties,
      CalendarSnapshotStore snapshotStore,
      RestClient.Builder restClientBuilder) {
    DateTableSource live;
    var remote = properties.remote();
    if (remote.isConfigured()) {
      var requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(remote.timeout());
      requestFactory.setReadTimeout(remote.timeout());
      live =
          new RemoteDateTableSource(
              restClientBuilder.baseUrl(remote.baseUrl()).requestFactory(requestFactory).build());
      log.info("Using remote date table source at {}", remote.baseUrl());
    } else {
      live = new ArithmeticDateTableSource();
      log.info("Using arithmetic date table source");
    }
    return new FallbackDateTableSource(live, snapshotStore, properties.cacheSize());
  }
}
