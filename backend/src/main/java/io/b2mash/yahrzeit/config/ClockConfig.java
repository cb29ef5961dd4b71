package io.b2mash.yahrzeit.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single source of time. Its zone is the one "today" is evaluated in, for both the sweep and
 * reminder send times.
 */
@Configuration
public class ClockConfig {

  @Bean
  public Clock clock(@Value("${yahrzeit.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
