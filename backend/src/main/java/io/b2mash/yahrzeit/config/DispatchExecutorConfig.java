package io.b2mash.yahrzeit.config;

import io.b2mash.yahrzeit.notification.DispatchProperties;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchExecutorConfig {

  /** Bounded worker pool for reminder delivery; a full queue runs the task on the poller. */
  @Bean
  public ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workers());
    executor.setMaxPoolSize(properties.workers());
    executor.setQueueCapacity(properties.batchSize());
    executor.setThreadNamePrefix("dispatch-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
