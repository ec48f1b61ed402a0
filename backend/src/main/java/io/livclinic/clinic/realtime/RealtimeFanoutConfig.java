package io.livclinic.clinic.realtime;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Threads that write queued payloads to live clients. */
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class RealtimeFanoutConfig {

  public static final String FANOUT_EXECUTOR = "realtimeFanoutExecutor";

  @Bean(name = FANOUT_EXECUTOR)
  public ThreadPoolTaskExecutor realtimeFanoutExecutor(RealtimeProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.fanoutThreads());
    executor.setMaxPoolSize(properties.fanoutThreads());
    executor.setThreadNamePrefix("realtime-fanout-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
