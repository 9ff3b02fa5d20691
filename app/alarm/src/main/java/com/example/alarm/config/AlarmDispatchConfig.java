/*
 * Where: Alarm application infrastructure
 * What: Provides the bounded worker pool used to fan out a tick across users
 * Why: Large ticks must not open an unbounded number of outbound push calls
 */
package com.example.alarm.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AlarmDispatchConfig {

  public static final String DISPATCH_EXECUTOR = "alarmDispatchExecutor";

  @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService alarmDispatchExecutor(AlarmDispatchProperties properties) {
    return Executors.newFixedThreadPool(
        properties.parallelism(),
        new ThreadFactoryBuilder().setNameFormat("alarm-dispatch-%d").setDaemon(true).build());
  }
}
