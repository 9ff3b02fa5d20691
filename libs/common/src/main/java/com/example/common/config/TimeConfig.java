/*
 * Where: Common configuration
 * What: Exposes the wall clock as an injectable bean
 * Why: Schedulers and repositories read time through one replaceable source
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // UTC on purpose; callers that need local wall time apply their own zone
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
