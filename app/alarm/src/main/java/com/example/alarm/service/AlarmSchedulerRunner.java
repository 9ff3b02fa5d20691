/*
 * Where: Alarm scheduler lifecycle
 * What: Starts the alarm loop with the application and stops it on shutdown
 * Why: Disabled in tests and in replicas that should only serve the API
 */
package com.example.alarm.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "alarm.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AlarmSchedulerRunner {

  private final AlarmScheduler scheduler;

  @PostConstruct
  public void start() {
    scheduler.start();
  }

  @PreDestroy
  public void stop() {
    scheduler.stop();
  }
}
