/*
 * Where: Alarm application configuration binding
 * What: Holds scheduler loop settings and the wall-clock zone alarms are matched in
 * Why: Dose times are local times; the zone must not depend on the host default
 */
package com.example.alarm.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.scheduler")
@Validated
public record AlarmSchedulerProperties(
    boolean enabled,
    @NotBlank String zone,
    @NotNull Duration errorBackoff) {

  @AssertTrue(message = "alarm.scheduler.zone must be a valid zone id")
  public boolean isZoneValid() {
    if (zone == null || zone.isBlank()) {
      // @NotBlank reports this case
      return true;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  @AssertTrue(message = "alarm.scheduler.error-backoff must be positive")
  public boolean isErrorBackoffPositive() {
    return errorBackoff != null && !errorBackoff.isZero() && !errorBackoff.isNegative();
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
