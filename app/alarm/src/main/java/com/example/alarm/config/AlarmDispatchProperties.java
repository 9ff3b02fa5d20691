/*
 * Where: Alarm application configuration binding
 * What: Bounds how many users are dispatched in parallel within one tick
 */
package com.example.alarm.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.dispatch")
@Validated
public record AlarmDispatchProperties(@Positive int parallelism) {}
