/*
 * Where: Alarm application configuration binding
 * What: Holds the visible text of dose alarm notifications
 */
package com.example.alarm.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.notification")
@Validated
public record AlarmNotificationProperties(@NotBlank String title) {}
