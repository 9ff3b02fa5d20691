/*
 * Where: Alarm application configuration binding
 * What: Holds the VAPID signing identity and Web Push delivery settings
 * Why: Keys come from the environment; missing keys must stop delivery, not startup
 */
package com.example.alarm.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.push")
@Validated
public record WebPushProperties(
    String publicKey,
    String privateKey,
    @NotBlank String subject,
    @NotNull Duration sendTimeout,
    @NotBlank String transport,
    String icon,
    String badge) {

  public static final String TRANSPORT_WEB_PUSH = "web-push";
  public static final String TRANSPORT_LOGGING = "logging";

  @AssertTrue(message = "alarm.push.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    return sendTimeout != null && !sendTimeout.isZero() && !sendTimeout.isNegative();
  }

  public boolean isSigningConfigured() {
    return hasText(publicKey) && hasText(privateKey);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
