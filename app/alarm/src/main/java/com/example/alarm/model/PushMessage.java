/*
 * Where: Alarm domain model
 * What: JSON envelope encrypted into each push delivery
 * Why: Field names follow what the service worker passes to showNotification
 */
package com.example.alarm.model;

import java.util.List;

public record PushMessage(
    String title,
    String body,
    String icon,
    String badge,
    String tag,
    Object data,
    boolean requireInteraction,
    List<Integer> vibrate) {

  public static final List<Integer> VIBRATION_PATTERN = List.of(200, 100, 200, 100, 200);

  public static PushMessage of(NotificationJob job, String icon, String badge) {
    return new PushMessage(
        job.title(), job.body(), icon, badge, job.tag(), job.data(), true, VIBRATION_PATTERN);
  }
}
