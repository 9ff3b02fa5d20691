/*
 * Where: Alarm service layer
 * What: Turns one user's due entries into a NotificationJob
 * Why: The same (minute, user) tag lets devices collapse duplicate alarms for that minute
 */
package com.example.alarm.service;

import com.example.alarm.config.AlarmNotificationProperties;
import com.example.alarm.model.AlarmPayload;
import com.example.alarm.model.DosageScheduleEntry;
import com.example.alarm.model.NotificationJob;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlarmNotificationFactory {

  private static final Map<String, String> TIMING_TEXT =
      ImmutableMap.of("before_meal", "식전", "after_meal", "식후");

  private final AlarmNotificationProperties properties;

  public NotificationJob create(String userId, String minute, List<DosageScheduleEntry> entries) {
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("no due entries for userId=" + userId);
    }
    final List<String> names = entries.stream().map(DosageScheduleEntry::medicationName).toList();
    final List<String> ids = entries.stream().map(DosageScheduleEntry::entryId).toList();
    final AlarmPayload payload = new AlarmPayload(AlarmPayload.TYPE_ALARM, minute, names, ids);
    return new NotificationJob(
        userId, properties.title(), body(minute, entries.get(0).timing(), names), payload, tag(minute, userId));
  }

  public static String tag(String minute, String userId) {
    return "alarm-" + minute + "-" + userId;
  }

  private String body(String minute, String timing, List<String> names) {
    final String timingText = timing == null ? "" : TIMING_TEXT.getOrDefault(timing, "");
    final String heading = timingText.isEmpty() ? minute : minute + " " + timingText;
    return heading + "\n" + String.join(", ", names);
  }
}
