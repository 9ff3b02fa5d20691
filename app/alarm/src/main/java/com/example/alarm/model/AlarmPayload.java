/*
 * Where: Alarm domain model
 * What: Structured data attached to a dose alarm push message
 * Why: The service worker reads medicine ids from it when the alarm is opened
 */
package com.example.alarm.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlarmPayload(String type, String time, List<String> medicines, List<String> medicineIds) {

  public static final String TYPE_ALARM = "alarm";
}
