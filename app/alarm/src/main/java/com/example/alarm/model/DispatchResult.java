/*
 * Where: Alarm domain model
 * What: Classification of one push delivery attempt
 */
package com.example.alarm.model;

public enum DispatchResult {
  DELIVERED,
  TRANSIENT_FAILURE,
  PERMANENT_FAILURE
}
