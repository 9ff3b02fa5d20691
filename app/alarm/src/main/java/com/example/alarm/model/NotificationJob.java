/*
 * Where: Alarm domain model
 * What: One notification to fan out to every device of a user
 * Why: Built per tick and discarded afterwards; never persisted
 */
package com.example.alarm.model;

public record NotificationJob(String userId, String title, String body, Object data, String tag) {}
