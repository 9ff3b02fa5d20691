package com.example.alarm.api;

public record PushActionResponse(boolean success, String message) {}
