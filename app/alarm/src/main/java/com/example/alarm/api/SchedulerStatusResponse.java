package com.example.alarm.api;

public record SchedulerStatusResponse(boolean running) {}
