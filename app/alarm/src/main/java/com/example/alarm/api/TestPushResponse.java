package com.example.alarm.api;

public record TestPushResponse(boolean success, int sent, int failed) {}
