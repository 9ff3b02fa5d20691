/*
 * Where: Alarm API
 * What: Error codes returned alongside the HTTP status
 */
package com.example.alarm.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    PUSH_NOT_CONFIGURED,
    SUBSCRIPTION_STORE_UNAVAILABLE
}
