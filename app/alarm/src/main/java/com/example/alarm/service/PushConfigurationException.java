/*
 * Where: Alarm service layer
 * What: Signals that the VAPID signing identity is missing
 * Why: Delivery without keys can never succeed, so it is refused before any endpoint is contacted
 */
package com.example.alarm.service;

public class PushConfigurationException extends RuntimeException {

    public PushConfigurationException(String message) {
        super(message);
    }
}
