/*
 * Where: Alarm service layer
 * What: A stored schedule entry that cannot be interpreted
 * Why: Lets the matcher skip the offending entry and keep matching the rest
 */
package com.example.alarm.service;

public class MalformedScheduleEntryException extends RuntimeException {

    public MalformedScheduleEntryException(String message) {
        super(message);
    }

    public MalformedScheduleEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
