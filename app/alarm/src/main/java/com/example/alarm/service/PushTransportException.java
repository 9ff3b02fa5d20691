/*
 * Where: Alarm service layer
 * What: Network, timeout or encryption failure while delivering one push message
 */
package com.example.alarm.service;

public class PushTransportException extends RuntimeException {

    public PushTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
