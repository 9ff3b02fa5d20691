/*
 * Where: Alarm API
 * What: applicationServerKey handed to PushManager.subscribe on the client
 */
package com.example.alarm.api;

public record VapidPublicKeyResponse(String publicKey) {}
