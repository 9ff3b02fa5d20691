/*
 * Where: Alarm service layer
 * What: Web Push delivery with a VAPID-signed JWT and an aes128gcm payload encrypted to the device keys
 * Why: Browsers accept pushes only in this form; each call is bounded by the configured timeout
 */
package com.example.alarm.service;

import com.example.alarm.config.WebPushProperties;
import com.example.alarm.model.PushSubscription;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import nl.martijndwars.webpush.Encoding;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import org.apache.http.HttpResponse;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "alarm.push.transport",
    havingValue = WebPushProperties.TRANSPORT_WEB_PUSH,
    matchIfMissing = true)
public class WebPushTransport implements PushTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebPushTransport.class);

    private final Duration sendTimeout;
    private final PushService pushService;

    public WebPushTransport(WebPushProperties properties) {
        this.sendTimeout = properties.sendTimeout();
        this.pushService = properties.isSigningConfigured() ? createPushService(properties) : null;
        if (pushService == null) {
            logger.warn("web push transport has no VAPID key pair; deliveries will be refused");
        }
    }

    @Override
    public int deliver(PushSubscription subscription, String payloadJson) {
        if (pushService == null) {
            throw new PushConfigurationException("VAPID key pair is not configured");
        }
        Future<HttpResponse> response;
        try {
            Notification notification = new Notification(
                    subscription.endpoint(),
                    subscription.p256dh(),
                    subscription.auth(),
                    payloadJson);
            response = pushService.sendAsync(notification, Encoding.AES128GCM);
        } catch (GeneralSecurityException | IOException | JoseException ex) {
            throw new PushTransportException("failed to encrypt or sign push message", ex);
        }
        try {
            return response.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .getStatusLine()
                    .getStatusCode();
        } catch (TimeoutException ex) {
            response.cancel(true);
            throw new PushTransportException("push delivery timed out after " + sendTimeout, ex);
        } catch (ExecutionException ex) {
            throw new PushTransportException("push delivery failed", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            throw new PushTransportException("interrupted while waiting for push delivery", ex);
        }
    }

    static PushService createPushService(WebPushProperties properties) {
        VapidKeys.ensureProvider();
        try {
            return new PushService(properties.publicKey(), properties.privateKey(), properties.subject());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("alarm.push VAPID key pair cannot be decoded", ex);
        }
    }
}
