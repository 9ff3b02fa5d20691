/*
 * Where: Alarm service layer
 * What: Sends push messages to one endpoint or to every device of a user and classifies the result
 * Why: The component that learns an endpoint is gone also removes it, so cleanup cannot be skipped
 */
package com.example.alarm.service;

import com.example.alarm.config.WebPushProperties;
import com.example.alarm.model.DispatchOutcome;
import com.example.alarm.model.DispatchSummary;
import com.example.alarm.model.NotificationJob;
import com.example.alarm.model.PushMessage;
import com.example.alarm.model.PushSubscription;
import com.example.alarm.repository.SubscriptionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PushDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(PushDispatcher.class);
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_GONE = 410;
    private static final int ENDPOINT_LOG_LENGTH = 50;

    private final SubscriptionRegistry subscriptionRegistry;
    private final PushTransport transport;
    private final WebPushProperties properties;
    private final AlarmMetrics metrics;
    private final ObjectMapper objectMapper;

    public DispatchSummary sendToUser(String userId, String title, String body, Object data, String tag) {
        return sendToUser(new NotificationJob(userId, title, body, data, tag));
    }

    /**
     * Sends {@code job} to every subscription the user has right now. Each device is tried once;
     * failures are counted, never retried here.
     *
     * @throws PushConfigurationException when no VAPID key pair is configured
     */
    public DispatchSummary sendToUser(NotificationJob job) {
        requireSigningIdentity();
        // read at call time: another dispatch may have just pruned an endpoint
        List<PushSubscription> subscriptions = subscriptionRegistry.listByUser(job.userId());
        if (subscriptions.isEmpty()) {
            logger.debug("push skipped; no subscriptions userId={}", job.userId());
            return DispatchSummary.EMPTY;
        }
        PushMessage message = PushMessage.of(job, properties.icon(), properties.badge());
        String payloadJson = serialize(message);
        DispatchSummary summary = DispatchSummary.EMPTY;
        for (PushSubscription subscription : subscriptions) {
            summary = summary.plus(deliver(subscription, payloadJson));
        }
        return summary;
    }

    /**
     * Sends one message to one endpoint. A 404/410 answer removes the endpoint from the registry.
     *
     * @throws PushConfigurationException when no VAPID key pair is configured
     */
    public DispatchOutcome send(PushSubscription subscription, PushMessage message) {
        requireSigningIdentity();
        return deliver(subscription, serialize(message));
    }

    public String vapidPublicKey() {
        requireSigningIdentity();
        return properties.publicKey();
    }

    private DispatchOutcome deliver(PushSubscription subscription, String payloadJson) {
        DispatchOutcome outcome;
        try {
            outcome = classify(transport.deliver(subscription, payloadJson));
        } catch (PushConfigurationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            // PushTransportException and anything else a transport throws count against this device only
            logger.warn("push delivery failed userId={} endpoint={}",
                    subscription.userId(),
                    abbreviate(subscription.endpoint()),
                    ex);
            outcome = DispatchOutcome.transientFailure(ex.getMessage());
        }
        if (outcome.isPermanentFailure()) {
            prune(subscription);
        } else if (!outcome.isDelivered()) {
            logger.warn("push rejected userId={} endpoint={} reason={}",
                    subscription.userId(),
                    abbreviate(subscription.endpoint()),
                    outcome.reason());
        }
        metrics.recordDelivery(outcome.result());
        return outcome;
    }

    @VisibleForTesting
    static DispatchOutcome classify(int status) {
        if (status >= 200 && status < 300) {
            return DispatchOutcome.delivered();
        }
        if (status == HTTP_GONE || status == HTTP_NOT_FOUND) {
            return DispatchOutcome.permanentFailure(DispatchOutcome.REASON_EXPIRED);
        }
        return DispatchOutcome.transientFailure("http status " + status);
    }

    private void prune(PushSubscription subscription) {
        try {
            int removed = subscriptionRegistry.removeByEndpoint(subscription.endpoint());
            if (removed > 0) {
                metrics.recordSubscriptionPruned();
            }
            logger.info("push subscription expired and removed userId={} endpoint={} removed={}",
                    subscription.userId(),
                    abbreviate(subscription.endpoint()),
                    removed);
        } catch (DataAccessException ex) {
            // the endpoint answers 410 again on its next due alarm, which retries the removal
            logger.error("failed to remove expired push subscription userId={} endpoint={}",
                    subscription.userId(),
                    abbreviate(subscription.endpoint()),
                    ex);
        }
    }

    private void requireSigningIdentity() {
        if (!properties.isSigningConfigured()) {
            throw new PushConfigurationException(
                    "VAPID key pair is not configured; set alarm.push.public-key and alarm.push.private-key");
        }
    }

    private String serialize(PushMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("push message serialization failure", ex);
        }
    }

    static String abbreviate(String endpoint) {
        if (endpoint == null || endpoint.length() <= ENDPOINT_LOG_LENGTH) {
            return endpoint;
        }
        return endpoint.substring(0, ENDPOINT_LOG_LENGTH) + "...";
    }
}
