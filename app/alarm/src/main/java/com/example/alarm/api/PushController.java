/*
 * Where: Alarm API
 * What: Device push registration, the VAPID public key, and an ad-hoc test send
 * Why: These are the only entry points the client app and operators need
 */
package com.example.alarm.api;

import com.example.alarm.model.DispatchSummary;
import com.example.alarm.repository.SubscriptionRegistry;
import com.example.alarm.service.AlarmScheduler;
import com.example.alarm.service.PushDispatcher;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/push")
@RequiredArgsConstructor
public class PushController {

    private static final Logger logger = LoggerFactory.getLogger(PushController.class);

    static final String DEFAULT_TEST_TITLE = "💊 복약 시간입니다!";
    static final String DEFAULT_TEST_BODY = "약을 복용해주세요.";
    private static final Map<String, String> TEST_PAYLOAD = Map.of("type", "test");
    private static final String INVALID_ENDPOINT_MESSAGE = "subscription.endpoint must be an absolute URL";

    private final SubscriptionRegistry subscriptionRegistry;
    private final PushDispatcher pushDispatcher;
    private final AlarmScheduler alarmScheduler;

    @GetMapping("/vapid-public-key")
    public VapidPublicKeyResponse vapidPublicKey() {
        return new VapidPublicKeyResponse(pushDispatcher.vapidPublicKey());
    }

    @PostMapping("/subscribe")
    public PushActionResponse subscribe(@Valid @RequestBody SubscribeRequest request) {
        SubscribeRequest.Subscription subscription = request.subscription();
        String endpointHost = requireEndpointHost(subscription.endpoint());
        subscriptionRegistry.upsert(
                subscription.endpoint(),
                request.userId(),
                subscription.keys().p256dh(),
                subscription.keys().auth());
        logger.info("push subscription registered userId={} endpointHost={}",
                request.userId(),
                endpointHost);
        return new PushActionResponse(true, "push subscription registered");
    }

    @PostMapping("/unsubscribe")
    public PushActionResponse unsubscribe(@Valid @RequestBody UnsubscribeRequest request) {
        int removed = subscriptionRegistry.removeByUserAndEndpoint(request.userId(), request.endpoint());
        logger.info("push subscription removed userId={} removed={}", request.userId(), removed);
        return new PushActionResponse(true, "push subscription removed");
    }

    @PostMapping("/test")
    public TestPushResponse test(@Valid @RequestBody TestPushRequest request) {
        DispatchSummary summary = pushDispatcher.sendToUser(
                request.userId(),
                orDefault(request.title(), DEFAULT_TEST_TITLE),
                orDefault(request.body(), DEFAULT_TEST_BODY),
                TEST_PAYLOAD,
                "test-" + UUID.randomUUID());
        logger.info("test push dispatched userId={} sent={} failed={}",
                request.userId(),
                summary.sent(),
                summary.failed());
        return new TestPushResponse(true, summary.sent(), summary.failed());
    }

    @GetMapping("/scheduler")
    public SchedulerStatusResponse scheduler() {
        return new SchedulerStatusResponse(alarmScheduler.isRunning());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String requireEndpointHost(String endpoint) {
        String host;
        try {
            host = URI.create(endpoint).getHost();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(INVALID_ENDPOINT_MESSAGE, ex);
        }
        if (host == null) {
            throw new IllegalArgumentException(INVALID_ENDPOINT_MESSAGE);
        }
        return host;
    }
}
