package com.example.alarm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.alarm.config.WebPushProperties;
import com.example.alarm.model.PushSubscription;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class PushTransportsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void webPushTransportWithoutKeysRefusesToDeliver() {
        WebPushTransport transport = new WebPushTransport(new WebPushProperties(
                null, null, "mailto:admin@example.com", Duration.ofSeconds(10),
                WebPushProperties.TRANSPORT_WEB_PUSH, null, null));

        assertThatThrownBy(() -> transport.deliver(subscription("https://push.example.com/a"), "{}"))
                .isInstanceOf(PushConfigurationException.class);
    }

    @Test
    void loggingTransportReportsCreated() {
        assertThat(new LoggingPushTransport().deliver(subscription("https://push.example.com/a"), "{}"))
                .isEqualTo(201);
    }

    @Test
    void failureInjectionAppliesOnlyToMatchingEndpoints() {
        FailureInjectingPushTransport transport = new FailureInjectingPushTransport(new LoggingPushTransport());
        ReflectionTestUtils.setField(transport, "endpointPrefix", "https://push.invalid/gone/");
        ReflectionTestUtils.setField(transport, "status", 410);

        assertThat(transport.deliver(subscription("https://push.invalid/gone/e1"), "{}")).isEqualTo(410);
        assertThat(transport.deliver(subscription("https://push.example.com/e2"), "{}")).isEqualTo(201);
    }

    @Test
    void failureInjectionWithoutPrefixPassesEverythingThrough() {
        FailureInjectingPushTransport transport = new FailureInjectingPushTransport(new LoggingPushTransport());
        ReflectionTestUtils.setField(transport, "endpointPrefix", "");
        ReflectionTestUtils.setField(transport, "status", 410);

        assertThat(transport.deliver(subscription("https://push.invalid/gone/e1"), "{}")).isEqualTo(201);
    }

    private static PushSubscription subscription(String endpoint) {
        return new PushSubscription(endpoint, "u1", "p256dh-key", "auth-secret", NOW, NOW);
    }
}
