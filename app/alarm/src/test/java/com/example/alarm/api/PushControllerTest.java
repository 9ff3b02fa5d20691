/*
 * Where: Alarm API tests
 * What: MVC slice for push registration, test sends and error mapping
 */
package com.example.alarm.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alarm.model.DispatchSummary;
import com.example.alarm.repository.SubscriptionRegistry;
import com.example.alarm.service.AlarmScheduler;
import com.example.alarm.service.PushConfigurationException;
import com.example.alarm.service.PushDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PushController.class)
@Import(ApiExceptionHandler.class)
class PushControllerTest {

    private static final String ENDPOINT = "https://fcm.googleapis.com/fcm/send/abc123";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SubscriptionRegistry subscriptionRegistry;

    @MockitoBean
    private PushDispatcher pushDispatcher;

    @MockitoBean
    private AlarmScheduler alarmScheduler;

    @Test
    void subscribeRegistersTheDevice() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-Id", "req-42")
                        .content(subscribeBody("u1", ENDPOINT)))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-42"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("push subscription registered"));

        verify(subscriptionRegistry).upsert(ENDPOINT, "u1", "p256dh-key", "auth-secret");
    }

    @Test
    void subscribeWithoutUserIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscribeBody("", ENDPOINT)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("user_id is required"));

        verifyNoInteractions(subscriptionRegistry);
    }

    @Test
    void subscribeWithoutKeysIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"subscription\":{\"endpoint\":\"" + ENDPOINT + "\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("subscription.keys is required"));
    }

    @Test
    void subscribeWithRelativeEndpointIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscribeBody("u1", "/not/absolute")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("subscription.endpoint must be an absolute URL"));

        verifyNoInteractions(subscriptionRegistry);
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void storeOutageIsServiceUnavailable() throws Exception {
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(subscriptionRegistry).upsert(anyString(), anyString(), anyString(), anyString());

        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscribeBody("u1", ENDPOINT)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_STORE_UNAVAILABLE"));
    }

    @Test
    void unsubscribeRemovesOnlyTheCallersEndpoint() throws Exception {
        when(subscriptionRegistry.removeByUserAndEndpoint("u1", ENDPOINT)).thenReturn(0);

        mockMvc.perform(post("/api/push/unsubscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\",\"endpoint\":\"" + ENDPOINT + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(subscriptionRegistry).removeByUserAndEndpoint("u1", ENDPOINT);
    }

    @Test
    void testPushUsesDefaultTextAndReportsCounts() throws Exception {
        when(pushDispatcher.sendToUser(
                        eq("u1"),
                        eq(PushController.DEFAULT_TEST_TITLE),
                        eq(PushController.DEFAULT_TEST_BODY),
                        any(),
                        anyString()))
                .thenReturn(new DispatchSummary(2, 1));

        mockMvc.perform(post("/api/push/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sent").value(2))
                .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void testPushWithoutDevicesReportsZeroCounts() throws Exception {
        when(pushDispatcher.sendToUser(eq("u2"), eq("hello"), eq("custom body"), any(), anyString()))
                .thenReturn(DispatchSummary.EMPTY);

        mockMvc.perform(post("/api/push/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u2\",\"title\":\"hello\",\"body\":\"custom body\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sent").value(0))
                .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    void testPushWithoutKeysIsReportedAsConfigurationError() throws Exception {
        when(pushDispatcher.sendToUser(eq("u1"), anyString(), anyString(), any(), anyString()))
                .thenThrow(new PushConfigurationException("VAPID key pair is not configured"));

        mockMvc.perform(post("/api/push/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"u1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("PUSH_NOT_CONFIGURED"));
    }

    @Test
    void vapidPublicKeyIsExposed() throws Exception {
        when(pushDispatcher.vapidPublicKey()).thenReturn("BPublicKey");

        mockMvc.perform(get("/api/push/vapid-public-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.publicKey").value("BPublicKey"));
    }

    @Test
    void schedulerStatusReflectsTheLoop() throws Exception {
        when(alarmScheduler.isRunning()).thenReturn(true);

        mockMvc.perform(get("/api/push/scheduler"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true));
    }

    private static String subscribeBody(String userId, String endpoint) {
        return """
                {"user_id":"%s","subscription":{"endpoint":"%s","keys":{"p256dh":"p256dh-key","auth":"auth-secret"}}}
                """.formatted(userId, endpoint);
    }
}
