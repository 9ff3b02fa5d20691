/*
 * Where: Alarm service layer
 * What: CI/test-only transport answering a fixed HTTP status for matching endpoints
 * Why: Reproduces expired and failing endpoints end to end without touching the dispatch code
 */
package com.example.alarm.service;

import com.example.alarm.model.PushSubscription;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(prefix = "alarm.push.failure-injection", name = "enabled", havingValue = "true")
public class FailureInjectingPushTransport implements PushTransport {

  private final LoggingPushTransport delegate;

  @Value("${alarm.push.failure-injection.endpoint-prefix:}")
  private String endpointPrefix;

  @Value("${alarm.push.failure-injection.status:410}")
  private int status;

  @Override
  public int deliver(PushSubscription subscription, String payloadJson) {
    if (shouldInjectFailure(subscription.endpoint())) {
      return status;
    }
    return delegate.deliver(subscription, payloadJson);
  }

  private boolean shouldInjectFailure(String endpoint) {
    if (endpointPrefix == null || endpointPrefix.isBlank()) {
      return false;
    }
    return endpoint.startsWith(endpointPrefix);
  }
}
