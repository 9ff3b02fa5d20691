package com.example.alarm.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alarm.model.DispatchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class AlarmMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final AlarmMetrics metrics = new AlarmMetrics(registry);

  @Test
  void deliveryOutcomesAreTaggedByResult() {
    metrics.recordDelivery(DispatchResult.DELIVERED);
    metrics.recordDelivery(DispatchResult.DELIVERED);
    metrics.recordDelivery(DispatchResult.PERMANENT_FAILURE);

    assertThat(registry.get(AlarmMetrics.METRIC_DELIVERY_TOTAL).tag("result", "delivered").counter().count())
        .isEqualTo(2.0);
    assertThat(
            registry.get(AlarmMetrics.METRIC_DELIVERY_TOTAL).tag("result", "permanent_failure").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void tickUpdatesCounterAndDueUserGauge() {
    metrics.recordTick(AlarmMetrics.TICK_DISPATCHED, 3);
    assertThat(registry.get(AlarmMetrics.METRIC_TICK_DUE_USERS).gauge().value()).isEqualTo(3.0);

    metrics.recordTick(AlarmMetrics.TICK_IDLE, 0);

    assertThat(registry.get(AlarmMetrics.METRIC_TICK_DUE_USERS).gauge().value()).isZero();
    assertThat(registry.get(AlarmMetrics.METRIC_TICK_TOTAL).tag("result", "dispatched").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get(AlarmMetrics.METRIC_TICK_TOTAL).tag("result", "idle").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void prunedSubscriptionsAreCounted() {
    metrics.recordSubscriptionPruned();

    assertThat(registry.get(AlarmMetrics.METRIC_PRUNED_TOTAL).counter().count()).isEqualTo(1.0);
  }
}
