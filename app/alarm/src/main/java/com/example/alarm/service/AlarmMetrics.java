/*
 * Where: Alarm service layer
 * What: Records push delivery outcomes, pruned endpoints and tick results
 * Why: Failures isolated inside a tick stay visible on the Prometheus endpoint
 */
package com.example.alarm.service;

import com.example.alarm.model.DispatchResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class AlarmMetrics {

  static final String METRIC_DELIVERY_TOTAL = "alarm.push.delivery.total";
  static final String METRIC_PRUNED_TOTAL = "alarm.push.subscription.pruned.total";
  static final String METRIC_TICK_TOTAL = "alarm.tick.total";
  static final String METRIC_TICK_DUE_USERS = "alarm.tick.due.users";

  public static final String TICK_DISPATCHED = "dispatched";
  public static final String TICK_IDLE = "idle";
  public static final String TICK_STORE_ERROR = "store_error";
  public static final String TICK_ERROR = "error";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger dueUsers = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter prunedCounter;

  public AlarmMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_TICK_DUE_USERS, dueUsers, AtomicInteger::get)
        .description("Users with at least one due dose in the latest tick")
        .register(meterRegistry);
    this.prunedCounter =
        Counter.builder(METRIC_PRUNED_TOTAL)
            .description("Push subscriptions removed after the push service reported them gone")
            .register(meterRegistry);
  }

  public void recordDelivery(DispatchResult result) {
    counter(METRIC_DELIVERY_TOTAL, "Push delivery outcomes", result.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordSubscriptionPruned() {
    prunedCounter.increment();
  }

  public void recordTick(String result, int dueUserCount) {
    counter(METRIC_TICK_TOTAL, "Alarm scheduler ticks", result).increment();
    dueUsers.set(Math.max(dueUserCount, 0));
  }

  private Counter counter(String name, String description, String result) {
    return counters.computeIfAbsent(
        name + "|" + result,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("result", result))
                .register(meterRegistry));
  }
}
