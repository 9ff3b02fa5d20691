/*
 * Where: Alarm service layer
 * What: One scheduler tick: snapshot schedules, match the minute, dispatch per user
 * Why: A failing user or store read is contained to this tick and never reaches the loop
 */
package com.example.alarm.service;

import com.example.alarm.config.AlarmDispatchConfig;
import com.example.alarm.model.DispatchSummary;
import com.example.alarm.model.DosageScheduleEntry;
import com.example.alarm.model.NotificationJob;
import com.example.alarm.model.TickReport;
import com.example.alarm.repository.ScheduleStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class AlarmTickService {

  private static final Logger logger = LoggerFactory.getLogger(AlarmTickService.class);
  private static final String MDC_ALARM_MINUTE = "alarm_minute";

  private final ScheduleStore scheduleStore;
  private final AlarmMatcher matcher;
  private final AlarmNotificationFactory notificationFactory;
  private final PushDispatcher dispatcher;
  private final AlarmMetrics metrics;
  private final ExecutorService executor;

  public AlarmTickService(
      ScheduleStore scheduleStore,
      AlarmMatcher matcher,
      AlarmNotificationFactory notificationFactory,
      PushDispatcher dispatcher,
      AlarmMetrics metrics,
      @Qualifier(AlarmDispatchConfig.DISPATCH_EXECUTOR) ExecutorService executor) {
    this.scheduleStore = scheduleStore;
    this.matcher = matcher;
    this.notificationFactory = notificationFactory;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
    this.executor = executor;
  }

  public TickReport runTick(Instant at) {
    final String minute = matcher.minuteOf(at);
    MDC.put(MDC_ALARM_MINUTE, minute);
    try {
      return dispatchDue(minute, at);
    } catch (RuntimeException ex) {
      // the next minute is planned regardless; a failed tick only costs this one
      logger.error("alarm tick failed minute={}", minute, ex);
      metrics.recordTick(AlarmMetrics.TICK_ERROR, 0);
      return TickReport.idle(minute);
    } finally {
      MDC.remove(MDC_ALARM_MINUTE);
    }
  }

  private TickReport dispatchDue(String minute, Instant at) {
    final List<DosageScheduleEntry> entries;
    try {
      entries = scheduleStore.listAllActiveEntries();
    } catch (DataAccessException ex) {
      logger.error("alarm tick skipped; schedule store unavailable minute={}", minute, ex);
      metrics.recordTick(AlarmMetrics.TICK_STORE_ERROR, 0);
      return TickReport.idle(minute);
    }

    final Map<String, List<DosageScheduleEntry>> dueByUser = matcher.match(entries, at);
    logger.info("alarm check minute={} zone={} entries={} dueUsers={}",
        minute, matcher.zone(), entries.size(), dueByUser.size());
    if (dueByUser.isEmpty()) {
      metrics.recordTick(AlarmMetrics.TICK_IDLE, 0);
      return TickReport.idle(minute);
    }

    final List<CompletableFuture<UserDispatch>> pending = new ArrayList<>(dueByUser.size());
    for (Map.Entry<String, List<DosageScheduleEntry>> due : dueByUser.entrySet()) {
      pending.add(submit(minute, due.getKey(), due.getValue()));
    }

    DispatchSummary total = DispatchSummary.EMPTY;
    int erroredUsers = 0;
    for (CompletableFuture<UserDispatch> future : pending) {
      final UserDispatch result = future.join();
      total = total.plus(result.summary());
      if (result.errored()) {
        erroredUsers++;
      }
    }
    metrics.recordTick(AlarmMetrics.TICK_DISPATCHED, dueByUser.size());
    final TickReport report =
        new TickReport(minute, dueByUser.size(), total.sent(), total.failed(), erroredUsers);
    logger.info("alarm tick finished minute={} dueUsers={} sent={} failed={} erroredUsers={}",
        minute, report.dueUsers(), report.sent(), report.failed(), report.erroredUsers());
    return report;
  }

  private CompletableFuture<UserDispatch> submit(
      String minute, String userId, List<DosageScheduleEntry> entries) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    try {
      return CompletableFuture.supplyAsync(
          () -> withMdc(mdc, () -> dispatchUser(minute, userId, entries)), executor);
    } catch (RejectedExecutionException ex) {
      logger.error("alarm dispatch rejected userId={} minute={}", userId, minute, ex);
      return CompletableFuture.completedFuture(UserDispatch.ERRORED);
    }
  }

  private UserDispatch dispatchUser(String minute, String userId, List<DosageScheduleEntry> entries) {
    try {
      final NotificationJob job = notificationFactory.create(userId, minute, entries);
      final DispatchSummary summary = dispatcher.sendToUser(job);
      logger.info("alarm dispatched userId={} minute={} medicines={} sent={} failed={}",
          userId, minute, entries.size(), summary.sent(), summary.failed());
      return new UserDispatch(summary, false);
    } catch (RuntimeException ex) {
      // isolated per user; the other users of this tick still get their alarm
      logger.error("alarm dispatch failed userId={} minute={}", userId, minute, ex);
      return UserDispatch.ERRORED;
    }
  }

  private static <T> T withMdc(Map<String, String> mdc, Supplier<T> work) {
    final Map<String, String> previous = MDC.getCopyOfContextMap();
    if (mdc == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(mdc);
    }
    try {
      return work.get();
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private record UserDispatch(DispatchSummary summary, boolean errored) {
    static final UserDispatch ERRORED = new UserDispatch(DispatchSummary.EMPTY, true);
  }
}
