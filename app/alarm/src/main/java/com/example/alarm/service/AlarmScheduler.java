/*
 * Where: Alarm service layer
 * What: Runs one alarm tick at every wall-clock minute boundary on a Spring TaskScheduler
 * Why: Dose alarms fire on wall-clock minutes; there is no external cron to rely on
 */
package com.example.alarm.service;

import com.example.alarm.config.AlarmSchedulerProperties;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Minute-sampling alarm loop, one instance per process.
 *
 * <p>Each tick is a one-shot task on a single-thread {@link ThreadPoolTaskScheduler}; when it
 * finishes, the task for the following boundary is planned. A failing tick is logged and the next
 * minute is planned as usual. Only a failure to plan the next boundary backs off for
 * {@code alarm.scheduler.error-backoff}.
 *
 * <p>Minutes that pass while the loop is stopped are not replayed: an alarm due during downtime is
 * missed. {@link #stop()} cancels the pending tick at once and returns only after a tick already in
 * progress has finished.
 */
@Component
public class AlarmScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AlarmScheduler.class);
    private static final String THREAD_NAME_PREFIX = "alarm-scheduler-";
    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    private final AlarmTickService tickService;
    private final AlarmSchedulerProperties properties;
    private final Clock clock;

    // true from start() until stop() has seen the worker thread terminate
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lock = new Object();

    // guarded by lock
    private ThreadPoolTaskScheduler taskScheduler;
    private ScheduledFuture<?> pending;
    private boolean active;

    private volatile Instant lastTickAt;

    public AlarmScheduler(AlarmTickService tickService, AlarmSchedulerProperties properties, Clock clock) {
        this.tickService = tickService;
        this.properties = properties;
        this.clock = clock;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.info("alarm scheduler already running");
            return;
        }
        ThreadPoolTaskScheduler scheduler = newTaskScheduler();
        synchronized (lock) {
            taskScheduler = scheduler;
            active = true;
            lastTickAt = null;
            planNextLocked();
        }
        logger.info("alarm scheduler started zone={}", properties.zone());
    }

    public void stop() {
        ThreadPoolTaskScheduler scheduler;
        synchronized (lock) {
            if (!active) {
                return;
            }
            active = false;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            scheduler = taskScheduler;
            taskScheduler = null;
        }
        scheduler.shutdown();
        // the flag is cleared only once no tick can still be running, so start() never overlaps one
        Uninterruptibles.awaitTerminationUninterruptibly(scheduler.getScheduledExecutor());
        running.set(false);
        logger.info("alarm scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void fire(Instant boundary) {
        try {
            synchronized (lock) {
                if (!active) {
                    return;
                }
                lastTickAt = boundary;
            }
            tickService.runTick(boundary);
        } catch (RuntimeException ex) {
            logger.error("alarm tick failed boundary={}", boundary, ex);
        } finally {
            // also reached when the tick throws an Error, so the loop keeps its schedule
            synchronized (lock) {
                planNextLocked();
            }
        }
    }

    private void retryPlanning() {
        synchronized (lock) {
            planNextLocked();
        }
    }

    // caller holds lock
    private void planNextLocked() {
        if (!active) {
            return;
        }
        Instant plannedAt;
        Runnable task;
        try {
            Instant now = Instant.now(clock);
            Instant boundary = nextBoundary(now);
            plannedAt = taskScheduler.getClock().instant().plus(Duration.between(now, boundary));
            task = () -> fire(boundary);
        } catch (RuntimeException ex) {
            logger.error("alarm scheduler could not plan the next tick; backing off {}",
                    properties.errorBackoff(),
                    ex);
            plannedAt = taskScheduler.getClock().instant().plus(properties.errorBackoff());
            task = this::retryPlanning;
        }
        pending = taskScheduler.schedule(task, plannedAt);
    }

    /**
     * The minute boundary after {@code now}, never one already ticked. A clock that moved backwards
     * therefore delays the next tick instead of repeating a minute.
     */
    @VisibleForTesting
    Instant nextBoundary(Instant now) {
        Instant boundary = now.truncatedTo(ChronoUnit.MINUTES).plus(ONE_MINUTE);
        Instant last = lastTickAt;
        if (last != null && !boundary.isAfter(last)) {
            boundary = last.plus(ONE_MINUTE);
        }
        return boundary;
    }

    private static ThreadPoolTaskScheduler newTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.initialize();
        return scheduler;
    }
}
