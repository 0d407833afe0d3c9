package com.nifty.bulk.client.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Named, cancellable repeating timers on the sync thread. Scheduling a name that is already
 * running replaces it. A task that throws is logged and keeps its schedule.
 */
@Component("syncTimers")
@Slf4j
public class SyncScheduler {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public SyncScheduler(@Qualifier("syncScheduler") TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void scheduleAtFixedRate(String name, Runnable task, Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Timer '{}' failed: {}", name, e.getMessage(), e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, clock.instant().plus(period), period);
        ScheduledFuture<?> prev = timers.put(name, f);
        if (prev != null) {
            prev.cancel(false);
        }
        log.info("Timer '{}' every {}", name, period);
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = timers.remove(name);
        if (f == null) return false;
        f.cancel(false);
        log.info("Timer '{}' cancelled", name);
        return true;
    }

    public void cancelAll() {
        for (String name : timers.keySet()) {
            cancel(name);
        }
    }

    public boolean isScheduled(String name) {
        ScheduledFuture<?> f = timers.get(name);
        return f != null && !f.isCancelled();
    }
}
