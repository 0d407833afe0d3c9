package com.nifty.bulk.client.service.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SSE hub for the view layer.
 * <p>
 * Topics: "session.state", "session.notice", "ledger.balance", "portfolio.valuation".
 * A subscription ending in ".*" matches every topic with that prefix.
 * A heartbeat event goes out while at least one listener is connected.
 */
@Service
@Slf4j
public class StreamGateway {

    private static final long DEFAULT_TIMEOUT_MS = 30L * 60L * 1000L;
    private static final Duration HEARTBEAT_EVERY = Duration.ofSeconds(20);

    private final TaskScheduler scheduler;
    private final Map<String, Listener> listeners = new ConcurrentHashMap<>();
    private final AtomicReference<ScheduledFuture<?>> heartbeat = new AtomicReference<>();

    public StreamGateway(@Qualifier("syncScheduler") TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    private static final class Listener {
        final SseEmitter emitter;
        final Set<String> exact;
        final Set<String> prefixes; // stored with the trailing '.'

        Listener(SseEmitter emitter, Set<String> exact, Set<String> prefixes) {
            this.emitter = emitter;
            this.exact = exact;
            this.prefixes = prefixes;
        }

        boolean wants(String topic) {
            if (exact.contains(topic)) return true;
            for (String p : prefixes) {
                if (topic.startsWith(p)) return true;
            }
            return false;
        }
    }

    /** Broadcast to every listener of the topic. Broken emitters are pruned. */
    public <T> void send(String topic, T payload) {
        if (!StringUtils.hasText(topic) || listeners.isEmpty()) return;
        for (Map.Entry<String, Listener> e : listeners.entrySet()) {
            if (!e.getValue().wants(topic)) continue;
            try {
                e.getValue().emitter.send(SseEmitter.event().name(topic).data(payload));
            } catch (IOException | IllegalStateException ex) {
                log.debug("SSE send failed; pruning listener {}", e.getKey(), ex);
                remove(e.getKey());
            }
        }
    }

    /**
     * @param timeoutMs null or <=0 uses 30 minutes
     * @param topics    exact topics and/or "prefix.*" patterns
     */
    public SseEmitter subscribe(@Nullable Long timeoutMs, Collection<String> topics) {
        long to = (timeoutMs == null || timeoutMs <= 0) ? DEFAULT_TIMEOUT_MS : timeoutMs;
        SseEmitter emitter = new SseEmitter(to);
        String id = UUID.randomUUID().toString();

        Set<String> exact = new LinkedHashSet<>();
        Set<String> prefixes = new LinkedHashSet<>();
        if (topics != null) {
            for (String raw : topics) {
                if (!StringUtils.hasText(raw)) continue;
                String t = raw.trim();
                if (t.endsWith(".*")) {
                    prefixes.add(t.substring(0, t.length() - 1));
                } else {
                    exact.add(t);
                }
            }
        }
        listeners.put(id, new Listener(emitter, exact, prefixes));

        emitter.onCompletion(() -> remove(id));
        emitter.onTimeout(() -> remove(id));
        emitter.onError(e -> remove(id));

        try {
            emitter.send(SseEmitter.event().name("init").data("ok"));
        } catch (IOException e) {
            log.debug("SSE init failed for {}", id, e);
            remove(id);
        }
        startHeartbeat();
        return emitter;
    }

    public SseEmitter subscribeCsv(@Nullable Long timeoutMs, @Nullable String csvTopics) {
        List<String> subs = new ArrayList<>();
        if (StringUtils.hasText(csvTopics)) {
            for (String s : csvTopics.split(",")) {
                if (StringUtils.hasText(s)) subs.add(s.trim());
            }
        }
        return subscribe(timeoutMs, subs);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    private void remove(String id) {
        Listener l = listeners.remove(id);
        if (l == null) return;
        try {
            l.emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter {} already completed", id);
        }
    }

    private void beat() {
        for (Map.Entry<String, Listener> e : listeners.entrySet()) {
            try {
                e.getValue().emitter.send(SseEmitter.event().name("heartbeat").data("ok"));
            } catch (IOException | IllegalStateException ex) {
                remove(e.getKey());
            }
        }
    }

    private void startHeartbeat() {
        if (heartbeat.get() != null) return;
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(this::beat, HEARTBEAT_EVERY);
        if (!heartbeat.compareAndSet(null, f)) {
            f.cancel(false);
            return;
        }
        log.info("SSE heartbeat every {}s", HEARTBEAT_EVERY.getSeconds());
    }
}
