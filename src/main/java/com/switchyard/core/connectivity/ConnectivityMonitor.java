package com.switchyard.core.connectivity;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether the remote backend is reachable.
 * <p>
 * The flag is changed either by an operator (REST/CLI override) or by an optional
 * periodic HTTP probe. Listeners are notified on every transition, on the thread
 * that caused it.
 */
@Service
public class ConnectivityMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityMonitor.class);

    private final ConnectivityProperties properties;
    private final AtomicBoolean online;
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService prober;
    private HttpClient probeClient;

    public ConnectivityMonitor(ConnectivityProperties properties) {
        this.properties = properties;
        this.online = new AtomicBoolean(properties.isInitiallyOnline());
    }

    @PostConstruct
    void startProbe() {
        if (!properties.isProbeEnabled() || properties.getProbeUrl() == null || properties.getProbeUrl().isBlank()) {
            log.info("Connectivity probe disabled; starting {}", online.get() ? "online" : "offline");
            return;
        }
        probeClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getProbeTimeoutMs()))
                .build();
        prober = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "connectivity-probe");
            t.setDaemon(true);
            return t;
        });
        long interval = properties.getProbeIntervalSeconds();
        prober.scheduleWithFixedDelay(this::probe, 0, interval, TimeUnit.SECONDS);
        log.info("Connectivity probe against {} every {}s", properties.getProbeUrl(), interval);
    }

    @PreDestroy
    void stopProbe() {
        if (prober != null) {
            prober.shutdownNow();
        }
    }

    public boolean isOnline() {
        return online.get();
    }

    /**
     * Sets the connectivity state and notifies listeners if it changed.
     *
     * @return {@code true} if the state changed
     */
    public boolean setOnline(boolean value) {
        boolean previous = online.getAndSet(value);
        if (previous == value) {
            return false;
        }
        log.info("Connectivity changed: {}", value ? "ONLINE" : "OFFLINE");
        for (Listener listener : listeners) {
            try {
                listener.onChange(value);
            } catch (Exception e) {
                log.warn("Connectivity listener failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public Subscription addListener(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    void probe() {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getProbeUrl()))
                .timeout(Duration.ofMillis(properties.getProbeTimeoutMs()))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        boolean reachable;
        try {
            HttpResponse<Void> response = probeClient.send(request, HttpResponse.BodyHandlers.discarding());
            reachable = response.statusCode() < 500;
        } catch (IOException e) {
            log.debug("Connectivity probe failed: {}", e.getMessage());
            reachable = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        setOnline(reachable);
    }

    @FunctionalInterface
    public interface Listener {
        void onChange(boolean online);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
