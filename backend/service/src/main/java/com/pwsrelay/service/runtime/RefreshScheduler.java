package com.pwsrelay.service.runtime;

import com.pwsrelay.acquisition.coordinator.RefreshOutcome;
import com.pwsrelay.acquisition.coordinator.WeatherCoordinator;
import com.pwsrelay.acquisition.error.NotReadyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives each coordinator on its configured interval. Ticks that land while a cycle is still
 * running are dropped by the coordinator's in-flight gate.
 */
public class RefreshScheduler {
    private static final Logger LOGGER = Logger.getLogger(RefreshScheduler.class.getName());

    public enum Phase {
        IDLE,
        REFRESHING
    }

    private final List<WeatherCoordinator> coordinators;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(daemon("pws-timer"));
    private final ExecutorService refreshExecutor = Executors.newCachedThreadPool(daemon("pws-refresh"));

    public RefreshScheduler(List<WeatherCoordinator> coordinators) {
        this(coordinators, 1_000);
    }

    RefreshScheduler(List<WeatherCoordinator> coordinators, long minIntervalMillis) {
        if (coordinators.isEmpty()) {
            throw new IllegalArgumentException("at least one coordinator is required");
        }
        this.coordinators = List.copyOf(coordinators);
        this.minIntervalMillis = minIntervalMillis;
    }

    /**
     * Runs the first refresh of every group in parallel.
     *
     * @throws NotReadyException naming every group that produced no data
     */
    public void firstRefreshAll() {
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (WeatherCoordinator coordinator : coordinators) {
            tasks.add(CompletableFuture.runAsync(coordinator::firstRefresh, refreshExecutor));
        }
        List<String> notReady = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            try {
                tasks.get(i).join();
            } catch (CompletionException e) {
                if (!(e.getCause() instanceof NotReadyException)) {
                    throw e;
                }
                notReady.add(coordinators.get(i).config().groupName());
            }
        }
        if (!notReady.isEmpty()) {
            throw new NotReadyException("Groups not ready after first refresh: " + String.join(", ", notReady));
        }
    }

    public void start() {
        for (WeatherCoordinator coordinator : coordinators) {
            long intervalMillis = Math.max(minIntervalMillis, coordinator.config().refreshInterval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> refreshExecutor.submit(() -> refreshSafely(coordinator)),
                    intervalMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
    }

    public Map<String, RefreshOutcome> runOnce() {
        Map<String, CompletableFuture<RefreshOutcome>> tasks = new LinkedHashMap<>();
        for (WeatherCoordinator coordinator : coordinators) {
            tasks.put(
                    coordinator.config().groupName(),
                    CompletableFuture.supplyAsync(() -> refreshSafely(coordinator), refreshExecutor)
            );
        }
        Map<String, RefreshOutcome> outcomes = new LinkedHashMap<>();
        tasks.forEach((group, task) -> outcomes.put(group, task.join()));
        return outcomes;
    }

    public Phase phase(WeatherCoordinator coordinator) {
        return coordinator.isRefreshing() ? Phase.REFRESHING : Phase.IDLE;
    }

    public List<WeatherCoordinator> coordinators() {
        return coordinators;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        coordinators.forEach(WeatherCoordinator::close);
        refreshExecutor.shutdownNow();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            refreshExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private RefreshOutcome refreshSafely(WeatherCoordinator coordinator) {
        try {
            return coordinator.refresh();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Refresh failed for group " + coordinator.config().groupName(), ex);
            return RefreshOutcome.FAILED;
        }
    }

    static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
