package com.pwsrelay.acquisition.select;

import com.pwsrelay.acquisition.error.AcquisitionException;
import com.pwsrelay.acquisition.error.FetchTimeoutException;
import com.pwsrelay.acquisition.error.MalformedResponseException;
import com.pwsrelay.acquisition.fetch.SourceFetcher;
import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.SourceFetchFailed;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.SourceStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches every configured source in parallel and picks the highest-priority one that succeeded.
 * All sources are attempted each cycle so that status reporting stays complete.
 */
public final class FallbackSelector {
    private static final Logger LOGGER = Logger.getLogger(FallbackSelector.class.getName());

    private final SourceFetcher fetcher;
    private final Executor executor;
    private final Duration attemptTimeout;
    private final Clock clock;
    private final EventBus eventBus;

    public FallbackSelector(SourceFetcher fetcher, Executor executor, Duration attemptTimeout, Clock clock, EventBus eventBus) {
        this.fetcher = fetcher;
        this.executor = executor;
        this.attemptTimeout = attemptTimeout;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public SelectionResult selectActive(List<SourceConfig> sources, Map<String, SourceStatus> previous) {
        List<CompletableFuture<SourceOutcome>> tasks = sources.stream()
                .map(source -> start(source)
                        .exceptionally(error -> SourceOutcome.failure(source, classify(source, error))))
                .toList();
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

        Instant completedAt = clock.instant();
        Map<String, SourceStatus> statuses = new HashMap<>();
        Map<String, ObservationDocument> documents = new HashMap<>();
        for (CompletableFuture<SourceOutcome> task : tasks) {
            SourceOutcome outcome = task.join();
            SourceConfig source = outcome.source();
            SourceStatus before = previous.getOrDefault(source.id(), SourceStatus.unknown(source));
            if (outcome.succeeded()) {
                statuses.put(source.id(), before.recordSuccess(outcome.document(), completedAt));
                documents.put(source.id(), outcome.document());
            } else {
                AcquisitionException error = outcome.error();
                LOGGER.warning("Failed to fetch data from station " + source.id() + ": " + error.getMessage());
                statuses.put(source.id(), before.recordFailure(error.kind() + ": " + error.getMessage()));
                eventBus.publish(new SourceFetchFailed(completedAt, source.id(), error.kind().name(), error.getMessage()));
            }
        }

        // Stream sort is stable, so equal priorities keep configuration order.
        List<SourceConfig> candidates = sources.stream()
                .filter(source -> documents.containsKey(source.id()))
                .sorted(Comparator.comparingInt(SourceConfig::priority))
                .toList();
        if (candidates.isEmpty()) {
            LOGGER.severe("No stations available - all " + sources.size() + " station(s) failed");
            return new SelectionResult(statuses, candidates, null, null);
        }
        SourceConfig selected = candidates.get(0);
        return new SelectionResult(statuses, candidates, selected, documents.get(selected.id()));
    }

    // The timeout is armed when the attempt starts running, so time spent queued for a thread is not counted.
    private CompletableFuture<SourceOutcome> start(SourceConfig source) {
        PendingAttempt pending = new PendingAttempt(source);
        executor.execute(pending);
        return pending.result;
    }

    /**
     * Fails attempts that an executor dropped before they ran, e.g. the list returned by
     * {@code shutdownNow()}. Without this their results would never complete.
     */
    public static void abandon(List<Runnable> dropped) {
        for (Runnable runnable : dropped) {
            if (runnable instanceof PendingAttempt pending) {
                pending.result.completeExceptionally(new RejectedExecutionException(
                        "Attempt for station " + pending.source.id() + " abandoned before it started"));
            }
        }
    }

    private final class PendingAttempt implements Runnable {
        private final SourceConfig source;
        private final CompletableFuture<SourceOutcome> result = new CompletableFuture<>();

        private PendingAttempt(SourceConfig source) {
            this.source = source;
        }

        @Override
        public void run() {
            result.orTimeout(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                result.complete(attempt(source));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }
    }

    private SourceOutcome attempt(SourceConfig source) {
        ObservationDocument document = fetcher.fetch(source);
        if (document == null) {
            throw new MalformedResponseException("Fetcher returned no document for " + source.id());
        }
        LOGGER.fine("Fetched data from station " + source.id());
        return SourceOutcome.success(source, document);
    }

    private AcquisitionException classify(SourceConfig source, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof AcquisitionException acquisition) {
            return acquisition;
        }
        if (cause instanceof TimeoutException) {
            return new FetchTimeoutException("Station " + source.id() + " did not answer within " + attemptTimeout, cause);
        }
        LOGGER.log(Level.WARNING, "Unexpected failure fetching station " + source.id(), cause);
        return new MalformedResponseException("Unexpected failure: " + rootMessage(cause), cause);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
