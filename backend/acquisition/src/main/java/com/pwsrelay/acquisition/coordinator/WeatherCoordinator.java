package com.pwsrelay.acquisition.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.acquisition.error.NotReadyException;
import com.pwsrelay.acquisition.fetch.SourceFetcher;
import com.pwsrelay.acquisition.field.ConditionClassifier;
import com.pwsrelay.acquisition.field.FieldAccessor;
import com.pwsrelay.acquisition.forecast.DailyForecast;
import com.pwsrelay.acquisition.forecast.DailyForecastAssembler;
import com.pwsrelay.acquisition.select.FallbackSelector;
import com.pwsrelay.acquisition.select.SelectionResult;
import com.pwsrelay.acquisition.units.UnitTable;
import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.ActiveSourceChanged;
import com.pwsrelay.core.events.DegradedEscalated;
import com.pwsrelay.core.events.RefreshCompleted;
import com.pwsrelay.core.events.RefreshStarted;
import com.pwsrelay.core.model.Coordinates;
import com.pwsrelay.core.model.Quantity;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.SourceStatus;
import com.pwsrelay.core.model.WeatherCondition;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Acquisition coordinator for one group of sources. Consumers only use the pull methods here;
 * {@link #refresh()} is the single writer of {@link CoordinatorState}.
 */
public final class WeatherCoordinator implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(WeatherCoordinator.class.getName());

    private final AcquisitionConfig config;
    private final FallbackSelector selector;
    private final ExecutorService fetchExecutor;
    private final EventBus eventBus;
    private final Clock clock;
    private final LocationState location;
    private final AtomicReference<CoordinatorState> state;
    private final AtomicBoolean refreshing = new AtomicBoolean();
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Object commitLock = new Object();

    public WeatherCoordinator(
            AcquisitionConfig config,
            LocationState location,
            SourceFetcher fetcher,
            EventBus eventBus,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.location = Objects.requireNonNull(location, "location is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        // One thread per source so every attempt starts at once.
        this.fetchExecutor = Executors.newFixedThreadPool(
                config.sources().size(),
                daemonThreads("pws-fetch-" + config.groupName())
        );
        // Current and forecast requests each get the request timeout.
        Duration attemptTimeout = config.requestTimeout().multipliedBy(2).plusSeconds(1);
        this.selector = new FallbackSelector(fetcher, fetchExecutor, attemptTimeout, clock, eventBus);
        this.state = new AtomicReference<>(CoordinatorState.initial(config.sources()));
    }

    /**
     * Builds a coordinator whose fetcher shares the coordinator's location state,
     * e.g. {@code location -> new HttpSourceFetcher(client, config, location)}.
     */
    public static WeatherCoordinator create(
            AcquisitionConfig config,
            Function<LocationState, SourceFetcher> fetcherFactory,
            EventBus eventBus,
            Clock clock
    ) {
        LocationState location = new LocationState(config.fixedCoordinates());
        return new WeatherCoordinator(config, location, fetcherFactory.apply(location), eventBus, clock);
    }

    public RefreshOutcome refresh() {
        if (disposed.get()) {
            return RefreshOutcome.DISPOSED;
        }
        if (!refreshing.compareAndSet(false, true)) {
            LOGGER.fine("Refresh already in flight for " + config.groupName() + "; skipping");
            return RefreshOutcome.SKIPPED;
        }
        try {
            return runCycle();
        } finally {
            refreshing.set(false);
        }
    }

    /**
     * Runs the initial cycle. Throws when no source has ever produced data so the caller
     * can abort setup instead of exposing an empty coordinator.
     */
    public void firstRefresh() {
        RefreshOutcome outcome = refresh();
        if (!isReady()) {
            throw new NotReadyException("No station in group " + config.groupName()
                    + " returned data on first refresh (" + outcome + ")");
        }
    }

    private RefreshOutcome runCycle() {
        Instant startedAt = clock.instant();
        eventBus.publish(new RefreshStarted(startedAt, config.groupName(), config.sources().size()));
        CoordinatorState before = state.get();

        SelectionResult result;
        try {
            result = selector.selectActive(config.sources(), before.statuses());
        } catch (RejectedExecutionException e) {
            if (disposed.get()) {
                return RefreshOutcome.DISPOSED;
            }
            throw e;
        }
        Instant completedAt = clock.instant();
        Map<String, SourceStatus> statuses = new LinkedHashMap<>();
        for (SourceConfig source : config.sources()) {
            statuses.put(source.id(), result.statuses().getOrDefault(source.id(), before.statuses().get(source.id())));
        }
        CoordinatorState next = result.hasSelection()
                ? before.succeeded(statuses, result.selected(), result.document(), completedAt)
                : before.failed(statuses, completedAt);

        synchronized (commitLock) {
            if (disposed.get()) {
                LOGGER.fine("Discarding refresh results for " + config.groupName() + " after disposal");
                return RefreshOutcome.DISPOSED;
            }
            state.set(next);
        }

        publishTransitions(before, next, completedAt);
        eventBus.publish(new RefreshCompleted(
                completedAt,
                config.groupName(),
                next.lastRefreshSucceeded(),
                next.active().map(SourceConfig::id).orElse(null),
                result.candidates().size(),
                Duration.between(startedAt, completedAt).toMillis()
        ));
        return next.lastRefreshSucceeded() ? RefreshOutcome.SUCCEEDED : RefreshOutcome.FAILED;
    }

    private void publishTransitions(CoordinatorState before, CoordinatorState next, Instant at) {
        String previousId = before.active().map(SourceConfig::id).orElse(null);
        String currentId = next.active().map(SourceConfig::id).orElse(null);
        if (next.lastRefreshSucceeded() && !Objects.equals(previousId, currentId)) {
            SourceConfig active = next.activeSource();
            LOGGER.info("Using data from station " + active.id() + " (" + active.displayName() + ")");
            eventBus.publish(new ActiveSourceChanged(at, config.groupName(), previousId, currentId));
        }
        if (next.consecutiveFailures() == config.failureEscalationThreshold()) {
            LOGGER.severe("Group " + config.groupName() + " has failed " + next.consecutiveFailures()
                    + " consecutive refreshes; serving stale data from "
                    + (currentId == null ? "no station" : currentId));
            eventBus.publish(new DegradedEscalated(at, config.groupName(), next.consecutiveFailures()));
        }
    }

    public boolean isReady() {
        return state.get().ready();
    }

    public boolean isRefreshing() {
        return refreshing.get();
    }

    public boolean lastRefreshSucceeded() {
        return state.get().lastRefreshSucceeded();
    }

    public boolean isDegraded() {
        return state.get().degraded();
    }

    public int consecutiveFailures() {
        return state.get().consecutiveFailures();
    }

    public Optional<String> activeSourceId() {
        return state.get().active().map(SourceConfig::id);
    }

    public Optional<SourceConfig> activeSource() {
        return state.get().active();
    }

    public CoordinatorState snapshot() {
        return state.get();
    }

    public Map<String, SourceStatusView> sourceStatuses() {
        CoordinatorState current = state.get();
        String activeId = current.active().map(SourceConfig::id).orElse(null);
        Map<String, SourceStatusView> views = new LinkedHashMap<>();
        for (SourceStatus status : current.statuses().values()) {
            SourceConfig source = status.source();
            views.put(source.id(), new SourceStatusView(
                    source.displayName(),
                    source.priority(),
                    source.id().equals(activeId),
                    status.lastSuccess(),
                    status.state(),
                    status.lastError()
            ));
        }
        return views;
    }

    public FieldAccessor accessor() {
        return state.get().document()
                .map(document -> FieldAccessor.of(document, config.unitSystem()))
                .orElseGet(() -> FieldAccessor.empty(config.unitSystem()));
    }

    public Optional<JsonNode> getCondition(String field) {
        return accessor().condition(field);
    }

    public Optional<JsonNode> getForecast(String field) {
        return getForecast(field, 0);
    }

    public Optional<JsonNode> getForecast(String field, int period) {
        return accessor().forecast(field, period);
    }

    public Optional<WeatherCondition> iconToCondition(Integer iconCode) {
        return ConditionClassifier.iconToCondition(iconCode);
    }

    public Optional<WeatherCondition> currentCondition() {
        FieldAccessor accessor = accessor();
        return accessor.hasDocument() ? ConditionClassifier.currentCondition(accessor) : Optional.empty();
    }

    public List<DailyForecast> dailyForecast() {
        FieldAccessor accessor = accessor();
        return accessor.hasDocument()
                ? DailyForecastAssembler.assemble(accessor, config.calendarDayTemperature())
                : List.of();
    }

    public String unitOf(Quantity quantity) {
        return UnitTable.unitOf(config.unitSystem(), quantity);
    }

    public Optional<Coordinates> coordinates() {
        return location.current();
    }

    public AcquisitionConfig config() {
        return config;
    }

    /**
     * Abandons in-flight fetches; a cycle that is still running will not commit its results.
     */
    @Override
    public void close() {
        boolean first;
        synchronized (commitLock) {
            first = disposed.compareAndSet(false, true);
        }
        if (first) {
            FallbackSelector.abandon(fetchExecutor.shutdownNow());
            LOGGER.fine("Coordinator for " + config.groupName() + " disposed");
        }
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
