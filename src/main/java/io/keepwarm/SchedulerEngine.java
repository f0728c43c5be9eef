package io.keepwarm;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.keepwarm.enums.FailureKind;
import io.keepwarm.enums.RunStatus;
import io.keepwarm.enums.WindowTransition;
import io.keepwarm.metrics.MetricsProvider;
import io.keepwarm.models.ModelStatus;
import io.keepwarm.models.ProbeOutcome;
import io.keepwarm.models.RunState;
import io.keepwarm.models.ScheduleDefinition;
import io.keepwarm.models.ScheduleRecord;
import io.keepwarm.models.TickSummary;
import io.keepwarm.notification.NotificationPublisher;
import io.keepwarm.notification.events.ColdStartEvent;
import io.keepwarm.notification.events.EngineEvent;
import io.keepwarm.notification.events.StartProbeEvent;
import io.keepwarm.notification.events.StatusChangeEvent;
import io.keepwarm.notification.events.TickSummaryEvent;
import io.keepwarm.notification.events.WindowTransitionEvent;
import io.keepwarm.probe.ProbeDispatcher;
import io.keepwarm.schedule.ScheduleValidator;
import io.keepwarm.schedule.WindowPolicy;
import io.keepwarm.store.ScheduleStore;
import io.keepwarm.store.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import static io.keepwarm.metrics.MetricsConstants.*;

/**
 * Owns every model's schedule and run state, evaluates which models are due on each tick
 * and dispatches their probes concurrently.
 *
 * Threading model:
 * - {@link #tick()} calls are serialized by a tick lock; each tick fans out probes on a bounded
 *   pool, joins them and only then persists and emits events.
 * - the model map is guarded by a short mutex; ticks work on copies taken under it, so control
 *   operations apply to the next tick.
 * - a model never has two probes running at once. A probe abandoned after the probe timeout
 *   keeps its model in flight until the underlying call returns.
 * - START, STOP and remove move a model to a new generation; a probe result from an older
 *   generation is discarded.
 * - the first probe after a window opened is reported as the model's daily cold start.
 * - store writes are serialized by a persist lock and always write the latest state.
 */
@Slf4j
public class SchedulerEngine implements AutoCloseable {

    private final ScheduleStore store;
    private final ProbeDispatcher dispatcher;
    private final NotificationPublisher publisher;
    private final WindowPolicy windowPolicy;
    private final ScheduleValidator validator;
    private final MetricsProvider metricsProvider;
    private final EngineSettings settings;
    private final Clock clock;

    private final Object mutex = new Object();
    private final Object persistLock = new Object();
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicLong generations = new AtomicLong();
    private final ExecutorService probePool;

    // guarded by mutex
    private final Map<String, Entry> entries = new TreeMap<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Set<String> pendingDeletes = new LinkedHashSet<>();

    public SchedulerEngine(ScheduleStore store, ProbeDispatcher dispatcher, NotificationPublisher publisher,
                           WindowPolicy windowPolicy, ScheduleValidator validator, MetricsProvider metricsProvider,
                           EngineSettings settings, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.publisher = publisher;
        this.windowPolicy = windowPolicy;
        this.validator = validator;
        this.metricsProvider = metricsProvider;
        this.settings = settings;
        this.clock = clock;
        this.probePool = Executors.newFixedThreadPool(settings.getMaxConcurrentProbes(),
            new ThreadFactoryBuilder().setNameFormat("keepwarm-probe-%d").setDaemon(true).build());
    }

    /**
     * Loads all persisted records. Malformed records are skipped by the store.
     */
    public void initialize() throws StoreException {
        Map<String, ScheduleRecord> records = store.load();
        synchronized (mutex) {
            entries.clear();
            for (Map.Entry<String, ScheduleRecord> record : records.entrySet()) {
                entries.put(record.getKey(), new Entry(record.getValue().getDefinition(),
                    record.getValue().getState(), generations.incrementAndGet()));
            }
        }
        log.info("SchedulerEngine initialized with {} model(s)", records.size());
        updateErrorGauge();
    }

    /**
     * Runs one scheduling pass: evaluates every enabled model, probes the due ones,
     * applies the outcomes, persists and emits events. Safe to call at any frequency.
     */
    public TickSummary tick() {
        tickLock.lock();
        try {
            return runTick();
        } finally {
            tickLock.unlock();
        }
    }

    private TickSummary runTick() {
        Instant now = clock.instant();
        retryPendingWrites();

        List<EngineEvent> events = new ArrayList<>();
        List<Dispatch> dispatches = new ArrayList<>();
        Set<String> touched = new LinkedHashSet<>();
        int evaluated = 0;
        int skippedInFlight = 0;

        synchronized (mutex) {
            for (Map.Entry<String, Entry> e : entries.entrySet()) {
                String modelId = e.getKey();
                Entry entry = e.getValue();
                if (!entry.definition.isEnabled()) {
                    entry.coldStartPending = false;
                    if (entry.state.isWindowOpen()) {
                        entry.state.setWindowOpen(false);
                        entry.markDirty();
                        touched.add(modelId);
                    }
                    continue;
                }
                evaluated++;

                boolean open;
                try {
                    open = windowPolicy.isInWindow(entry.definition, now);
                } catch (RuntimeException ex) {
                    log.error("[Model: {}] Failed to evaluate window, skipping: {}", modelId, ex.getMessage(), ex);
                    continue;
                }
                if (open != entry.state.isWindowOpen()) {
                    entry.state.setWindowOpen(open);
                    entry.coldStartPending = open;
                    entry.markDirty();
                    touched.add(modelId);
                    events.add(windowEvent(entry.definition, open ? WindowTransition.OPENED : WindowTransition.CLOSED, now));
                }

                if (!windowPolicy.isDue(entry.definition, entry.state, now)) {
                    continue;
                }
                if (inFlight.contains(modelId)) {
                    log.warn("[Model: {}] Due but previous probe is still in flight, skipping", modelId);
                    skippedInFlight++;
                    continue;
                }
                inFlight.add(modelId);
                dispatches.add(new Dispatch(modelId, entry.generation, entry.definition.copy(), entry.coldStartPending));
                entry.coldStartPending = false;
            }
        }

        log.debug("Tick at {}: {} enabled, {} due, {} skipped in flight", now, evaluated, dispatches.size(), skippedInFlight);

        List<CompletableFuture<ProbeOutcome>> futures = new ArrayList<>();
        for (Dispatch dispatch : dispatches) {
            futures.add(dispatchBounded(dispatch));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int succeeded = 0;
        int failed = 0;
        int discarded = 0;
        for (int i = 0; i < dispatches.size(); i++) {
            Dispatch dispatch = dispatches.get(i);
            ProbeOutcome outcome = futures.get(i).join();
            recordProbeMetrics(dispatch.modelId, outcome);
            StatusChangeEvent change;
            synchronized (mutex) {
                Entry entry = entries.get(dispatch.modelId);
                if (entry == null || entry.generation != dispatch.generation) {
                    log.info("[Model: {}] Discarding probe result ({}), model was stopped, restarted or removed",
                        dispatch.modelId, outcome.label());
                    discarded++;
                    continue;
                }
                change = applyOutcome(dispatch.modelId, entry, outcome, now);
                touched.add(dispatch.modelId);
            }
            if (outcome.isSuccess()) {
                succeeded++;
            } else {
                failed++;
            }
            if (change != null) {
                events.add(change);
            }
            if (dispatch.coldStart) {
                events.add(coldStartEvent(dispatch, outcome, now));
            }
        }

        for (String modelId : touched) {
            persist(modelId);
        }

        TickSummary summary = TickSummary.builder()
            .tickAt(now)
            .evaluated(evaluated)
            .due(dispatches.size())
            .succeeded(succeeded)
            .failed(failed)
            .skippedInFlight(skippedInFlight)
            .discarded(discarded)
            .build();

        metricsProvider.counter(TICK_TOTAL_METRIC_NAME, new HashMap<>()).increment();
        updateErrorGauge();

        events.forEach(publisher::publish);
        publisher.publish(new TickSummaryEvent(summary));
        log.info("Tick completed: evaluated={}, due={}, succeeded={}, failed={}, skipped={}, discarded={}",
            evaluated, dispatches.size(), succeeded, failed, skippedInFlight, discarded);
        return summary;
    }

    /**
     * Enables the model, resets its failure count, marks it RUNNING and probes it once right away,
     * regardless of its window.
     *
     * @return the run state after the immediate probe
     * @throws ModelNotFoundException if the model is unknown
     */
    public RunState start(String modelId) {
        Instant now = clock.instant();
        Dispatch dispatch = null;
        StatusChangeEvent startChange;
        synchronized (mutex) {
            Entry entry = require(modelId);
            RunStatus oldStatus = entry.state.getStatus();
            entry.definition.setEnabled(true);
            entry.state.setConsecutiveFailures(0);
            entry.state.setStatus(RunStatus.RUNNING);
            entry.generation = generations.incrementAndGet();
            entry.markDirty();
            startChange = statusChange(modelId, entry, oldStatus, now);
            if (inFlight.contains(modelId)) {
                log.warn("[Model: {}] Started while a previous probe is still in flight, initial probe skipped", modelId);
            } else {
                inFlight.add(modelId);
                dispatch = new Dispatch(modelId, entry.generation, entry.definition.copy(), false);
            }
        }
        log.info("[Model: {}] Started", modelId);
        persist(modelId);
        if (startChange != null) {
            publisher.publish(startChange);
        }
        if (dispatch == null) {
            return getModel(modelId).getState();
        }

        ProbeOutcome outcome = dispatchBounded(dispatch).join();
        recordProbeMetrics(modelId, outcome);
        StatusChangeEvent change = null;
        RunState result;
        synchronized (mutex) {
            Entry entry = entries.get(modelId);
            if (entry == null) {
                throw new ModelNotFoundException(modelId);
            }
            if (entry.generation == dispatch.generation) {
                change = applyOutcome(modelId, entry, outcome, now);
            } else {
                log.info("[Model: {}] Discarding start probe result, model changed meanwhile", modelId);
            }
            result = entry.state.copy();
        }
        persist(modelId);
        updateErrorGauge();
        if (change != null) {
            publisher.publish(change);
        }
        publisher.publish(StartProbeEvent.builder()
            .modelId(modelId)
            .targetUrl(dispatch.definition.getTargetUrl())
            .outcome(outcome)
            .fromTime(dispatch.definition.getFromTime())
            .toTime(dispatch.definition.getToTime())
            .timezone(dispatch.definition.getTimezone())
            .intervalMinutes(dispatch.definition.getIntervalMinutes())
            .timestamp(clock.instant())
            .build());
        return result;
    }

    /**
     * Disables the model and marks it STOPPED. The run state is kept; an in-flight probe result
     * will be discarded.
     *
     * @throws ModelNotFoundException if the model is unknown
     */
    public RunState stop(String modelId) {
        StatusChangeEvent change;
        RunState result;
        synchronized (mutex) {
            Entry entry = require(modelId);
            RunStatus oldStatus = entry.state.getStatus();
            entry.definition.setEnabled(false);
            entry.state.setStatus(RunStatus.STOPPED);
            entry.generation = generations.incrementAndGet();
            entry.markDirty();
            change = statusChange(modelId, entry, oldStatus, clock.instant());
            result = entry.state.copy();
        }
        log.info("[Model: {}] Stopped", modelId);
        persist(modelId);
        updateErrorGauge();
        if (change != null) {
            publisher.publish(change);
        }
        return result;
    }

    /**
     * Validates and stores a schedule. New models start IDLE and disabled; an existing
     * model keeps its enabled flag and run state.
     *
     * @throws io.keepwarm.schedule.InvalidScheduleException if the definition is invalid
     */
    public ModelStatus addOrUpdate(ScheduleDefinition definition) {
        ScheduleDefinition candidate = definition.copy();
        if (candidate.getTimezone() == null || candidate.getTimezone().isBlank()) {
            candidate.setTimezone(settings.getDefaultTimezone());
        }
        validator.validate(candidate);
        candidate.setUpdatedAt(clock.instant());

        String modelId = candidate.getModelId();
        ModelStatus status;
        synchronized (mutex) {
            Entry existing = entries.get(modelId);
            if (existing == null) {
                candidate.setEnabled(false);
                Entry created = new Entry(candidate, RunState.idle(), generations.incrementAndGet());
                created.markDirty();
                entries.put(modelId, created);
                pendingDeletes.remove(modelId);
                log.info("[Model: {}] Added schedule {} ~ {} {} every {} min", modelId,
                    candidate.getFromTime(), candidate.getToTime(), candidate.getTimezone(), candidate.getIntervalMinutes());
            } else {
                candidate.setEnabled(existing.definition.isEnabled());
                existing.definition = candidate;
                existing.markDirty();
                log.info("[Model: {}] Updated schedule {} ~ {} {} every {} min", modelId,
                    candidate.getFromTime(), candidate.getToTime(), candidate.getTimezone(), candidate.getIntervalMinutes());
            }
            Entry entry = entries.get(modelId);
            status = new ModelStatus(modelId, entry.definition.copy(), entry.state.copy());
        }
        persist(modelId);
        return status;
    }

    /**
     * Forgets the model in memory and in the store.
     *
     * @throws ModelNotFoundException if the model is unknown
     */
    public void remove(String modelId) {
        synchronized (mutex) {
            require(modelId);
            entries.remove(modelId);
            pendingDeletes.add(modelId);
        }
        log.info("[Model: {}] Removed", modelId);
        deletePending(modelId);
        updateErrorGauge();
    }

    /**
     * Copies of every model sorted by model id.
     */
    public List<ModelStatus> getStatus() {
        synchronized (mutex) {
            List<ModelStatus> statuses = new ArrayList<>(entries.size());
            entries.forEach((modelId, entry) ->
                statuses.add(new ModelStatus(modelId, entry.definition.copy(), entry.state.copy())));
            return statuses;
        }
    }

    public ModelStatus getModel(String modelId) {
        synchronized (mutex) {
            Entry entry = require(modelId);
            return new ModelStatus(modelId, entry.definition.copy(), entry.state.copy());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down SchedulerEngine probe pool");
        probePool.shutdownNow();
        try {
            if (!probePool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Probe pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Submits a probe and bounds the caller's wait by the probe timeout. The in-flight mark is
     * released only when the underlying probe finishes, even after the caller gave up on it.
     */
    private CompletableFuture<ProbeOutcome> dispatchBounded(Dispatch dispatch) {
        CompletableFuture<ProbeOutcome> probe;
        try {
            probe = CompletableFuture.supplyAsync(
                () -> dispatcher.send(dispatch.definition).withCompletedAt(clock.instant()), probePool);
        } catch (RejectedExecutionException e) {
            releaseInFlight(dispatch.modelId);
            log.warn("[Model: {}] Probe rejected, engine is shutting down", dispatch.modelId);
            return CompletableFuture.completedFuture(
                ProbeOutcome.failure(FailureKind.TRANSIENT, "Probe rejected: engine shutting down", 0));
        }
        probe.whenComplete((outcome, error) -> releaseInFlight(dispatch.modelId));

        long timeoutSeconds = settings.getProbeTimeout().getSeconds();
        return probe
            .exceptionally(error -> {
                log.error("[Model: {}] Probe task failed unexpectedly: {}", dispatch.modelId, error.getMessage(), error);
                return ProbeOutcome.failure(FailureKind.TRANSIENT, "Unexpected probe error: " + error.getMessage(), 0);
            })
            .completeOnTimeout(
                ProbeOutcome.failure(FailureKind.TIMEOUT, "Probe exceeded timeout of " + timeoutSeconds + "s", 0),
                settings.getProbeTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((outcome, error) -> {
                if (outcome != null && outcome.isFailure(FailureKind.TIMEOUT) && !probe.isDone()) {
                    log.warn("[Model: {}] Probe abandoned after {}s, model stays in flight until it returns",
                        dispatch.modelId, timeoutSeconds);
                }
            });
    }

    private void releaseInFlight(String modelId) {
        synchronized (mutex) {
            inFlight.remove(modelId);
        }
    }

    // caller holds mutex
    private StatusChangeEvent applyOutcome(String modelId, Entry entry, ProbeOutcome outcome, Instant fireAt) {
        RunState state = entry.state;
        RunStatus oldStatus = state.getStatus();
        int threshold = settings.getFailureThreshold();
        state.setLastFireAt(fireAt);

        if (outcome.isSuccess()) {
            state.setStatus(RunStatus.RUNNING);
            state.setLastSuccessAt(outcome.getCompletedAt() != null ? outcome.getCompletedAt() : clock.instant());
            state.setConsecutiveFailures(0);
            state.setLastErrorMessage(null);
            state.setLastFailureKind(null);
            state.setLastLatencyMillis(outcome.getLatencyMillis());
        } else {
            FailureKind kind = outcome.getFailureKind();
            state.setLastFailureKind(kind);
            state.setLastErrorMessage(outcome.getMessage());
            if (kind == FailureKind.COLD_START) {
                state.setConsecutiveFailures(Math.min(state.getConsecutiveFailures() + 1, Math.max(threshold - 1, 0)));
                if (oldStatus != RunStatus.ERROR) {
                    state.setStatus(RunStatus.RUNNING);
                }
                log.info("[Model: {}] Endpoint is cold starting, failure count held at {}", modelId, state.getConsecutiveFailures());
            } else {
                state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
                if (kind == FailureKind.AUTH_FAILURE || state.getConsecutiveFailures() >= threshold) {
                    state.setStatus(RunStatus.ERROR);
                } else if (oldStatus != RunStatus.ERROR) {
                    state.setStatus(RunStatus.RUNNING);
                }
                log.warn("[Model: {}] Probe failed ({}), consecutive failures {}/{}",
                    modelId, kind, state.getConsecutiveFailures(), threshold);
            }
        }
        entry.markDirty();
        return statusChange(modelId, entry, oldStatus, clock.instant());
    }

    private StatusChangeEvent statusChange(String modelId, Entry entry, RunStatus oldStatus, Instant at) {
        RunStatus newStatus = entry.state.getStatus();
        if (oldStatus == newStatus) {
            return null;
        }
        log.info("[Model: {}] Status {} -> {}", modelId, oldStatus, newStatus);
        return StatusChangeEvent.builder()
            .modelId(modelId)
            .targetUrl(entry.definition.getTargetUrl())
            .oldStatus(oldStatus)
            .newStatus(newStatus)
            .failureKind(newStatus == RunStatus.ERROR ? entry.state.getLastFailureKind() : null)
            .errorDetail(newStatus == RunStatus.ERROR ? entry.state.getLastErrorMessage() : null)
            .consecutiveFailures(entry.state.getConsecutiveFailures())
            .timestamp(at)
            .build();
    }

    private ColdStartEvent coldStartEvent(Dispatch dispatch, ProbeOutcome outcome, Instant firedAt) {
        return ColdStartEvent.builder()
            .modelId(dispatch.modelId)
            .targetUrl(dispatch.definition.getTargetUrl())
            .outcome(outcome)
            .maxAttempts(dispatcher.getMaxAttempts())
            .firedAt(firedAt)
            .completedAt(outcome.getCompletedAt())
            .timezone(dispatch.definition.getTimezone())
            .timestamp(clock.instant())
            .build();
    }

    private WindowTransitionEvent windowEvent(ScheduleDefinition definition, WindowTransition transition, Instant at) {
        return WindowTransitionEvent.builder()
            .modelId(definition.getModelId())
            .targetUrl(definition.getTargetUrl())
            .transition(transition)
            .fromTime(definition.getFromTime())
            .toTime(definition.getToTime())
            .timezone(definition.getTimezone())
            .intervalMinutes(definition.getIntervalMinutes())
            .timestamp(at)
            .build();
    }

    /**
     * Writes the latest state of the model. On failure the model stays dirty and the write
     * is retried at the start of the next tick.
     */
    private void persist(String modelId) {
        synchronized (persistLock) {
            ScheduleDefinition definition;
            RunState state;
            long version;
            synchronized (mutex) {
                Entry entry = entries.get(modelId);
                if (entry == null || !entry.dirty) {
                    return;
                }
                definition = entry.definition.copy();
                state = entry.state.copy();
                version = entry.version;
            }
            try {
                store.save(modelId, definition, state);
                synchronized (mutex) {
                    Entry entry = entries.get(modelId);
                    if (entry != null && entry.version == version) {
                        entry.dirty = false;
                    }
                }
            } catch (StoreException e) {
                log.warn("[Model: {}] Degraded mode: failed to persist record, will retry next tick: {}",
                    modelId, e.getMessage());
            }
        }
    }

    private void deletePending(String modelId) {
        synchronized (persistLock) {
            synchronized (mutex) {
                if (!pendingDeletes.contains(modelId) || entries.containsKey(modelId)) {
                    pendingDeletes.remove(modelId);
                    return;
                }
            }
            try {
                store.delete(modelId);
                synchronized (mutex) {
                    pendingDeletes.remove(modelId);
                }
            } catch (StoreException e) {
                log.warn("[Model: {}] Degraded mode: failed to delete record, will retry next tick: {}",
                    modelId, e.getMessage());
            }
        }
    }

    private void retryPendingWrites() {
        List<String> dirty = new ArrayList<>();
        List<String> deletes;
        synchronized (mutex) {
            entries.forEach((modelId, entry) -> {
                if (entry.dirty) {
                    dirty.add(modelId);
                }
            });
            deletes = new ArrayList<>(pendingDeletes);
        }
        if (!dirty.isEmpty() || !deletes.isEmpty()) {
            log.info("Retrying {} pending save(s) and {} pending delete(s)", dirty.size(), deletes.size());
        }
        dirty.forEach(this::persist);
        deletes.forEach(this::deletePending);
    }

    private void recordProbeMetrics(String modelId, ProbeOutcome outcome) {
        Map<String, String> tags = new HashMap<>();
        tags.put(MODEL_ID_TAG, modelId);
        tags.put(OUTCOME_TAG, outcome.label());
        metricsProvider.counter(PROBE_TOTAL_METRIC_NAME, tags).increment();
        if (outcome.isSuccess() && outcome.getLatencyMillis() != null) {
            Map<String, String> latencyTags = new HashMap<>();
            latencyTags.put(MODEL_ID_TAG, modelId);
            metricsProvider.timer(PROBE_LATENCY_METRIC_NAME, latencyTags)
                .record(outcome.getLatencyMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void updateErrorGauge() {
        long inError;
        synchronized (mutex) {
            inError = entries.values().stream().filter(e -> e.state.getStatus() == RunStatus.ERROR).count();
        }
        metricsProvider.gauge(MODELS_IN_ERROR_METRIC_NAME, inError, new HashMap<>());
    }

    // caller holds mutex
    private Entry require(String modelId) {
        Entry entry = entries.get(modelId);
        if (entry == null) {
            throw new ModelNotFoundException(modelId);
        }
        return entry;
    }

    private static final class Entry {
        private ScheduleDefinition definition;
        private final RunState state;
        private long generation;
        private long version;
        private boolean dirty;
        // set when the window opens, cleared by the next dispatch
        private boolean coldStartPending;

        private Entry(ScheduleDefinition definition, RunState state, long generation) {
            this.definition = definition;
            this.state = state != null ? state : RunState.idle();
            this.generation = generation;
        }

        private void markDirty() {
            version++;
            dirty = true;
        }
    }

    private static final class Dispatch {
        private final String modelId;
        private final long generation;
        private final ScheduleDefinition definition;
        private final boolean coldStart;

        private Dispatch(String modelId, long generation, ScheduleDefinition definition, boolean coldStart) {
            this.modelId = modelId;
            this.generation = generation;
            this.definition = definition;
            this.coldStart = coldStart;
        }
    }
}
