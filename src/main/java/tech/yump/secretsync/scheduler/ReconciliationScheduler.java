package tech.yump.secretsync.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.yump.secretsync.cluster.ObjectKey;
import tech.yump.secretsync.provider.ValidationResult;
import tech.yump.secretsync.provider.error.ErrorKind;
import tech.yump.secretsync.provider.error.SecretSyncException;
import tech.yump.secretsync.provider.error.SyncTimeoutException;
import tech.yump.secretsync.sink.SyncOutcome;
import tech.yump.secretsync.sink.SyncResultSink;
import tech.yump.secretsync.store.StoreKey;
import tech.yump.secretsync.sync.PushedRef;
import tech.yump.secretsync.sync.SecretSyncDefinition;
import tech.yump.secretsync.sync.SecretSyncer;
import tech.yump.secretsync.sync.SyncDefinitionRepository;
import tech.yump.secretsync.sync.SyncResult;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives sync passes of every {@link SecretSyncDefinition}.
 *
 * <p>A fixed pool of {@code concurrent} workers takes keys from a {@link WorkQueue}, so at most one pass
 * per definition is in flight and triggers arriving meanwhile collapse into one re-check. Each pass runs
 * on a separate pass thread under the pass deadline. A pass that outlives its deadline keeps its key and
 * one of the {@code concurrent} pass slots until its thread really returns. Before a pass, the flood gate
 * holds the definition in {@link SyncPhase#PENDING} until every store it uses reports
 * {@link ValidationResult#READY}, or fails it right away when a store is misconfigured.
 *
 * <p>Successful passes are repeated after the refresh interval. Retryable failures back off
 * exponentially; permanent failures wait for a definition change or a manual trigger.
 */
@Slf4j
public class ReconciliationScheduler {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final SyncDefinitionRepository definitions;
    private final SecretSyncer syncer;
    private final SyncResultSink sink;
    private final StoreHealthCache healthCache;
    private final StoreHealthChecker healthChecker;
    private final SchedulerSettings settings;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;

    private final WorkQueue<ObjectKey> queue = new WorkQueue<>();
    private final Map<ObjectKey, SyncState> states = new ConcurrentHashMap<>();
    private final Map<ObjectKey, Pass<?>> timedOut = new ConcurrentHashMap<>();
    private final Semaphore passSlots;
    private final ExecutorService passExecutor;
    private ExecutorService workers;

    public ReconciliationScheduler(SyncDefinitionRepository definitions, SecretSyncer syncer, SyncResultSink sink,
                                   StoreHealthCache healthCache, StoreHealthChecker healthChecker,
                                   SchedulerSettings settings, Clock clock) {
        this.definitions = definitions;
        this.syncer = syncer;
        this.sink = sink;
        this.healthCache = healthCache;
        this.healthChecker = healthChecker;
        this.settings = settings;
        this.backoffPolicy = settings.backoffPolicy();
        this.clock = clock;
        this.passSlots = new Semaphore(settings.concurrent());
        this.passExecutor = Executors.newFixedThreadPool(settings.concurrent(), new CustomizableThreadFactory("sync-pass-"));
        healthChecker.addListener(this::onStoreHealthChange);
    }

    public synchronized void start() {
        if (workers != null) {
            return;
        }
        healthChecker.start();
        workers = Executors.newFixedThreadPool(settings.concurrent(), new CustomizableThreadFactory("sync-worker-"));
        for (int i = 0; i < settings.concurrent(); i++) {
            workers.execute(this::runWorker);
        }
        for (SecretSyncDefinition definition : definitions.all()) {
            state(definition.key());
            queue.add(definition.key());
        }
        log.info("Reconciliation scheduler started with {} workers, flood gate {}", settings.concurrent(),
                settings.isFloodGateEnabled() ? "enabled" : "disabled");
    }

    /**
     * Stops workers and interrupts running passes. The scheduler cannot be restarted afterwards.
     */
    public synchronized void stop() {
        int pending = queue.size();
        queue.shutDown();
        passExecutor.shutdownNow();
        if (workers == null) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sync workers did not terminate within {}", SHUTDOWN_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        healthChecker.stop();
        log.info("Reconciliation scheduler stopped, {} queued syncs dropped", pending);
    }

    /**
     * Adds or replaces a definition and schedules a pass right away.
     */
    public void apply(SecretSyncDefinition definition) {
        Optional<SecretSyncDefinition> previous = definitions.put(definition);
        SyncState state = state(definition.key());
        state.clearRemoved();
        if (previous.isEmpty() || !previous.get().equals(definition)) {
            state.resetFailures();
        }
        log.info("{} sync definition {}", previous.isPresent() ? "Updated" : "Added", definition.key());
        queue.add(definition.key());
    }

    /**
     * Schedules an immediate pass.
     *
     * @return false if no such definition exists
     */
    public boolean trigger(ObjectKey key) {
        if (definitions.find(key).isEmpty()) {
            return false;
        }
        if (queue.isProcessing(key)) {
            log.debug("Manual trigger of {} while a pass is in flight, re-checking afterwards", key);
        } else {
            log.debug("Manual trigger of {}", key);
        }
        queue.add(key);
        return true;
    }

    /**
     * Removes a definition. Its pushed secrets are cleaned up asynchronously per deletion policy.
     *
     * @return false if no such definition exists
     */
    public boolean remove(ObjectKey key) {
        Optional<SecretSyncDefinition> removed = definitions.remove(key);
        if (removed.isEmpty()) {
            return false;
        }
        state(key).markRemoved(removed.get());
        log.info("Removed sync definition {}", key);
        queue.add(key);
        return true;
    }

    public Optional<SyncStatus> status(ObjectKey key) {
        if (definitions.find(key).isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(states.get(key)).map(SyncState::snapshot);
    }

    public List<SyncStatus> statuses() {
        return definitions.all().stream()
                .map(definition -> state(definition.key()).snapshot())
                .sorted(Comparator.comparing(SyncStatus::key))
                .toList();
    }

    /**
     * Runs one pass of {@code key} on the calling thread. Used by workers.
     */
    void reconcile(ObjectKey key) {
        Optional<SecretSyncDefinition> found = definitions.find(key);
        if (found.isEmpty()) {
            finalizeRemoval(key);
            return;
        }
        SecretSyncDefinition definition = found.get();
        SyncState state = state(key);
        state.toPending(clock.instant());

        if (settings.isFloodGateEnabled()) {
            Set<StoreKey> blocked = blockedStores(definition);
            Optional<SecretSyncException> misconfigured = misconfiguredStore(blocked);
            if (misconfigured.isPresent()) {
                handleFailure(key, state, misconfigured.get());
                return;
            }
            if (!blocked.isEmpty()) {
                state.gate(blocked, clock.instant());
                blocked.forEach(healthChecker::requestProbe);
                log.debug("Sync {} held back until stores {} are ready", key, blocked);
                queue.addAfter(key, settings.probeInterval());
                return;
            }
        }

        if (!claimPassSlot(key)) {
            queue.addAfter(key, settings.probeInterval());
            return;
        }
        state.toSyncing(clock.instant());
        Set<PushedRef> previouslyPushed = state.pushed();
        try {
            SyncResult result = runWithDeadline(key, () -> syncer.sync(definition, previouslyPushed));
            sink.deliver(SyncOutcome.success(result, clock.instant()));
            state.toSynced(result, clock.instant());
            log.info("Synced {} ({} keys, {} pushed)", key, result.data().size(), result.pushed().size());

            Duration next = definition.refreshInterval() != null ? definition.refreshInterval() : settings.requeueInterval();
            if (!next.isZero()) {
                queue.addAfter(key, next);
            }
        } catch (RuntimeException e) {
            handleFailure(key, state, e);
        }
    }

    private void handleFailure(ObjectKey key, SyncState state, RuntimeException error) {
        ErrorKind kind = ErrorKind.of(error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        int failures = state.toFailed(kind, message, clock.instant());
        try {
            sink.deliver(SyncOutcome.failure(key, kind, message, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to deliver failure of {} to sink: {}", key, e.getMessage(), e);
        }

        if (kind.isRetryable()) {
            Duration delay = backoffPolicy.delayFor(failures);
            log.warn("Sync {} failed ({}, attempt {}), retrying in {}: {}", key, kind, failures, delay, message);
            queue.addAfter(key, delay);
        } else {
            log.error("Sync {} failed permanently ({}): {}. Waiting for a definition change or manual trigger.",
                    key, kind, message);
        }
        if (kind == ErrorKind.INTERNAL) {
            log.error("Unexpected error during sync of {}", key, error);
        }
    }

    private void finalizeRemoval(ObjectKey key) {
        SyncState state = states.get(key);
        SecretSyncDefinition removed = state == null ? null : state.removedDefinition();
        if (removed == null) {
            states.remove(key);
            return;
        }
        if (!claimPassSlot(key)) {
            queue.addAfter(key, settings.probeInterval());
            return;
        }
        try {
            runWithDeadline(key, () -> {
                syncer.cleanup(removed, state.pushed());
                return null;
            });
            sink.removed(removed);
            states.remove(key);
            log.info("Cleaned up removed sync definition {}", key);
        } catch (RuntimeException e) {
            ErrorKind kind = ErrorKind.of(e);
            int failures = state.toFailed(kind, e.getMessage(), clock.instant());
            if (kind.isRetryable()) {
                Duration delay = backoffPolicy.delayFor(failures);
                log.warn("Cleanup of removed sync {} failed ({}), retrying in {}: {}", key, kind, delay, e.getMessage());
                queue.addAfter(key, delay);
            } else {
                log.error("Cleanup of removed sync {} failed permanently ({}): {}", key, kind, e.getMessage());
                states.remove(key);
            }
        }
    }

    /**
     * Takes a pass slot for {@code key}. Fails while a timed out pass of the same key is still running
     * or while every slot is held by timed out passes.
     */
    private boolean claimPassSlot(ObjectKey key) {
        Pass<?> previous = timedOut.get(key);
        if (previous != null) {
            if (previous.isRunning()) {
                log.warn("Timed out pass of {} is still running, deferring the next one", key);
                return false;
            }
            timedOut.remove(key, previous);
        }
        if (!passSlots.tryAcquire()) {
            log.warn("All {} pass slots are held by timed out passes, deferring {}", settings.concurrent(), key);
            return false;
        }
        return true;
    }

    /**
     * Runs {@code body} on a pass thread. The caller must hold a pass slot; it is released once the body returns.
     */
    private <T> T runWithDeadline(ObjectKey key, Callable<T> body) {
        Pass<T> pass = new Pass<>(body);
        Future<T> future;
        try {
            future = passExecutor.submit(pass);
        } catch (RejectedExecutionException e) {
            pass.abandon();
            throw new SecretSyncException(ErrorKind.INTERNAL, "Scheduler is stopping, pass of " + key + " not started", e);
        }
        try {
            return future.get(settings.passTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            giveUp(key, pass, future);
            throw new SyncTimeoutException("Sync pass of " + key + " exceeded its deadline of " + settings.passTimeout(), e);
        } catch (InterruptedException e) {
            giveUp(key, pass, future);
            Thread.currentThread().interrupt();
            throw new SyncTimeoutException("Sync pass of " + key + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SecretSyncException(ErrorKind.INTERNAL, "Sync pass of " + key + " failed: " + cause.getMessage(), cause);
        }
    }

    private void giveUp(ObjectKey key, Pass<?> pass, Future<?> future) {
        boolean started = !pass.abandon();
        future.cancel(true);
        if (started) {
            timedOut.put(key, pass);
        }
    }

    /**
     * Returns the first non-retryable health error among {@code blocked}, such as an unknown store.
     */
    private Optional<SecretSyncException> misconfiguredStore(Set<StoreKey> blocked) {
        for (StoreKey store : blocked) {
            Optional<SecretSyncException> error = healthCache.entry(store)
                    .filter(entry -> !healthCache.isExpired(entry))
                    .map(entry -> entry.status().error())
                    .filter(e -> !e.isRetryable());
            if (error.isPresent()) {
                SecretSyncException cause = error.get();
                return Optional.of(new SecretSyncException(cause.getKind(),
                        "Store " + store + " is misconfigured: " + cause.getMessage(), cause));
            }
        }
        return Optional.empty();
    }

    private Set<StoreKey> blockedStores(SecretSyncDefinition definition) {
        Set<StoreKey> blocked = new LinkedHashSet<>();
        for (StoreKey store : definition.storeKeys()) {
            if (healthCache.resultOf(store) != ValidationResult.READY) {
                blocked.add(store);
            }
        }
        return blocked;
    }

    private void onStoreHealthChange(StoreKey store, ValidationResult previous, ValidationResult current) {
        if (current != ValidationResult.READY) {
            return;
        }
        for (SecretSyncDefinition definition : definitions.dependentsOf(store)) {
            SyncState state = states.get(definition.key());
            if (state != null && state.phase() == SyncPhase.PENDING) {
                log.debug("Store {} recovered, triggering {}", store, definition.key());
                queue.add(definition.key());
            }
        }
    }

    private void runWorker() {
        while (true) {
            ObjectKey key;
            try {
                key = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            try {
                reconcile(key);
            } catch (RuntimeException e) {
                log.error("Unexpected error reconciling {}", key, e);
            } finally {
                queue.done(key);
            }
        }
    }

    private SyncState state(ObjectKey key) {
        return states.computeIfAbsent(key, SyncState::new);
    }

    WorkQueue<ObjectKey> queue() {
        return queue;
    }

    /**
     * A pass body holding one pass slot. The slot is released when the body returns, or when the pass
     * is abandoned before a thread picked it up.
     */
    private final class Pass<T> implements Callable<T> {

        private final Callable<T> body;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private volatile boolean finished;

        Pass(Callable<T> body) {
            this.body = body;
        }

        @Override
        public T call() throws Exception {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return body.call();
            } finally {
                finish();
            }
        }

        /**
         * @return true if the body never started
         */
        boolean abandon() {
            if (claimed.compareAndSet(false, true)) {
                finish();
                return true;
            }
            return false;
        }

        boolean isRunning() {
            return !finished;
        }

        private void finish() {
            finished = true;
            passSlots.release();
        }
    }
}
