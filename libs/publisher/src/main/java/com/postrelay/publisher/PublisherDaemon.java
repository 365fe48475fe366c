package com.postrelay.publisher;

import com.postrelay.accessor.AmbientAccessorRegistry;
import com.postrelay.accessor.ApiClientFactory;
import com.postrelay.accessor.CredentialScopedClientAccessor;
import com.postrelay.accessor.ThreadAffineStorageAccessor;
import com.postrelay.observability.MdcScope;
import com.postrelay.observability.TokenMasker;
import com.postrelay.security.Credential;
import com.postrelay.security.ThreadLocalCredentialContext;
import com.postrelay.storage.StorageHandle;
import com.postrelay.storage.StorageOpener;
import com.postrelay.storage.StoragePathResolver;
import com.postrelay.storage.ThreadAffineHandleCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-running loop that publishes due posts on behalf of whoever last authenticated.
 *
 * <p>The daemon has no inbound request, so it owns its own identity and storage: a private
 * {@link ThreadLocalCredentialContext}, a private {@link ThreadAffineHandleCache} and the
 * {@link AmbientAccessorRegistry} the scheduling library reads from while a cycle runs. None of
 * these are shared with the request path.
 *
 * <p>Each tick looks up any stored credential. With none, the tick is {@link TickOutcome#SKIPPED};
 * otherwise the cycle runs with that credential installed. Any failure of the cycle is logged
 * and the next tick still happens. Ticks run on one dedicated daemon thread, the first one
 * immediately after {@link #start()}.
 *
 * @param <C> the client type the scheduling library consumes
 * @param <H> the storage handle type
 */
public final class PublisherDaemon<C, H extends StorageHandle> {

    public static final String MDC_TICK_ID = "tickId";
    public static final String METRIC_TICKS = "postrelay.publisher.ticks";
    public static final String METRIC_TICK_DURATION = "postrelay.publisher.tick.duration";
    public static final String SPAN_TICK = "publisher.tick";

    private static final Logger log = LoggerFactory.getLogger(PublisherDaemon.class);

    private final DaemonSettings settings;
    private final CredentialStore credentialStore;
    private final SchedulingCycle cycle;
    private final StartupCheck startupCheck;
    private final AmbientAccessorRegistry<C, H> registry;
    private final ThreadLocalCredentialContext context;
    private final ThreadAffineHandleCache<H> handles;
    private final Tracer tracer;
    private final Timer tickTimer;
    private final Map<TickOutcome, Counter> tickCounters = new EnumMap<>(TickOutcome.class);

    private final AtomicReference<DaemonState> state = new AtomicReference<>(DaemonState.IDLE);
    private final AtomicLong tickSequence = new AtomicLong();
    private final AtomicReference<TickOutcome> lastOutcome = new AtomicReference<>();
    private final AtomicReference<WorkUnitFailureException> lastFailure = new AtomicReference<>();

    private ScheduledExecutorService executor;

    /**
     * Creates a daemon and installs its accessors into {@code registry}, which must be empty.
     *
     * @param settings        interval and thread naming
     * @param credentialStore where the daemon finds an identity to act as
     * @param cycle           the unit of work run per tick
     * @param registry        the publisher seam's accessor registry
     * @param clientFactory   builds a client from a stored credential
     * @param storageOpener   opens the daemon's storage handles
     * @param pathResolver    default storage path
     * @param startupCheck    verified once by {@link #start()}
     * @param meterRegistry   tick counters and timer
     * @param tracer          one span per tick
     */
    public PublisherDaemon(DaemonSettings settings,
                           CredentialStore credentialStore,
                           SchedulingCycle cycle,
                           AmbientAccessorRegistry<C, H> registry,
                           ApiClientFactory<C> clientFactory,
                           StorageOpener<H> storageOpener,
                           StoragePathResolver pathResolver,
                           StartupCheck startupCheck,
                           MeterRegistry meterRegistry,
                           Tracer tracer) {
        this.settings = settings != null ? settings : DaemonSettings.defaults();
        this.credentialStore = requireArg(credentialStore, "credentialStore");
        this.cycle = requireArg(cycle, "cycle");
        this.registry = requireArg(registry, "registry");
        this.startupCheck = startupCheck != null ? startupCheck : StartupCheck.none();
        this.tracer = requireArg(tracer, "tracer");
        requireArg(meterRegistry, "meterRegistry");

        this.context = new ThreadLocalCredentialContext("publisher");
        this.handles = new ThreadAffineHandleCache<>("publisher", requireArg(storageOpener, "storageOpener"));
        registry.installClientAccessor(
                new CredentialScopedClientAccessor<>(context, requireArg(clientFactory, "clientFactory")));
        registry.installStorageAccessor(
                new ThreadAffineStorageAccessor<>(handles, requireArg(pathResolver, "pathResolver")));

        for (TickOutcome outcome : TickOutcome.values()) {
            tickCounters.put(outcome, Counter.builder(METRIC_TICKS)
                    .description("Publisher ticks by outcome")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.tickTimer = Timer.builder(METRIC_TICK_DURATION)
                .description("Duration of one publisher tick")
                .register(meterRegistry);
    }

    /**
     * Verifies the startup check and starts the loop on a dedicated daemon thread.
     *
     * @throws DaemonStartupException if the startup check fails; the loop is not started
     * @throws IllegalStateException  if already started or stopped
     */
    public synchronized void start() {
        if (executor != null || state.get() == DaemonState.STOPPED) {
            throw new IllegalStateException("publisher daemon already started (state " + state.get() + ")");
        }
        try {
            startupCheck.verify();
        } catch (Exception e) {
            throw new DaemonStartupException("Publisher startup check failed: " + e.getMessage(), e);
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, settings.threadName());
            thread.setDaemon(true);
            return thread;
        });
        state.set(DaemonState.AWAIT_TICK);
        executor.scheduleWithFixedDelay(this::scheduledTick, 0, settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Publisher daemon started (poll interval: {}s, thread: {})",
                settings.pollInterval().toSeconds(), settings.threadName());
    }

    /**
     * Stops the loop. A tick in progress runs to completion; it is interrupted only if it is still
     * running after the shutdown timeout. The daemon's storage handles are closed once the loop
     * thread has terminated. Safe to call more than once.
     */
    public synchronized void stop() {
        if (state.get() == DaemonState.STOPPED && executor == null) {
            return;
        }
        boolean terminated = true;
        if (executor != null) {
            terminated = awaitLoopTermination(executor);
            executor = null;
        }
        if (terminated) {
            handles.closeAll();
        } else {
            log.warn("Publisher thread did not stop; leaving its storage handles open");
        }
        state.set(DaemonState.STOPPED);
        log.info("Publisher daemon stopped after {} tick(s)", tickSequence.get());
    }

    private boolean awaitLoopTermination(ScheduledExecutorService loop) {
        long timeoutMillis = settings.shutdownTimeout().toMillis();
        loop.shutdown();
        try {
            if (loop.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Publisher tick still running after {}ms shutdown timeout; interrupting it",
                    timeoutMillis);
            loop.shutdownNow();
            return loop.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the publisher thread to stop");
            loop.shutdownNow();
            return false;
        }
    }

    // A throwable escaping a periodic task silently cancels all later runs.
    private void scheduledTick() {
        try {
            tick();
        } catch (VirtualMachineError e) {
            state.set(DaemonState.STOPPED);
            log.error("Publisher loop stopped by fatal error", e);
            throw e;
        }
    }

    /**
     * Runs one tick on the calling thread. Never throws for failures of the cycle or the
     * credential lookup, {@link Error}s included; the outcome says what happened. Only a
     * {@link VirtualMachineError} propagates.
     */
    public TickOutcome tick() {
        long tickId = tickSequence.incrementAndGet();
        DaemonState before = state.getAndSet(DaemonState.RUN_UNIT);
        Timer.Sample sample = Timer.start();
        Span span = tracer.spanBuilder(SPAN_TICK)
                .setAttribute("publisher.tick.id", tickId)
                .startSpan();
        TickOutcome outcome;
        try (MdcScope ignored = MdcScope.put(MDC_TICK_ID, Long.toString(tickId));
             Scope scope = span.makeCurrent()) {
            outcome = runUnit(tickId, span);
            span.setAttribute("publisher.tick.outcome", outcome.name());
        } finally {
            span.end();
            sample.stop(tickTimer);
            state.compareAndSet(DaemonState.RUN_UNIT,
                    before == DaemonState.STOPPED ? DaemonState.STOPPED : DaemonState.AWAIT_TICK);
        }
        tickCounters.get(outcome).increment();
        lastOutcome.set(outcome);
        return outcome;
    }

    private TickOutcome runUnit(long tickId, Span span) {
        try {
            Optional<Credential> credential = credentialStore.findAnyStoredCredential();
            if (credential.isEmpty()) {
                log.debug("Publisher skipped: no upstream credentials; authenticate via OAuth first");
                return TickOutcome.SKIPPED;
            }
            Credential acting = credential.get();
            log.debug("Publisher acting as {} (token {})",
                    acting.subject().orElse("<unknown>"), TokenMasker.mask(acting.accessToken()));
            context.callWithCredential(acting, () -> {
                registry.currentClient();
                cycle.runOnce();
                return null;
            });
            span.setStatus(StatusCode.OK);
            return TickOutcome.SUCCESS;
        } catch (NoCredentialAvailableException e) {
            log.debug("Publisher skipped: {}", e.getMessage());
            return TickOutcome.SKIPPED;
        } catch (Exception e) {
            return failed(tickId, span, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return failed(tickId, span, e);
        }
    }

    private TickOutcome failed(long tickId, Span span, Throwable cause) {
        WorkUnitFailureException failure = new WorkUnitFailureException(tickId, cause);
        lastFailure.set(failure);
        span.recordException(cause);
        span.setStatus(StatusCode.ERROR, cause.getClass().getSimpleName());
        log.error("Publisher error: {}", cause.getMessage(), failure);
        return TickOutcome.FAILED;
    }

    public DaemonState state() {
        return state.get();
    }

    /**
     * Number of ticks started so far.
     */
    public long tickCount() {
        return tickSequence.get();
    }

    public Optional<TickOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    public Optional<WorkUnitFailureException> lastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }

    public DaemonSettings settings() {
        return settings;
    }

    AmbientAccessorRegistry<C, H> registry() {
        return registry;
    }

    ThreadAffineHandleCache<H> handles() {
        return handles;
    }

    private static <T> T requireArg(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }
}
