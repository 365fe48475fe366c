package com.postrelay.security;

import com.postrelay.observability.MdcScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * {@link CredentialContext} scoped to the executing thread.
 * <p>
 * Servlet containers run one request per thread at a time, so a thread-confined slot is a
 * per-logical-request slot as long as every {@code set} is reset before the thread returns to the
 * pool. Work that a request hands to another executor keeps the caller's identity only when
 * submitted through {@link #wrap(Runnable)}, {@link #wrap(Callable)} or {@link #propagating}.
 * <p>
 * While a credential is installed its subject id (never the token) is published under the SLF4J
 * MDC key {@value #MDC_SUBJECT_ID}. Values memoized through {@link #scoped} belong to the scope
 * and are dropped with it, so nothing derived from a credential outlives its request on a pooled
 * thread.
 * <p>
 * Each instance is an independent slot: the request path and the publisher daemon own separate
 * instances and never observe each other's values.
 */
public final class ThreadLocalCredentialContext implements CredentialContext {

    /** MDC key carrying the subject id of the installed credential. */
    public static final String MDC_SUBJECT_ID = "subjectId";

    private static final Logger log = LoggerFactory.getLogger(ThreadLocalCredentialContext.class);

    private final ThreadLocal<Scope> current = new ThreadLocal<>();
    private final String name;

    /**
     * Creates a context with the given name (used in log lines only).
     *
     * @param name descriptive name, e.g. "request" or "publisher"
     */
    public ThreadLocalCredentialContext(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        this.name = name;
    }

    @Override
    public Token set(Credential credential) {
        if (credential == null) {
            throw new IllegalArgumentException("credential must not be null");
        }
        ScopeToken token = install(credential);
        log.debug("[{}] credential installed: {}", name, credential);
        return token;
    }

    @Override
    public void reset(Token token) {
        if (!(token instanceof ScopeToken scoped) || scoped.owner() != this) {
            throw new IllegalArgumentException(
                    "token was not issued by credential context '" + name + "'");
        }
        scoped.restore();
    }

    @Override
    public Optional<Credential> get() {
        Scope scope = current.get();
        return scope == null ? Optional.empty() : Optional.of(scope.credential);
    }

    @Override
    public <T> T scoped(Object key, Function<Credential, T> factory) {
        if (key == null || factory == null) {
            throw new IllegalArgumentException("key and factory must not be null");
        }
        Scope scope = current.get();
        if (scope == null) {
            throw new UnauthenticatedException(
                    "No credential in scope for this request; is OAuth configured?");
        }
        return scope.computeIfAbsent(key, factory);
    }

    /**
     * Captures the caller's current credential (or its absence) and returns a task that runs with
     * exactly that value on whichever thread executes it, restoring that thread's own value after.
     *
     * @param task the work to hand off
     * @return the wrapped task
     */
    public Runnable wrap(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        Credential captured = get().orElse(null);
        return () -> {
            ScopeToken token = install(captured);
            try {
                task.run();
            } finally {
                token.restore();
            }
        };
    }

    /**
     * Callable form of {@link #wrap(Runnable)}.
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        Credential captured = get().orElse(null);
        return () -> {
            ScopeToken token = install(captured);
            try {
                return task.call();
            } finally {
                token.restore();
            }
        };
    }

    /**
     * Returns an executor that wraps every submitted task with the submitting thread's credential.
     *
     * @param delegate the executor that actually runs the tasks
     * @return a credential-propagating view of {@code delegate}
     */
    public Executor propagating(Executor delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        return command -> delegate.execute(wrap(command));
    }

    /**
     * Returns the name given at construction.
     */
    public String name() {
        return name;
    }

    private ScopeToken install(Credential credential) {
        Scope previous = current.get();
        if (credential != null) {
            current.set(new Scope(credential));
        } else {
            current.remove();
        }
        MdcScope mdc = MdcScope.put(MDC_SUBJECT_ID, credential != null ? credential.subjectId() : null);
        return new ScopeToken(previous, Thread.currentThread(), mdc);
    }

    private final class ScopeToken implements Token {

        private final Scope previous;
        private final Thread creator;
        private final MdcScope mdc;
        private boolean used;

        private ScopeToken(Scope previous, Thread creator, MdcScope mdc) {
            this.previous = previous;
            this.creator = creator;
            this.mdc = mdc;
        }

        @Override
        public Optional<Credential> previous() {
            return previous == null ? Optional.empty() : Optional.of(previous.credential);
        }

        @Override
        public void close() {
            reset(this);
        }

        private ThreadLocalCredentialContext owner() {
            return ThreadLocalCredentialContext.this;
        }

        private void restore() {
            if (Thread.currentThread() != creator) {
                throw new IllegalStateException("token for credential context '" + name
                        + "' was created on thread " + creator.getName()
                        + " and cannot be reset on " + Thread.currentThread().getName());
            }
            if (used) {
                throw new IllegalStateException(
                        "token for credential context '" + name + "' has already been used");
            }
            used = true;
            if (previous != null) {
                current.set(previous);
            } else {
                current.remove();
            }
            mdc.close();
        }
    }

    /**
     * One installed credential and the values derived from it. Confined to the installing thread.
     */
    private static final class Scope {

        private final Credential credential;
        private Map<Object, Object> values;

        private Scope(Credential credential) {
            this.credential = credential;
        }

        @SuppressWarnings("unchecked")
        private <T> T computeIfAbsent(Object key, Function<Credential, T> factory) {
            if (values == null) {
                values = new HashMap<>();
            }
            return (T) values.computeIfAbsent(key, k -> factory.apply(credential));
        }
    }
}
