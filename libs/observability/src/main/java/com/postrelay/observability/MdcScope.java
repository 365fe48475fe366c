package com.postrelay.observability;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts SLF4J MDC entries for the duration of a scope and restores the previous values on close.
 * <p>
 * Unlike {@code MDC.putCloseable}, closing restores whatever value the key held before the scope
 * opened instead of removing it, so nested scopes (a request inside a request, a tick inside a
 * test) unwind correctly. A {@code null} value removes the key for the duration of the scope.
 * <p>
 * An MdcScope belongs to the thread that opened it and must be closed on that thread.
 */
public final class MdcScope implements AutoCloseable {

    private final Map<String, String> previous;
    private boolean closed;

    private MdcScope(Map<String, String> previous) {
        this.previous = previous;
    }

    /**
     * Opens a scope with a single MDC entry.
     *
     * @param key   MDC key (must not be null or blank)
     * @param value value for the scope, or null to hide the key
     * @return the scope; close it to restore the previous value
     */
    public static MdcScope put(String key, String value) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(key, value);
        return putAll(entries);
    }

    /**
     * Opens a scope with several MDC entries. Null values hide their key for the scope.
     *
     * @param entries MDC entries to set
     * @return the scope; close it to restore the previous values
     */
    public static MdcScope putAll(Map<String, String> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("entries must not be null");
        }
        Map<String, String> previous = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("MDC key must not be null or blank");
            }
            previous.put(key, MDC.get(key));
            String value = entry.getValue();
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
        return new MdcScope(previous);
    }

    /**
     * Restores every key touched by this scope. Closing twice is a no-op.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        previous.forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
    }
}
