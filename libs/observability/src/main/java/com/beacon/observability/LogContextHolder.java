package com.beacon.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link LogContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (messageId, eventType, anonymousId, userId) are populated so
 * that every log statement on this thread includes them. When cleared, all keys are removed.
 * Scoped execution through {@link #callWithContext(LogContext, Supplier)} restores whatever
 * context was active before, so nested dispatches on one thread do not clobber each other.
 */
public final class LogContextHolder {

    private static final ThreadLocal<LogContext> CONTEXT = new ThreadLocal<>();

    private LogContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(LogContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if set. */
    public static Optional<LogContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and removes all MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(LogContext.MDC_MESSAGE_ID);
        MDC.remove(LogContext.MDC_EVENT_TYPE);
        MDC.remove(LogContext.MDC_ANONYMOUS_ID);
        MDC.remove(LogContext.MDC_USER_ID);
    }

    /**
     * Runs {@code work} with the given context set, then restores the previous context (or clears
     * if there was none).
     *
     * @return the value produced by {@code work}
     */
    public static <T> T callWithContext(LogContext context, Supplier<T> work) {
        LogContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /** Runnable flavour of {@link #callWithContext(LogContext, Supplier)}. */
    public static void runWithContext(LogContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void populateMdc(LogContext ctx) {
        setMdc(LogContext.MDC_MESSAGE_ID, ctx.messageId());
        setMdc(LogContext.MDC_EVENT_TYPE, ctx.eventType());
        setMdc(LogContext.MDC_ANONYMOUS_ID, ctx.anonymousId());
        setMdc(LogContext.MDC_USER_ID, ctx.userId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
