package com.trusty.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys so every log statement on the thread carries them;
 * clearing removes them. Servlet containers reuse threads, so whoever sets a context must clear it
 * (or use {@link #callWithContext(CorrelationContext, Supplier)}, which restores the previous one).
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_EXTERNAL_USER_ID);
        MDC.remove(CorrelationContext.MDC_NAMESPACE);
    }

    /**
     * Runs {@code work} with {@code context} set, then restores the previous context (or clears
     * if there was none), even when {@code work} throws.
     *
     * @return whatever {@code work} returns
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
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

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_EXTERNAL_USER_ID, ctx.externalUserId());
        setMdc(CorrelationContext.MDC_NAMESPACE, ctx.namespace());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
