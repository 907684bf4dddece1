package com.comanda.observability;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 *
 * <p>While a context is set, the MDC keys of {@link CorrelationContext} are populated so every log
 * statement on the thread carries them. Work handed to another thread must carry the context
 * across explicitly, e.g. with {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final List<String> MDC_KEYS =
            List.of(
                    CorrelationContext.MDC_CORRELATION_ID,
                    CorrelationContext.MDC_LOCATION_ID,
                    CorrelationContext.MDC_ACTOR_ID,
                    CorrelationContext.MDC_REQUEST_ID,
                    CorrelationContext.MDC_TRACE_ID);

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

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Clears the context and removes its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code runnable} with {@code context} set, then restores the previous context (or
     * clears if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(
                context,
                () -> {
                    runnable.run();
                    return null;
                });
    }

    /** Supplier variant of {@link #runWithContext}. */
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
        String[] values = {ctx.correlationId(), ctx.locationId(), ctx.actorId(), ctx.requestId(), ctx.traceId()};
        for (int i = 0; i < MDC_KEYS.size(); i++) {
            if (values[i] != null) {
                MDC.put(MDC_KEYS.get(i), values[i]);
            } else {
                MDC.remove(MDC_KEYS.get(i));
            }
        }
    }

    private static void clearMdc() {
        MDC_KEYS.forEach(MDC::remove);
    }
}
