package tech.axiom.platform.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import org.jboss.logging.Logger;

/**
 * CDI interceptor that times repository calls.
 *
 * Records per table and method:
 * - call duration (histogram)
 * - call count by outcome
 * - error count by error kind
 * - a warning for calls slower than 100ms
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);
    private static final long SLOW_CALL_THRESHOLD_MS = 100;

    @Inject
    MeterRegistry registry;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String table = resolveTable(ctx);
        String operation = ctx.getMethod().getName();

        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";

        try {
            return ctx.proceed();
        } catch (Exception e) {
            outcome = "error";
            registry.counter("axiom.store.operation.errors",
                "table", table,
                "operation", operation,
                "error_kind", errorKind(e)
            ).increment();
            throw e;
        } finally {
            long durationNanos = sample.stop(Timer.builder("axiom.store.operation.duration")
                .tag("table", table)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .publishPercentileHistogram()
                .register(registry));

            registry.counter("axiom.store.operations",
                "table", table,
                "operation", operation,
                "outcome", outcome
            ).increment();

            long durationMs = durationNanos / 1_000_000;
            if (durationMs > SLOW_CALL_THRESHOLD_MS) {
                LOG.warnf("Slow store call: %s.%s took %dms", table, operation, durationMs);
            }
        }
    }

    private String resolveTable(InvocationContext ctx) {
        Instrumented onMethod = ctx.getMethod().getAnnotation(Instrumented.class);
        if (onMethod != null && !onMethod.table().isEmpty()) {
            return onMethod.table();
        }

        // CDI subclasses inherit the annotation from the bean class
        Instrumented onClass = ctx.getTarget().getClass().getAnnotation(Instrumented.class);
        if (onClass != null && !onClass.table().isEmpty()) {
            return onClass.table();
        }
        return "unknown";
    }

    private String errorKind(Exception e) {
        String name = e.getClass().getSimpleName();
        if (name.contains("Constraint")) {
            return "constraint";
        }
        if (name.contains("Timeout")) {
            return "timeout";
        }
        if (name.contains("Connection")) {
            return "connection";
        }
        return "internal";
    }
}
