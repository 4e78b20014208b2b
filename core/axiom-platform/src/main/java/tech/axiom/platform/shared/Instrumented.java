package tech.axiom.platform.shared;

import jakarta.interceptor.InterceptorBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a repository for store metrics, recorded via Micrometer by
 * {@link InstrumentedInterceptor}.
 *
 * Usage:
 * <pre>
 * {@code @Instrumented(table = "divisions")}
 * class DivisionReadRepository implements DivisionRepository { ... }
 * </pre>
 *
 * Metrics produced:
 * - axiom_store_operation_duration_seconds (histogram)
 * - axiom_store_operations_total (counter)
 * - axiom_store_operation_errors_total (counter)
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Table name used as the {@code table} tag. Required on the class.
     */
    String table() default "";
}
