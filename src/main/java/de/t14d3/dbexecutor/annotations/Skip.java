package de.t14d3.dbexecutor.annotations;

import de.t14d3.dbexecutor.mapping.Operation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Excludes a field from one or more operations.
 * <p>
 * A field skipped for {@link Operation#CREATE} is left out of generated INSERT
 * statements, one skipped for {@link Operation#RETRIEVE} is never populated from
 * a result row, and so on. A database-maintained timestamp, for example, is
 * typically declared as {@code @Skip({Operation.CREATE, Operation.UPDATE})}.
 *
 * @see Operation
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Skip {
    /**
     * The operations to skip. An empty array skips the field for every operation.
     */
    Operation[] value() default {};
}
