package de.t14d3.dbexecutor.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies the database table name for a mapped type.
 * <p>
 * If not specified, the table name defaults to the simple class name.
 *
 * @see Column
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Table {
    /**
     * The name of the database table.
     */
    String name();
}
