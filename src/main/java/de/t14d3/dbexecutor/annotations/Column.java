package de.t14d3.dbexecutor.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Specifies the column name for a field.
 * <p>
 * If not specified, the field name is used as the column name. The name is also
 * the name of the parameter bound for the field in generated statements.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * The name of the database column.
     */
    String name();
}
