package de.t14d3.dbexecutor.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field as the primary key identifier.
 * <p>
 * The key is assumed to be generated by the database: it is never part of an
 * INSERT and is the only column used in the WHERE clause of an UPDATE or DELETE.
 * A type may declare at most one key field.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Id {
}
