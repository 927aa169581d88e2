package de.t14d3.dbexecutor.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class for registration by classpath scanning.
 * <p>
 * Any class with a no-argument constructor can be mapped without this annotation.
 * Annotated classes are picked up by
 * {@link de.t14d3.dbexecutor.mapping.MappingScanner}, which validates their mapping
 * up front and registers it so it is not rebuilt on every call.
 *
 * @see Table
 * @see Id
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Entity {
}
