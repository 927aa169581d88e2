package de.t14d3.dbexecutor.exceptions;

/**
 * Thrown when a type cannot be mapped to its table, or a result row cannot be
 * mapped back onto a type.
 */
public class MappingException extends OrmException {
    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
