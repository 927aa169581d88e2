package de.t14d3.dbexecutor.exceptions;

/**
 * Thrown when a call running inside a transaction failed and its transaction was
 * rolled back. The original failure is the cause.
 */
public class TransactionRolledBackException extends OrmException {
    public TransactionRolledBackException(String message, Throwable cause) {
        super(message, cause);
    }
}
