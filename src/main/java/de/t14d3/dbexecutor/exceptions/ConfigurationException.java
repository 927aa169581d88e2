package de.t14d3.dbexecutor.exceptions;

public class ConfigurationException extends OrmException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
