package de.t14d3.dbexecutor.mapping;

/**
 * The CRUD operation a field set is requested for.
 */
public enum Operation {
    CREATE,
    RETRIEVE,
    UPDATE,
    DELETE
}
