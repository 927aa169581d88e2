package de.t14d3.dbexecutor.mapping;

import de.t14d3.dbexecutor.exceptions.MappingException;

import java.lang.reflect.Field;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A single mapped field: its column name, whether it is the key, and the
 * operations it is skipped for.
 */
public final class FieldMapping {
    private final Field field;
    private final String columnName;
    private final boolean id;
    private final Set<Operation> skippedFor;

    FieldMapping(Field field, String columnName, boolean id, EnumSet<Operation> skippedFor) {
        this.field = field;
        this.columnName = columnName;
        this.id = id;
        this.skippedFor = Collections.unmodifiableSet(skippedFor);
    }

    public Field getField() {
        return field;
    }

    public String getName() {
        return field.getName();
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * The column name without identifier quoting ({@code "..."}, {@code [...]} or
     * backticks), as a database reports it in result set labels.
     */
    public String getColumnLabel() {
        int last = columnName.length() - 1;
        if (last > 0) {
            char first = columnName.charAt(0);
            char end = columnName.charAt(last);
            if ((first == '"' && end == '"') || (first == '[' && end == ']') || (first == '`' && end == '`')) {
                return columnName.substring(1, last);
            }
        }
        return columnName;
    }

    public Class<?> getType() {
        return field.getType();
    }

    public boolean isId() {
        return id;
    }

    public Set<Operation> getSkippedFor() {
        return skippedFor;
    }

    public boolean isSkippedFor(Operation operation) {
        return skippedFor.contains(operation);
    }

    /**
     * Gets the value of this field from an instance.
     */
    public Object getValue(Object instance) {
        try {
            return field.get(instance);
        } catch (IllegalAccessException e) {
            throw new MappingException("Cannot access field " + describe(), e);
        }
    }

    /**
     * Sets the value of this field on an instance.
     */
    public void setValue(Object instance, Object value) {
        try {
            field.set(instance, value);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new MappingException("Cannot set field " + describe()
                    + " to value of type " + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    private String describe() {
        return field.getDeclaringClass().getSimpleName() + "." + field.getName();
    }

    @Override
    public String toString() {
        return describe() + " -> " + columnName;
    }
}
