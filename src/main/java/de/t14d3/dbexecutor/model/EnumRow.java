package de.t14d3.dbexecutor.model;

import java.util.Objects;

/**
 * One row of a lookup ("enum") table.
 *
 * @param <V> type of the value column, usually the row id
 */
public class EnumRow<V> {
    private String name;
    private V value;

    public EnumRow() {}

    public EnumRow(String name, V value) {
        this.name = name;
        this.value = value;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public V getValue() { return value; }
    public void setValue(V value) { this.value = value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumRow<?> other)) return false;
        return Objects.equals(name, other.name) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
