package de.t14d3.dbexecutor.query;

/**
 * A named statement parameter.
 * <p>
 * Names are stored without a marker prefix: {@code @driverId}, {@code :driverId}
 * and {@code driverId} all name the same parameter.
 */
public record Parameter(String name, Object value) {
    public Parameter {
        name = normalize(name);
    }

    public static Parameter of(String name, Object value) {
        return new Parameter(name, value);
    }

    static String normalize(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Parameter name must not be null");
        }
        String trimmed = name.trim();
        if (trimmed.startsWith("@") || trimmed.startsWith(":")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return ":" + name + "=" + value;
    }
}
