package de.t14d3.dbexecutor.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The declared parameter names of a stored procedure, in call order.
 * <p>
 * Names are compared without a {@code @} or {@code :} prefix and ignoring case,
 * so {@code @DriverId} declared by the database matches a {@code driverId} field.
 */
public final class ProcedureSignature {
    private final String procedureName;
    private final List<String> parameterNames;

    public ProcedureSignature(String procedureName, List<String> parameterNames) {
        if (procedureName == null || procedureName.isBlank()) {
            throw new IllegalArgumentException("Procedure name must not be blank");
        }
        List<String> normalized = new ArrayList<>(parameterNames.size());
        Set<String> seen = new LinkedHashSet<>();
        for (String name : parameterNames) {
            String parameter = Parameter.normalize(name);
            if (!seen.add(key(parameter))) {
                throw new IllegalArgumentException("Procedure " + procedureName + " declares parameter '" + parameter + "' twice");
            }
            normalized.add(parameter);
        }
        this.procedureName = procedureName;
        this.parameterNames = Collections.unmodifiableList(normalized);
    }

    public String getProcedureName() {
        return procedureName;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    /**
     * Orders the given bindings by declared parameter position.
     *
     * @throws IllegalArgumentException if a declared parameter has no binding, a
     *                                  binding names no declared parameter, or a
     *                                  name is bound twice
     */
    public List<Object> bind(List<Parameter> parameters) {
        Map<String, Parameter> byName = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            if (byName.put(key(parameter.name()), parameter) != null) {
                throw new IllegalArgumentException("Parameter '" + parameter.name() + "' is bound more than once for procedure " + procedureName);
            }
        }

        List<Object> ordered = new ArrayList<>(parameterNames.size());
        for (String name : parameterNames) {
            Parameter parameter = byName.remove(key(name));
            if (parameter == null) {
                throw new IllegalArgumentException("No value bound for parameter '" + name + "' of procedure " + procedureName
                        + " " + parameterNames);
            }
            ordered.add(parameter.value());
        }

        if (!byName.isEmpty()) {
            List<String> unknown = new ArrayList<>();
            byName.values().forEach(p -> unknown.add(p.name()));
            throw new IllegalArgumentException("Unknown parameter(s) " + unknown + " for procedure " + procedureName
                    + ", which declares " + parameterNames);
        }
        return ordered;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return procedureName + parameterNames;
    }
}
