package de.t14d3.dbexecutor.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites SQL with {@code :name} markers into JDBC's positional form.
 * <p>
 * Markers inside string literals, quoted identifiers and comments are left
 * alone, as is the {@code ::} cast operator. A name may appear more than once;
 * each occurrence becomes its own {@code ?}.
 */
public final class NamedParameters {
    private final String originalSql;
    private final String positionalSql;
    private final List<String> parameterNames;

    private NamedParameters(String originalSql, String positionalSql, List<String> parameterNames) {
        this.originalSql = originalSql;
        this.positionalSql = positionalSql;
        this.parameterNames = Collections.unmodifiableList(parameterNames);
    }

    public String getOriginalSql() {
        return originalSql;
    }

    /**
     * The SQL with every marker replaced by {@code ?}.
     */
    public String getPositionalSql() {
        return positionalSql;
    }

    /**
     * Marker names in order of appearance, repeats included.
     */
    public List<String> getParameterNames() {
        return parameterNames;
    }

    public Set<String> getDistinctParameterNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(parameterNames));
    }

    /**
     * Orders the given bindings by marker position.
     *
     * @throws IllegalArgumentException if a marker has no binding, a binding has no
     *                                  marker, or a name is bound twice
     */
    public List<Object> bind(List<Parameter> parameters) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            if (values.containsKey(parameter.name())) {
                throw new IllegalArgumentException("Parameter '" + parameter.name() + "' is bound more than once for SQL: " + originalSql);
            }
            values.put(parameter.name(), parameter.value());
        }

        List<Object> ordered = new ArrayList<>(parameterNames.size());
        for (String name : parameterNames) {
            if (!values.containsKey(name)) {
                throw new IllegalArgumentException("No value bound for parameter ':" + name + "' in SQL: " + originalSql);
            }
            ordered.add(values.get(name));
        }

        Set<String> unused = new LinkedHashSet<>(values.keySet());
        unused.removeAll(parameterNames);
        if (!unused.isEmpty()) {
            throw new IllegalArgumentException("Unknown parameter(s) " + unused + " for SQL: " + originalSql);
        }
        return ordered;
    }

    public static NamedParameters parse(String sql) {
        if (sql == null) {
            throw new IllegalArgumentException("sql must not be null");
        }

        StringBuilder out = new StringBuilder(sql.length());
        List<String> names = new ArrayList<>();

        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean inBracketQuote = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;

        for (int i = 0; i < sql.length(); ) {
            char c = sql.charAt(i);

            if (inLineComment) {
                out.append(c);
                ++i;
                if (c == '\n' || c == '\r') inLineComment = false;
                continue;
            }

            if (inBlockComment) {
                out.append(c);
                if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
                    out.append('/');
                    i += 2;
                    inBlockComment = false;
                } else {
                    ++i;
                }
                continue;
            }

            if (inSingleQuote) {
                out.append(c);
                // '' is an escaped quote and stays inside the literal
                if (c == '\'') {
                    if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                        out.append('\'');
                        i += 2;
                        continue;
                    }
                    inSingleQuote = false;
                }
                ++i;
                continue;
            }

            if (inDoubleQuote) {
                out.append(c);
                if (c == '"') inDoubleQuote = false;
                ++i;
                continue;
            }

            if (inBracketQuote) {
                out.append(c);
                if (c == ']') inBracketQuote = false;
                ++i;
                continue;
            }

            if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
                out.append("--");
                i += 2;
                inLineComment = true;
                continue;
            }

            if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
                out.append("/*");
                i += 2;
                inBlockComment = true;
                continue;
            }

            if (c == '\'') {
                inSingleQuote = true;
            } else if (c == '"') {
                inDoubleQuote = true;
            } else if (c == '[') {
                inBracketQuote = true;
            } else if (c == '?') {
                throw new IllegalArgumentException("Positional parameters ('?') are not supported, use named parameters (e.g. ':id'). SQL: " + sql);
            } else if (c == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
                continue;
            } else if (c == ':' && i + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
                int end = i + 2;
                while (end < sql.length() && Character.isJavaIdentifierPart(sql.charAt(end))) {
                    ++end;
                }
                names.add(sql.substring(i + 1, end));
                out.append('?');
                i = end;
                continue;
            }

            out.append(c);
            ++i;
        }

        return new NamedParameters(sql, out.toString(), names);
    }
}
