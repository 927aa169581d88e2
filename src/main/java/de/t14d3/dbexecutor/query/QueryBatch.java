package de.t14d3.dbexecutor.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Several statements that are executed together and atomically.
 */
public final class QueryBatch {
    private final List<Query> queries;

    public QueryBatch(List<Query> queries) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one statement");
        }
        this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public List<Query> getQueries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }

    /**
     * The whole batch as text, one statement per line.
     */
    public String getSql() {
        return queries.stream().map(Query::getSql).collect(Collectors.joining(System.lineSeparator()));
    }

    /**
     * The parameters of every statement, in statement order.
     */
    public List<Parameter> getParameters() {
        List<Parameter> all = new ArrayList<>();
        for (Query query : queries) {
            all.addAll(query.getParameters());
        }
        return all;
    }

    @Override
    public String toString() {
        return getSql();
    }
}
