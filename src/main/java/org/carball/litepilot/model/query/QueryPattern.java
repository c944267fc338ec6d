package org.carball.litepilot.model.query;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated statistics for every executed statement sharing the same normalized text.
 */
@Data
public class QueryPattern {
    private final String normalizedQuery;
    private String table;
    private int frequency;
    private double averageExecutionTime;
    private Instant lastExecuted;

    // Columns pulled out of the first statement seen for this pattern
    private List<String> whereColumns = new ArrayList<>();
    private List<String> orderByColumns = new ArrayList<>();
    private List<String> joinColumns = new ArrayList<>();

    public QueryPattern(String normalizedQuery, String table, double executionTime) {
        this.normalizedQuery = normalizedQuery;
        this.table = table;
        this.frequency = 1;
        this.averageExecutionTime = executionTime;
        this.lastExecuted = Instant.now();
    }

    /**
     * Counts one more execution and folds its time into the running average.
     */
    public void recordExecution(double executionTime) {
        frequency++;
        lastExecuted = Instant.now();
        averageExecutionTime = (averageExecutionTime * (frequency - 1) + executionTime) / frequency;
    }

    public boolean hasWhereClause() {
        return !whereColumns.isEmpty();
    }

    public boolean hasOrderBy() {
        return !orderByColumns.isEmpty();
    }

    public boolean hasJoins() {
        return !joinColumns.isEmpty();
    }

    /**
     * Copy with its own column lists, detached from the recorder.
     */
    public QueryPattern copy() {
        QueryPattern copy = new QueryPattern(normalizedQuery, table, averageExecutionTime);
        copy.setFrequency(frequency);
        copy.setLastExecuted(lastExecuted);
        copy.setWhereColumns(new ArrayList<>(whereColumns));
        copy.setOrderByColumns(new ArrayList<>(orderByColumns));
        copy.setJoinColumns(new ArrayList<>(joinColumns));
        return copy;
    }
}
