package com.sailfish.taskengine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one rule evaluation pass: the tasks created per rule and the
 * number of content items that could not be processed.
 */
public final class RuleEvaluationResult {

    private final Map<String, List<Task>> createdByRule;
    private final int failedItems;

    public RuleEvaluationResult(Map<String, List<Task>> createdByRule, int failedItems) {
        Map<String, List<Task>> copy = new LinkedHashMap<>();
        createdByRule.forEach((ruleId, tasks) -> copy.put(ruleId, List.copyOf(tasks)));
        this.createdByRule = Collections.unmodifiableMap(copy);
        this.failedItems = failedItems;
    }

    public Map<String, List<Task>> getCreatedByRule() {
        return createdByRule;
    }

    public List<Task> getCreatedTasks(String ruleId) {
        return createdByRule.getOrDefault(ruleId, List.of());
    }

    public List<Task> getCreatedTasks() {
        List<Task> all = new ArrayList<>();
        createdByRule.values().forEach(all::addAll);
        return all;
    }

    public int getTotalCreated() {
        return createdByRule.values().stream().mapToInt(List::size).sum();
    }

    public int getFailedItems() {
        return failedItems;
    }

    @Override
    public String toString() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        createdByRule.forEach((ruleId, tasks) -> counts.put(ruleId, tasks.size()));
        return "RuleEvaluationResult{created=" + counts + ", failedItems=" + failedItems + '}';
    }
}
