package com.sailfish.taskengine.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A simple implementation of {@link TaskRuleRegistry} using an insertion-ordered Map.
 * Rules should be registered during application startup.
 */
public class MapTaskRuleRegistry implements TaskRuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapTaskRuleRegistry.class);

    private final Map<String, TaskRule> rules = new LinkedHashMap<>();

    /**
     * Registers a rule under its id. Registering the same id again replaces the
     * earlier rule but keeps its position.
     */
    public synchronized void registerRule(TaskRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        TaskRule previous = rules.put(rule.getId(), rule);
        if (previous != null) {
            log.info("Replaced task rule '{}': {} -> {}", rule.getId(), previous.getThreshold(), rule.getThreshold());
        } else {
            log.info("Registered task rule '{}' (threshold {})", rule.getId(), rule.getThreshold());
        }
    }

    @Override
    public synchronized List<TaskRule> getRules() {
        return new ArrayList<>(rules.values());
    }

    @Override
    public synchronized Optional<TaskRule> getRule(String ruleId) {
        if (ruleId == null) {
            return Optional.empty();
        }
        TaskRule rule = rules.get(ruleId);
        if (rule == null) {
            log.warn("No task rule found for id: {}", ruleId);
        }
        return Optional.ofNullable(rule);
    }

    @Override
    public synchronized Optional<TaskRule> findByTitle(String title) {
        for (TaskRule rule : rules.values()) {
            if (rule.matchesTitle(title)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
