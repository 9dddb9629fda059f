package com.sailfish.taskengine.rules;

import java.util.List;
import java.util.Optional;

/**
 * Provides the rules the engine evaluates, and resolves a rule from a task.
 */
public interface TaskRuleRegistry {

    /**
     * @return all rules, in registration order.
     */
    List<TaskRule> getRules();

    Optional<TaskRule> getRule(String ruleId);

    /**
     * Finds the rule whose title template produced the given title.
     *
     * @param title a task title.
     * @return the first matching rule, in registration order.
     */
    Optional<TaskRule> findByTitle(String title);
}
