package com.sailfish.taskengine.service;

import com.sailfish.taskengine.model.Content;
import com.sailfish.taskengine.model.RuleEvaluationResult;
import com.sailfish.taskengine.model.Task;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives follow-up tasks from content state and folds completed tasks back
 * into content flags.
 */
public interface TaskRulesEngine {

    /**
     * Creates a system task for every published, unflagged content item that has
     * passed a rule's threshold and has no outstanding task for that rule yet.
     * A failure on one content item is reported and does not stop the pass.
     * <p>
     * Calls are not mutually excluded. Two overlapping passes can both create a
     * task for the same content and rule.
     *
     * @return the tasks created, grouped by rule id.
     */
    RuleEvaluationResult evaluateRules();

    /**
     * Completes a task: sets the flag of the rule that produced it on the related
     * content, then deletes the task. A missing content item is logged and the
     * task is still deleted.
     *
     * @param taskId The id of the task to complete.
     * @return the flagged content, or empty if no content was flagged.
     * @throws com.sailfish.taskengine.error.NotFoundException if the task does not exist.
     */
    Optional<Content> completeDerivedTask(Long taskId);

    /**
     * @return outstanding system tasks grouped by rule id, in rule order.
     */
    Map<String, List<Task>> queryPendingTasks();

    /**
     * Lists content that needs a review per rule, whether or not a task currently exists for it.
     *
     * @return content grouped by rule id, in rule order.
     */
    Map<String, List<Content>> queryContentNeedingAnalysis();
}
