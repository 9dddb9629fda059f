package com.sailfish.taskengine.service.impl;

import com.sailfish.taskengine.error.ErrorReporter;
import com.sailfish.taskengine.error.NotFoundException;
import com.sailfish.taskengine.model.Content;
import com.sailfish.taskengine.model.RuleEvaluationResult;
import com.sailfish.taskengine.model.Task;
import com.sailfish.taskengine.model.TaskType;
import com.sailfish.taskengine.repository.ContentRepository;
import com.sailfish.taskengine.repository.TaskRepository;
import com.sailfish.taskengine.retry.RetryExecutor;
import com.sailfish.taskengine.retry.RetryResult;
import com.sailfish.taskengine.rules.TaskRule;
import com.sailfish.taskengine.rules.TaskRuleRegistry;
import com.sailfish.taskengine.service.TaskRulesEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Default implementation of the TaskRulesEngine.
 * <p>
 * Every repository call goes through the {@link RetryExecutor}, which reports
 * terminal failures itself. Tasks are tied to their rule and content through
 * {@link Task#getRuleId()} and {@link Task#getContentId()}; tasks without those
 * fields are matched by title instead.
 */
public class TaskRulesEngineImpl implements TaskRulesEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskRulesEngineImpl.class);

    public static final Duration DEFAULT_TASK_LIFETIME = Duration.ofDays(7);

    private final ContentRepository contentRepository;
    private final TaskRepository taskRepository;
    private final TaskRuleRegistry ruleRegistry;
    private final RetryExecutor retryExecutor;
    private final ErrorReporter errorReporter;
    private final Clock clock;
    private final Duration taskLifetime;

    public TaskRulesEngineImpl(ContentRepository contentRepository,
                               TaskRepository taskRepository,
                               TaskRuleRegistry ruleRegistry,
                               RetryExecutor retryExecutor,
                               ErrorReporter errorReporter,
                               Clock clock) {
        this(contentRepository, taskRepository, ruleRegistry, retryExecutor, errorReporter, clock, DEFAULT_TASK_LIFETIME);
    }

    public TaskRulesEngineImpl(ContentRepository contentRepository,
                               TaskRepository taskRepository,
                               TaskRuleRegistry ruleRegistry,
                               RetryExecutor retryExecutor,
                               ErrorReporter errorReporter,
                               Clock clock,
                               Duration taskLifetime) {
        this.contentRepository = Objects.requireNonNull(contentRepository, "contentRepository cannot be null");
        this.taskRepository = Objects.requireNonNull(taskRepository, "taskRepository cannot be null");
        this.ruleRegistry = Objects.requireNonNull(ruleRegistry, "ruleRegistry cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor cannot be null");
        this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.taskLifetime = Objects.requireNonNull(taskLifetime, "taskLifetime cannot be null");
        if (taskLifetime.isNegative() || taskLifetime.isZero()) {
            throw new IllegalArgumentException("taskLifetime must be positive");
        }
    }

    @Override
    public RuleEvaluationResult evaluateRules() {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, List<Task>> created = new LinkedHashMap<>();
        int failedItems = 0;

        for (TaskRule rule : ruleRegistry.getRules()) {
            List<Content> published = call("list-published-content", contentRepository::findPublished);
            List<Task> outstanding = new ArrayList<>(call("list-system-tasks", () -> taskRepository.findByType(TaskType.SYSTEM)));
            List<Task> createdForRule = new ArrayList<>();

            for (Content content : published) {
                try {
                    if (!rule.isDue(content, now) || hasOutstandingTask(outstanding, rule, content, now)) {
                        continue;
                    }
                    Task task = buildTask(rule, content, now);
                    RetryResult<Task> saved = retryExecutor.execute("create-task", () -> taskRepository.save(task));
                    if (saved.isFailure()) {
                        // Already reported by the executor
                        failedItems++;
                        continue;
                    }
                    // Later content in this pass must see the new task
                    outstanding.add(saved.getValue());
                    createdForRule.add(saved.getValue());
                    log.info("Created task '{}' for content ID {}", task.getTitle(), content.getId());
                } catch (Exception e) {
                    failedItems++;
                    errorReporter.report(e, "Evaluating rule " + rule.getId() + " for content '" + content.getTopic() + "' failed");
                }
            }
            created.put(rule.getId(), createdForRule);
        }

        RuleEvaluationResult result = new RuleEvaluationResult(created, failedItems);
        log.info("Rule evaluation finished: {}", result);
        return result;
    }

    @Override
    public Optional<Content> completeDerivedTask(Long taskId) {
        Objects.requireNonNull(taskId, "taskId cannot be null");
        Task task = call("find-task", () -> taskRepository.findById(taskId))
                .orElseThrow(() -> NotFoundException.task(taskId));

        Optional<TaskRule> rule = Optional.empty();
        Optional<Content> content = Optional.empty();
        if (task.isCorrelated()) {
            rule = ruleRegistry.getRule(task.getRuleId());
            if (rule.isPresent()) {
                content = call("find-content", () -> contentRepository.findById(task.getContentId()));
            }
        }
        if (rule.isEmpty()) {
            rule = ruleRegistry.findByTitle(task.getTitle());
            Optional<String> topic = rule.flatMap(r -> r.parseTopic(task.getTitle()));
            if (topic.isPresent()) {
                content = call("find-content-by-topic", () -> contentRepository.findByTopic(topic.get()));
            }
        }

        Content flagged = null;
        if (rule.isEmpty()) {
            log.debug("Task ID {} was not derived from a rule; completing without flag", taskId);
        } else if (content.isEmpty()) {
            log.warn("Content for task ID {} ('{}') not found; deleting task without flag", taskId, task.getTitle());
        } else {
            Long contentId = content.get().getId();
            TaskRule matched = rule.get();
            flagged = call("flag-content", () -> contentRepository.addFlag(contentId, matched.getFlag()));
            log.info("Marked content ID {} as {}", contentId, matched.getFlag().getValue());
        }

        call("delete-task", () -> taskRepository.deleteById(taskId));
        return Optional.ofNullable(flagged);
    }

    @Override
    public Map<String, List<Task>> queryPendingTasks() {
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, List<Task>> pending = new LinkedHashMap<>();
        for (TaskRule rule : ruleRegistry.getRules()) {
            pending.put(rule.getId(), new ArrayList<>());
        }
        List<Task> systemTasks = retryExecutor
                .execute("list-system-tasks", () -> taskRepository.findByType(TaskType.SYSTEM))
                .orElse(List.of());

        for (Task task : systemTasks) {
            if (task.isExpired(now)) {
                continue;
            }
            resolveRule(task).ifPresent(rule -> pending.get(rule.getId()).add(task));
        }
        return pending;
    }

    @Override
    public Map<String, List<Content>> queryContentNeedingAnalysis() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Content> published = retryExecutor
                .execute("list-published-content", contentRepository::findPublished)
                .orElse(List.of());

        Map<String, List<Content>> needing = new LinkedHashMap<>();
        for (TaskRule rule : ruleRegistry.getRules()) {
            List<Content> due = new ArrayList<>();
            for (Content content : published) {
                if (rule.isDue(content, now)) {
                    due.add(content);
                }
            }
            needing.put(rule.getId(), due);
        }
        return needing;
    }

    private Optional<TaskRule> resolveRule(Task task) {
        if (task.getRuleId() != null) {
            Optional<TaskRule> byId = ruleRegistry.getRule(task.getRuleId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        return ruleRegistry.findByTitle(task.getTitle());
    }

    private boolean hasOutstandingTask(List<Task> outstanding, TaskRule rule, Content content, LocalDateTime now) {
        String expectedTitle = rule.titleFor(content.getTopic());
        for (Task task : outstanding) {
            // Expired but not yet swept; the daily sweep runs after evaluation.
            if (task.isExpired(now)) {
                continue;
            }
            if (task.isCorrelated()) {
                if (rule.getId().equals(task.getRuleId()) && Objects.equals(content.getId(), task.getContentId())) {
                    return true;
                }
            } else if (expectedTitle.equals(task.getTitle())) {
                return true;
            }
        }
        return false;
    }

    private Task buildTask(TaskRule rule, Content content, LocalDateTime now) {
        Task task = new Task();
        task.setTitle(rule.titleFor(content.getTopic()));
        task.setDescription(rule.descriptionFor(content.getTopic()));
        task.setType(TaskType.SYSTEM);
        task.setCreatedAt(now);
        task.setExpiresAt(now.plus(taskLifetime));
        task.setLink("/content/edit/" + content.getId());
        task.setContentId(content.getId());
        task.setRuleId(rule.getId());
        return task;
    }

    private <T> T call(String operationName, Callable<T> operation) {
        return retryExecutor.execute(operationName, operation).getOrThrow();
    }
}
