package com.sailfish.taskengine.rules;

import com.sailfish.taskengine.model.ContentFlag;

import java.time.Duration;

/**
 * The two built-in feedback review rules.
 */
public final class FeedbackRules {

    public static final String FANS_FEEDBACK_ID = "fans-feedback";
    public static final String OVERALL_FEEDBACK_ID = "overall-feedback";

    public static final Duration DEFAULT_FANS_FEEDBACK_THRESHOLD = Duration.ofDays(2);
    public static final Duration DEFAULT_OVERALL_FEEDBACK_THRESHOLD = Duration.ofDays(10);

    private FeedbackRules() {
    }

    public static TaskRule fansFeedback(Duration threshold) {
        return new TaskRule(FANS_FEEDBACK_ID, threshold, ContentFlag.FANS_FEEDBACK_ANALYSED,
                "Analyse Fans Feedback on %s",
                "Review and analyze fan feedback for \"%s\" content. Check comments, engagement metrics, and audience response.");
    }

    public static TaskRule overallFeedback(Duration threshold) {
        return new TaskRule(OVERALL_FEEDBACK_ID, threshold, ContentFlag.OVERALL_FEEDBACK_ANALYSED,
                "Analyse Overall Feedback on %s",
                "Conduct comprehensive analysis of overall feedback for \"%s\" content. Review performance metrics, audience retention, and long-term impact.");
    }

    public static MapTaskRuleRegistry defaultRegistry() {
        return registry(DEFAULT_FANS_FEEDBACK_THRESHOLD, DEFAULT_OVERALL_FEEDBACK_THRESHOLD);
    }

    public static MapTaskRuleRegistry registry(Duration fansFeedbackThreshold, Duration overallFeedbackThreshold) {
        MapTaskRuleRegistry registry = new MapTaskRuleRegistry();
        registry.registerRule(fansFeedback(fansFeedbackThreshold));
        registry.registerRule(overallFeedback(overallFeedbackThreshold));
        return registry;
    }
}
