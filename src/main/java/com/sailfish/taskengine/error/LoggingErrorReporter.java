package com.sailfish.taskengine.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ErrorReporter} that writes reports to the application log.
 */
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(Throwable error, String context, Integer attempt) {
        ErrorCategory category = ErrorClassifier.classify(error);
        if (attempt != null) {
            log.error("[{}] {} (attempt {})", category, context, attempt, error);
        } else {
            log.error("[{}] {}", category, context, error);
        }
    }
}
