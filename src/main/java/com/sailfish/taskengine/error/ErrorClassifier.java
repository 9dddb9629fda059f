package com.sailfish.taskengine.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Maps arbitrary failures onto {@link ErrorCategory}.
 * <p>
 * Known exception types win. Otherwise the message and simple class name of each
 * throwable in the cause chain are matched against known patterns. Anything left
 * over is {@link ErrorCategory#UNCLASSIFIED}.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private static final List<Pattern> TRANSIENT_PATTERNS = List.of(
            Pattern.compile("network", Pattern.CASE_INSENSITIVE),
            Pattern.compile("time[ d]?out", Pattern.CASE_INSENSITIVE),
            Pattern.compile("fetch", Pattern.CASE_INSENSITIVE),
            Pattern.compile("connection", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rate limit", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b5\\d\\d\\b"));

    private static final List<Pattern> NOT_FOUND_PATTERNS = List.of(
            Pattern.compile("not found", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b404\\b"));

    private static final List<Pattern> PERMANENT_PATTERNS = List.of(
            Pattern.compile("validation", Pattern.CASE_INSENSITIVE),
            Pattern.compile("invalid", Pattern.CASE_INSENSITIVE),
            Pattern.compile("required", Pattern.CASE_INSENSITIVE),
            Pattern.compile("permission", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unauthori[sz]ed", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forbidden", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b4\\d\\d\\b"));

    private ErrorClassifier() {
    }

    public static ErrorCategory classify(Throwable error) {
        if (error == null) {
            return ErrorCategory.UNCLASSIFIED;
        }
        ErrorCategory byType = classifyByType(error);
        if (byType != ErrorCategory.UNCLASSIFIED) {
            return byType;
        }
        return classifyByMessage(error);
    }

    /**
     * Default retry condition: only transient failures are retried.
     */
    public static boolean isRetryable(Throwable error) {
        return classify(error) == ErrorCategory.TRANSIENT;
    }

    private static ErrorCategory classifyByType(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TaskEngineException) {
                ErrorCategory category = ((TaskEngineException) current).getCategory();
                if (category != ErrorCategory.UNCLASSIFIED) {
                    return category;
                }
            } else if (current instanceof IOException
                    || current instanceof UncheckedIOException
                    || current instanceof TimeoutException) {
                return ErrorCategory.TRANSIENT;
            }
            current = current.getCause();
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    private static ErrorCategory classifyByMessage(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String text = current.getClass().getSimpleName() + " " + (current.getMessage() == null ? "" : current.getMessage());
            if (matchesAny(TRANSIENT_PATTERNS, text)) {
                return ErrorCategory.TRANSIENT;
            }
            if (matchesAny(NOT_FOUND_PATTERNS, text)) {
                return ErrorCategory.NOT_FOUND;
            }
            if (matchesAny(PERMANENT_PATTERNS, text)) {
                return ErrorCategory.PERMANENT;
            }
            current = current.getCause();
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
