package com.linlay.archinsight.llm.retry;

import com.linlay.archinsight.llm.LlmCallException;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failure is transient. A failure is retryable iff one of the patterns is a
 * case-insensitive substring of its message, its code or the decimal form of its status.
 */
public final class RetryableErrorClassifier {

    private RetryableErrorClassifier() {
    }

    public static boolean isRetryable(Throwable error, List<String> patterns) {
        if (error == null || patterns == null || patterns.isEmpty()) {
            return false;
        }
        String message = lower(error.getMessage());
        String code = "";
        String status = "";
        if (error instanceof LlmCallException callError) {
            code = lower(callError.code());
            status = callError.status() == null ? "" : String.valueOf(callError.status());
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            String needle = pattern.toLowerCase(Locale.ROOT);
            if (message.contains(needle) || code.contains(needle) || status.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
