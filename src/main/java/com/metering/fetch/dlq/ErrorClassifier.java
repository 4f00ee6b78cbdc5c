package com.metering.fetch.dlq;

import com.metering.fetch.domain.ErrorCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps a failure to a {@link FailureClassification}.
 *
 * The error category decides whenever it is known. Message text is consulted only
 * for {@link ErrorCategory#UNKNOWN}, with pattern groups checked in order
 * recoverable, user, system.
 */
@Component
public class ErrorClassifier {

    private static final List<String> RECOVERABLE_PATTERNS =
        List.of("timeout", "timed out", "rate limit", "temporarily unavailable", "503", "504");
    private static final List<String> USER_ERROR_PATTERNS =
        List.of("invalid", "not found", "unauthorized", "400", "401", "403", "404");
    private static final List<String> SYSTEM_ERROR_PATTERNS =
        List.of("internal", "unexpected", "crash", "500", "502");

    public FailureClassification classify(ErrorCategory category, String message) {
        if (category == null) {
            return classifyText(message);
        }
        switch (category) {
            case TRANSIENT:
                return FailureClassification.RECOVERABLE;
            case CLIENT_FAULT:
                return FailureClassification.USER_ERROR;
            case SERVER_FAULT:
                return FailureClassification.SYSTEM_ERROR;
            default:
                return classifyText(message);
        }
    }

    FailureClassification classifyText(String message) {
        if (message == null || message.isBlank()) {
            return FailureClassification.UNKNOWN;
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (matchesAny(text, RECOVERABLE_PATTERNS)) {
            return FailureClassification.RECOVERABLE;
        }
        if (matchesAny(text, USER_ERROR_PATTERNS)) {
            return FailureClassification.USER_ERROR;
        }
        if (matchesAny(text, SYSTEM_ERROR_PATTERNS)) {
            return FailureClassification.SYSTEM_ERROR;
        }
        return FailureClassification.UNKNOWN;
    }

    private static boolean matchesAny(String text, List<String> patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
