package me.golemcore.turnguard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.turnguard.domain.model.FailureClass;
import me.golemcore.turnguard.domain.model.VerifyFailureAnalysis;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classifies a failed turn attempt into a {@link FailureClass} and a retry
 * decision using case-insensitive message heuristics.
 *
 * <p>
 * Anything not recognized as a policy limit, exhausted quota or 4xx provider
 * error is treated as transient. The verify/repair caps bound how often those
 * are retried.
 */
public final class VerifyFailureAnalyzer {

    private VerifyFailureAnalyzer() {
    }

    public static VerifyFailureAnalysis analyze(Throwable throwable) {
        return analyze(describe(throwable));
    }

    public static VerifyFailureAnalysis analyze(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);

        if (lower.contains("action limit exceeded") || lower.contains("daily cost limit exceeded")) {
            return new VerifyFailureAnalysis(FailureClass.POLICY_LIMIT, false);
        }

        if (lower.contains("insufficient_quota")
                || lower.contains("exceeded your current quota")
                || (lower.contains("429") && lower.contains("billing"))) {
            return new VerifyFailureAnalysis(FailureClass.QUOTA_EXHAUSTED, false);
        }

        if (containsNonRetryableStatus(lower)) {
            return new VerifyFailureAnalysis(FailureClass.NON_RETRYABLE_PROVIDER_ERROR, false);
        }

        return new VerifyFailureAnalysis(FailureClass.TRANSIENT_FAILURE, true);
    }

    /**
     * Message of the throwable and its causes joined with {@code ": "}. Async
     * wrappers ({@link CompletionException}, {@link ExecutionException}) are
     * skipped so the underlying failure is described.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        StringBuilder description = new StringBuilder();
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            boolean wrapper = (current instanceof CompletionException || current instanceof ExecutionException)
                    && current.getCause() != null;
            String message = current.getMessage();
            if (!wrapper && message != null && !message.isBlank()
                    && description.indexOf(message) < 0) {
                if (description.length() > 0) {
                    description.append(": ");
                }
                description.append(message);
            }
            current = current.getCause();
        }
        if (description.length() == 0) {
            return throwable.getClass().getSimpleName();
        }
        return description.toString();
    }

    // Every run of digits is a candidate status code.
    private static boolean containsNonRetryableStatus(String lower) {
        int index = 0;
        int length = lower.length();
        while (index < length) {
            if (!isAsciiDigit(lower.charAt(index))) {
                index++;
                continue;
            }
            int start = index;
            while (index < length && isAsciiDigit(lower.charAt(index))) {
                index++;
            }
            String digits = lower.substring(start, index);
            if (digits.length() <= 5) {
                int code = Integer.parseInt(digits);
                if (code >= 400 && code < 500 && code != 408 && code != 429) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
