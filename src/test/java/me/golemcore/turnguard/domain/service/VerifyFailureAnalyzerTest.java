package me.golemcore.turnguard.domain.service;

import me.golemcore.turnguard.domain.model.FailureClass;
import me.golemcore.turnguard.domain.model.VerifyFailureAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class VerifyFailureAnalyzerTest {

    // ===== Classification =====

    @Test
    void shouldClassifyActionLimitAsPolicyLimit() {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer
                .analyze("blocked by security policy: action limit exceeded");

        assertEquals(FailureClass.POLICY_LIMIT, analysis.failureClass());
        assertFalse(analysis.retryable());
    }

    @Test
    void shouldClassifyDailyCostLimitAsPolicyLimit() {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze("Daily Cost Limit Exceeded for today");

        assertEquals(FailureClass.POLICY_LIMIT, analysis.failureClass());
    }

    @ParameterizedTest
    @ValueSource(strings = { "error: insufficient_quota", "You exceeded your current quota, please check",
            "HTTP 429: billing hard limit reached" })
    void shouldClassifyQuotaExhaustion(String message) {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze(message);

        assertEquals(FailureClass.QUOTA_EXHAUSTED, analysis.failureClass());
        assertFalse(analysis.retryable());
    }

    @ParameterizedTest
    @ValueSource(strings = { "provider returned 401 unauthorized", "status=400 bad request", "404 not found",
            "error 499" })
    void shouldClassifyClientErrorsAsNonRetryable(String message) {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze(message);

        assertEquals(FailureClass.NON_RETRYABLE_PROVIDER_ERROR, analysis.failureClass());
        assertFalse(analysis.retryable());
    }

    @ParameterizedTest
    @ValueSource(strings = { "request timed out (408)", "429 too many requests", "502 bad gateway",
            "connection reset", "error 4000", "code 39" })
    void shouldClassifyEverythingElseAsTransient(String message) {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze(message);

        assertEquals(FailureClass.TRANSIENT_FAILURE, analysis.failureClass());
        assertTrue(analysis.retryable());
    }

    @Test
    void shouldPreferPolicyOverStatusCode() {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze("403: action limit exceeded");

        assertEquals(FailureClass.POLICY_LIMIT, analysis.failureClass());
    }

    @Test
    void shouldIgnoreNonAsciiDigits() {
        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze("status ٤٠١");

        assertEquals(FailureClass.TRANSIENT_FAILURE, analysis.failureClass());
    }

    @Test
    void shouldTreatNullMessageAsTransient() {
        assertTrue(VerifyFailureAnalyzer.analyze((String) null).retryable());
    }

    // ===== Cause chain =====

    @Test
    void shouldClassifyUsingCauseChain() {
        RuntimeException error = new CompletionException(
                new IllegalStateException("call provider", new RuntimeException("HTTP 403 forbidden")));

        VerifyFailureAnalysis analysis = VerifyFailureAnalyzer.analyze(error);

        assertEquals(FailureClass.NON_RETRYABLE_PROVIDER_ERROR, analysis.failureClass());
    }

    @Test
    void shouldDescribeCauseChainWithoutWrappers() {
        RuntimeException error = new CompletionException(
                new IllegalStateException("call provider", new RuntimeException("timeout")));

        assertEquals("call provider: timeout", VerifyFailureAnalyzer.describe(error));
    }

    @Test
    void shouldFallBackToClassNameWhenNoMessage() {
        assertEquals("IllegalStateException", VerifyFailureAnalyzer.describe(new IllegalStateException()));
    }
}
