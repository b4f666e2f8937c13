package me.golemcore.interactions.domain.system;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    // ==================== THROWABLES ====================

    @Test
    void shouldFindRateLimitDeepInCauseChain() {
        Throwable throwable = new CompletionException(
                new IllegalStateException("request failed", new RateLimitException("slow down")));

        assertEquals(ProviderErrorClassifier.RATE_LIMITED,
                ProviderErrorClassifier.classifyFromThrowable(throwable));
    }

    @Test
    void shouldClassifyLangchainExceptionTypes() {
        assertEquals(ProviderErrorClassifier.AUTHENTICATION,
                ProviderErrorClassifier.classifyFromThrowable(new AuthenticationException("bad key")));
        assertEquals(ProviderErrorClassifier.INVALID_REQUEST,
                ProviderErrorClassifier.classifyFromThrowable(new InvalidRequestException("bad body")));
        assertEquals(ProviderErrorClassifier.MODEL_NOT_FOUND,
                ProviderErrorClassifier.classifyFromThrowable(new ModelNotFoundException("no model")));
        assertEquals(ProviderErrorClassifier.CONTENT_FILTERED,
                ProviderErrorClassifier.classifyFromThrowable(new ContentFilteredException("filtered")));
        assertEquals(ProviderErrorClassifier.SERVER_ERROR,
                ProviderErrorClassifier.classifyFromThrowable(new InternalServerException("overloaded")));
        assertEquals(ProviderErrorClassifier.PROVIDER_TIMEOUT,
                ProviderErrorClassifier.classifyFromThrowable(new TimeoutException("slow")));
        assertEquals(ProviderErrorClassifier.UNKNOWN,
                ProviderErrorClassifier.classifyFromThrowable(new LangChain4jException("other")));
    }

    @Test
    void shouldResolveSubclassToNearestMappedAncestor() {
        RetriableException custom = new RetriableException("provider hiccup") {
        };

        assertEquals(ProviderErrorClassifier.SERVER_ERROR, ProviderErrorClassifier.classifyFromThrowable(custom));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.classifyFromThrowable(custom)));
    }

    @ParameterizedTest
    @CsvSource({
            "429, llm.rate_limited",
            "403, llm.authentication",
            "404, llm.model_not_found",
            "504, llm.provider.timeout",
            "529, llm.provider.server_error",
            "422, llm.invalid_request"
    })
    void shouldClassifyHttpStatus(int status, String expected) {
        assertEquals(expected, ProviderErrorClassifier.classifyFromThrowable(new HttpException(status, "http")));
        assertEquals(expected, ProviderErrorClassifier.classifyHttpStatus(status));
    }

    @Test
    void shouldClassifyJdkAbortAndTimeout() {
        assertEquals(ProviderErrorClassifier.REQUEST_ABORTED,
                ProviderErrorClassifier.classifyFromThrowable(new CancellationException("cancelled")));
        assertEquals(ProviderErrorClassifier.REQUEST_TIMEOUT,
                ProviderErrorClassifier.classifyFromThrowable(new SocketTimeoutException("read timed out")));
    }

    @Test
    void shouldRecognizeRateLimitByMessage() {
        assertEquals(ProviderErrorClassifier.RATE_LIMITED, ProviderErrorClassifier.classifyFromThrowable(
                new RuntimeException("429 Too Many Requests")));
    }

    @Test
    void shouldPreferEmbeddedCode() {
        assertEquals("llm.tool_loop.exhausted", ProviderErrorClassifier.classifyFromThrowable(
                new RateLimitException("[llm.tool_loop.exhausted] gave up")));
    }

    @Test
    void shouldReturnUnknownForUnrelatedFailures() {
        assertEquals(ProviderErrorClassifier.UNKNOWN,
                ProviderErrorClassifier.classifyFromThrowable(new IllegalStateException("boom")));
        assertEquals(ProviderErrorClassifier.UNKNOWN, ProviderErrorClassifier.classifyFromThrowable(null));
    }

    // ==================== CODES ====================

    @Test
    void shouldPrefixDiagnosticOnce() {
        String once = ProviderErrorClassifier.withCode(ProviderErrorClassifier.REQUEST_TIMEOUT, "took too long");

        assertEquals("[llm.request.timeout] took too long", once);
        assertEquals(once, ProviderErrorClassifier.withCode(ProviderErrorClassifier.REQUEST_TIMEOUT, once));
        assertEquals("[llm.request.timeout]",
                ProviderErrorClassifier.withCode(ProviderErrorClassifier.REQUEST_TIMEOUT, null));
    }

    @Test
    void shouldExtractCodeOnlyFromBracketPrefix() {
        assertEquals("llm.x", ProviderErrorClassifier.extractCode("[llm.x] detail"));
        assertNull(ProviderErrorClassifier.extractCode("detail [llm.x]"));
        assertNull(ProviderErrorClassifier.extractCode("[] detail"));
        assertNull(ProviderErrorClassifier.extractCode(null));
    }

    @Test
    void shouldTreatOnlyTransientCodesAsRetryable() {
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.RATE_LIMITED));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.SERVER_ERROR));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.REQUEST_TIMEOUT));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.AUTHENTICATION));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.INVALID_REQUEST));
        assertFalse(ProviderErrorClassifier.isTransientCode(null));
        assertTrue(ProviderErrorClassifier.isRateLimitCode(ProviderErrorClassifier.RATE_LIMITED));
    }
}
