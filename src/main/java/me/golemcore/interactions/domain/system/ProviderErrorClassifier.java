package me.golemcore.interactions.domain.system;

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

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures to stable {@code llm.*} codes and decides which of
 * them are worth retrying.
 *
 * <p>
 * The cause chain is searched for an embedded {@code [code]} prefix, then for
 * a langchain4j exception (matched by class name up its superclass chain, so
 * the domain does not depend on langchain4j), then for a rate-limit message.
 */
public final class ProviderErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String RATE_LIMITED = "llm.rate_limited";
    public static final String PROVIDER_TIMEOUT = "llm.provider.timeout";
    public static final String SERVER_ERROR = "llm.provider.server_error";
    public static final String AUTHENTICATION = "llm.authentication";
    public static final String INVALID_REQUEST = "llm.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.model_not_found";
    public static final String CONTENT_FILTERED = "llm.content_filtered";
    public static final String UNKNOWN = "llm.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS = "dev.langchain4j.exception.";
    private static final String HTTP_EXCEPTION = "HttpException";

    // langchain4j exception simple name -> code; subclasses resolve to their nearest mapped ancestor
    private static final Map<String, String> CODES_BY_EXCEPTION = Map.of(
            "RateLimitException", RATE_LIMITED,
            "TimeoutException", PROVIDER_TIMEOUT,
            "InternalServerException", SERVER_ERROR,
            "RetriableException", SERVER_ERROR,
            "AuthenticationException", AUTHENTICATION,
            "ModelNotFoundException", MODEL_NOT_FOUND,
            "ContentFilteredException", CONTENT_FILTERED,
            "InvalidRequestException", INVALID_REQUEST,
            "NonRetriableException", INVALID_REQUEST);

    private static final Set<String> TRANSIENT_CODES = Set.of(
            RATE_LIMITED, PROVIDER_TIMEOUT, SERVER_ERROR, REQUEST_TIMEOUT);

    private ProviderErrorClassifier() {
    }

    public static String classifyFromThrowable(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        for (Throwable current = throwable; current != null && visited.add(current); current = current.getCause()) {
            String code = extractCode(current.getMessage());
            if (code == null) {
                code = classifyByType(current);
            }
            if (code == null) {
                code = classifyByMessage(current.getMessage());
            }
            if (code != null) {
                return code;
            }
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        return message.startsWith("[" + code + "]") ? message : "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        return end <= 1 ? null : message.substring(1, end);
    }

    /**
     * Rate limits, timeouts and server-side failures. Authentication and
     * invalid-request errors never are.
     */
    public static boolean isTransientCode(String code) {
        return code != null && TRANSIENT_CODES.contains(code);
    }

    public static boolean isRateLimitCode(String code) {
        return RATE_LIMITED.equals(code);
    }

    public static String classifyHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 404) {
            return MODEL_NOT_FOUND;
        }
        if (statusCode == 408 || statusCode == 504) {
            return PROVIDER_TIMEOUT;
        }
        if (statusCode >= 500) {
            return SERVER_ERROR;
        }
        return statusCode >= 400 ? INVALID_REQUEST : UNKNOWN;
    }

    private static String classifyByType(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        for (Class<?> type = throwable.getClass(); type != null; type = type.getSuperclass()) {
            String name = type.getName();
            if (!name.startsWith(LANGCHAIN4J_EXCEPTIONS)) {
                continue;
            }
            String simpleName = name.substring(LANGCHAIN4J_EXCEPTIONS.length());
            if (HTTP_EXCEPTION.equals(simpleName)) {
                Integer status = readStatusCode(throwable);
                return status != null ? classifyHttpStatus(status) : null;
            }
            String code = CODES_BY_EXCEPTION.get(simpleName);
            if (code != null) {
                return code;
            }
        }
        return null;
    }

    private static Integer readStatusCode(Throwable throwable) {
        try {
            Object status = throwable.getClass().getMethod("statusCode").invoke(throwable);
            return status instanceof Integer ? (Integer) status : null;
        } catch (ReflectiveOperationException e) {
            return null;
        }
    }

    private static String classifyByMessage(String message) {
        if (message == null) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit") || normalized.contains("too many requests")) {
            return RATE_LIMITED;
        }
        return null;
    }
}
