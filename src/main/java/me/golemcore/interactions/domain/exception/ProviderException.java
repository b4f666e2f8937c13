package me.golemcore.interactions.domain.exception;

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

/**
 * Failure of a provider request. {@code code} is a machine-readable
 * classification ({@code llm.*}); {@code retryable} tells the interaction
 * service whether backing off and resending can help.
 */
public class ProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String provider;
    private final String model;
    private final String interactionId;
    private final String code;
    private final boolean retryable;

    public ProviderException(String message, String provider, String model, String interactionId, String code,
            boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.model = model;
        this.interactionId = interactionId;
        this.code = code;
        this.retryable = retryable;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public String getInteractionId() {
        return interactionId;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
