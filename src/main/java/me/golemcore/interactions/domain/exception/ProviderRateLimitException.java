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

import me.golemcore.interactions.domain.model.RateLimitInfo;

/**
 * Rate limit or quota rejection. Always retryable; carries what the provider
 * said about when to come back.
 */
public class ProviderRateLimitException extends ProviderException {

    private static final long serialVersionUID = 1L;

    private final transient RateLimitInfo rateLimit;

    public ProviderRateLimitException(String message, String provider, String model, String interactionId,
            String code, RateLimitInfo rateLimit, Throwable cause) {
        super(message, provider, model, interactionId, code, true, cause);
        this.rateLimit = rateLimit != null ? rateLimit : new RateLimitInfo();
    }

    public RateLimitInfo getRateLimit() {
        return rateLimit;
    }

    /**
     * Seconds until the quota resets, or -1 when the provider did not say.
     */
    public long getResetSeconds() {
        return rateLimit.getResetSeconds() != null ? rateLimit.getResetSeconds() : -1;
    }
}
