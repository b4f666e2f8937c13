package me.golemcore.interactions.port.outbound;

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

import me.golemcore.interactions.domain.model.ProviderRequest;
import me.golemcore.interactions.domain.model.ProviderResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for LLM providers. Implementations translate the request to the vendor
 * format and fail with
 * {@link me.golemcore.interactions.domain.exception.ProviderException} (or its
 * rate-limit subtype) classified as retryable or not. Retrying is the caller's
 * job.
 */
public interface ProviderPort {

    /**
     * Returns the provider identifier (e.g., "anthropic", "openai").
     */
    String getProviderId();

    CompletableFuture<ProviderResponse> send(ProviderRequest request);
}
