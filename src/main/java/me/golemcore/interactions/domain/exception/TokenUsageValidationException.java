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
 * A usage record was rejected before being appended to the ledger.
 */
public class TokenUsageValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String constraint;

    public TokenUsageValidationException(String field, String constraint, String message) {
        super(message);
        this.field = field;
        this.constraint = constraint;
    }

    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }
}
