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
 * Resource access failure, tagged with the attempted operation and the kind of
 * failure so callers can tell "missing" from "forbidden".
 */
public class ResourceHandlingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String uri;
    private final ResourceOperation operation;
    private final ResourceFailureKind kind;

    public ResourceHandlingException(String uri, ResourceOperation operation, ResourceFailureKind kind,
            String message) {
        this(uri, operation, kind, message, null);
    }

    public ResourceHandlingException(String uri, ResourceOperation operation, ResourceFailureKind kind,
            String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
        this.operation = operation;
        this.kind = kind;
    }

    public String getUri() {
        return uri;
    }

    public ResourceOperation getOperation() {
        return operation;
    }

    public ResourceFailureKind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == ResourceFailureKind.NOT_FOUND;
    }
}
