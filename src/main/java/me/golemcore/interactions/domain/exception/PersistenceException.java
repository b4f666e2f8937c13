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
 * Durable storage failure with enough context to remediate by hand: the path,
 * what was being done and the schema version involved (0 when unknown).
 */
public class PersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Operation {
        READ,
        WRITE,
        APPEND,
        DELETE,
        VALIDATE
    }

    private final String path;
    private final Operation operation;
    private final int version;

    public PersistenceException(String message, String path, Operation operation, int version, Throwable cause) {
        super(message + " [path=" + path + ", operation=" + operation + ", version=" + version + "]", cause);
        this.path = path;
        this.operation = operation;
        this.version = version;
    }

    public PersistenceException(String message, String path, Operation operation, Throwable cause) {
        this(message, path, operation, 0, cause);
    }

    public String getPath() {
        return path;
    }

    public Operation getOperation() {
        return operation;
    }

    public int getVersion() {
        return version;
    }
}
