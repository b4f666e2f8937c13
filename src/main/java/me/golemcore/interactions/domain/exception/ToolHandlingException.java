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
 * Failure while looking up, loading or running a tool.
 */
public class ToolHandlingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String OP_LOOKUP = "lookup";
    public static final String OP_LOAD = "load";
    public static final String OP_EXECUTE = "execute";
    public static final String OP_FORMAT = "format";
    public static final String OP_CAPABILITY_CHECK = "capability-check";

    private final String toolName;
    private final String operation;

    public ToolHandlingException(String toolName, String operation, String message) {
        this(toolName, operation, message, null);
    }

    public ToolHandlingException(String toolName, String operation, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.operation = operation;
    }

    public String getToolName() {
        return toolName;
    }

    public String getOperation() {
        return operation;
    }
}
