package me.golemcore.interactions.tools;

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

import me.golemcore.interactions.domain.component.BuiltinTool;
import me.golemcore.interactions.domain.exception.ToolHandlingException;
import me.golemcore.interactions.domain.model.EditorContext;
import me.golemcore.interactions.domain.model.Interaction;
import me.golemcore.interactions.domain.model.ToolDescriptor;
import me.golemcore.interactions.domain.model.ToolRunResult;
import me.golemcore.interactions.domain.model.ToolSource;
import me.golemcore.interactions.domain.model.ToolUseRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns current date/time in a specified timezone (or system default).
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
@RequiredArgsConstructor
public class CurrentDateTimeTool implements BuiltinTool {

    public static final String NAME = "current_datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .version("1.0.0")
                .source(ToolSource.INTERNAL)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is system timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public ToolRunResult run(Interaction interaction, ToolUseRequest request, EditorContext editorContext) {
        Object timezone = request.getToolInput() != null ? request.getToolInput().get("timezone") : null;
        ZoneId zoneId;
        if (timezone instanceof String timezoneStr && !timezoneStr.isBlank()) {
            try {
                zoneId = ZoneId.of(timezoneStr);
            } catch (DateTimeException e) {
                throw new ToolHandlingException(NAME, ToolHandlingException.OP_EXECUTE,
                        "Invalid timezone: " + timezoneStr, e);
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted = now.format(FORMATTER);
        String text = formatted + " (" + now.getDayOfWeek().name() + ")";
        return ToolRunResult.text(text, text, "Current time: " + formatted);
    }
}
