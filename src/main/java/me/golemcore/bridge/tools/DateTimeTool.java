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

package me.golemcore.bridge.tools;

import me.golemcore.bridge.domain.component.ToolComponent;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;
import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting current date and time.
 *
 * <p>
 * Returns the current date/time in the requested timezone, or in the clock's
 * zone when none is given. Timezone examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    @Override
    public ToolSpec getSpec() {
        return ToolSpec.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .parameterSchema(SchemaNode.object(
                        Map.of("timezone", SchemaNode.of(SchemaType.STRING,
                                "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). "
                                        + "Default is the server timezone.")),
                        List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString());
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        return CompletableFuture.completedFuture(ToolResult.success(List.of(
                now.format(FORMATTER),
                "Day of week: " + now.getDayOfWeek().name())));
    }
}
