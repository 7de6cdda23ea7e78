package com.budgetbridge.ynab.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-facing description of a tool, including behavioural hints for the caller's planner.
 */
public record ToolDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("readOnlyHint") boolean readOnly,
        @JsonProperty("destructiveHint") boolean destructive,
        @JsonProperty("idempotentHint") boolean idempotent,
        @JsonProperty("openWorldHint") boolean openWorld
) {

    static ToolDescriptor read(String name, String title, String description) {
        return new ToolDescriptor(name, title, description, true, false, true, true);
    }

    static ToolDescriptor write(String name, String title, String description, boolean idempotent) {
        return new ToolDescriptor(name, title, description, false, false, idempotent, true);
    }
}
