package com.budgetbridge.ynab.tools;

import java.util.function.Function;

/**
 * A registered tool: its descriptor, the request record its parameters bind to, and the handler.
 */
public record ToolDefinition<T>(ToolDescriptor descriptor, Class<T> requestType, Function<T, String> handler) {
}
