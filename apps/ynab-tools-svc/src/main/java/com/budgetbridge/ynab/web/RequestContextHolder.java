package com.budgetbridge.ynab.web;

import java.util.Optional;

/**
 * Per-request trace id and tool name, readable from anywhere on the serving thread.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void begin(String traceId) {
        CURRENT.set(new RequestContext(traceId, null));
    }

    /** Records the tool being served; a no-op outside {@link TraceIdFilter}. */
    public static void setToolName(String toolName) {
        RequestContext current = CURRENT.get();
        if (current != null) {
            CURRENT.set(new RequestContext(current.traceId(), toolName));
        }
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static void clear() {
        CURRENT.remove();
    }

    public record RequestContext(String traceId, String toolName) {
    }
}
