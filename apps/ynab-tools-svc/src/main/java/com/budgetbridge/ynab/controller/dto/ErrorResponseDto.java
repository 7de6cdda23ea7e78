package com.budgetbridge.ynab.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * HTTP error envelope for requests that never reach a tool (unknown tool name, unreadable body).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {
}
