package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Parameters of the list tools scoped to one budget (accounts, payees, scheduled transactions).
 */
public record BudgetListRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public BudgetListRequest {
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.MARKDOWN;
    }
}
