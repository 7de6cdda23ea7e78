package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AccountRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("account_id") @NotBlank String accountId,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public AccountRequest {
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.JSON;
    }
}
