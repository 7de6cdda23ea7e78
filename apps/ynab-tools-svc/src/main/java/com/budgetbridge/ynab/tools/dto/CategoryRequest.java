package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CategoryRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("category_id") @NotBlank String categoryId,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public CategoryRequest {
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.JSON;
    }
}
