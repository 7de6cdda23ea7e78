package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CategoriesRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("include_hidden") Boolean includeHidden,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public CategoriesRequest {
        includeHidden = includeHidden != null && includeHidden;
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.MARKDOWN;
    }
}
