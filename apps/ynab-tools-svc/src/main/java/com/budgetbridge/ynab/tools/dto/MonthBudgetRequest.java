package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record MonthBudgetRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("month") @NotNull @Pattern(regexp = ToolPatterns.ISO_DATE, message = ToolPatterns.ISO_DATE_MESSAGE) String month,
        @JsonProperty("include_hidden") Boolean includeHidden,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public MonthBudgetRequest {
        includeHidden = includeHidden != null && includeHidden;
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.MARKDOWN;
    }
}
