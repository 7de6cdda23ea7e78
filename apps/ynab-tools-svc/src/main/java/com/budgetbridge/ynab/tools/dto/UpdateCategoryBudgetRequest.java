package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;

public record UpdateCategoryBudgetRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("category_id") @NotBlank String categoryId,
        @JsonProperty("month") @NotNull @Pattern(regexp = ToolPatterns.ISO_DATE, message = ToolPatterns.ISO_DATE_MESSAGE) String month,
        @JsonProperty("amount_milliunits") Long amountMilliunits,
        @JsonProperty("amount_dollars") BigDecimal amountDollars
) {
}
