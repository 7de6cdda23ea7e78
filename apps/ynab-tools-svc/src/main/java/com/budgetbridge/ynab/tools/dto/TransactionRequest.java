package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record TransactionRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("transaction_id") @NotBlank String transactionId
) {
}
