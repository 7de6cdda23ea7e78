package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Partial update; every field except the ids is optional and only populated fields are sent.
 */
public record UpdateTransactionRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("transaction_id") @NotBlank String transactionId,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("date") @Pattern(regexp = ToolPatterns.ISO_DATE, message = ToolPatterns.ISO_DATE_MESSAGE) String date,
        @JsonProperty("amount_milliunits") Long amountMilliunits,
        @JsonProperty("amount_dollars") BigDecimal amountDollars,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("memo") @Size(max = 200) String memo,
        @JsonProperty("cleared") ClearedStatus cleared,
        @JsonProperty("approved") Boolean approved
) {
}
