package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record CreateScheduledTransactionRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("account_id") @NotBlank String accountId,
        @JsonProperty("date_first") @NotNull @Pattern(regexp = ToolPatterns.ISO_DATE, message = ToolPatterns.ISO_DATE_MESSAGE) String dateFirst,
        @JsonProperty("frequency") @NotNull ScheduleFrequency frequency,
        @JsonProperty("amount_milliunits") Long amountMilliunits,
        @JsonProperty("amount_dollars") BigDecimal amountDollars,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("memo") @Size(max = 200) String memo
) {
}
