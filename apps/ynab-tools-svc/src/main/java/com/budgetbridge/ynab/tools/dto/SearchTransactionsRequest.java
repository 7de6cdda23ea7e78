package com.budgetbridge.ynab.tools.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record SearchTransactionsRequest(
        @JsonProperty("budget_id") @NotBlank String budgetId,
        @JsonProperty("query") @NotBlank String query,
        @JsonProperty("since_date") @Pattern(regexp = ToolPatterns.ISO_DATE, message = ToolPatterns.ISO_DATE_MESSAGE) String sinceDate,
        @JsonProperty("output_to_file") Boolean outputToFile,
        @JsonProperty("output_path") String outputPath,
        @JsonProperty("summary_only") Boolean summaryOnly
) {
    public SearchTransactionsRequest {
        outputToFile = outputToFile == null || outputToFile;
        summaryOnly = summaryOnly != null && summaryOnly;
    }
}
