package com.budgetbridge.ynab.spill;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpillReceipt(
        @JsonProperty("query") String query,
        @JsonProperty("count") int count,
        @JsonProperty("total_milliunits") long totalMilliunits,
        @JsonProperty("total") String total,
        @JsonProperty("output_file") String outputFile,
        @JsonProperty("message") String message
) {
}
