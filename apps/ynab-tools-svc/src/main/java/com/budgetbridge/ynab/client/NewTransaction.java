package com.budgetbridge.ynab.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NewTransaction(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("date") String date,
        @JsonProperty("amount") long amount,
        @JsonProperty("payee_id") String payeeId,
        @JsonProperty("payee_name") String payeeName,
        @JsonProperty("category_id") String categoryId,
        @JsonProperty("memo") String memo,
        @JsonProperty("cleared") String cleared,
        @JsonProperty("approved") Boolean approved
) {
}
