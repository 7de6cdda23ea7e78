package com.budgetbridge.ynab.tools.dto;

import com.budgetbridge.ynab.render.ResponseFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

public record GetBudgetsRequest(
        @JsonProperty("include_accounts") Boolean includeAccounts,
        @JsonProperty("response_format") ResponseFormat responseFormat
) {
    public GetBudgetsRequest {
        includeAccounts = includeAccounts != null && includeAccounts;
        responseFormat = responseFormat != null ? responseFormat : ResponseFormat.MARKDOWN;
    }
}
