package com.budgetbridge.ynab.spill;

import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.money.MilliunitCodec;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Count and total of a transaction collection, optionally with the transformed items themselves.
 * Also the layout of a spill file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionReport(
        @JsonProperty("query") String query,
        @JsonProperty("count") int count,
        @JsonProperty("total_milliunits") long totalMilliunits,
        @JsonProperty("total") String total,
        @JsonProperty("transactions") List<ObjectNode> transactions
) {

    /**
     * Sums the raw milliunit amounts first, then transforms each transaction for display.
     */
    public static TransactionReport of(String query, List<ObjectNode> rawTransactions, EntityTransformer transformer) {
        long totalMilliunits = rawTransactions.stream()
                .mapToLong(transaction -> transaction.path("amount").asLong(0L))
                .sum();
        return new TransactionReport(
                query,
                rawTransactions.size(),
                totalMilliunits,
                MilliunitCodec.toDisplay(totalMilliunits),
                transformer.transformAll(EntityKind.TRANSACTION, rawTransactions)
        );
    }

    public TransactionReport summaryOnly() {
        return new TransactionReport(query, count, totalMilliunits, total, null);
    }
}
