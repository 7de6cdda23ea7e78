package com.budgetbridge.ynab.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;

/**
 * Local search over fetched transactions: case-insensitive substring match on payee name or memo.
 */
public final class TransactionSearch {

    private TransactionSearch() {
    }

    public static List<ObjectNode> filter(List<ObjectNode> transactions, String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return transactions.stream()
                .filter(transaction -> contains(transaction.get("payee_name"), needle)
                        || contains(transaction.get("memo"), needle))
                .toList();
    }

    private static boolean contains(JsonNode field, String needle) {
        if (field == null || field.isNull()) {
            return false;
        }
        return field.asText().toLowerCase(Locale.ROOT).contains(needle);
    }
}
