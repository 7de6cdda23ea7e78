package com.budgetbridge.ynab.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionSearchTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ObjectNode tx(String id, String payee, String memo) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id);
        if (payee != null) {
            node.put("payee_name", payee);
        } else {
            node.putNull("payee_name");
        }
        if (memo != null) {
            node.put("memo", memo);
        }
        return node;
    }

    @Test
    void matchesPayeeOrMemoIgnoringCase() {
        List<ObjectNode> all = List.of(
                tx("1", "Starbucks", null),
                tx("2", "Grocer", "coffee beans"),
                tx("3", "Gas", "fuel"));

        List<ObjectNode> matches = TransactionSearch.filter(all, "STAR");
        assertThat(matches).extracting(node -> node.get("id").asText()).containsExactly("1");

        assertThat(TransactionSearch.filter(all, "Coffee"))
                .extracting(node -> node.get("id").asText())
                .containsExactly("2");
    }

    @Test
    void matchesEitherField() {
        List<ObjectNode> all = List.of(
                tx("1", "Blue Bottle Coffee", null),
                tx("2", "Office Depot", "Office coffee run"),
                tx("3", "Hardware Store", "nails"));

        assertThat(TransactionSearch.filter(all, "coffee"))
                .extracting(node -> node.get("id").asText())
                .containsExactly("1", "2");
    }

    @Test
    void nullPayeeAndMissingMemoNeverMatch() {
        List<ObjectNode> all = List.of(tx("1", null, null));

        assertThat(TransactionSearch.filter(all, "null")).isEmpty();
    }

    @Test
    void preservesOriginalOrder() {
        List<ObjectNode> all = List.of(
                tx("1", "Cafe A", null),
                tx("2", "Other", null),
                tx("3", "cafe b", null));

        assertThat(TransactionSearch.filter(all, "cafe"))
                .extracting(node -> node.get("id").asText())
                .containsExactly("1", "3");
    }
}
