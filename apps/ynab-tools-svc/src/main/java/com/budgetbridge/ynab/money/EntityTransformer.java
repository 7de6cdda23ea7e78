package com.budgetbridge.ynab.money;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Produces a dual-representation copy of a YNAB entity: every monetary field present for the entity kind
 * keeps its integer under {@code <field>_milliunits} and is replaced by its display string.
 */
@Component
public class EntityTransformer {

    private static final String CATEGORIES = "categories";

    public ObjectNode transform(EntityKind kind, ObjectNode raw) {
        ObjectNode result = raw.deepCopy();
        applyAmounts(kind, result);
        if (kind == EntityKind.MONTH_BUDGET) {
            JsonNode categories = result.get(CATEGORIES);
            if (categories instanceof ArrayNode array) {
                for (JsonNode category : array) {
                    if (category instanceof ObjectNode categoryNode) {
                        applyAmounts(EntityKind.CATEGORY, categoryNode);
                    }
                }
            }
        }
        return result;
    }

    public List<ObjectNode> transformAll(EntityKind kind, List<ObjectNode> raw) {
        return raw.stream().map(entity -> transform(kind, entity)).toList();
    }

    private void applyAmounts(EntityKind kind, ObjectNode target) {
        for (String field : kind.monetaryFields()) {
            JsonNode value = target.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            long milliunits = value.asLong();
            target.put(EntityKind.milliunitsField(field), milliunits);
            target.put(field, MilliunitCodec.toDisplay(milliunits));
        }
    }
}
