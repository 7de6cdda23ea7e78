package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.BudgetSummaryRequest;
import com.budgetbridge.ynab.tools.dto.GetBudgetsRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class BudgetTools {

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public BudgetTools(YnabClient ynabClient, EntityTransformer transformer, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.markdown = markdown;
        this.json = json;
    }

    public String getBudgets(GetBudgetsRequest request) {
        List<ObjectNode> budgets = new ArrayList<>();
        for (ObjectNode budget : ynabClient.listBudgets(request.includeAccounts())) {
            ObjectNode copy = budget.deepCopy();
            if (request.includeAccounts() && budget.path("accounts").isArray()) {
                copy.set("accounts", transformAccounts(budget.path("accounts")));
            }
            budgets.add(copy);
        }
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.budgets(budgets, request.includeAccounts());
        }
        return json.write(budgets);
    }

    /**
     * Curated overview of one budget: accounts plus category groups carrying only category names.
     */
    public String getBudgetSummary(BudgetSummaryRequest request) {
        ObjectNode summary = summarize(ynabClient.getBudget(request.budgetId()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.budgetSummary(summary, request.includeHidden());
        }
        return json.write(summary);
    }

    ObjectNode summarize(ObjectNode budget) {
        Map<String, List<String>> categoryNamesByGroup = new LinkedHashMap<>();
        for (JsonNode category : budget.path("categories")) {
            categoryNamesByGroup
                    .computeIfAbsent(category.path("category_group_id").asText(), key -> new ArrayList<>())
                    .add(category.path("name").asText());
        }

        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode summary = nodes.objectNode();
        summary.set("id", budget.get("id"));
        summary.set("name", budget.get("name"));
        summary.set("last_modified_on", budget.get("last_modified_on"));
        summary.set("currency_format", budget.get("currency_format"));
        summary.set("accounts", transformAccounts(budget.path("accounts")));

        ArrayNode groups = summary.putArray("category_groups");
        for (JsonNode group : budget.path("category_groups")) {
            ObjectNode entry = groups.addObject();
            String groupId = group.path("id").asText();
            entry.put("id", groupId);
            entry.set("name", group.get("name"));
            entry.put("hidden", group.path("hidden").asBoolean(false));
            ArrayNode names = entry.putArray("categories");
            categoryNamesByGroup.getOrDefault(groupId, List.of()).forEach(names::add);
        }
        return summary;
    }

    private ArrayNode transformAccounts(JsonNode accounts) {
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (JsonNode account : accounts) {
            if (account instanceof ObjectNode accountNode) {
                result.add(transformer.transform(EntityKind.ACCOUNT, accountNode));
            }
        }
        return result;
    }
}
