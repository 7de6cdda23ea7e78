package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.CategoriesRequest;
import com.budgetbridge.ynab.tools.dto.CategoryRequest;
import com.budgetbridge.ynab.tools.dto.UpdateCategoryBudgetRequest;
import com.budgetbridge.ynab.validation.AmountInput;
import com.budgetbridge.ynab.validation.AmountInputValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CategoryTools {

    private static final Logger log = LoggerFactory.getLogger(CategoryTools.class);

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public CategoryTools(YnabClient ynabClient, EntityTransformer transformer, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.markdown = markdown;
        this.json = json;
    }

    public String getCategories(CategoriesRequest request) {
        List<ObjectNode> groups = ynabClient.listCategoryGroups(request.budgetId()).stream()
                .map(this::transformGroup)
                .toList();
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.categoryGroups(groups, request.includeHidden());
        }
        return json.write(groups);
    }

    public String getCategory(CategoryRequest request) {
        ObjectNode category = transformer.transform(EntityKind.CATEGORY,
                ynabClient.getCategory(request.budgetId(), request.categoryId()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.category(category);
        }
        return json.write(category);
    }

    public String updateCategoryBudget(UpdateCategoryBudgetRequest request) {
        AmountInput amount = AmountInputValidator.requireExactlyOne(request.amountMilliunits(), request.amountDollars());
        long budgeted = amount.toMilliunits();
        log.info("category_budget_update budgetId={} categoryId={} month={} budgeted={}",
                request.budgetId(), request.categoryId(), request.month(), budgeted);
        ObjectNode updated = ynabClient.updateMonthCategory(request.budgetId(), request.month(), request.categoryId(), budgeted);
        return json.success("category", transformer.transform(EntityKind.CATEGORY, updated));
    }

    private ObjectNode transformGroup(ObjectNode group) {
        ObjectNode result = group.objectNode();
        result.set("id", group.get("id"));
        result.set("name", group.get("name"));
        result.put("hidden", group.path("hidden").asBoolean(false));
        ArrayNode categories = result.putArray("categories");
        for (JsonNode category : group.path("categories")) {
            if (category instanceof ObjectNode categoryNode) {
                categories.add(transformer.transform(EntityKind.CATEGORY, categoryNode));
            }
        }
        return result;
    }
}
