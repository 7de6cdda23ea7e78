package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.MonthBudgetRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

@Service
public class MonthTools {

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public MonthTools(YnabClient ynabClient, EntityTransformer transformer, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.markdown = markdown;
        this.json = json;
    }

    public String getMonthBudget(MonthBudgetRequest request) {
        ObjectNode month = transformer.transform(EntityKind.MONTH_BUDGET,
                ynabClient.getMonth(request.budgetId(), request.month()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.month(month, request.includeHidden());
        }
        return json.write(month);
    }
}
