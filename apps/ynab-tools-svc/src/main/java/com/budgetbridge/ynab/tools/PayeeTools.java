package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.BudgetListRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class PayeeTools {

    private final YnabClient ynabClient;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public PayeeTools(YnabClient ynabClient, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.markdown = markdown;
        this.json = json;
    }

    public String getPayees(BudgetListRequest request) {
        List<ObjectNode> payees = ynabClient.listPayees(request.budgetId());
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.payees(payees);
        }
        return json.write(payees);
    }
}
