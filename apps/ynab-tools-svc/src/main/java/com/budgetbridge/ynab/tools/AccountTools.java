package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.AccountRequest;
import com.budgetbridge.ynab.tools.dto.BudgetListRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class AccountTools {

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public AccountTools(YnabClient ynabClient, EntityTransformer transformer, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.markdown = markdown;
        this.json = json;
    }

    public String getAccounts(BudgetListRequest request) {
        List<ObjectNode> accounts = transformer.transformAll(EntityKind.ACCOUNT, ynabClient.listAccounts(request.budgetId()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.accounts(accounts);
        }
        return json.write(accounts);
    }

    public String getAccount(AccountRequest request) {
        ObjectNode account = transformer.transform(EntityKind.ACCOUNT,
                ynabClient.getAccount(request.budgetId(), request.accountId()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.account(account);
        }
        return json.write(account);
    }
}
