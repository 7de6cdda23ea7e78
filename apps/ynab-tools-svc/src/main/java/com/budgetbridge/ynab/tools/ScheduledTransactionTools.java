package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.NewScheduledTransaction;
import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.render.MarkdownRenderer;
import com.budgetbridge.ynab.render.ResponseFormat;
import com.budgetbridge.ynab.tools.dto.BudgetListRequest;
import com.budgetbridge.ynab.tools.dto.CreateScheduledTransactionRequest;
import com.budgetbridge.ynab.validation.AmountInput;
import com.budgetbridge.ynab.validation.AmountInputValidator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ScheduledTransactionTools {

    private static final Logger log = LoggerFactory.getLogger(ScheduledTransactionTools.class);

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final MarkdownRenderer markdown;
    private final JsonDocumentWriter json;

    public ScheduledTransactionTools(YnabClient ynabClient, EntityTransformer transformer, MarkdownRenderer markdown, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.markdown = markdown;
        this.json = json;
    }

    public String getScheduledTransactions(BudgetListRequest request) {
        List<ObjectNode> scheduled = transformer.transformAll(EntityKind.SCHEDULED_TRANSACTION,
                ynabClient.listScheduledTransactions(request.budgetId()));
        if (request.responseFormat() == ResponseFormat.MARKDOWN) {
            return markdown.scheduledTransactions(scheduled);
        }
        return json.write(scheduled);
    }

    public String createScheduledTransaction(CreateScheduledTransactionRequest request) {
        AmountInput amount = AmountInputValidator.requireExactlyOne(request.amountMilliunits(), request.amountDollars());
        NewScheduledTransaction transaction = new NewScheduledTransaction(
                request.accountId(),
                request.dateFirst(),
                request.frequency().wireValue(),
                amount.toMilliunits(),
                request.payeeId(),
                request.payeeName(),
                request.categoryId(),
                request.memo()
        );
        ObjectNode created = ynabClient.createScheduledTransaction(request.budgetId(), transaction);
        log.info("scheduled_transaction_created budgetId={} accountId={} frequency={}",
                request.budgetId(), request.accountId(), transaction.frequency());
        return json.success("scheduled_transaction", transformer.transform(EntityKind.SCHEDULED_TRANSACTION, created));
    }
}
