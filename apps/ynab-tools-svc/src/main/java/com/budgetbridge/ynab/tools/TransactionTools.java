package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.client.NewTransaction;
import com.budgetbridge.ynab.client.TransactionPatch;
import com.budgetbridge.ynab.client.YnabClient;
import com.budgetbridge.ynab.money.EntityKind;
import com.budgetbridge.ynab.money.EntityTransformer;
import com.budgetbridge.ynab.render.JsonDocumentWriter;
import com.budgetbridge.ynab.spill.ResultSpiller;
import com.budgetbridge.ynab.spill.SpillKind;
import com.budgetbridge.ynab.spill.TransactionReport;
import com.budgetbridge.ynab.tools.dto.CreateTransactionRequest;
import com.budgetbridge.ynab.tools.dto.SearchTransactionsRequest;
import com.budgetbridge.ynab.tools.dto.TransactionRequest;
import com.budgetbridge.ynab.tools.dto.TransactionsRequest;
import com.budgetbridge.ynab.tools.dto.UpdateTransactionRequest;
import com.budgetbridge.ynab.validation.AmountInput;
import com.budgetbridge.ynab.validation.AmountInputValidator;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TransactionTools {

    private static final Logger log = LoggerFactory.getLogger(TransactionTools.class);

    private final YnabClient ynabClient;
    private final EntityTransformer transformer;
    private final ResultSpiller spiller;
    private final JsonDocumentWriter json;

    public TransactionTools(YnabClient ynabClient, EntityTransformer transformer, ResultSpiller spiller, JsonDocumentWriter json) {
        this.ynabClient = ynabClient;
        this.transformer = transformer;
        this.spiller = spiller;
        this.json = json;
    }

    /**
     * Filters apply in order account, category, payee; only the first one given is used.
     */
    public String getTransactions(TransactionsRequest request) {
        List<ObjectNode> raw = fetch(request);
        TransactionReport report = TransactionReport.of(null, raw, transformer);
        return deliver(report, SpillKind.TRANSACTIONS, request.summaryOnly(), request.outputToFile(), request.outputPath());
    }

    public String searchTransactions(SearchTransactionsRequest request) {
        List<ObjectNode> all = ynabClient.listTransactions(request.budgetId(), request.sinceDate());
        List<ObjectNode> matches = TransactionSearch.filter(all, request.query());
        log.debug("transaction_search budgetId={} scanned={} matched={}", request.budgetId(), all.size(), matches.size());
        TransactionReport report = TransactionReport.of(request.query(), matches, transformer);
        return deliver(report, SpillKind.SEARCH_TRANSACTIONS, request.summaryOnly(), request.outputToFile(), request.outputPath());
    }

    public String getTransaction(TransactionRequest request) {
        ObjectNode transaction = ynabClient.getTransaction(request.budgetId(), request.transactionId());
        return json.write(transformer.transform(EntityKind.TRANSACTION, transaction));
    }

    public String createTransaction(CreateTransactionRequest request) {
        AmountInput amount = AmountInputValidator.requireExactlyOne(request.amountMilliunits(), request.amountDollars());
        NewTransaction transaction = new NewTransaction(
                request.accountId(),
                request.date(),
                amount.toMilliunits(),
                request.payeeId(),
                request.payeeName(),
                request.categoryId(),
                request.memo(),
                request.cleared().wireValue(),
                request.approved()
        );
        ObjectNode created = ynabClient.createTransaction(request.budgetId(), transaction);
        log.info("transaction_created budgetId={} accountId={} amount={}",
                request.budgetId(), request.accountId(), transaction.amount());
        return json.success("transaction", transformer.transform(EntityKind.TRANSACTION, created));
    }

    public String updateTransaction(UpdateTransactionRequest request) {
        Long amount = AmountInputValidator.atMostOne(request.amountMilliunits(), request.amountDollars())
                .map(AmountInput::toMilliunits)
                .orElse(null);
        TransactionPatch patch = new TransactionPatch(
                blankToNull(request.accountId()),
                blankToNull(request.date()),
                amount,
                blankToNull(request.payeeId()),
                blankToNull(request.payeeName()),
                blankToNull(request.categoryId()),
                request.memo(),
                request.cleared() != null ? request.cleared().wireValue() : null,
                request.approved()
        );
        ObjectNode updated = ynabClient.updateTransaction(request.budgetId(), request.transactionId(), patch);
        log.info("transaction_updated budgetId={} transactionId={}", request.budgetId(), request.transactionId());
        return json.success("transaction", transformer.transform(EntityKind.TRANSACTION, updated));
    }

    private List<ObjectNode> fetch(TransactionsRequest request) {
        if (hasText(request.accountId())) {
            return ynabClient.listTransactionsByAccount(request.budgetId(), request.accountId(), request.sinceDate());
        }
        if (hasText(request.categoryId())) {
            return ynabClient.listTransactionsByCategory(request.budgetId(), request.categoryId(), request.sinceDate());
        }
        if (hasText(request.payeeId())) {
            return ynabClient.listTransactionsByPayee(request.budgetId(), request.payeeId(), request.sinceDate());
        }
        return ynabClient.listTransactions(request.budgetId(), request.sinceDate());
    }

    private String deliver(TransactionReport report, SpillKind kind, boolean summaryOnly, boolean outputToFile, String outputPath) {
        if (summaryOnly) {
            return json.write(report.summaryOnly());
        }
        return spiller.maybeSpill(report, kind, outputToFile, outputPath);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return hasText(value) ? value : null;
    }
}
