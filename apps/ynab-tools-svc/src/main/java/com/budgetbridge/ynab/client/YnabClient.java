package com.budgetbridge.ynab.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Capabilities consumed from the YNAB API. Entities come back as the raw JSON objects YNAB returns;
 * failures surface as {@link com.budgetbridge.ynab.error.YnabApiException}.
 */
public interface YnabClient {

    List<ObjectNode> listBudgets(boolean includeAccounts);

    ObjectNode getBudget(String budgetId);

    List<ObjectNode> listAccounts(String budgetId);

    ObjectNode getAccount(String budgetId, String accountId);

    List<ObjectNode> listCategoryGroups(String budgetId);

    ObjectNode getCategory(String budgetId, String categoryId);

    ObjectNode updateMonthCategory(String budgetId, String month, String categoryId, long budgeted);

    List<ObjectNode> listPayees(String budgetId);

    List<ObjectNode> listTransactions(String budgetId, String sinceDate);

    List<ObjectNode> listTransactionsByAccount(String budgetId, String accountId, String sinceDate);

    List<ObjectNode> listTransactionsByCategory(String budgetId, String categoryId, String sinceDate);

    List<ObjectNode> listTransactionsByPayee(String budgetId, String payeeId, String sinceDate);

    ObjectNode getTransaction(String budgetId, String transactionId);

    ObjectNode createTransaction(String budgetId, NewTransaction transaction);

    ObjectNode updateTransaction(String budgetId, String transactionId, TransactionPatch patch);

    ObjectNode getMonth(String budgetId, String month);

    List<ObjectNode> listScheduledTransactions(String budgetId);

    ObjectNode createScheduledTransaction(String budgetId, NewScheduledTransaction transaction);
}
