package com.budgetbridge.ynab.tools;

import com.budgetbridge.ynab.tools.dto.AccountRequest;
import com.budgetbridge.ynab.tools.dto.BudgetListRequest;
import com.budgetbridge.ynab.tools.dto.BudgetSummaryRequest;
import com.budgetbridge.ynab.tools.dto.CategoriesRequest;
import com.budgetbridge.ynab.tools.dto.CategoryRequest;
import com.budgetbridge.ynab.tools.dto.CreateScheduledTransactionRequest;
import com.budgetbridge.ynab.tools.dto.CreateTransactionRequest;
import com.budgetbridge.ynab.tools.dto.GetBudgetsRequest;
import com.budgetbridge.ynab.tools.dto.MonthBudgetRequest;
import com.budgetbridge.ynab.tools.dto.SearchTransactionsRequest;
import com.budgetbridge.ynab.tools.dto.TransactionRequest;
import com.budgetbridge.ynab.tools.dto.TransactionsRequest;
import com.budgetbridge.ynab.tools.dto.UpdateCategoryBudgetRequest;
import com.budgetbridge.ynab.tools.dto.UpdateTransactionRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Every tool the service exposes, keyed by tool name in registration order.
 */
@Component
public class ToolRegistry {

    private final Map<String, ToolDefinition<?>> tools = new LinkedHashMap<>();

    public ToolRegistry(
            BudgetTools budgets,
            AccountTools accounts,
            CategoryTools categories,
            PayeeTools payees,
            TransactionTools transactions,
            MonthTools months,
            ScheduledTransactionTools scheduled
    ) {
        register(ToolDescriptor.read("ynab_get_budgets", "List YNAB Budgets",
                        "List all budgets the user has access to. Returns budget names and IDs. Use the budget_id in other tools."),
                GetBudgetsRequest.class, budgets::getBudgets);
        register(ToolDescriptor.read("ynab_get_budget_summary", "Get Budget Summary",
                        "Get a summary of a budget including accounts and category groups. Returns a curated overview, not the full budget export."),
                BudgetSummaryRequest.class, budgets::getBudgetSummary);
        register(ToolDescriptor.read("ynab_get_accounts", "List Budget Accounts",
                        "List all accounts in a budget with balances."),
                BudgetListRequest.class, accounts::getAccounts);
        register(ToolDescriptor.read("ynab_get_account", "Get Single Account",
                        "Get details for a single account."),
                AccountRequest.class, accounts::getAccount);
        register(ToolDescriptor.read("ynab_get_categories", "List Budget Categories",
                        "List all categories in a budget grouped by category group."),
                CategoriesRequest.class, categories::getCategories);
        register(ToolDescriptor.read("ynab_get_category", "Get Single Category",
                        "Get details for a single category including goal info."),
                CategoryRequest.class, categories::getCategory);
        register(ToolDescriptor.write("ynab_update_category_budget", "Update Category Budget",
                        "Update the budgeted amount for a category in a specific month.", true),
                UpdateCategoryBudgetRequest.class, categories::updateCategoryBudget);
        register(ToolDescriptor.read("ynab_get_payees", "List Payees",
                        "List all payees in a budget."),
                BudgetListRequest.class, payees::getPayees);
        register(ToolDescriptor.read("ynab_get_transactions", "Get Transactions",
                        "Get transactions from a budget with optional filters. Defaults to file output to keep large results out of the response. Use since_date and filters to limit results."),
                TransactionsRequest.class, transactions::getTransactions);
        register(ToolDescriptor.read("ynab_get_transaction", "Get Single Transaction",
                        "Get details for a single transaction."),
                TransactionRequest.class, transactions::getTransaction);
        register(ToolDescriptor.write("ynab_create_transaction", "Create Transaction",
                        "Create a new transaction in YNAB.", false),
                CreateTransactionRequest.class, transactions::createTransaction);
        register(ToolDescriptor.write("ynab_update_transaction", "Update Transaction",
                        "Update an existing transaction.", true),
                UpdateTransactionRequest.class, transactions::updateTransaction);
        register(ToolDescriptor.read("ynab_search_transactions", "Search Transactions",
                        "Search transactions by payee name or memo. Fetches transactions and filters locally; use since_date to limit scope."),
                SearchTransactionsRequest.class, transactions::searchTransactions);
        register(ToolDescriptor.read("ynab_get_month_budget", "Get Month Budget",
                        "Get budget details for a specific month including category allocations and activity."),
                MonthBudgetRequest.class, months::getMonthBudget);
        register(ToolDescriptor.read("ynab_get_scheduled_transactions", "List Scheduled Transactions",
                        "List all scheduled (recurring) transactions in a budget."),
                BudgetListRequest.class, scheduled::getScheduledTransactions);
        register(ToolDescriptor.write("ynab_create_scheduled_transaction", "Create Scheduled Transaction",
                        "Create a new scheduled (recurring) transaction.", false),
                CreateScheduledTransactionRequest.class, scheduled::createScheduledTransaction);
    }

    public Optional<ToolDefinition<?>> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream().map(ToolDefinition::descriptor).toList();
    }

    private <T> void register(ToolDescriptor descriptor, Class<T> requestType, Function<T, String> handler) {
        tools.put(descriptor.name(), new ToolDefinition<>(descriptor, requestType, handler));
    }
}
