package com.budgetbridge.ynab.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Curated markdown views of transformed YNAB entities. Monetary fields are expected to already hold
 * display strings. Hidden category groups, hidden categories and closed accounts nested in a larger
 * view are skipped unless {@code includeHidden} is set.
 */
@Component
public class MarkdownRenderer {

    public String budgets(List<ObjectNode> budgets, boolean includeAccounts) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "YNAB Budgets").blank();
        for (ObjectNode budget : budgets) {
            doc.heading(2, text(budget, "name"));
            doc.fact("ID", code(text(budget, "id")));
            if (present(budget, "last_modified_on")) {
                doc.fact("Last Modified", text(budget, "last_modified_on"));
            }
            JsonNode accounts = budget.path("accounts");
            if (includeAccounts && accounts.isArray() && !accounts.isEmpty()) {
                doc.bullet("**Accounts**:");
                for (JsonNode account : accounts) {
                    doc.line("  - " + text(account, "name") + ": " + text(account, "balance"));
                }
            }
            doc.blank();
        }
        return doc.render();
    }

    public String budgetSummary(ObjectNode summary, boolean includeHidden) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Budget: " + text(summary, "name")).blank();
        doc.line("**ID**: " + code(text(summary, "id")));
        if (present(summary, "last_modified_on")) {
            doc.line("**Last Modified**: " + text(summary, "last_modified_on"));
        }
        doc.blank();

        doc.heading(2, "Accounts");
        for (JsonNode account : summary.path("accounts")) {
            boolean closed = flag(account, "closed");
            if (closed && !includeHidden) {
                continue;
            }
            doc.bullet("**" + text(account, "name") + "**" + (closed ? " (closed)" : "") + ": "
                    + text(account, "balance") + " (cleared: " + text(account, "cleared_balance") + ")");
        }
        doc.blank();

        doc.heading(2, "Category Groups");
        for (JsonNode group : summary.path("category_groups")) {
            if (flag(group, "hidden") && !includeHidden) {
                continue;
            }
            doc.heading(3, text(group, "name"));
            for (JsonNode categoryName : group.path("categories")) {
                doc.line("  - " + categoryName.asText());
            }
            doc.blank();
        }
        return doc.render();
    }

    public String accounts(List<ObjectNode> accounts) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Accounts").blank();
        for (ObjectNode account : accounts) {
            String status = flag(account, "closed") ? " (closed)" : "";
            String onBudget = flag(account, "on_budget") ? "on-budget" : "off-budget";
            doc.heading(2, text(account, "name") + status);
            doc.fact("ID", code(text(account, "id")));
            doc.fact("Type", textOr(account, "type", "unknown") + " (" + onBudget + ")");
            doc.fact("Balance", text(account, "balance"));
            doc.fact("Cleared", text(account, "cleared_balance"));
            doc.fact("Uncleared", text(account, "uncleared_balance"));
            doc.blank();
        }
        return doc.render();
    }

    public String account(ObjectNode account) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, text(account, "name")).blank();
        doc.line("**ID**: " + code(text(account, "id")));
        doc.line("**Type**: " + textOr(account, "type", "unknown"));
        doc.line("**On Budget**: " + yesNo(flag(account, "on_budget")));
        doc.line("**Closed**: " + yesNo(flag(account, "closed")));
        doc.blank();
        doc.heading(2, "Balances");
        doc.fact("Balance", text(account, "balance"));
        doc.fact("Cleared", text(account, "cleared_balance"));
        doc.fact("Uncleared", text(account, "uncleared_balance"));
        return doc.render();
    }

    public String categoryGroups(List<ObjectNode> groups, boolean includeHidden) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Categories").blank();
        for (ObjectNode group : groups) {
            if (flag(group, "hidden") && !includeHidden) {
                continue;
            }
            doc.heading(2, text(group, "name"));
            for (JsonNode category : group.path("categories")) {
                if (flag(category, "hidden") && !includeHidden) {
                    continue;
                }
                doc.bullet("**" + text(category, "name") + "** (" + code(text(category, "id")) + ")");
                doc.line("  - Budgeted: " + text(category, "budgeted")
                        + " | Activity: " + text(category, "activity")
                        + " | Balance: " + text(category, "balance"));
            }
            doc.blank();
        }
        return doc.render();
    }

    public String category(ObjectNode category) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, text(category, "name")).blank();
        doc.line("**ID**: " + code(text(category, "id")));
        doc.line("**Budgeted**: " + text(category, "budgeted"));
        doc.line("**Activity**: " + text(category, "activity"));
        doc.line("**Balance**: " + text(category, "balance"));
        if (present(category, "goal_type")) {
            doc.blank();
            doc.heading(2, "Goal");
            doc.bullet("Type: " + text(category, "goal_type"));
            if (present(category, "goal_target")) {
                doc.bullet("Target: " + text(category, "goal_target"));
            }
            JsonNode progress = category.get("goal_percentage_complete");
            if (progress != null && !progress.isNull()) {
                doc.bullet("Progress: " + progress.asText() + "%");
            }
        }
        return doc.render();
    }

    public String payees(List<ObjectNode> payees) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Payees").blank();
        for (ObjectNode payee : payees) {
            doc.bullet("**" + text(payee, "name") + "** (" + code(text(payee, "id")) + ")");
        }
        return doc.render();
    }

    public String month(ObjectNode month, boolean includeHidden) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Budget: " + text(month, "month")).blank();
        doc.line("**Income**: " + text(month, "income"));
        doc.line("**Budgeted**: " + text(month, "budgeted"));
        doc.line("**Activity**: " + text(month, "activity"));
        doc.line("**To Be Budgeted**: " + text(month, "to_be_budgeted"));
        JsonNode ageOfMoney = month.get("age_of_money");
        if (ageOfMoney != null && ageOfMoney.asInt() != 0) {
            doc.line("**Age of Money**: " + ageOfMoney.asInt() + " days");
        }
        doc.blank();

        doc.heading(2, "Categories");
        for (JsonNode category : month.path("categories")) {
            if (flag(category, "hidden") && !includeHidden) {
                continue;
            }
            doc.heading(3, text(category, "name"));
            doc.bullet("Budgeted: " + text(category, "budgeted"));
            doc.bullet("Activity: " + text(category, "activity"));
            doc.bullet("Balance: " + text(category, "balance"));
            doc.blank();
        }
        return doc.render();
    }

    public String scheduledTransactions(List<ObjectNode> transactions) {
        MarkdownDocument doc = new MarkdownDocument().heading(1, "Scheduled Transactions").blank();
        for (ObjectNode transaction : transactions) {
            doc.heading(2, textOr(transaction, "payee_name", "Unknown Payee"));
            doc.fact("ID", code(text(transaction, "id")));
            doc.fact("Amount", text(transaction, "amount"));
            doc.fact("Frequency", textOr(transaction, "frequency", "unknown"));
            doc.fact("Next Date", textOr(transaction, "date_next", "unknown"));
            if (present(transaction, "memo")) {
                doc.fact("Memo", text(transaction, "memo"));
            }
            doc.blank();
        }
        return doc.render();
    }

    private static String text(JsonNode node, String field) {
        return textOr(node, field, "");
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }

    private static boolean present(JsonNode node, String field) {
        return !text(node, field).isEmpty();
    }

    private static boolean flag(JsonNode node, String field) {
        return node.path(field).asBoolean(false);
    }

    private static String code(String value) {
        return "`" + value + "`";
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
