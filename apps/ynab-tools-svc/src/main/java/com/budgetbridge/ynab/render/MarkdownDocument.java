package com.budgetbridge.ynab.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered lines of a markdown response, joined with {@code \n} when rendered.
 */
public final class MarkdownDocument {

    private final List<String> lines = new ArrayList<>();

    public MarkdownDocument heading(int level, String text) {
        lines.add("#".repeat(level) + " " + text);
        return this;
    }

    public MarkdownDocument bullet(String text) {
        lines.add("- " + text);
        return this;
    }

    public MarkdownDocument fact(String label, Object value) {
        return bullet("**" + label + "**: " + value);
    }

    public MarkdownDocument line(String text) {
        lines.add(text);
        return this;
    }

    public MarkdownDocument blank() {
        lines.add("");
        return this;
    }

    public String render() {
        return String.join("\n", lines);
    }
}
