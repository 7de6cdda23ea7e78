package com.budgetbridge.ynab.tools;

public class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
