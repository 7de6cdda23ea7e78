package com.budgetbridge.ynab.spill;

/**
 * Collection being spilled; decides the generated file prefix and the acknowledgement wording.
 */
public enum SpillKind {
    TRANSACTIONS("transactions") {
        @Override
        String writtenMessage(TransactionReport report, String path) {
            return "Wrote " + report.count() + " transactions to " + path;
        }
    },
    SEARCH_TRANSACTIONS("search_transactions") {
        @Override
        String writtenMessage(TransactionReport report, String path) {
            return "Found " + report.count() + " matching transactions. Wrote to " + path;
        }
    };

    private final String filePrefix;

    SpillKind(String filePrefix) {
        this.filePrefix = filePrefix;
    }

    public String filePrefix() {
        return filePrefix;
    }

    abstract String writtenMessage(TransactionReport report, String path);

    String tooLargeMessage(int inlineLength, String path) {
        return "Response too large (" + inlineLength + " chars). Wrote to " + path;
    }
}
