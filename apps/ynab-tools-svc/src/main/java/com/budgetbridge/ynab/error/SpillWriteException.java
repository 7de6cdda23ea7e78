package com.budgetbridge.ynab.error;

import java.nio.file.Path;

/**
 * The result spiller could not write its output file.
 */
public class SpillWriteException extends RuntimeException {

    public SpillWriteException(Path target, Throwable cause) {
        super("Could not write " + target + ": " + cause.getMessage(), cause);
    }
}
