package org.dooq.ddbjson.transfer;

import org.jetbrains.annotations.NotNull;

/**
 * A document of the input could not be converted.
 */
public class TransferException extends RuntimeException {

    private final long lineNumber;

    public TransferException(long lineNumber, @NotNull String message, @NotNull Throwable cause) {
        super(lineNumber > 0 ? "line %d: %s".formatted(lineNumber, message) : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line of a JSON Lines input, 0 for a whole document input.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
