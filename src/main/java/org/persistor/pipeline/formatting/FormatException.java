package org.persistor.pipeline.formatting;

/**
 * Thrown when a source message cannot be turned into a record, e.g. because its body is not
 * valid UTF-8 text. Only the affected message is skipped; the pull task continues.
 */
public class FormatException extends Exception {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
