package io.codewaste.history;

/**
 * Exception thrown when the run history database cannot be opened or written.
 */
public class RunHistoryException extends RuntimeException {

    public RunHistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
