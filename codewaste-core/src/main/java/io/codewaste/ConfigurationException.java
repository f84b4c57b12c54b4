package io.codewaste;

/**
 * Exception thrown when caller input is unusable: bad thresholds, a missing
 * repository root or an unreadable runtime evidence file.
 *
 * <p>Raised before any scanning starts.</p>
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
