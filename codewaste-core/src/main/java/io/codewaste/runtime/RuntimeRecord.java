package io.codewaste.runtime;

/**
 * One usable record from a runtime evidence file.
 *
 * @param invocations   invocation count over the observation window
 * @param lastInvokedAt last invocation timestamp as given, or null
 */
public record RuntimeRecord(int invocations, String lastInvokedAt) {
}
