package io.codewaste.runtime;

/**
 * Runtime invocation data mapped onto one entity.
 */
public record RuntimeEvidence(
    String entityId,

    /** Invocations in the observation window; null when unknown */
    Integer invocationCount,

    String lastInvokedAt,

    /** Where the data came from: runtime-file, runtime-unmapped or runtime-unavailable */
    String source
) {
    public static final String SOURCE_FILE = "runtime-file";
    public static final String SOURCE_UNMAPPED = "runtime-unmapped";
    public static final String SOURCE_UNAVAILABLE = "runtime-unavailable";

    public boolean zeroInvocations() {
        return invocationCount != null && invocationCount == 0;
    }

    public boolean invoked() {
        return invocationCount != null && invocationCount > 0;
    }
}
