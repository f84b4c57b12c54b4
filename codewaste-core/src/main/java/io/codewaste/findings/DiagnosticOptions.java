package io.codewaste.findings;

import io.codewaste.ConfigurationException;

import java.nio.file.Path;

/**
 * Options for correlating analysis output with runtime evidence.
 */
public record DiagnosticOptions(
    /** Runtime evidence JSON file, or null */
    Path runtimePath,

    /** Days covered by the runtime evidence */
    int timeWindowDays,

    /** Cost of one invocation; 0 disables cost estimates */
    double costPerInvocation,

    /** Currency label used in reports */
    String currency,

    /** SQLite run history database, or null to skip recording */
    Path historyPath
) {
    public static DiagnosticOptions defaults() {
        return new DiagnosticOptions(
            null,   // runtimePath
            90,     // timeWindowDays
            0.0,    // costPerInvocation
            "USD",  // currency
            null    // historyPath
        );
    }

    /**
     * @throws ConfigurationException if a value is out of range
     */
    public DiagnosticOptions validate() {
        if (timeWindowDays < 0) {
            throw new ConfigurationException("timeWindowDays must be >= 0, got " + timeWindowDays);
        }
        if (Double.isNaN(costPerInvocation) || costPerInvocation < 0.0) {
            throw new ConfigurationException("costPerInvocation must be >= 0, got " + costPerInvocation);
        }
        if (currency == null || currency.isBlank()) {
            throw new ConfigurationException("currency must not be blank");
        }
        return this;
    }

    public DiagnosticOptions withRuntimePath(Path runtimePath) {
        return new DiagnosticOptions(runtimePath, timeWindowDays, costPerInvocation, currency, historyPath);
    }

    public DiagnosticOptions withTimeWindowDays(int timeWindowDays) {
        return new DiagnosticOptions(runtimePath, timeWindowDays, costPerInvocation, currency, historyPath);
    }

    public DiagnosticOptions withCostPerInvocation(double costPerInvocation) {
        return new DiagnosticOptions(runtimePath, timeWindowDays, costPerInvocation, currency, historyPath);
    }

    public DiagnosticOptions withCurrency(String currency) {
        return new DiagnosticOptions(runtimePath, timeWindowDays, costPerInvocation, currency, historyPath);
    }

    public DiagnosticOptions withHistoryPath(Path historyPath) {
        return new DiagnosticOptions(runtimePath, timeWindowDays, costPerInvocation, currency, historyPath);
    }
}
