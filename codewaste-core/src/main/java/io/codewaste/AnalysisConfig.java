package io.codewaste;

/**
 * Configuration for one analysis run.
 */
public record AnalysisConfig(
    /** Whether directories named "tests" are scanned */
    boolean includeTests,

    /** Similarity at or above which a pair is high confidence */
    double highThreshold,

    /** Similarity at or above which a pair is medium confidence (if enabled) */
    double mediumThreshold,

    /** Whether medium-confidence pairs are reported */
    boolean includeMedium,

    /** Minimum body statements for a function to take part in duplication */
    int minBodyStatements,

    /** Minimum canonical signature length for duplication; 0 disables the check */
    int minSignatureChars,

    /** Minimum score for a provenance signal to be reported */
    double provenanceThreshold,

    /** Whether git blame evidence is collected and applied */
    boolean gitEvidenceEnabled
) {

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
            false,  // includeTests
            0.9,    // highThreshold
            0.75,   // mediumThreshold
            false,  // includeMedium
            3,      // minBodyStatements
            0,      // minSignatureChars
            0.65,   // provenanceThreshold
            true    // gitEvidenceEnabled
        );
    }

    /**
     * Checks caller-supplied values.
     *
     * @throws ConfigurationException if a value is out of range
     */
    public AnalysisConfig validate() {
        requireUnitInterval("highThreshold", highThreshold);
        requireUnitInterval("mediumThreshold", mediumThreshold);
        requireUnitInterval("provenanceThreshold", provenanceThreshold);
        if (includeMedium && mediumThreshold > highThreshold) {
            throw new ConfigurationException(String.format(
                "mediumThreshold (%.2f) must not exceed highThreshold (%.2f)", mediumThreshold, highThreshold));
        }
        if (minBodyStatements < 0) {
            throw new ConfigurationException("minBodyStatements must be >= 0, got " + minBodyStatements);
        }
        if (minSignatureChars < 0) {
            throw new ConfigurationException("minSignatureChars must be >= 0, got " + minSignatureChars);
        }
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0, 1], got " + value);
        }
    }

    public AnalysisConfig withIncludeTests(boolean includeTests) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withHighThreshold(double highThreshold) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withMediumTier(double mediumThreshold) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, true,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withMinBodyStatements(int minBodyStatements) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withMinSignatureChars(int minSignatureChars) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withProvenanceThreshold(double provenanceThreshold) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }

    public AnalysisConfig withGitEvidence(boolean gitEvidenceEnabled) {
        return new AnalysisConfig(includeTests, highThreshold, mediumThreshold, includeMedium,
            minBodyStatements, minSignatureChars, provenanceThreshold, gitEvidenceEnabled);
    }
}
