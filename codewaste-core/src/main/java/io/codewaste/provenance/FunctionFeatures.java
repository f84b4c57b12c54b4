package io.codewaste.provenance;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Structural measurements of one function, as read by the provenance rules.
 */
public record FunctionFeatures(
    /** Top-level statements in the body */
    int statementCount,

    /** Guard clauses ({@code if} ending in return or throw) near the top of the body */
    int guardClauseCount,

    /** Names bound by declarations or assignments, lowercased, with repeats */
    List<String> assignedNames,

    /** {@code if} statements anywhere in the body */
    int ifCount,

    /** String literals mentioning error, invalid or fail, lowercased, with repeats */
    List<String> errorLiterals,

    /** Name returned bare by the final statement, if that is its shape */
    Optional<String> returnedName,

    /** Whether any loop or try block appears in the body */
    boolean hasLoopOrTry
) {
    public FunctionFeatures {
        assignedNames = List.copyOf(assignedNames);
        errorLiterals = List.copyOf(errorLiterals);
    }

    /** Share of assigned names in the generic set; 0 when nothing is assigned. */
    public double genericNameRatio() {
        if (assignedNames.isEmpty()) {
            return 0.0;
        }
        long generic = assignedNames.stream().filter(GenericNames::isGeneric).count();
        return (double) generic / assignedNames.size();
    }

    /** {@code if} statements per top-level statement. */
    public double defensiveDensity() {
        return (double) ifCount / Math.max(statementCount, 1);
    }

    /** At least two error literals, mostly repeating the same text. */
    public boolean repetitiveErrors() {
        int total = errorLiterals.size();
        long distinct = errorLiterals.stream().distinct().count();
        return total >= 2 && distinct <= total / 2 + 1;
    }

    public boolean returnsGenericName() {
        return returnedName.filter(GenericNames::isGeneric).isPresent();
    }

    static boolean isErrorLike(String literal) {
        String lowered = literal.toLowerCase(Locale.ROOT);
        return lowered.contains("error") || lowered.contains("invalid") || lowered.contains("fail");
    }
}
