package io.codewaste.duplication;

import io.codewaste.AnalysisConfig;
import io.codewaste.CodeEntity;
import io.codewaste.Confidence;
import io.codewaste.DuplicationPair;
import io.codewaste.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds pairs of structurally near-identical functions.
 *
 * <p>Each entity is canonicalized by its language's {@link Canonicalizer}.
 * Functions with too few body statements or too short a signature are left
 * out; every remaining pair is compared with {@link SequenceMatcher}.
 * Comparison is quadratic in the number of retained functions.</p>
 */
public class DuplicationDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicationDetector.class);

    private final double highThreshold;
    private final double mediumThreshold;
    private final boolean includeMedium;
    private final int minBodyStatements;
    private final int minSignatureChars;
    private final Map<SourceLanguage, Canonicalizer> canonicalizers;

    public DuplicationDetector(AnalysisConfig config) {
        this(config, defaultCanonicalizers());
    }

    public DuplicationDetector(AnalysisConfig config, Map<SourceLanguage, Canonicalizer> canonicalizers) {
        this.highThreshold = config.highThreshold();
        this.mediumThreshold = config.mediumThreshold();
        this.includeMedium = config.includeMedium();
        this.minBodyStatements = config.minBodyStatements();
        this.minSignatureChars = config.minSignatureChars();
        this.canonicalizers = new EnumMap<>(canonicalizers);
    }

    private static Map<SourceLanguage, Canonicalizer> defaultCanonicalizers() {
        Canonicalizer script = new ScriptCanonicalizer();
        return Map.of(
            SourceLanguage.JAVA, new JavaCanonicalizer(),
            SourceLanguage.JAVASCRIPT, script,
            SourceLanguage.TYPESCRIPT, script);
    }

    /**
     * Compares every pair of eligible entities.
     *
     * @param entities entities in scan order
     * @return pairs at or above the configured thresholds, similarity descending
     */
    public List<DuplicationPair> detect(List<CodeEntity> entities) {
        List<CanonicalSignature> signatures = new ArrayList<>();
        for (CodeEntity entity : entities) {
            signature(entity).ifPresent(signatures::add);
        }

        List<DuplicationPair> pairs = new ArrayList<>();
        for (int i = 0; i < signatures.size(); i++) {
            for (int j = i + 1; j < signatures.size(); j++) {
                CanonicalSignature a = signatures.get(i);
                CanonicalSignature b = signatures.get(j);
                // same-line overloads share an id
                if (a.entityId().equals(b.entityId())) {
                    continue;
                }
                double ratio = SequenceMatcher.ratio(a.tokens(), b.tokens());
                classify(ratio).ifPresent(confidence ->
                    pairs.add(new DuplicationPair(a.entityId(), b.entityId(), round3(ratio), confidence)));
            }
        }

        // List.sort is stable: equal similarities keep scan order
        pairs.sort(Comparator.comparingDouble(DuplicationPair::similarity).reversed());
        log.debug("Compared {} of {} entities, {} duplication pairs",
            signatures.size(), entities.size(), pairs.size());
        return pairs;
    }

    Optional<CanonicalSignature> signature(CodeEntity entity) {
        Optional<SourceLanguage> language = SourceLanguage.forPath(entity.filePath());
        Canonicalizer canonicalizer = language.map(canonicalizers::get).orElse(null);
        if (canonicalizer == null) {
            return Optional.empty();
        }
        return canonicalizer.canonicalize(entity)
            .filter(signature -> signature.bodyStatements() >= minBodyStatements)
            .filter(signature -> signature.text().length() >= minSignatureChars);
    }

    private Optional<Confidence> classify(double ratio) {
        if (ratio >= highThreshold) {
            return Optional.of(Confidence.HIGH);
        }
        if (includeMedium && ratio >= mediumThreshold) {
            return Optional.of(Confidence.MEDIUM);
        }
        return Optional.empty();
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
