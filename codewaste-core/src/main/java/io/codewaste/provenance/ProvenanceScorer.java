package io.codewaste.provenance;

import io.codewaste.CodeEntity;
import io.codewaste.GitEvidence;
import io.codewaste.ProvenanceSignal;
import io.codewaste.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores entities for probable machine-generated authorship.
 *
 * <p>The score is the sum of the weights of every matching
 * {@link ProvenanceRule}, plus every matching {@link GitAdjustment} when the
 * entity has available git evidence. It is clamped to [0, 0.99] and rounded
 * to two decimals.</p>
 */
public class ProvenanceScorer {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceScorer.class);

    static final double MAX_SCORE = 0.99;

    private final Map<SourceLanguage, FeatureExtractor> extractors;

    public ProvenanceScorer() {
        this(defaultExtractors());
    }

    public ProvenanceScorer(Map<SourceLanguage, FeatureExtractor> extractors) {
        this.extractors = new EnumMap<>(extractors);
    }

    private static Map<SourceLanguage, FeatureExtractor> defaultExtractors() {
        FeatureExtractor script = new ScriptFeatureExtractor();
        return Map.of(
            SourceLanguage.JAVA, new JavaFeatureExtractor(),
            SourceLanguage.JAVASCRIPT, script,
            SourceLanguage.TYPESCRIPT, script);
    }

    /**
     * @param entities  entities in scan order
     * @param threshold minimum score for a signal to be reported
     * @param evidence  git evidence by entity id; empty when git evidence is disabled
     * @return signals at or above the threshold, in entity order
     */
    public List<ProvenanceSignal> score(List<CodeEntity> entities, double threshold,
                                        Map<String, GitEvidence> evidence) {
        List<ProvenanceSignal> signals = new ArrayList<>();
        for (CodeEntity entity : entities) {
            score(entity, evidence.get(entity.id()))
                .filter(signal -> signal.probability() >= threshold)
                .ifPresent(signals::add);
        }
        log.debug("{} of {} entities scored at or above {}", signals.size(), entities.size(), threshold);
        return signals;
    }

    /**
     * Scores one entity regardless of threshold.
     *
     * @param gitEvidence evidence for this entity, or null
     * @return the signal, or empty if the entity holds no readable function
     */
    public Optional<ProvenanceSignal> score(CodeEntity entity, GitEvidence gitEvidence) {
        FeatureExtractor extractor = SourceLanguage.forPath(entity.filePath())
            .map(extractors::get)
            .orElse(null);
        if (extractor == null) {
            return Optional.empty();
        }
        Optional<FunctionFeatures> features = extractor.extract(entity);
        if (features.isEmpty()) {
            return Optional.empty();
        }

        double score = 0.0;
        List<String> labels = new ArrayList<>();
        for (ProvenanceRule rule : ProvenanceRule.RULES) {
            if (rule.matches(features.get())) {
                score += rule.weight();
                labels.add(rule.label());
            }
        }
        if (gitEvidence != null) {
            for (GitAdjustment adjustment : GitAdjustment.ADJUSTMENTS) {
                if (adjustment.matches(gitEvidence)) {
                    score += adjustment.weight();
                    labels.add(adjustment.label());
                }
            }
        }

        return Optional.of(ProvenanceSignal.of(entity.id(), clamp(score), labels));
    }

    static double clamp(double score) {
        double rounded = Math.round(score * 100.0) / 100.0;
        return Math.max(0.0, Math.min(MAX_SCORE, rounded));
    }
}
