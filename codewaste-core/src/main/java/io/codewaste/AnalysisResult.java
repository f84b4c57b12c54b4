package io.codewaste;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one {@link CodeAnalyzer#analyze} call produced.
 */
public record AnalysisResult(
    /** Entities in scan order (file path, then start line) */
    List<CodeEntity> entities,

    /** Provenance signals at or above the threshold, in entity order */
    List<ProvenanceSignal> signals,

    /** Duplication pairs, similarity descending */
    List<DuplicationPair> duplicationPairs,

    /** Git evidence keyed by entity id; empty when unavailable */
    Map<String, GitEvidence> gitEvidence
) {
    public AnalysisResult {
        entities = List.copyOf(entities);
        signals = List.copyOf(signals);
        duplicationPairs = List.copyOf(duplicationPairs);
        gitEvidence = Collections.unmodifiableMap(new LinkedHashMap<>(gitEvidence));
    }

    /** First entity with the id, in scan order. */
    public Optional<CodeEntity> entity(String id) {
        return entities.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public long gitEvidenceAvailableCount() {
        return gitEvidence.values().stream().filter(GitEvidence::available).count();
    }
}
