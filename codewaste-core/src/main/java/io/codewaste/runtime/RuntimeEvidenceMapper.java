package io.codewaste.runtime;

import io.codewaste.CodeEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps runtime records onto entities by qualified name, then by simple name.
 */
public final class RuntimeEvidenceMapper {

    private RuntimeEvidenceMapper() {
    }

    public static Map<String, RuntimeEvidence> map(List<CodeEntity> entities, Map<String, RuntimeRecord> index) {
        String unmatchedSource = index.isEmpty() ? RuntimeEvidence.SOURCE_UNAVAILABLE : RuntimeEvidence.SOURCE_UNMAPPED;
        Map<String, RuntimeEvidence> mapped = new LinkedHashMap<>();
        for (CodeEntity entity : entities) {
            RuntimeRecord record = index.get(entity.qualifiedName());
            if (record == null) {
                record = index.get(entity.name());
            }
            mapped.put(entity.id(), record != null
                ? new RuntimeEvidence(entity.id(), record.invocations(), record.lastInvokedAt(), RuntimeEvidence.SOURCE_FILE)
                : new RuntimeEvidence(entity.id(), null, null, unmatchedSource));
        }
        return mapped;
    }
}
