package io.codewaste.runtime;

import io.codewaste.CodeEntity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeEvidenceMapperTest {

    private final CodeEntity validate = CodeEntity.of("orders.js", "validate", "orders.validate", 1, 3, "");
    private final CodeEntity cancel = CodeEntity.of("orders.js", "cancel", "orders.cancel", 5, 7, "");

    @Test
    void testQualifiedNameWinsOverSimpleName() {
        Map<String, RuntimeRecord> index = Map.of(
            "orders.validate", new RuntimeRecord(10, "2026-01-01"),
            "validate", new RuntimeRecord(99, null));

        RuntimeEvidence evidence = RuntimeEvidenceMapper.map(List.of(validate), index).get(validate.id());

        assertEquals(10, evidence.invocationCount());
        assertEquals("2026-01-01", evidence.lastInvokedAt());
        assertEquals(RuntimeEvidence.SOURCE_FILE, evidence.source());
        assertTrue(evidence.invoked());
        assertFalse(evidence.zeroInvocations());
    }

    @Test
    void testSimpleNameFallback() {
        Map<String, RuntimeRecord> index = Map.of("cancel", new RuntimeRecord(0, null));

        Map<String, RuntimeEvidence> mapped = RuntimeEvidenceMapper.map(List.of(validate, cancel), index);

        assertTrue(mapped.get(cancel.id()).zeroInvocations());
        RuntimeEvidence unmapped = mapped.get(validate.id());
        assertNull(unmapped.invocationCount());
        assertEquals(RuntimeEvidence.SOURCE_UNMAPPED, unmapped.source());
        assertFalse(unmapped.invoked());
        assertFalse(unmapped.zeroInvocations());
    }

    @Test
    void testNoIndexMeansUnavailable() {
        Map<String, RuntimeEvidence> mapped = RuntimeEvidenceMapper.map(List.of(validate, cancel), Map.of());

        assertEquals(List.of(validate.id(), cancel.id()), List.copyOf(mapped.keySet()));
        mapped.values().forEach(e -> assertEquals(RuntimeEvidence.SOURCE_UNAVAILABLE, e.source()));
    }
}
