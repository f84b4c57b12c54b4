package io.codewaste.provenance;

import io.codewaste.CodeEntity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScriptFeatureExtractorTest {

    private final ScriptFeatureExtractor extractor = new ScriptFeatureExtractor();

    private FunctionFeatures features(String source) {
        CodeEntity entity = CodeEntity.of("src/a.js", "f", "src.a.f", 1, (int) source.lines().count(), source);
        return extractor.extract(entity).orElseThrow();
    }

    @Test
    void testValidatorFeatures() {
        FunctionFeatures features = features("""
            function validateOrderPayload(payload) {
              if (payload == null) {
                throw new Error("invalid payload");
              }
              if (!payload.orderId) {
                throw new Error("invalid payload");
              }
              if (!payload.items) {
                throw new Error("invalid payload");
              }

              const data = payload;
              const result = {};
              result.orderId = data.orderId;
              result.itemCount = data.items.length;
              return result;
            }
            """);

        assertEquals(8, features.statementCount());
        assertEquals(3, features.guardClauseCount());
        assertEquals(List.of("data", "result"), features.assignedNames());
        assertEquals(3, features.ifCount());
        assertEquals(3, features.errorLiterals().size());
        assertTrue(features.repetitiveErrors());
        assertEquals(Optional.of("result"), features.returnedName());
        assertFalse(features.hasLoopOrTry());
    }

    @Test
    void testBracesInsideStringsDoNotBreakGuards() {
        FunctionFeatures features = features("""
            const check = (value) => {
              if (!value) { return "{missing}"; }
              if (value.length > 9) { throw new Error("too long }"); }
              return value;
            };
            """);

        assertEquals(2, features.guardClauseCount());
        assertEquals(Optional.of("value"), features.returnedName());
        assertTrue(features.errorLiterals().isEmpty());
    }

    @Test
    void testGuardsWithCallConditions() {
        String source = """
            function normalizeOrders(payload) {
              if (!Array.isArray(payload)) {
                throw new Error("invalid payload");
              }
              if (isEmpty(payload)) {
                return null;
              }
              if (!isValid(payload[0], (row) => row.id)) {
                throw new Error("invalid payload");
              }
              const result = payload.map((row) => row.id);
              return result;
            }
            """;

        assertEquals(3, features(source).guardClauseCount());

        CodeEntity entity = CodeEntity.of("src/a.js", "normalizeOrders", "src.a.normalizeOrders", 1,
            (int) source.lines().count(), source);
        List<String> labels = new ProvenanceScorer().score(entity, null).orElseThrow().signals();
        assertTrue(labels.contains("uniform guard clauses"));
    }

    @Test
    void testGuardBlockWithNestedBlockNotCounted() {
        FunctionFeatures features = features("""
            function drain(queue) {
              if (queue.isOpen()) {
                for (const item of queue.items) {
                  item.close();
                }
                return queue;
              }
              if (!queue) return null;
              return queue;
            }
            """);

        assertEquals(0, features.guardClauseCount());
    }

    @Test
    void testLoopsAndLetBindings() {
        FunctionFeatures features = features("""
            function sum(rows) {
              let total = 0;
              for (const row of rows) {
                total += row.amount;
              }
              return total;
            }
            """);

        assertEquals(List.of("total", "row"), features.assignedNames());
        assertTrue(features.hasLoopOrTry());
        assertEquals(3, features.statementCount());
    }

    @Test
    void testNoFunctionNoFeatures() {
        CodeEntity entity = CodeEntity.of("src/a.js", "x", "src.a.x", 1, 1, "const x = 1;");
        assertTrue(extractor.extract(entity).isEmpty());
    }
}
