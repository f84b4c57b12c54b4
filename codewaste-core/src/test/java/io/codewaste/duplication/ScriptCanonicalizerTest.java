package io.codewaste.duplication;

import io.codewaste.CodeEntity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptCanonicalizerTest {

    private final ScriptCanonicalizer canonicalizer = new ScriptCanonicalizer();

    private static CodeEntity entity(String source) {
        return CodeEntity.of("src/a.js", "f", "src.a.f", 1, 1, source);
    }

    @Test
    void testTokensAreCanonical() {
        CanonicalSignature signature = canonicalizer.canonicalize(
            entity("function add(x) { return x + 1; } // note")).orElseThrow();

        assertEquals(List.of("function", "ID", "(", "ID", ")", "{", "return", "ID", "+", "NUM", ";", "}"),
            signature.tokens());
        assertEquals(1, signature.bodyStatements());
    }

    @Test
    void testRenamedCopiesMatch() {
        CanonicalSignature a = canonicalizer.canonicalize(entity("""
            const load = (id) => {
              const item = cache.get(id);
              if (!item) { throw new Error("missing"); }
              return item;
            };
            """)).orElseThrow();
        CanonicalSignature b = canonicalizer.canonicalize(entity("""
            const fetchUser = (key) => {
              // cached lookup
              const user = store.get(key);
              if (!user) { throw new Error(`absent ${key}`); }
              return user;
            };
            """)).orElseThrow();

        assertEquals(a.tokens(), b.tokens());
        assertEquals(3, a.bodyStatements());
    }

    @Test
    void testNoFunctionNoSignature() {
        assertTrue(canonicalizer.canonicalize(entity("let x = 1;")).isEmpty());
    }
}
