package io.codewaste.scanner;

import io.codewaste.CodeEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaEntityExtractorTest {

    private JavaEntityExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new JavaEntityExtractor();
    }

    private static CodeEntity byName(List<CodeEntity> entities, String name) {
        return entities.stream()
            .filter(e -> e.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No entity named " + name));
    }

    // ==================== Qualified Name Tests ====================

    @Test
    void testMethodsAndConstructors() {
        String source = """
            package com.acme;

            public class OrderService {

                public OrderService() {
                }

                public boolean validate(String id) {
                    return id != null;
                }

                static class Inner {
                    void run() {
                    }
                }
            }
            """;

        List<CodeEntity> entities = extractor.extract("com/acme/OrderService.java", source);

        assertEquals(3, entities.size());
        assertEquals("com.acme.OrderService.OrderService", byName(entities, "OrderService").qualifiedName());
        assertEquals("com.acme.OrderService.validate", byName(entities, "validate").qualifiedName());
        assertEquals("com.acme.OrderService.Inner.run", byName(entities, "run").qualifiedName());
    }

    @Test
    void testSecondTopLevelTypeKeepsItsName() {
        String source = """
            class Main {
                void start() {
                }
            }

            class Helper {
                void help() {
                }
            }
            """;

        List<CodeEntity> entities = extractor.extract("app/Main.java", source);

        assertEquals("app.Main.start", byName(entities, "start").qualifiedName());
        assertEquals("app.Main.Helper.help", byName(entities, "help").qualifiedName());
    }

    @Test
    void testEnumAndRecordMembers() {
        String source = """
            enum Color {
                RED;

                String lower() {
                    return name().toLowerCase();
                }
            }

            record Point(int x, int y) {
                int sum() {
                    return x + y;
                }
            }
            """;

        List<CodeEntity> entities = extractor.extract("Color.java", source);

        assertEquals("Color.lower", byName(entities, "lower").qualifiedName());
        assertEquals("Color.Point.sum", byName(entities, "sum").qualifiedName());
    }

    @Test
    void testRecordCompactConstructor() {
        String source = """
            package com.acme;

            public record Money(long cents, String currency) {

                public Money {
                    if (cents < 0) {
                        throw new IllegalArgumentException("negative amount");
                    }
                    currency = currency.toUpperCase();
                }

                public String label() {
                    return currency + " " + cents;
                }
            }
            """;

        List<CodeEntity> entities = extractor.extract("com/acme/Money.java", source);

        assertEquals(2, entities.size());
        CodeEntity compact = entities.get(0);
        assertEquals("Money", compact.name());
        assertEquals("com.acme.Money.Money", compact.qualifiedName());
        assertEquals(5, compact.lineStart());
        assertEquals(10, compact.lineEnd());
        assertTrue(compact.source().trim().startsWith("public Money {"));
        assertEquals("com.acme.Money.label", byName(entities, "label").qualifiedName());
    }

    // ==================== Line Range Tests ====================

    @Test
    void testAnnotationsExtendStartLine() {
        String source = """
            class Widget {

                @Override
                public String toString() {
                    return "widget";
                }
            }
            """;

        CodeEntity entity = extractor.extract("Widget.java", source).get(0);

        assertEquals(3, entity.lineStart());
        assertEquals(6, entity.lineEnd());
        assertTrue(entity.source().startsWith("    @Override"));
        assertTrue(entity.source().endsWith("    }"));
    }

    @Test
    void testIdsAreStableAcrossExtractions() {
        String source = """
            class Widget {
                void a() {
                }
            }
            """;

        CodeEntity first = extractor.extract("Widget.java", source).get(0);
        CodeEntity second = extractor.extract("Widget.java", source).get(0);

        assertEquals(first, second);
        assertEquals(12, first.id().length());
    }

    // ==================== Failure Tests ====================

    @Test
    void testUnparseableSourceYieldsNothing() {
        assertTrue(extractor.extract("Broken.java", "class Broken { void x( { }").isEmpty());
    }

    @Test
    void testAbstractAndDefaultInterfaceMethods() {
        String source = """
            interface Shape {
                double area();

                default String describe() {
                    return "area " + area();
                }
            }
            """;

        List<CodeEntity> entities = extractor.extract("Shape.java", source);

        assertEquals(2, entities.size());
        assertEquals("Shape.describe", byName(entities, "describe").qualifiedName());
    }
}
