package io.codewaste.scanner;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JavaParser access shared by the scanner, the canonicalizer and the
 * provenance feature extractor.
 *
 * <p>{@link JavaParser} instances are not thread-safe; each call creates its own.</p>
 */
public final class JavaSources {

    private static final String[] WRAPPERS = {"class CodewasteSlice {\n", "interface CodewasteSlice {\n"};
    private static final String RECORD_WRAPPER = "record %s() {\n";

    private JavaSources() {
    }

    public static JavaParser newParser() {
        ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(configuration);
    }

    public static Optional<CompilationUnit> parseCompilationUnit(String source) {
        ParseResult<CompilationUnit> result = newParser().parse(source);
        return result.isSuccessful() ? result.getResult() : Optional.empty();
    }

    /**
     * Re-parses an entity slice and returns the first method, constructor or
     * compact constructor in it.
     *
     * <p>A slice is a member declaration lifted out of its type, so it is tried
     * as a bare body declaration first, then inside a class, then inside an
     * interface (default methods do not validate in a class body), then inside
     * a record named {@code name} (compact constructors only exist there).</p>
     *
     * @param name simple name of the entity, used as the record name
     */
    public static Optional<BodyDeclaration<?>> firstFunction(String slice, String name) {
        JavaParser parser = newParser();
        ParseResult<BodyDeclaration<?>> member = parser.parseBodyDeclaration(slice);
        if (member.isSuccessful() && member.getResult().isPresent() && isFunction(member.getResult().get())) {
            return member.getResult();
        }
        List<String> wrappers = new ArrayList<>(List.of(WRAPPERS));
        wrappers.add(String.format(RECORD_WRAPPER, name));
        for (String wrapper : wrappers) {
            ParseResult<CompilationUnit> wrapped = parser.parse(wrapper + slice + "\n}\n");
            if (!wrapped.isSuccessful() || wrapped.getResult().isEmpty()) {
                continue;
            }
            Optional<BodyDeclaration<?>> function = wrapped.getResult().get().getType(0).getMembers().stream()
                .filter(JavaSources::isFunction)
                .findFirst();
            if (function.isPresent()) {
                return function;
            }
        }
        return Optional.empty();
    }

    static boolean isFunction(BodyDeclaration<?> declaration) {
        return declaration instanceof CallableDeclaration || declaration instanceof CompactConstructorDeclaration;
    }

    /**
     * Body of a method or constructor; empty for abstract and native methods.
     */
    public static Optional<BlockStmt> body(BodyDeclaration<?> function) {
        if (function instanceof MethodDeclaration method) {
            return method.getBody();
        }
        if (function instanceof ConstructorDeclaration constructor) {
            return Optional.of(constructor.getBody());
        }
        if (function instanceof CompactConstructorDeclaration compact) {
            return Optional.of(compact.getBody());
        }
        return Optional.empty();
    }
}
