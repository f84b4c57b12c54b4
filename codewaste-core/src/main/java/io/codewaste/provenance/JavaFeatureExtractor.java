package io.codewaste.provenance;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import io.codewaste.CodeEntity;
import io.codewaste.scanner.JavaSources;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads provenance features from a Java method or constructor's syntax tree.
 */
public class JavaFeatureExtractor implements FeatureExtractor {

    static final int GUARD_WINDOW = 6;

    @Override
    public Optional<FunctionFeatures> extract(CodeEntity entity) {
        Optional<BlockStmt> body = JavaSources.firstFunction(entity.source(), entity.name())
            .flatMap(JavaSources::body);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        BlockStmt block = body.get();
        NodeList<Statement> statements = block.getStatements();

        return Optional.of(new FunctionFeatures(
            statements.size(),
            guardClauses(statements),
            assignedNames(block),
            block.findAll(IfStmt.class).size(),
            errorLiterals(block),
            returnedName(statements),
            hasLoopOrTry(block)
        ));
    }

    /**
     * Counts the leading run of single-statement {@code if}s whose statement
     * returns or throws. The run ends at the first other statement or at an
     * {@code if} with a larger then-branch.
     */
    static int guardClauses(List<Statement> statements) {
        int guards = 0;
        for (Statement statement : statements.subList(0, Math.min(GUARD_WINDOW, statements.size()))) {
            if (!(statement instanceof IfStmt ifStmt)) {
                break;
            }
            Statement then = ifStmt.getThenStmt();
            List<Statement> branch = then instanceof BlockStmt thenBlock ? thenBlock.getStatements() : List.of(then);
            if (branch.size() != 1) {
                break;
            }
            if (branch.get(0) instanceof ReturnStmt || branch.get(0) instanceof ThrowStmt) {
                guards++;
            }
        }
        return guards;
    }

    private static List<String> assignedNames(BlockStmt block) {
        List<String> names = new ArrayList<>();
        block.findAll(VariableDeclarator.class)
            .forEach(declarator -> names.add(declarator.getNameAsString().toLowerCase(Locale.ROOT)));
        block.findAll(AssignExpr.class).stream()
            .filter(assign -> assign.getTarget().isNameExpr())
            .forEach(assign -> names.add(assign.getTarget().asNameExpr().getNameAsString().toLowerCase(Locale.ROOT)));
        return names;
    }

    private static List<String> errorLiterals(BlockStmt block) {
        Stream<String> strings = block.findAll(StringLiteralExpr.class).stream().map(StringLiteralExpr::asString);
        Stream<String> textBlocks = block.findAll(TextBlockLiteralExpr.class).stream().map(TextBlockLiteralExpr::asString);
        return Stream.concat(strings, textBlocks)
            .filter(FunctionFeatures::isErrorLike)
            .map(literal -> literal.toLowerCase(Locale.ROOT))
            .toList();
    }

    private static Optional<String> returnedName(NodeList<Statement> statements) {
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        if (statements.get(statements.size() - 1) instanceof ReturnStmt returnStmt) {
            return returnStmt.getExpression()
                .filter(Expression::isNameExpr)
                .map(expression -> expression.asNameExpr().getNameAsString());
        }
        return Optional.empty();
    }

    private static boolean hasLoopOrTry(BlockStmt block) {
        return !block.findAll(ForStmt.class).isEmpty()
            || !block.findAll(ForEachStmt.class).isEmpty()
            || !block.findAll(WhileStmt.class).isEmpty()
            || !block.findAll(DoStmt.class).isEmpty()
            || !block.findAll(TryStmt.class).isEmpty();
    }
}
