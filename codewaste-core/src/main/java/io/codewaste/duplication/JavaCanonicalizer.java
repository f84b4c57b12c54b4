package io.codewaste.duplication;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import io.codewaste.CodeEntity;
import io.codewaste.scanner.JavaSources;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonicalizes Java methods and constructors on their syntax tree.
 *
 * <p>Parameter names become {@code arg}; variable references, declared local
 * names and unscoped call names become {@code var}; field-access names and
 * scoped call names become {@code attr}; string-like literals become
 * {@code "STR"} and numeric literals {@code 0}. The rewritten tree is dumped
 * as node kinds with the identifiers, operators and literal values that remain.</p>
 */
public class JavaCanonicalizer implements Canonicalizer {

    @Override
    public Optional<CanonicalSignature> canonicalize(CodeEntity entity) {
        Optional<BodyDeclaration<?>> function = JavaSources.firstFunction(entity.source(), entity.name());
        if (function.isEmpty()) {
            return Optional.empty();
        }
        Optional<BlockStmt> body = JavaSources.body(function.get());
        if (body.isEmpty()) {
            return Optional.empty();
        }
        int statements = body.get().getStatements().size();

        // The parsed tree belongs to this call only, so it is rewritten in place.
        function.get().accept(new CanonicalNames(), null);

        List<String> tokens = new ArrayList<>();
        dump(function.get(), tokens);
        return Optional.of(new CanonicalSignature(entity.id(), tokens, statements));
    }

    static void dump(Node node, List<String> out) {
        out.add(node.getClass().getSimpleName());
        String value = leafValue(node);
        if (value != null) {
            out.add(value);
        }
        List<Node> children = node.getChildNodes().stream()
            .filter(child -> !(child instanceof Comment))
            .toList();
        if (!children.isEmpty()) {
            out.add("(");
            for (Node child : children) {
                dump(child, out);
            }
            out.add(")");
        }
    }

    private static String leafValue(Node node) {
        if (node instanceof SimpleName simpleName) return simpleName.getIdentifier();
        if (node instanceof Name name) return name.asString();
        if (node instanceof LiteralStringValueExpr literal) return literal.getValue();
        if (node instanceof BooleanLiteralExpr literal) return String.valueOf(literal.getValue());
        if (node instanceof BinaryExpr binary) return binary.getOperator().asString();
        if (node instanceof UnaryExpr unary) return unary.getOperator().asString();
        if (node instanceof AssignExpr assign) return assign.getOperator().asString();
        if (node instanceof Modifier modifier) return modifier.getKeyword().asString();
        if (node instanceof PrimitiveType primitive) return primitive.asString();
        return null;
    }

    /**
     * Replaces names and literals with placeholders.
     */
    private static class CanonicalNames extends ModifierVisitor<Void> {

        @Override
        public Visitable visit(Parameter n, Void arg) {
            super.visit(n, arg);
            n.setName("arg");
            return n;
        }

        @Override
        public Visitable visit(NameExpr n, Void arg) {
            super.visit(n, arg);
            n.setName("var");
            return n;
        }

        @Override
        public Visitable visit(VariableDeclarator n, Void arg) {
            super.visit(n, arg);
            n.setName("var");
            return n;
        }

        @Override
        public Visitable visit(FieldAccessExpr n, Void arg) {
            super.visit(n, arg);
            n.setName("attr");
            return n;
        }

        @Override
        public Visitable visit(MethodCallExpr n, Void arg) {
            super.visit(n, arg);
            n.setName(n.getScope().isPresent() ? "attr" : "var");
            return n;
        }

        @Override
        public Visitable visit(MethodReferenceExpr n, Void arg) {
            super.visit(n, arg);
            n.setIdentifier("attr");
            return n;
        }

        @Override
        public Visitable visit(StringLiteralExpr n, Void arg) {
            return new StringLiteralExpr("STR");
        }

        @Override
        public Visitable visit(CharLiteralExpr n, Void arg) {
            return new StringLiteralExpr("STR");
        }

        @Override
        public Visitable visit(TextBlockLiteralExpr n, Void arg) {
            return new StringLiteralExpr("STR");
        }

        @Override
        public Visitable visit(IntegerLiteralExpr n, Void arg) {
            return new IntegerLiteralExpr("0");
        }

        @Override
        public Visitable visit(LongLiteralExpr n, Void arg) {
            return new IntegerLiteralExpr("0");
        }

        @Override
        public Visitable visit(DoubleLiteralExpr n, Void arg) {
            return new IntegerLiteralExpr("0");
        }
    }
}
