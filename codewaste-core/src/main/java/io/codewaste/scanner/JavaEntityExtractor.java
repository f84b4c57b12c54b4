package io.codewaste.scanner;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import io.codewaste.CodeEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Extracts method, constructor and record compact constructor entities from
 * Java source using JavaParser.
 *
 * <p>Nested, local and anonymous-class members are all reported. Qualified
 * names carry the chain of enclosing named types; the outermost type is not
 * repeated when it matches the file name.</p>
 */
public class JavaEntityExtractor implements EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(JavaEntityExtractor.class);

    @Override
    public List<CodeEntity> extract(String relativePath, String source) {
        Optional<CompilationUnit> cu = JavaSources.parseCompilationUnit(source);
        if (cu.isEmpty()) {
            log.debug("Skipping {}: not parseable as Java", relativePath);
            return List.of();
        }

        List<String> module = ModulePaths.segments(relativePath);
        String fileStem = module.isEmpty() ? "" : module.get(module.size() - 1);

        List<CodeEntity> entities = new ArrayList<>();
        cu.get().accept(new EntityVisitor(entities, relativePath, String.join(".", module),
            fileStem, new SourceText(source)), null);

        log.debug("Extracted {} entities from {}", entities.size(), relativePath);
        return entities;
    }

    /**
     * Depth-first walk keeping the stack of enclosing type names.
     */
    private static class EntityVisitor extends VoidVisitorAdapter<Void> {

        private final List<CodeEntity> entities;
        private final String filePath;
        private final String modulePath;
        private final String fileStem;
        private final SourceText text;
        private final Deque<String> types = new ArrayDeque<>();

        EntityVisitor(List<CodeEntity> entities, String filePath, String modulePath,
                      String fileStem, SourceText text) {
            this.entities = entities;
            this.filePath = filePath;
            this.modulePath = modulePath;
            this.fileStem = fileStem;
            this.text = text;
        }

        @Override
        public void visit(ClassOrInterfaceDeclaration node, Void arg) {
            enterType(node);
            super.visit(node, arg);
            types.removeLast();
        }

        @Override
        public void visit(EnumDeclaration node, Void arg) {
            enterType(node);
            super.visit(node, arg);
            types.removeLast();
        }

        @Override
        public void visit(RecordDeclaration node, Void arg) {
            enterType(node);
            super.visit(node, arg);
            types.removeLast();
        }

        @Override
        public void visit(AnnotationDeclaration node, Void arg) {
            enterType(node);
            super.visit(node, arg);
            types.removeLast();
        }

        @Override
        public void visit(MethodDeclaration node, Void arg) {
            addEntity(node, node.getNameAsString());
            super.visit(node, arg);
        }

        @Override
        public void visit(ConstructorDeclaration node, Void arg) {
            addEntity(node, node.getNameAsString());
            super.visit(node, arg);
        }

        @Override
        public void visit(CompactConstructorDeclaration node, Void arg) {
            addEntity(node, node.getNameAsString());
            super.visit(node, arg);
        }

        private void enterType(TypeDeclaration<?> node) {
            types.addLast(node.getNameAsString());
        }

        private void addEntity(BodyDeclaration<?> node, String name) {
            int lineStart = node.getBegin().map(p -> p.line).orElse(1);
            int lineEnd = node.getEnd().map(p -> p.line).orElse(lineStart);

            // Include annotations
            if (!node.getAnnotations().isEmpty()) {
                int annotationStart = node.getAnnotation(0)
                    .getBegin().map(p -> p.line).orElse(lineStart);
                lineStart = Math.min(lineStart, annotationStart);
            }

            String qualifiedName = ModulePaths.qualify(modulePath, enclosingTypes(), name);
            entities.add(CodeEntity.of(filePath, name, qualifiedName, lineStart, lineEnd,
                text.slice(lineStart, lineEnd)));
        }

        private List<String> enclosingTypes() {
            List<String> enclosing = new ArrayList<>(types);
            if (!enclosing.isEmpty() && enclosing.get(0).equals(fileStem)) {
                enclosing.remove(0);
            }
            return enclosing;
        }
    }
}
