package com.archcodex.core.adapter.impl.java;

import com.archcodex.core.adapter.base.AbstractSemanticModelAdapter;
import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.ControlFlowContext;
import com.archcodex.core.model.semantic.DecoratorInfo;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.InterfaceInfo;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.MethodInfo;
import com.archcodex.core.model.semantic.MutationInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.model.semantic.SourceLocation;
import com.archcodex.core.model.semantic.Visibility;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Java adapter built on JavaParser.
 *
 * <p>Mapping rules:
 * <ul>
 *   <li>Top-level types are exported; nested types are exported when declared {@code public}</li>
 *   <li>Annotations are reported as decorators</li>
 *   <li>Methods and constructors are also flattened into functions so function-level checks
 *       (intents, call ordering) work for Java</li>
 *   <li>Inheritance chains are resolved within the file only</li>
 * </ul>
 *
 * <p>A new {@link JavaParser} is created per call: parser instances keep per-parse state and this
 * adapter is shared across batch worker threads.
 *
 * @since 1.0.0
 */
public class JavaSemanticModelAdapter extends AbstractSemanticModelAdapter {

    private static final ParserConfiguration CONFIGURATION = new ParserConfiguration()
        .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public String getId() {
        return "java";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of(".java");
    }

    @Override
    public LanguageCapabilities getCapabilities() {
        return LanguageCapabilities.all();
    }

    @Override
    public SemanticModel parseFile(String filePath, String content) {
        ParseResult<CompilationUnit> result = new JavaParser(CONFIGURATION).parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                .map(p -> p.getMessage())
                .limit(3)
                .reduce((a, b) -> a + "; " + b)
                .orElse("unknown parse error");
            log.debug("Failed to parse Java file {}: {}", filePath, problems);
            throw new SemanticModelException(filePath, "Failed to parse " + filePath + ": " + problems);
        }
        CompilationUnit cu = result.getResult().get();

        SemanticModel.Builder builder = SemanticModel.builder(filePath, content, getId())
            .lineCount(countLines(content))
            .locCount(countCStyleLoc(content));

        cu.getImports().forEach(i -> builder.addImport(toImport(i)));

        Map<String, String> parents = new HashMap<>();
        for (ClassOrInterfaceDeclaration type : cu.findAll(ClassOrInterfaceDeclaration.class)) {
            if (!type.isInterface() && !type.getExtendedTypes().isEmpty()) {
                parents.put(type.getNameAsString(), type.getExtendedTypes(0).getNameAsString());
            }
        }

        for (ClassOrInterfaceDeclaration type : cu.findAll(ClassOrInterfaceDeclaration.class)) {
            if (type.isInterface()) {
                builder.addInterface(toInterface(type));
            } else {
                builder.addClass(toClass(type, parents));
            }
            if (isExported(type)) {
                builder.addExport(new ExportInfo(type.getNameAsString(), type.isInterface() ? "interface" : "class",
                    false, locationOf(type)));
            }
        }
        for (RecordDeclaration record : cu.findAll(RecordDeclaration.class)) {
            builder.addClass(toRecordClass(record));
            if (isExported(record)) {
                builder.addExport(new ExportInfo(record.getNameAsString(), "record", false, locationOf(record)));
            }
        }

        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            builder.addFunction(toFunction(callable));
        }

        for (MethodCallExpr call : cu.findAll(MethodCallExpr.class)) {
            builder.addCall(toCall(call));
        }
        for (ObjectCreationExpr creation : cu.findAll(ObjectCreationExpr.class)) {
            builder.addCall(toConstructorCall(creation));
        }

        for (AssignExpr assign : cu.findAll(AssignExpr.class)) {
            builder.addMutation(toMutation(assign.getTarget().toString(), assign.getOperator().asString(),
                assign, assign.toString()));
        }
        for (UnaryExpr unary : cu.findAll(UnaryExpr.class)) {
            if (isIncrementOrDecrement(unary)) {
                builder.addMutation(toMutation(unary.getExpression().toString(), unary.getOperator().asString(),
                    unary, unary.toString()));
            }
        }

        SemanticModel model = builder.build();
        log.debug("Parsed {}: {} class(es), {} import(s), {} call(s)", filePath, model.classes().size(),
            model.imports().size(), model.functionCalls().size());
        return model;
    }

    // ==================== Declarations ====================

    private ImportInfo toImport(ImportDeclaration declaration) {
        String name = declaration.getNameAsString();
        String specifier = declaration.isAsterisk() ? name + ".*" : name;
        List<String> named = declaration.isAsterisk()
            ? List.of()
            : List.of(name.substring(name.lastIndexOf('.') + 1));
        return new ImportInfo(specifier, named, null, false, false, locationOf(declaration),
            declaration.toString().trim());
    }

    private ClassInfo toClass(ClassOrInterfaceDeclaration type, Map<String, String> parents) {
        ClassInfo.Builder builder = ClassInfo.builder(type.getNameAsString())
            .exported(isExported(type))
            .isAbstract(type.isAbstract())
            .location(locationOf(type));
        if (!type.getExtendedTypes().isEmpty()) {
            builder.extendsClass(type.getExtendedTypes(0).asString());
            builder.inheritanceChain(chainOf(type.getNameAsString(), parents));
        }
        for (ClassOrInterfaceType implemented : type.getImplementedTypes()) {
            builder.implementsInterface(implemented.asString());
        }
        type.getAnnotations().forEach(a -> builder.decorator(toDecorator(a)));
        for (MethodDeclaration method : type.getMethods()) {
            builder.method(toMethod(method, false));
        }
        return builder.build();
    }

    private ClassInfo toRecordClass(RecordDeclaration record) {
        ClassInfo.Builder builder = ClassInfo.builder(record.getNameAsString())
            .exported(isExported(record))
            .location(locationOf(record));
        for (ClassOrInterfaceType implemented : record.getImplementedTypes()) {
            builder.implementsInterface(implemented.asString());
        }
        record.getAnnotations().forEach(a -> builder.decorator(toDecorator(a)));
        for (MethodDeclaration method : record.getMethods()) {
            builder.method(toMethod(method, false));
        }
        return builder.build();
    }

    private InterfaceInfo toInterface(ClassOrInterfaceDeclaration type) {
        List<String> extended = type.getExtendedTypes().stream().map(ClassOrInterfaceType::asString).toList();
        List<MethodInfo> methods = type.getMethods().stream().map(m -> toMethod(m, true)).toList();
        return new InterfaceInfo(type.getNameAsString(), isExported(type), extended, methods, locationOf(type));
    }

    private MethodInfo toMethod(MethodDeclaration method, boolean interfaceMember) {
        Visibility visibility = interfaceMember && !method.isPrivate() ? Visibility.PUBLIC : visibilityOf(method);
        int startLine = method.getBegin().map(p -> p.line).orElse(0);
        int endLine = method.getEnd().map(p -> p.line).orElse(startLine);
        return new MethodInfo(
            method.getNameAsString(),
            visibility,
            method.isStatic(),
            method.isAbstract(),
            method.getAnnotations().stream().map(this::toDecorator).toList(),
            method.getParameters().size(),
            method.getType().asString(),
            locationOf(method),
            intentsIn(method.getComment().map(Comment::getContent).orElse(null)),
            startLine,
            endLine
        );
    }

    private FunctionInfo toFunction(CallableDeclaration<?> callable) {
        int startLine = callable.getBegin().map(p -> p.line).orElse(0);
        int endLine = callable.getEnd().map(p -> p.line).orElse(startLine);
        boolean typeExported = callable.findAncestor(TypeDeclaration.class).map(this::isExported).orElse(false);
        String returnType = callable instanceof MethodDeclaration method ? method.getType().asString() : null;
        return new FunctionInfo(
            callable.getNameAsString(),
            typeExported && callable.isPublic(),
            false,
            visibilityOf(callable),
            callable.getAnnotations().stream().map(this::toDecorator).toList(),
            callable.getParameters().size(),
            returnType,
            locationOf(callable),
            intentsIn(callable.getComment().map(Comment::getContent).orElse(null)),
            startLine,
            endLine
        );
    }

    private DecoratorInfo toDecorator(AnnotationExpr annotation) {
        List<String> arguments = new ArrayList<>();
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            arguments.add(single.getMemberValue().toString());
        } else if (annotation instanceof NormalAnnotationExpr normal) {
            normal.getPairs().forEach(pair -> arguments.add(pair.toString()));
        }
        return new DecoratorInfo(annotation.getNameAsString(), arguments, locationOf(annotation), annotation.toString());
    }

    // ==================== Calls & Mutations ====================

    private FunctionCallInfo toCall(MethodCallExpr call) {
        String receiver = call.getScope().map(Node::toString).orElse(null);
        String callee = receiver != null ? receiver + "." + call.getNameAsString() : call.getNameAsString();
        List<String> arguments = call.getArguments().stream().map(Node::toString).toList();
        return new FunctionCallInfo(callee, receiver, call.getNameAsString(), arguments, arguments.size(),
            locationOf(call), call.toString(), controlFlowOf(call), false, enclosingCallable(call));
    }

    private FunctionCallInfo toConstructorCall(ObjectCreationExpr creation) {
        String type = creation.getType().getNameAsString();
        List<String> arguments = creation.getArguments().stream().map(Node::toString).toList();
        return new FunctionCallInfo(type, null, type, arguments, arguments.size(), locationOf(creation),
            creation.toString(), controlFlowOf(creation), true, enclosingCallable(creation));
    }

    private MutationInfo toMutation(String target, String operator, Node node, String rawText) {
        String normalized = target.startsWith("this.") ? target.substring("this.".length()) : target;
        List<String> segments = List.of(normalized.split("\\."));
        List<String> path = segments.size() > 1 ? segments.subList(1, segments.size()) : List.of();
        return new MutationInfo(normalized, segments.get(0), path, operator, locationOf(node), rawText, false);
    }

    private static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }

    /**
     * Walks ancestors to find enclosing try/catch/finally blocks.
     */
    private static ControlFlowContext controlFlowOf(Node node) {
        boolean inTry = false;
        boolean inCatch = false;
        boolean inFinally = false;
        int depth = 0;
        Node child = node;
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node current = parent.get();
            if (current instanceof TryStmt tryStmt) {
                if (tryStmt.getTryBlock() == child) {
                    inTry = true;
                    depth++;
                } else if (tryStmt.getFinallyBlock().orElse(null) == child) {
                    inFinally = true;
                }
            } else if (current instanceof CatchClause) {
                inCatch = true;
            } else if (current instanceof CallableDeclaration<?>) {
                break;
            }
            child = current;
            parent = current.getParentNode();
        }
        return new ControlFlowContext(inTry, inCatch, inFinally, depth);
    }

    private static String enclosingCallable(Node node) {
        return node.findAncestor(MethodDeclaration.class)
            .map(MethodDeclaration::getNameAsString)
            .or(() -> node.findAncestor(ConstructorDeclaration.class).map(ConstructorDeclaration::getNameAsString))
            .orElse(null);
    }

    // ==================== Helpers ====================

    private boolean isExported(TypeDeclaration<?> type) {
        return type.isTopLevelType() || type.isPublic();
    }

    private static Visibility visibilityOf(NodeWithModifiers<?> member) {
        if (member.hasModifier(com.github.javaparser.ast.Modifier.Keyword.PUBLIC)) {
            return Visibility.PUBLIC;
        }
        if (member.hasModifier(com.github.javaparser.ast.Modifier.Keyword.PROTECTED)) {
            return Visibility.PROTECTED;
        }
        if (member.hasModifier(com.github.javaparser.ast.Modifier.Keyword.PRIVATE)) {
            return Visibility.PRIVATE;
        }
        return Visibility.INTERNAL;
    }

    private static List<String> chainOf(String className, Map<String, String> parents) {
        List<String> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        seen.add(className);
        String current = parents.get(className);
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = parents.get(current);
        }
        return chain;
    }

    private static SourceLocation locationOf(Node node) {
        return node.getBegin()
            .map(p -> new SourceLocation(p.line, p.column))
            .orElse(SourceLocation.START);
    }
}
