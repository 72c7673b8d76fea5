package com.archcodex.core.model.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Language-neutral structural summary of one source file.
 *
 * <p>Produced by a {@code SemanticModelAdapter}, read-only for everything downstream. A model is a
 * pure function of (path, content), so callers may compute models for different files on any thread.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SemanticModel model = SemanticModel.builder("src/PaymentService.java", content, "java")
 *     .addClass(ClassInfo.builder("PaymentService").extendsClass("BaseService").build())
 *     .build();
 * }</pre>
 *
 * @param filePath path as given to the adapter
 * @param fileName file name without directories
 * @param extension extension including the dot, empty if none
 * @param content full file content
 * @param lineCount number of lines
 * @param locCount lines of code (non-blank, non-comment)
 * @param language adapter language id
 * @param imports imports in source order
 * @param classes classes in source order
 * @param interfaces interfaces in source order
 * @param functions functions (and flattened methods) in source order
 * @param functionCalls calls in source order
 * @param mutations mutations in source order
 * @param exports exported symbols
 */
public record SemanticModel(
    String filePath,
    String fileName,
    String extension,
    String content,
    int lineCount,
    int locCount,
    String language,
    List<ImportInfo> imports,
    List<ClassInfo> classes,
    List<InterfaceInfo> interfaces,
    List<FunctionInfo> functions,
    List<FunctionCallInfo> functionCalls,
    List<MutationInfo> mutations,
    List<ExportInfo> exports
) {
    /**
     * Compact constructor with validation.
     */
    public SemanticModel {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(language, "language must not be null");
        fileName = fileName != null ? fileName : fileNameOf(filePath);
        extension = extension != null ? extension : extensionOf(fileName);
        imports = imports != null ? List.copyOf(imports) : List.of();
        classes = classes != null ? List.copyOf(classes) : List.of();
        interfaces = interfaces != null ? List.copyOf(interfaces) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
        functionCalls = functionCalls != null ? List.copyOf(functionCalls) : List.of();
        mutations = mutations != null ? List.copyOf(mutations) : List.of();
        exports = exports != null ? List.copyOf(exports) : List.of();
    }

    public static Builder builder(String filePath, String content, String language) {
        return new Builder(filePath, content, language);
    }

    /**
     * Exported classes only.
     *
     * @return exported classes in source order
     */
    public List<ClassInfo> exportedClasses() {
        return classes.stream().filter(ClassInfo::exported).toList();
    }

    /**
     * Every method of every class, in source order.
     *
     * @return all methods
     */
    public List<MethodInfo> allMethods() {
        return classes.stream().flatMap(c -> c.methods().stream()).toList();
    }

    /**
     * Names of every decorator in the file: classes, their methods and free functions.
     *
     * @return decorator names without {@code @}
     */
    public List<String> allDecoratorNames() {
        return Stream.of(
                classes.stream().flatMap(c -> c.decorators().stream()),
                classes.stream().flatMap(c -> c.methods().stream()).flatMap(m -> m.decorators().stream()),
                functions.stream().flatMap(f -> f.decorators().stream()))
            .flatMap(s -> s)
            .map(DecoratorInfo::name)
            .distinct()
            .toList();
    }

    /**
     * The innermost function containing the given line.
     *
     * @param line 1-based line
     * @return containing function, or null
     */
    public FunctionInfo functionAt(int line) {
        FunctionInfo best = null;
        for (FunctionInfo function : functions) {
            if (function.containsLine(line)
                    && (best == null || function.endLine() - function.startLine() < best.endLine() - best.startLine())) {
                best = function;
            }
        }
        return best;
    }

    private static String fileNameOf(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot) : "";
    }

    /**
     * Fluent builder used by adapters and tests.
     */
    public static final class Builder {
        private final String filePath;
        private final String content;
        private final String language;
        private int lineCount = -1;
        private int locCount = -1;
        private final List<ImportInfo> imports = new ArrayList<>();
        private final List<ClassInfo> classes = new ArrayList<>();
        private final List<InterfaceInfo> interfaces = new ArrayList<>();
        private final List<FunctionInfo> functions = new ArrayList<>();
        private final List<FunctionCallInfo> functionCalls = new ArrayList<>();
        private final List<MutationInfo> mutations = new ArrayList<>();
        private final List<ExportInfo> exports = new ArrayList<>();

        private Builder(String filePath, String content, String language) {
            this.filePath = filePath;
            this.content = content;
            this.language = language;
        }

        public Builder lineCount(int lineCount) {
            this.lineCount = lineCount;
            return this;
        }

        public Builder locCount(int locCount) {
            this.locCount = locCount;
            return this;
        }

        public Builder addImport(ImportInfo importInfo) {
            imports.add(importInfo);
            return this;
        }

        public Builder addClass(ClassInfo classInfo) {
            classes.add(classInfo);
            return this;
        }

        public Builder addInterface(InterfaceInfo interfaceInfo) {
            interfaces.add(interfaceInfo);
            return this;
        }

        public Builder addFunction(FunctionInfo function) {
            functions.add(function);
            return this;
        }

        public Builder addCall(FunctionCallInfo call) {
            functionCalls.add(call);
            return this;
        }

        public Builder addMutation(MutationInfo mutation) {
            mutations.add(mutation);
            return this;
        }

        public Builder addExport(ExportInfo export) {
            exports.add(export);
            return this;
        }

        public SemanticModel build() {
            int lines = lineCount >= 0 ? lineCount : countLines(content);
            int loc = locCount >= 0 ? locCount : lines;
            return new SemanticModel(filePath, null, null, content, lines, loc, language, imports, classes,
                interfaces, functions, functionCalls, mutations, exports);
        }

        private static int countLines(String text) {
            if (text.isEmpty()) {
                return 0;
            }
            int count = text.split("\r?\n", -1).length;
            return text.endsWith("\n") ? count - 1 : count;
        }
    }
}
