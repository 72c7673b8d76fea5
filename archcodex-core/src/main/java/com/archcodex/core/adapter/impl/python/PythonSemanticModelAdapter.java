package com.archcodex.core.adapter.impl.python;

import com.archcodex.core.adapter.base.AbstractSemanticModelAdapter;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.ControlFlowContext;
import com.archcodex.core.model.semantic.DecoratorInfo;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.MethodInfo;
import com.archcodex.core.model.semantic.MutationInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.model.semantic.SourceLocation;
import com.archcodex.core.util.SourcePatterns;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based Python adapter.
 *
 * <p>Python structure is recovered line by line from indentation, the same way the fallback
 * parsers of other tools do when no grammar is available. Good enough for imports, classes,
 * decorators, functions, calls and attribute mutations; not a full parser.
 *
 * <p>Capabilities: class inheritance and decorators, no interfaces, no visibility modifiers
 * (underscore conventions are still mapped onto {@code Visibility} for information).
 *
 * @since 1.0.0
 */
public class PythonSemanticModelAdapter extends AbstractSemanticModelAdapter {

    private static final Pattern IMPORT_PATTERN =
        Pattern.compile("^\\s*import\\s+([\\w.]+)(?:\\s+as\\s+(\\w+))?");

    private static final Pattern FROM_IMPORT_PATTERN =
        Pattern.compile("^\\s*from\\s+([\\w.]+)\\s+import\\s+\\(?([\\w\\s,*]+)\\)?");

    private static final Pattern DYNAMIC_IMPORT_PATTERN =
        Pattern.compile("(?:importlib\\.import_module|__import__)\\(\\s*['\"]([\\w.]+)['\"]");

    private static final Pattern CLASS_PATTERN =
        Pattern.compile("^(\\s*)class\\s+(\\w+)\\s*(?:\\((.*?)\\))?\\s*:");

    private static final Pattern DEF_PATTERN =
        Pattern.compile("^(\\s*)(async\\s+)?def\\s+(\\w+)\\s*\\((.*?)\\)?\\s*(?:->\\s*([^:]+))?:");

    private static final Pattern DECORATOR_PATTERN =
        Pattern.compile("^\\s*@([\\w.]+)(?:\\((.*)\\))?\\s*$");

    private static final Pattern CALL_PATTERN =
        Pattern.compile("(?<![\\w.])([A-Za-z_][\\w]*(?:\\.[A-Za-z_]\\w*)*)\\s*\\(");

    private static final Pattern MUTATION_PATTERN =
        Pattern.compile("^\\s*([A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)+|[A-Za-z_]\\w*\\[[^\\]]+\\])\\s*(=|\\+=|-=|\\*=|/=)(?!=)");

    private static final Pattern DELETE_PATTERN =
        Pattern.compile("^\\s*del\\s+([A-Za-z_][\\w.]*(?:\\[[^\\]]+\\])?)");

    private static final Pattern ALL_PATTERN =
        Pattern.compile("^__all__\\s*=\\s*\\[([^\\]]*)\\]", Pattern.MULTILINE);

    private static final Pattern BLOCK_PATTERN =
        Pattern.compile("^(\\s*)(try|except|finally|else)\\b.*:\\s*(#.*)?$");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "elif", "while", "for", "return", "def", "class", "with", "assert", "not", "and", "or",
        "in", "is", "lambda", "yield", "await", "except", "raise", "del", "print_function");

    @Override
    public String getId() {
        return "python";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of(".py");
    }

    @Override
    public LanguageCapabilities getCapabilities() {
        return new LanguageCapabilities(true, false, true, false);
    }

    @Override
    public SemanticModel parseFile(String filePath, String content) {
        String[] lines = content.split("\r?\n", -1);
        SemanticModel.Builder builder = SemanticModel.builder(filePath, content, getId())
            .lineCount(countLines(content))
            .locCount(SourcePatterns.countLinesOfCode(content, "#", null, null));

        extractImports(lines, builder);
        List<FunctionInfo> functions = extractFunctions(lines);
        functions.forEach(builder::addFunction);
        List<ClassInfo> classes = extractClasses(lines, functions);
        classes.forEach(builder::addClass);
        extractCallsAndMutations(lines, functions, builder);
        extractExports(content, classes, functions, builder);

        return builder.build();
    }

    // ==================== Imports ====================

    private void extractImports(String[] lines, SemanticModel.Builder builder) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Matcher from = FROM_IMPORT_PATTERN.matcher(line);
            if (from.find()) {
                List<String> names = Arrays.stream(from.group(2).split(","))
                    .map(String::trim)
                    .map(n -> n.split("\\s+as\\s+")[0].trim())
                    .filter(n -> !n.isEmpty())
                    .toList();
                builder.addImport(new ImportInfo(from.group(1), names, null, false, false,
                    SourceLocation.at(i + 1), line.trim()));
                continue;
            }
            Matcher plain = IMPORT_PATTERN.matcher(line);
            if (plain.find()) {
                builder.addImport(new ImportInfo(plain.group(1), List.of(), plain.group(2), false, false,
                    SourceLocation.at(i + 1), line.trim()));
                continue;
            }
            Matcher dynamic = DYNAMIC_IMPORT_PATTERN.matcher(line);
            if (dynamic.find()) {
                builder.addImport(new ImportInfo(dynamic.group(1), List.of(), null, false, true,
                    new SourceLocation(i + 1, dynamic.start() + 1), line.trim()));
            }
        }
    }

    // ==================== Functions & Classes ====================

    private List<FunctionInfo> extractFunctions(String[] lines) {
        List<FunctionInfo> functions = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher def = DEF_PATTERN.matcher(lines[i]);
            if (!def.find()) {
                continue;
            }
            int indent = def.group(1).length();
            String name = def.group(3);
            int endLine = blockEnd(lines, i, indent);
            List<String> intents = new ArrayList<>(intentsIn(precedingComments(lines, i)));
            for (String intent : intentsIn(docstringAfter(lines, i))) {
                if (!intents.contains(intent)) {
                    intents.add(intent);
                }
            }
            functions.add(new FunctionInfo(
                name,
                indent == 0 && !name.startsWith("_"),
                def.group(2) != null,
                visibilityFromName(name),
                decoratorsAbove(lines, i),
                countParameters(def.group(4)),
                def.group(5) != null ? def.group(5).trim() : null,
                new SourceLocation(i + 1, indent + 1),
                intents,
                i + 1,
                endLine
            ));
        }
        return functions;
    }

    private List<ClassInfo> extractClasses(String[] lines, List<FunctionInfo> functions) {
        List<ClassInfo> classes = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = CLASS_PATTERN.matcher(lines[i]);
            if (!matcher.find()) {
                continue;
            }
            int indent = matcher.group(1).length();
            String name = matcher.group(2);
            int endLine = blockEnd(lines, i, indent);
            ClassInfo.Builder builder = ClassInfo.builder(name)
                .exported(indent == 0 && !name.startsWith("_"))
                .location(new SourceLocation(i + 1, indent + 1));

            List<String> bases = parseBases(matcher.group(3));
            if (!bases.isEmpty()) {
                builder.extendsClass(bases.get(0));
            }
            builder.isAbstract(bases.contains("ABC") || bases.contains("abc.ABC"));
            decoratorsAbove(lines, i).forEach(builder::decorator);

            int methodIndent = -1;
            for (FunctionInfo function : functions) {
                int defLine = function.startLine();
                if (defLine <= i + 1 || defLine > endLine) {
                    continue;
                }
                int functionIndent = function.location().column() - 1;
                if (methodIndent < 0) {
                    methodIndent = functionIndent;
                }
                if (functionIndent == methodIndent) {
                    builder.method(new MethodInfo(function.name(), function.visibility(),
                        function.decorators().stream().anyMatch(d -> d.name().equals("staticmethod")),
                        function.decorators().stream().anyMatch(d -> d.name().endsWith("abstractmethod")),
                        function.decorators(), function.parameterCount(), function.returnType(), function.location(),
                        function.intents(), function.startLine(), function.endLine()));
                }
            }
            classes.add(builder.build());
        }
        return classes;
    }

    // ==================== Calls & Mutations ====================

    private void extractCallsAndMutations(String[] lines, List<FunctionInfo> functions, SemanticModel.Builder builder) {
        Deque<Block> blocks = new ArrayDeque<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String stripped = stripComment(line);
            if (stripped.isBlank()) {
                continue;
            }
            int indent = indentOf(line);
            while (!blocks.isEmpty() && indent <= blocks.peek().indent()) {
                blocks.pop();
            }
            Matcher block = BLOCK_PATTERN.matcher(line);
            if (block.find()) {
                blocks.push(new Block(indent, block.group(2)));
                continue;
            }
            if (CLASS_PATTERN.matcher(line).find()) {
                continue;
            }

            FunctionInfo parent = innermost(functions, i + 1);
            boolean isDef = DEF_PATTERN.matcher(line).find();
            ControlFlowContext flow = controlFlow(blocks);

            Matcher call = CALL_PATTERN.matcher(stripped);
            while (call.find()) {
                String callee = call.group(1);
                String head = callee.contains(".") ? callee.substring(0, callee.indexOf('.')) : callee;
                if (KEYWORDS.contains(head) || (isDef && call.start() < stripped.indexOf('('))) {
                    continue;
                }
                int dot = callee.lastIndexOf('.');
                builder.addCall(new FunctionCallInfo(
                    callee,
                    dot > 0 ? callee.substring(0, dot) : null,
                    null,
                    List.of(),
                    0,
                    new SourceLocation(i + 1, call.start() + 1),
                    callee + "(...)",
                    flow,
                    !callee.contains(".") && Character.isUpperCase(callee.charAt(0)),
                    parent != null && parent.startLine() != i + 1 ? parent.name() : null
                ));
            }

            Matcher mutation = MUTATION_PATTERN.matcher(stripped);
            if (mutation.find()) {
                String target = stripSelf(mutation.group(1));
                builder.addMutation(new MutationInfo(target, null, pathOf(target), mutation.group(2),
                    new SourceLocation(i + 1, indent + 1), stripped.trim(), false));
            }
            Matcher delete = DELETE_PATTERN.matcher(stripped);
            if (delete.find()) {
                String target = stripSelf(delete.group(1));
                builder.addMutation(new MutationInfo(target, null, pathOf(target), "delete",
                    new SourceLocation(i + 1, indent + 1), stripped.trim(), true));
            }
        }
    }

    private record Block(int indent, String kind) {}

    private static ControlFlowContext controlFlow(Deque<Block> blocks) {
        boolean inTry = false;
        boolean inCatch = false;
        boolean inFinally = false;
        int depth = 0;
        for (Block block : blocks) {
            switch (block.kind()) {
                case "try" -> {
                    inTry = true;
                    depth++;
                }
                case "except" -> inCatch = true;
                case "finally" -> inFinally = true;
                default -> {
                    // else-branches of try do not change the context
                }
            }
        }
        return new ControlFlowContext(inTry, inCatch, inFinally, depth);
    }

    // ==================== Exports ====================

    private void extractExports(String content, List<ClassInfo> classes, List<FunctionInfo> functions,
                                SemanticModel.Builder builder) {
        Matcher all = ALL_PATTERN.matcher(content);
        if (all.find()) {
            Arrays.stream(all.group(1).split(","))
                .map(s -> s.trim().replaceAll("^['\"]|['\"]$", ""))
                .filter(s -> !s.isEmpty())
                .forEach(name -> builder.addExport(new ExportInfo(name, "variable", false,
                    SourceLocation.at(SourcePatterns.lineOf(content, all.start())))));
            return;
        }
        classes.stream().filter(ClassInfo::exported)
            .forEach(c -> builder.addExport(new ExportInfo(c.name(), "class", false, c.location())));
        functions.stream().filter(FunctionInfo::exported)
            .forEach(f -> builder.addExport(new ExportInfo(f.name(), "function", false, f.location())));
    }

    // ==================== Helpers ====================

    private List<DecoratorInfo> decoratorsAbove(String[] lines, int index) {
        List<DecoratorInfo> decorators = new ArrayList<>();
        for (int i = index - 1; i >= 0; i--) {
            Matcher matcher = DECORATOR_PATTERN.matcher(lines[i]);
            if (!matcher.find()) {
                break;
            }
            List<String> arguments = matcher.group(2) != null && !matcher.group(2).isBlank()
                ? List.of(matcher.group(2).trim())
                : List.of();
            decorators.add(0, new DecoratorInfo(matcher.group(1), arguments,
                new SourceLocation(i + 1, indentOf(lines[i]) + 1), lines[i].trim()));
        }
        return decorators;
    }

    private static String precedingComments(String[] lines, int index) {
        StringBuilder text = new StringBuilder();
        int i = index - 1;
        while (i >= 0 && DECORATOR_PATTERN.matcher(lines[i]).find()) {
            i--;
        }
        while (i >= 0 && lines[i].trim().startsWith("#")) {
            text.insert(0, lines[i].trim() + "\n");
            i--;
        }
        return text.toString();
    }

    private static String docstringAfter(String[] lines, int index) {
        if (index + 1 >= lines.length) {
            return "";
        }
        String first = lines[index + 1].trim();
        String quote = first.startsWith("\"\"\"") ? "\"\"\"" : first.startsWith("'''") ? "'''" : null;
        if (quote == null) {
            return "";
        }
        StringBuilder text = new StringBuilder(first);
        if (first.length() > 3 && first.substring(3).contains(quote)) {
            return text.toString();
        }
        for (int i = index + 2; i < lines.length; i++) {
            text.append('\n').append(lines[i]);
            if (lines[i].contains(quote)) {
                break;
            }
        }
        return text.toString();
    }

    private static int blockEnd(String[] lines, int start, int indent) {
        int end = start + 1;
        for (int i = start + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.trim().startsWith("#")) {
                continue;
            }
            if (indentOf(line) <= indent) {
                break;
            }
            end = i + 1;
        }
        return end;
    }

    private static FunctionInfo innermost(List<FunctionInfo> functions, int line) {
        FunctionInfo best = null;
        for (FunctionInfo function : functions) {
            if (function.containsLine(line)
                    && (best == null || function.startLine() > best.startLine())) {
                best = function;
            }
        }
        return best;
    }

    private static List<String> parseBases(String bases) {
        if (bases == null || bases.isBlank()) {
            return List.of();
        }
        return Arrays.stream(bases.split(","))
            .map(String::trim)
            .filter(b -> !b.isEmpty() && !b.contains("="))
            .toList();
    }

    private static int countParameters(String parameters) {
        if (parameters == null || parameters.isBlank()) {
            return 0;
        }
        return (int) Arrays.stream(parameters.split(","))
            .map(String::trim)
            .filter(p -> !p.isEmpty() && !p.equals("self") && !p.equals("cls") && !p.equals("*") && !p.equals("/"))
            .count();
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static String stripSelf(String target) {
        return target.startsWith("self.") ? target.substring("self.".length()) : target;
    }

    private static List<String> pathOf(String target) {
        String[] segments = target.split("[.\\[]");
        return segments.length > 1 ? List.of(Arrays.copyOfRange(segments, 1, segments.length)) : List.of();
    }

    private static int indentOf(String line) {
        int count = 0;
        while (count < line.length() && (line.charAt(count) == ' ' || line.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }
}
