package com.archcodex.core.validator.impl.project;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.MethodInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.tag.ArchTag;
import com.archcodex.core.tag.ParsedTags;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.base.AbstractConstraintValidator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@code max_similarity}: the file is not a near-copy of a sibling with the same architecture.
 *
 * <p>Similarity compares structural signatures, never implementation text: the weighted Jaccard
 * index of exported names (0.35), method and function names (0.35), class names (0.15) and
 * imported module names (0.15). A sibling whose score reaches the threshold (a number between 0
 * and 1) is reported. Siblings are files of the same extension tagged with the same architecture.
 *
 * @since 1.0.0
 */
public class MaxSimilarityValidator extends AbstractConstraintValidator {

    private static final double EXPORT_WEIGHT = 0.35;
    private static final double METHOD_WEIGHT = 0.35;
    private static final double CLASS_WEIGHT = 0.15;
    private static final double IMPORT_WEIGHT = 0.15;

    @Override
    public String getRule() {
        return "max_similarity";
    }

    @Override
    public String getErrorCode() {
        return "E026";
    }

    @Override
    public ValidationOutcome validate(Constraint constraint, ConstraintContext context) {
        Optional<ProjectContext> project = context.projectContext();
        if (project.isEmpty()) {
            return notEvaluated(constraint, context);
        }
        Optional<Double> threshold = thresholdOf(constraint.value());
        if (threshold.isEmpty()) {
            return ValidationOutcome.fail(violation(constraint, context)
                .line(1)
                .column(1)
                .message("max_similarity requires a number between 0 and 1, got '" + constraint.valueAsString() + "'")
                .fixHint("Set the constraint value to a threshold such as 0.8")
                .build());
        }

        ProjectContext projectContext = project.get();
        String self = projectContext.relativize(context.filePath());
        Signature signature = Signature.of(context.parsedFile());

        List<Match> matches = new ArrayList<>();
        for (String sibling : projectContext.findFiles("**/*" + context.parsedFile().extension())) {
            if (sibling.equals(self) || !context.archId().equals(archIdOf(projectContext, sibling))) {
                continue;
            }
            Optional<SemanticModel> model = projectContext.semanticModel(sibling);
            if (model.isEmpty()) {
                continue;
            }
            double similarity = signature.similarityTo(Signature.of(model.get()));
            if (similarity >= threshold.get()) {
                matches.add(new Match(sibling, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(Match::similarity).reversed().thenComparing(Match::file));

        List<Violation> violations = new ArrayList<>();
        for (Match match : matches) {
            violations.add(violation(constraint, context)
                .line(1)
                .column(1)
                .message(String.format(Locale.ROOT, "File is %d%% similar to '%s' (maximum %d%%)",
                    Math.round(match.similarity() * 100), match.file(), Math.round(threshold.get() * 100)))
                .fixHint("Extract the shared structure of this file and '" + match.file() + "' into a common module")
                .build());
        }
        return outcome(violations);
    }

    private static String archIdOf(ProjectContext project, String path) {
        return project.tags(path).flatMap(ParsedTags::tag).map(ArchTag::archId).orElse(null);
    }

    private static Optional<Double> thresholdOf(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private record Match(String file, double similarity) {}

    private record Signature(Set<String> exports, Set<String> methods, Set<String> classes, Set<String> imports) {

        static Signature of(SemanticModel model) {
            Set<String> methods = new LinkedHashSet<>();
            for (FunctionInfo function : model.functions()) {
                addPublicName(methods, function.name());
            }
            for (MethodInfo method : model.allMethods()) {
                addPublicName(methods, method.name());
            }
            return new Signature(
                lowercase(model.exports().stream().map(ExportInfo::name).toList()),
                methods,
                lowercase(model.classes().stream().map(ClassInfo::name).toList()),
                lowercase(model.imports().stream().map(ImportInfo::moduleSpecifier).map(Signature::moduleName).toList()));
        }

        double similarityTo(Signature other) {
            return jaccard(exports, other.exports) * EXPORT_WEIGHT
                + jaccard(methods, other.methods) * METHOD_WEIGHT
                + jaccard(classes, other.classes) * CLASS_WEIGHT
                + jaccard(imports, other.imports) * IMPORT_WEIGHT;
        }

        private static double jaccard(Set<String> a, Set<String> b) {
            Set<String> union = new HashSet<>(a);
            union.addAll(b);
            if (union.isEmpty()) {
                return 0;
            }
            long shared = a.stream().filter(b::contains).count();
            return (double) shared / union.size();
        }

        private static void addPublicName(Set<String> names, String name) {
            if (!name.startsWith("_")) {
                names.add(name.toLowerCase(Locale.ROOT));
            }
        }

        private static Set<String> lowercase(List<String> names) {
            Set<String> result = new LinkedHashSet<>();
            names.forEach(n -> result.add(n.toLowerCase(Locale.ROOT)));
            return result;
        }

        private static String moduleName(String specifier) {
            String last = specifier.substring(specifier.lastIndexOf('/') + 1);
            return last.endsWith(".js") ? last.substring(0, last.length() - 3) : last;
        }
    }
}
