package com.archcodex.core.validator;

import com.archcodex.core.model.IntentRegistry;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.tag.IntentAnnotation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluation scope for one (file, constraint) pair.
 *
 * <p>Created fresh by the orchestrator for every constraint it evaluates and never shared between
 * threads. Validators read it and never mutate anything reachable from it.
 *
 * @param filePath path of the file under validation
 * @param fileName file name without directories
 * @param archId architecture the file is tagged with
 * @param constraintSource provenance of the constraint being evaluated
 * @param parsedFile semantic model of the file
 * @param intents file-level intent annotations
 * @param capabilities capabilities of the adapter that produced {@code parsedFile}
 * @param project project-wide view for cross-file rules, may be null
 * @param intentRegistry known intent definitions
 * @param testFilePatterns globs identifying test files
 * @since 1.0.0
 */
public record ConstraintContext(
    String filePath,
    String fileName,
    String archId,
    String constraintSource,
    SemanticModel parsedFile,
    List<IntentAnnotation> intents,
    LanguageCapabilities capabilities,
    ProjectContext project,
    IntentRegistry intentRegistry,
    List<String> testFilePatterns
) {
    /**
     * Globs used when no test file patterns are configured.
     */
    public static final List<String> DEFAULT_TEST_FILE_PATTERNS = List.of(
        "**/*.test.*", "**/*.spec.*", "**/*Test.java", "**/*Tests.java", "**/test_*.py", "**/*_test.py",
        "**/src/test/**");

    /**
     * Compact constructor with validation and defaults.
     */
    public ConstraintContext {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(parsedFile, "parsedFile must not be null");
        fileName = fileName != null ? fileName : parsedFile.fileName();
        constraintSource = constraintSource != null ? constraintSource : "";
        intents = intents != null ? List.copyOf(intents) : List.of();
        capabilities = capabilities != null ? capabilities : LanguageCapabilities.all();
        intentRegistry = intentRegistry != null ? intentRegistry : IntentRegistry.empty();
        testFilePatterns = testFilePatterns != null && !testFilePatterns.isEmpty()
            ? List.copyOf(testFilePatterns) : DEFAULT_TEST_FILE_PATTERNS;
    }

    /**
     * Minimal context over a semantic model, mainly for validator tests.
     *
     * @param model parsed file
     * @param archId architecture id
     * @return context without project, intents or intent registry
     */
    public static ConstraintContext of(SemanticModel model, String archId) {
        return new ConstraintContext(model.filePath(), model.fileName(), archId, archId, model, List.of(),
            null, null, null, null);
    }

    public ConstraintContext withConstraintSource(String source) {
        return new ConstraintContext(filePath, fileName, archId, source, parsedFile, intents, capabilities, project,
            intentRegistry, testFilePatterns);
    }

    public ConstraintContext withIntents(List<IntentAnnotation> newIntents) {
        return new ConstraintContext(filePath, fileName, archId, constraintSource, parsedFile, newIntents,
            capabilities, project, intentRegistry, testFilePatterns);
    }

    public ConstraintContext withProject(ProjectContext newProject) {
        return new ConstraintContext(filePath, fileName, archId, constraintSource, parsedFile, intents,
            capabilities, newProject, intentRegistry, testFilePatterns);
    }

    public ConstraintContext withIntentRegistry(IntentRegistry registry) {
        return new ConstraintContext(filePath, fileName, archId, constraintSource, parsedFile, intents,
            capabilities, project, registry, testFilePatterns);
    }

    public String content() {
        return parsedFile.content();
    }

    public Optional<ProjectContext> projectContext() {
        return Optional.ofNullable(project);
    }

    /**
     * File-level intent names, lowercase.
     *
     * @return intent names in declaration order
     */
    public List<String> intentNames() {
        return intents.stream().map(IntentAnnotation::name).distinct().toList();
    }
}
