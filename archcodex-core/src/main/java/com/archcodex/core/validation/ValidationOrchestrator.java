package com.archcodex.core.validation;

import com.archcodex.core.adapter.AdapterRegistry;
import com.archcodex.core.config.ArchCodexConfig;
import com.archcodex.core.config.ArchCodexConfig.UntaggedPolicy;
import com.archcodex.core.config.ArchCodexConfig.ValidationSettings;
import com.archcodex.core.exception.ArchCodexException;
import com.archcodex.core.exception.InvalidConstraintException;
import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.ArchitectureNode;
import com.archcodex.core.model.ConflictReport;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.FlattenedArchitecture;
import com.archcodex.core.model.IntentRegistry;
import com.archcodex.core.model.Registry;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.project.ProjectContext;
import com.archcodex.core.resolver.ResolutionResult;
import com.archcodex.core.resolver.Resolver;
import com.archcodex.core.tag.ArchTag;
import com.archcodex.core.tag.ArchTagParser;
import com.archcodex.core.tag.IntentAnnotation;
import com.archcodex.core.tag.ParsedTags;
import com.archcodex.core.util.StringSimilarity;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ConstraintValidator;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs every applicable constraint of a file's architecture against its semantic model.
 *
 * <p>For one file:
 * <ol>
 *   <li>Parse the {@code @arch} tag, overrides and intents</li>
 *   <li>Build the semantic model through the adapter for the file's extension</li>
 *   <li>Apply the untagged policy, or resolve the architecture with the tag's inline mixins</li>
 *   <li>For each constraint: check language capabilities, {@code when}, {@code unless} and
 *       {@code applies_when}, then run the validator</li>
 *   <li>Add intent and governance findings (E027, E028, I001, C001)</li>
 *   <li>Apply valid overrides and report them as active, flag invalid ones</li>
 *   <li>Partition by severity and derive the status</li>
 * </ol>
 *
 * <p>Failures are converted to results here and nowhere else: resolution failure is S002, adapter
 * failure S003, anything unexpected S999. A batch never aborts because one file failed.
 *
 * <p>For identical file content, registry and configuration the result is identical.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidationOrchestrator orchestrator = ValidationOrchestrator.builder(registry)
 *     .config(ConfigLoader.loadFromProject(root))
 *     .project(new FileSystemProjectContext(root, AdapterRegistry.loadDefault()))
 *     .build();
 *
 * ValidationResult result = orchestrator.validateFile("src/PaymentService.java", content);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ValidationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    static final String UNTAGGED_CODE = "S001";
    static final String RESOLUTION_CODE = "S002";
    static final String ADAPTER_CODE = "S003";
    static final String APPLIES_WHEN_CODE = "S004";
    static final String INTERNAL_CODE = "S999";
    static final String INLINE_MIXIN_CODE = "E027";
    static final String EXPECTED_INTENT_CODE = "E028";
    static final String SINGLETON_CODE = "E029";
    static final String MISSING_WHY_CODE = "C001";
    static final String UNDEFINED_INTENT_CODE = "I001";

    private static final int INTENT_SUGGESTION_DISTANCE = 2;

    private final Registry registry;
    private final AdapterRegistry adapters;
    private final ValidatorRegistry validators;
    private final ArchCodexConfig config;
    private final IntentRegistry intentRegistry;
    private final ProjectContext project;
    private final OverrideValidator overrideValidator;

    private ValidationOrchestrator(Builder builder) {
        this.registry = builder.registry;
        this.adapters = builder.adapters != null ? builder.adapters : AdapterRegistry.loadDefault();
        this.validators = builder.validators != null ? builder.validators : ValidatorRegistry.loadDefault();
        this.config = builder.config != null ? builder.config : ArchCodexConfig.defaults();
        this.intentRegistry = builder.intentRegistry != null ? builder.intentRegistry : IntentRegistry.empty();
        this.project = builder.project;
        this.overrideValidator = new OverrideValidator(config.overrides(),
            builder.clock != null ? builder.clock : Clock.systemDefaultZone());
    }

    public static Builder builder(Registry registry) {
        return new Builder(registry);
    }

    // ==================== Single File ====================

    /**
     * Validates one file, converting any unexpected failure into an S999 result.
     *
     * @param filePath file path
     * @param content file content
     * @return validation result, never null
     */
    public ValidationResult validateFile(String filePath, String content) {
        try {
            return runValidation(filePath, content);
        } catch (RuntimeException e) {
            log.error("Internal error validating {}: {}", filePath, e.getMessage(), e);
            return ValidationResult.error(filePath, null, systemViolation(INTERNAL_CODE, "internal_error",
                "Internal error while validating " + filePath + ": " + e.getMessage(),
                "Report this failure with the file that triggered it"));
        }
    }

    /**
     * Validates one file; unexpected exceptions propagate.
     *
     * @param filePath file path
     * @param content file content
     * @return validation result
     */
    public ValidationResult runValidation(String filePath, String content) {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        ValidationSettings settings = config.validation();

        if (!adapters.supports(filePath)) {
            log.debug("No adapter for {}, skipping", filePath);
            return ValidationResult.skipped(filePath);
        }

        ParsedTags tags = ArchTagParser.parse(content);
        String taggedArchId = tags.tag().map(ArchTag::archId).orElse(null);

        SemanticModel model;
        try {
            model = adapters.parseFile(filePath, content);
        } catch (SemanticModelException e) {
            log.warn("Adapter failed for {}: {}", filePath, e.getMessage());
            return ValidationResult.error(filePath, taggedArchId, systemViolation(ADAPTER_CODE, "adapter_error",
                "Could not parse " + filePath + ": " + e.getMessage(), "Fix the syntax error and validate again"));
        }

        if (tags.tag().isEmpty()) {
            return untaggedResult(filePath, settings.untaggedPolicy());
        }
        ArchTag archTag = tags.tag().get();

        ResolutionResult resolution;
        try {
            resolution = Resolver.resolveArchitecture(registry, archTag.archId(), archTag.inlineMixins());
        } catch (ArchCodexException e) {
            log.warn("Resolution failed for {} ({}): {}", filePath, archTag.archId(), e.getMessage());
            List<String> candidates = StringSimilarity.closest(archTag.archId(), registry.architectureIds(),
                INTENT_SUGGESTION_DISTANCE);
            String hint = candidates.isEmpty()
                ? "Define '" + archTag.archId() + "' in the registry or fix the @arch tag"
                : "Did you mean '" + candidates.get(0) + "'?";
            return ValidationResult.error(filePath, archTag.archId(), systemViolation(RESOLUTION_CODE,
                "resolution_error", e.getMessage(), hint));
        }
        FlattenedArchitecture architecture = resolution.architecture();

        ConstraintContext baseContext = new ConstraintContext(
            filePath,
            model.fileName(),
            architecture.archId(),
            architecture.archId(),
            model,
            tags.intents(),
            adapters.capabilitiesFor(filePath).orElse(LanguageCapabilities.all()),
            project,
            intentRegistry,
            config.files().testPatterns());

        List<Violation> findings = new ArrayList<>();
        findings.addAll(inlineMixinFindings(resolution.conflicts(), archTag));
        for (Constraint constraint : architecture.constraints()) {
            findings.addAll(evaluateConstraint(constraint, baseContext, archTag, settings));
        }
        findings.addAll(expectedIntentFindings(architecture, baseContext, archTag));
        findings.addAll(undefinedIntentFindings(tags.intents(), model));

        return finish(filePath, architecture, findings, tags, settings);
    }

    private List<Violation> evaluateConstraint(Constraint constraint, ConstraintContext baseContext, ArchTag archTag,
            ValidationSettings settings) {
        if (settings.skipRules().contains(constraint.rule()) || !settings.includes(constraint.severity())) {
            return List.of();
        }
        List<Violation> findings = new ArrayList<>();
        if (settings.requireWhyForForbid() && constraint.rule().startsWith("forbid_")
                && (constraint.why() == null || constraint.why().isBlank())) {
            findings.add(Violation.builder(MISSING_WHY_CODE, "missing_why", Severity.WARNING)
                .value(constraint.rule() + ":" + constraint.valueAsString())
                .line(archTag.line())
                .column(archTag.column())
                .message("Constraint '" + constraint.rule() + "' is missing 'why' field - explain why this is forbidden")
                .fixHint("Add 'why' to the " + constraint.rule() + " constraint in the registry")
                .source(constraint.source())
                .build());
        }

        ConstraintValidator validator = validators.find(constraint.rule()).orElse(null);
        if (validator == null) {
            log.debug("No validator for rule '{}', skipping", constraint.rule());
            return findings;
        }

        ConstraintContext context = baseContext.withConstraintSource(constraint.source());
        try {
            if (!ApplicabilityRules.standard(validator).test(constraint, context)) {
                log.debug("{} not applicable to {}", constraint.slotKey(), context.filePath());
                return findings;
            }
        } catch (InvalidConstraintException e) {
            findings.add(Violation.builder(APPLIES_WHEN_CODE, constraint.rule(), Severity.WARNING)
                .value(constraint.value())
                .line(archTag.line())
                .column(archTag.column())
                .message(e.getMessage())
                .fixHint("Fix the applies_when regex of the " + constraint.rule() + " constraint")
                .source(constraint.source())
                .build());
            return findings;
        }

        ValidationOutcome outcome = validator.validate(constraint, context);
        findings.addAll(outcome.violations());
        return findings;
    }

    // ==================== Synthetic Findings ====================

    private static List<Violation> inlineMixinFindings(List<ConflictReport> conflicts, ArchTag archTag) {
        List<Violation> findings = new ArrayList<>();
        for (ConflictReport conflict : conflicts) {
            if (Resolver.MIXIN_INLINE_FORBIDDEN.equals(conflict.rule())
                    || Resolver.MIXIN_INLINE_ONLY.equals(conflict.rule())) {
                findings.add(Violation.builder(INLINE_MIXIN_CODE, conflict.rule(), Severity.WARNING)
                    .value(conflict.value())
                    .line(archTag.line())
                    .column(archTag.column())
                    .message(conflict.resolution())
                    .source(conflict.loser())
                    .build());
            }
        }
        return findings;
    }

    private static List<Violation> expectedIntentFindings(FlattenedArchitecture architecture, ConstraintContext context,
            ArchTag archTag) {
        List<Violation> findings = new ArrayList<>();
        List<String> declared = context.intentNames();
        for (String expected : architecture.expectedIntents()) {
            if (!declared.contains(expected.toLowerCase(Locale.ROOT))) {
                findings.add(Violation.builder(EXPECTED_INTENT_CODE, "missing_expected_intent", Severity.WARNING)
                    .value(expected)
                    .line(archTag.line())
                    .column(archTag.column())
                    .message("Architecture '" + architecture.archId() + "' expects @intent:" + expected
                        + " but file lacks it")
                    .fixHint("Add @intent:" + expected + " to the file header")
                    .source(architecture.archId())
                    .build());
            }
        }
        return findings;
    }

    private List<Violation> undefinedIntentFindings(List<IntentAnnotation> fileIntents, SemanticModel model) {
        if (intentRegistry.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> used = new LinkedHashMap<>();
        for (IntentAnnotation intent : fileIntents) {
            used.putIfAbsent(intent.name().toLowerCase(Locale.ROOT), intent.line());
        }
        for (FunctionInfo function : model.functions()) {
            function.intents().forEach(i -> used.putIfAbsent(i.toLowerCase(Locale.ROOT), Math.max(1, function.startLine())));
        }

        List<Violation> findings = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : used.entrySet()) {
            String name = entry.getKey();
            if (intentRegistry.isDefined(name)) {
                continue;
            }
            List<String> closest = StringSimilarity.closest(name, intentRegistry.names(), INTENT_SUGGESTION_DISTANCE);
            String hint = closest.isEmpty()
                ? "Define '" + name + "' in the intent registry or remove the annotation"
                : "Did you mean @intent:" + closest.get(0) + "?";
            findings.add(Violation.builder(UNDEFINED_INTENT_CODE, "undefined_intent", Severity.WARNING)
                .value(name)
                .line(entry.getValue())
                .column(1)
                .message("Intent '@intent:" + name + "' is not defined")
                .fixHint(hint)
                .source("intents")
                .build());
        }
        return findings;
    }

    // ==================== Overrides and Status ====================

    private ValidationResult finish(String filePath, FlattenedArchitecture architecture, List<Violation> findings,
            ParsedTags tags, ValidationSettings settings) {
        OverrideValidator.Evaluation overrides = overrideValidator.evaluate(tags.overrides());

        int[] suppressed = new int[overrides.active().size()];
        List<Violation> kept = new ArrayList<>();
        for (Violation violation : findings) {
            int match = -1;
            if (violation.severity() != Severity.INFO) {
                for (int i = 0; i < overrides.active().size() && match < 0; i++) {
                    if (OverrideValidator.matches(overrides.active().get(i), violation)) {
                        match = i;
                    }
                }
            }
            if (match >= 0) {
                suppressed[match]++;
            } else {
                kept.add(violation);
            }
        }
        kept.addAll(overrides.issues());

        List<ActiveOverride> active = new ArrayList<>();
        for (int i = 0; i < suppressed.length; i++) {
            active.add(overrides.active().get(i).withSuppressedCount(suppressed[i]));
        }

        return partition(filePath, architecture.archId(), architecture.inheritanceChain(),
            architecture.appliedMixins(), kept, active, settings);
    }

    private static ValidationResult partition(String filePath, String archId, List<String> chain, List<String> mixins,
            List<Violation> findings, List<ActiveOverride> active, ValidationSettings settings) {
        List<Violation> errors = new ArrayList<>();
        List<Violation> warnings = new ArrayList<>();
        List<Violation> infos = new ArrayList<>();
        for (Violation violation : findings) {
            switch (violation.severity()) {
                case ERROR -> errors.add(violation);
                case WARNING -> {
                    if (settings.strict()) {
                        errors.add(violation);
                    } else {
                        warnings.add(violation);
                    }
                }
                case INFO -> infos.add(violation);
            }
        }
        ValidationStatus status = !errors.isEmpty() ? ValidationStatus.FAIL
            : !warnings.isEmpty() ? ValidationStatus.WARN
            : ValidationStatus.PASS;
        return new ValidationResult(filePath, status, archId, chain, mixins, errors, warnings, infos, active);
    }

    private ValidationResult untaggedResult(String filePath, UntaggedPolicy policy) {
        if (policy == UntaggedPolicy.ALLOW) {
            return new ValidationResult(filePath, ValidationStatus.PASS, null, null, null, null, null, null, null);
        }
        Severity severity = policy == UntaggedPolicy.DENY ? Severity.ERROR : Severity.WARNING;
        Violation untagged = Violation.builder(UNTAGGED_CODE, "untagged", severity)
            .line(1)
            .column(1)
            .message("File has no @arch tag")
            .fixHint("Add '@arch <architecture-id>' to the file header")
            .source("engine")
            .build();
        return partition(filePath, null, null, null, List.of(untagged), List.of(), config.validation());
    }

    private static Violation systemViolation(String code, String rule, String message, String fixHint) {
        return Violation.builder(code, rule, Severity.ERROR)
            .line(1)
            .column(1)
            .message(message)
            .fixHint(fixHint)
            .source("engine")
            .build();
    }

    // ==================== Batch ====================

    /**
     * Validates a batch of files on a bounded worker pool.
     *
     * <p>Results are returned in input order. A failure on one file yields an S999 result for that
     * file; the rest of the batch completes. Singleton architectures used by more than one file in
     * the batch are reported (E029) on every file after the first.
     *
     * @param files files to validate
     * @return one result per file, in input order
     */
    public List<ValidationResult> validateFiles(List<SourceFile> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(config.validation().concurrency(), files.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        List<ValidationResult> results = new ArrayList<>(files.size());
        try {
            List<Future<ValidationResult>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(executor.submit(() -> validateFile(file.path(), file.content())));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), files.get(i).path()));
            }
        } finally {
            executor.shutdownNow();
        }

        List<ValidationResult> checked = applySingletonRule(results);
        long failed = checked.stream().filter(r -> !r.passed()).count();
        log.info("Validated {} file(s): {} passed, {} failed", checked.size(), checked.size() - failed, failed);
        return checked;
    }

    /**
     * Reads and validates files from disk.
     *
     * @param paths files to validate
     * @return one result per path, in input order
     */
    public List<ValidationResult> validatePaths(List<Path> paths) {
        List<SourceFile> files = new ArrayList<>();
        Map<Integer, ValidationResult> unreadable = new HashMap<>();
        for (int i = 0; i < paths.size(); i++) {
            Path path = paths.get(i);
            String display = project != null ? project.relativize(path.toString()) : path.toString();
            try {
                files.add(new SourceFile(display, Files.readString(path)));
            } catch (IOException e) {
                log.warn("Cannot read {}: {}", path, e.getMessage());
                unreadable.put(i, ValidationResult.error(display, null, systemViolation(INTERNAL_CODE,
                    "internal_error", "Cannot read " + display + ": " + e.getMessage(), "Check the file permissions")));
            }
        }
        List<ValidationResult> validated = validateFiles(files);
        List<ValidationResult> results = new ArrayList<>(paths.size());
        int next = 0;
        for (int i = 0; i < paths.size(); i++) {
            results.add(unreadable.containsKey(i) ? unreadable.get(i) : validated.get(next++));
        }
        return results;
    }

    private static ValidationResult await(Future<ValidationResult> future, String filePath) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchCodexException("Interrupted while validating " + filePath, e);
        } catch (ExecutionException e) {
            log.error("Validation task failed for {}", filePath, e.getCause());
            return ValidationResult.error(filePath, null, systemViolation(INTERNAL_CODE, "internal_error",
                "Internal error while validating " + filePath + ": " + e.getCause().getMessage(),
                "Report this failure with the file that triggered it"));
        }
    }

    private List<ValidationResult> applySingletonRule(List<ValidationResult> results) {
        Set<String> seen = new LinkedHashSet<>();
        Map<String, String> firstFile = new HashMap<>();
        List<ValidationResult> checked = new ArrayList<>(results.size());
        for (ValidationResult result : results) {
            String archId = result.archId();
            boolean singleton = archId != null && result.status() != ValidationStatus.ERROR
                && registry.findArchitecture(archId).map(ArchitectureNode::singleton).orElse(false);
            if (!singleton || seen.add(archId)) {
                if (singleton) {
                    firstFile.put(archId, result.filePath());
                }
                checked.add(result);
                continue;
            }
            Violation violation = Violation.builder(SINGLETON_CODE, "singleton_violation", Severity.ERROR)
                .value(archId)
                .line(1)
                .column(1)
                .message("Architecture '" + archId + "' is marked singleton but is already used by '"
                    + firstFile.get(archId) + "'")
                .fixHint("Use a different architecture for this file or merge it into " + firstFile.get(archId))
                .source("engine")
                .build();
            List<Violation> errors = new ArrayList<>(result.violations());
            errors.add(violation);
            checked.add(new ValidationResult(result.filePath(), ValidationStatus.FAIL, archId,
                result.inheritanceChain(), result.mixinsApplied(), errors, result.warnings(), result.infos(),
                result.activeOverrides()));
        }
        return checked;
    }

    // ==================== Builder ====================

    /**
     * Builder for {@link ValidationOrchestrator}; only the registry is required.
     */
    public static final class Builder {
        private final Registry registry;
        private AdapterRegistry adapters;
        private ValidatorRegistry validators;
        private ArchCodexConfig config;
        private IntentRegistry intentRegistry;
        private ProjectContext project;
        private Clock clock;

        private Builder(Registry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
        }

        public Builder adapters(AdapterRegistry adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder validators(ValidatorRegistry validators) {
            this.validators = validators;
            return this;
        }

        public Builder config(ArchCodexConfig config) {
            this.config = config;
            return this;
        }

        public Builder intentRegistry(IntentRegistry intentRegistry) {
            this.intentRegistry = intentRegistry;
            return this;
        }

        /**
         * Project context for cross-file rules; without one they report "not evaluated".
         *
         * @param project project context
         * @return this builder
         */
        public Builder project(ProjectContext project) {
            this.project = project;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ValidationOrchestrator build() {
            return new ValidationOrchestrator(this);
        }
    }
}
