package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.NamingCase;
import com.archcodex.core.model.NamingSpec;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NamingPatternValidator}.
 */
class NamingPatternValidatorTest {

    private final NamingPatternValidator validator = new NamingPatternValidator();

    private static ConstraintContext contextFor(String filePath) {
        SemanticModel model = SemanticModel.builder(filePath, "", "typescript").build();
        return ConstraintContext.of(model, "svc.payment");
    }

    // ========== Structured Spec Tests ==========

    @Test
    void validate_structuredSpec_acceptsMatchingName() {
        Constraint constraint = Constraint.builder("naming_pattern")
            .naming(new NamingSpec(NamingCase.PASCAL_CASE, null, "Service", ".ts"))
            .build();

        assertThat(validator.validate(constraint, contextFor("src/PaymentService.ts")).passed()).isTrue();
    }

    @Test
    void validate_structuredSpec_rejectsWrongCaseAndWrongExtension() {
        Constraint constraint = Constraint.builder("naming_pattern")
            .naming(new NamingSpec(NamingCase.PASCAL_CASE, null, "Service", ".ts"))
            .build();

        ValidationOutcome wrongCase = validator.validate(constraint, contextFor("src/paymentService.ts"));
        ValidationOutcome wrongExtension = validator.validate(constraint, contextFor("src/PaymentService.js"));

        assertThat(wrongCase.passed()).isFalse();
        assertThat(wrongExtension.passed()).isFalse();
        assertThat(wrongCase.violations()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E007");
            assertThat(v.message()).isEqualTo("File name 'paymentService.ts' does not match naming pattern: "
                + "PascalCase, suffix \"Service\", extension \".ts\"");
        });
    }

    @Test
    void validate_mapValue_treatedAsStructuredSpec() {
        Constraint constraint = Constraint.of("naming_pattern",
            Map.of("case", "PascalCase", "suffix", "Service", "extension", ".ts"), Severity.ERROR);

        assertThat(validator.validate(constraint, contextFor("src/PaymentService.ts")).passed()).isTrue();
        assertThat(validator.validate(constraint, contextFor("src/paymentService.ts")).passed()).isFalse();
    }

    @Test
    void validate_specWithoutExtension_matchesBaseName() {
        Constraint constraint = Constraint.builder("naming_pattern")
            .naming(new NamingSpec(NamingCase.KEBAB_CASE, null, "-service", null))
            .build();

        assertThat(validator.validate(constraint, contextFor("src/payment-service.ts")).passed()).isTrue();
        assertThat(validator.validate(constraint, contextFor("src/payment_service.ts")).passed()).isFalse();
    }

    @Test
    void validate_emptySpec_reportsInvalidPattern() {
        Constraint constraint = Constraint.builder("naming_pattern")
            .naming(new NamingSpec(null, null, null, null))
            .build();

        assertThat(validator.validate(constraint, contextFor("src/Anything.ts")).violations())
            .singleElement()
            .satisfies(v -> assertThat(v.message()).startsWith("Invalid structured naming pattern: "));
    }

    @Test
    void validate_emptyMapValue_reportsInvalidStructuredPattern() {
        Constraint constraint = Constraint.of("naming_pattern", Map.of(), Severity.ERROR);

        assertThat(validator.validate(constraint, contextFor("src/Anything.ts")).violations())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.code()).isEqualTo("E007");
                assertThat(v.message()).startsWith("Invalid structured naming pattern: ");
            });
    }

    // ========== Regex Tests ==========

    @Test
    void validate_regexWithExamples_mentionsExamplesOnFailure() {
        Constraint constraint = Constraint.builder("naming_pattern")
            .value("^[A-Z][a-zA-Z]+Controller\\.ts$")
            .examples(List.of("OrderController.ts", "UserController.ts"))
            .build();

        ValidationOutcome outcome = validator.validate(constraint, contextFor("src/orders.ts"));

        assertThat(outcome.violations()).singleElement().satisfies(v -> {
            assertThat(v.message()).contains("does not match pattern '^[A-Z][a-zA-Z]+Controller\\.ts$'");
            assertThat(v.message()).endsWith(" (e.g. OrderController.ts, UserController.ts)");
        });
        assertThat(validator.validate(constraint, contextFor("src/OrderController.ts")).passed()).isTrue();
    }

    @Test
    void validate_invalidRegex_reportsViolation() {
        Constraint constraint = Constraint.of("naming_pattern", "([A-Z]", Severity.ERROR);

        assertThat(validator.validate(constraint, contextFor("src/Order.ts")).violations())
            .singleElement()
            .satisfies(v -> assertThat(v.message()).startsWith("Invalid naming pattern regex '([A-Z]'"));
    }
}
