package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidationOutcome;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MustExtendValidator}.
 */
class MustExtendValidatorTest extends ValidatorTestBase {

    private MustExtendValidator validator;
    private Constraint constraint;

    @BeforeEach
    void setUp() {
        validator = new MustExtendValidator();
        constraint = Constraint.builder("must_extend")
            .value("BaseService")
            .severity(Severity.ERROR)
            .why("Services share lifecycle hooks")
            .source("svc.payment")
            .build();
    }

    @Test
    void validate_classWithoutBase_reportsHasNoBaseClass() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService {
            }
            """);

        ValidationOutcome outcome = validator.validate(constraint, context);

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.violations()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E001");
            assertThat(v.rule()).isEqualTo("must_extend");
            assertThat(v.severity()).isEqualTo(Severity.ERROR);
            assertThat(v.message()).contains("has no base class");
            assertThat(v.why()).isEqualTo("Services share lifecycle hooks");
            assertThat(v.line()).isEqualTo(1);
            assertThat(v.fixHint()).isEqualTo("Add 'extends BaseService' to the class declaration");
        });
    }

    @Test
    void validate_classWithWrongBase_reportsFoundBase() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService extends BaseController {
            }
            """);

        List<Violation> violations = validator.validate(constraint, context).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.message()).contains("must extend 'BaseService'").contains("found 'BaseController'");
            assertThat(v.message()).doesNotContain("has no base class");
        });
    }

    @Test
    void validate_directBaseWithGenerics_passes() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService extends BaseService<Payment> {
            }
            """);

        assertThat(validator.validate(constraint, context).passed()).isTrue();
    }

    @Test
    void validate_qualifiedBase_matchesSimpleName() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService extends com.acme.core.BaseService {
            }
            """);

        assertThat(validator.validate(constraint, context).violations()).isEmpty();
    }

    @Test
    void validate_requiredBaseReachedThroughChain_passes() {
        // Given: PaymentService -> AuditedService -> BaseService
        SemanticModel model = SemanticModel.builder("src/PaymentService.ts", "class PaymentService {}", "typescript")
            .addClass(ClassInfo.builder("PaymentService")
                .extendsClass("AuditedService")
                .inheritanceChain(List.of("AuditedService", "BaseService"))
                .build())
            .build();

        ValidationOutcome outcome = validator.validate(constraint, ConstraintContext.of(model, "svc.payment"));

        assertThat(outcome.passed()).isTrue();
    }

    @Test
    void validate_inFileChain_resolvedByJavaAdapter() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService extends Audited {
                static class Audited extends BaseService {
                }
            }
            """);

        assertThat(validator.validate(constraint, context).violations()).isEmpty();
    }

    @Test
    void validate_nonExportedClass_isIgnored() {
        SemanticModel model = SemanticModel.builder("src/helpers.ts", "", "typescript")
            .addClass(ClassInfo.builder("Helper").exported(false).build())
            .build();

        assertThat(validator.validate(constraint, ConstraintContext.of(model, "svc")).passed()).isTrue();
    }

    @Test
    void validate_sourceFromContext_isCopiedToViolation() {
        ConstraintContext context = javaContext("src/PaymentService.java", "public class PaymentService {}")
            .withConstraintSource("mixin:service");

        Violation violation = validator.validate(constraint, context).violations().get(0);

        assertThat(violation.source()).isEqualTo("mixin:service");
    }
}
