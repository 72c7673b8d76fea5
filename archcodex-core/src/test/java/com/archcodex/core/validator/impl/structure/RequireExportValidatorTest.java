package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequireExportValidator}.
 */
class RequireExportValidatorTest extends ValidatorTestBase {

    private final RequireExportValidator validator = new RequireExportValidator();

    @Test
    void validate_exactAndGlobExports_pass() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService {
            }
            """);

        assertThat(validator.validate(Constraint.of("require_export", List.of("PaymentService", "*Service"),
            Severity.ERROR), context).passed()).isTrue();
    }

    @Test
    void validate_missingExport_listsActualExports() {
        ConstraintContext context = javaContext("src/PaymentService.java", """
            public class PaymentService {
            }
            """);

        var violations = validator.validate(Constraint.of("require_export", "*Handler", Severity.ERROR), context)
            .violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E018");
            assertThat(v.message()).isEqualTo("Missing required export '*Handler' (exports: PaymentService)");
        });
    }
}
