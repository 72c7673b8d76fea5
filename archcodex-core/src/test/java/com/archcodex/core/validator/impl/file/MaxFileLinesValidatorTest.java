package com.archcodex.core.validator.impl.file;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MaxFileLinesValidator}.
 */
class MaxFileLinesValidatorTest extends ValidatorTestBase {

    private static final String SOURCE = """
        // Payment service
        /*
         * Handles charges.
         */
        public class PaymentService {

            void charge() {}
        }
        """;

    private final MaxFileLinesValidator validator = new MaxFileLinesValidator();

    @Test
    void validate_overLimit_reportsLineCount() {
        ConstraintContext context = javaContext("src/PaymentService.java", SOURCE);

        assertThat(validator.validate(Constraint.of("max_file_lines", 5, Severity.WARNING), context).violations())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.code()).isEqualTo("E010");
                assertThat(v.message()).isEqualTo("File has 8 lines; maximum is 5");
                assertThat(v.fixHint()).isEqualTo("Split the file so that it stays within 5 lines");
            });
    }

    @Test
    void validate_excludeComments_countsOnlyCode() {
        ConstraintContext context = javaContext("src/PaymentService.java", SOURCE);
        Constraint constraint = Constraint.builder("max_file_lines").value(5).excludeComments(true).build();

        assertThat(validator.validate(constraint, context).passed()).isTrue();
    }

    @Test
    void validate_atLimit_passes() {
        ConstraintContext context = javaContext("src/PaymentService.java", SOURCE);

        assertThat(validator.validate(Constraint.of("max_file_lines", "8", Severity.ERROR), context).passed()).isTrue();
    }
}
