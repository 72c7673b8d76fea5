package com.archcodex.core.validator.impl.structure;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequireDecoratorValidator} and {@link ForbidDecoratorValidator}.
 */
class DecoratorValidatorsTest extends ValidatorTestBase {

    private static final String CONTROLLER = """
        @RestController
        @Deprecated
        public class OrderController {
        }
        """;

    // ========== require_decorator Tests ==========

    @Test
    void requireDecorator_presentWithOrWithoutAt_passes() {
        ConstraintContext context = javaContext("src/OrderController.java", CONTROLLER);
        RequireDecoratorValidator validator = new RequireDecoratorValidator();

        assertThat(validator.validate(Constraint.of("require_decorator", "@RestController", Severity.ERROR), context)
            .passed()).isTrue();
        assertThat(validator.validate(Constraint.of("require_decorator", "RestController", Severity.ERROR), context)
            .passed()).isTrue();
    }

    @Test
    void requireDecorator_missing_reportsE005PerDecorator() {
        ConstraintContext context = javaContext("src/OrderController.java", CONTROLLER);

        var violations = new RequireDecoratorValidator()
            .validate(Constraint.of("require_decorator", List.of("Validated", "Transactional"), Severity.ERROR), context)
            .violations();

        assertThat(violations).extracting(v -> v.message()).containsExactly(
            "Class 'OrderController' is missing required decorator '@Validated'",
            "Class 'OrderController' is missing required decorator '@Transactional'");
        assertThat(violations).allSatisfy(v -> assertThat(v.code()).isEqualTo("E005"));
    }

    // ========== forbid_decorator Tests ==========

    @Test
    void forbidDecorator_present_reportsAtDecoratorLine() {
        ConstraintContext context = javaContext("src/OrderController.java", CONTROLLER);

        var violations = new ForbidDecoratorValidator()
            .validate(Constraint.of("forbid_decorator", "@Deprecated", Severity.WARNING), context)
            .violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E006");
            assertThat(v.severity()).isEqualTo(Severity.WARNING);
            assertThat(v.line()).isEqualTo(2);
            assertThat(v.message()).isEqualTo("Class 'OrderController' uses forbidden decorator '@Deprecated'");
            assertThat(v.suggestion().action()).isEqualTo(Suggestion.Action.REMOVE);
            assertThat(v.didYouMean()).isNull();
        });
    }

    @Test
    void forbidDecorator_withAlternative_suggestsReplacement() {
        ConstraintContext context = javaContext("src/OrderController.java", CONTROLLER);
        Constraint constraint = Constraint.builder("forbid_decorator")
            .value("RestController")
            .alternative("@Controller")
            .why("Views are rendered server-side")
            .build();

        var violation = new ForbidDecoratorValidator().validate(constraint, context).violations().get(0);

        assertThat(violation.suggestion()).isEqualTo(Suggestion.replace("@RestController", "@Controller"));
        assertThat(violation.didYouMean().file()).isEqualTo("@Controller");
        assertThat(violation.didYouMean().description()).isEqualTo("Views are rendered server-side");
    }

    @Test
    void forbidDecorator_absent_passes() {
        ConstraintContext context = javaContext("src/OrderController.java", CONTROLLER);

        assertThat(new ForbidDecoratorValidator()
            .validate(Constraint.of("forbid_decorator", "Transactional", Severity.ERROR), context)
            .passed()).isTrue();
    }
}
