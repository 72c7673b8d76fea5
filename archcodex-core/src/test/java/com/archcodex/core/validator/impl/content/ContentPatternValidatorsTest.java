package com.archcodex.core.validator.impl.content;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RequirePatternValidator} and {@link ForbidPatternValidator}.
 */
class ContentPatternValidatorsTest extends ValidatorTestBase {

    private static final String PRINTING_SOURCE = """
        public class Report {
            void render() {
                System.out.println("a");
            }

            /** @intent:cli-output */
            void dump() {
                System.out.println("b");
            }
        }
        """;

    private final RequirePatternValidator requirePattern = new RequirePatternValidator();
    private final ForbidPatternValidator forbidPattern = new ForbidPatternValidator();

    // ========== require_pattern Tests ==========

    @Test
    void requirePattern_caretMatchesAtLineStart() {
        Constraint constraint = Constraint.builder("require_pattern").pattern("^package com\\.acme").build();
        var context = javaContext("src/Order.java", """
            // header
            package com.acme;

            public class Order {}
            """);

        assertThat(requirePattern.validate(constraint, context).passed()).isTrue();
    }

    @Test
    void requirePattern_dotMatchesAcrossLines() {
        Constraint constraint = Constraint.of("require_pattern", "try \\{.*finally", Severity.ERROR);
        var context = javaContext("src/Order.java", """
            public class Order {
                void save() {
                    try {
                        write();
                    } finally {
                        close();
                    }
                }
            }
            """);

        assertThat(requirePattern.validate(constraint, context).passed()).isTrue();
    }

    @Test
    void requirePattern_missing_reportsLabelAndExample() {
        Constraint constraint = Constraint.builder("require_pattern")
            .value("logger declaration")
            .pattern("LoggerFactory\\.getLogger")
            .codeExample("private static final Logger log = LoggerFactory.getLogger(Order.class);")
            .build();
        var context = javaContext("src/Order.java", "public class Order {}");

        assertThat(requirePattern.validate(constraint, context).violations()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E012");
            assertThat(v.message())
                .isEqualTo("Required pattern not found: logger declaration ('LoggerFactory\\.getLogger')");
            assertThat(v.fixHint()).startsWith("Add code matching the pattern, e.g. private static final Logger");
        });
    }

    @Test
    void requirePattern_invalidRegex_reportsViolation() {
        var context = javaContext("src/Order.java", "public class Order {}");

        assertThat(requirePattern.validate(Constraint.of("require_pattern", "(", Severity.ERROR), context)
            .violations())
            .singleElement()
            .satisfies(v -> assertThat(v.message()).startsWith("Invalid regex pattern '('"));
    }

    // ========== forbid_pattern Tests ==========

    @Test
    void forbidPattern_reportsEachMatchAtItsLine() {
        Constraint constraint = Constraint.of("forbid_pattern", "System\\.out\\.println", Severity.WARNING);

        List<Violation> violations = forbidPattern.validate(constraint,
            javaContext("src/Report.java", PRINTING_SOURCE)).violations();

        assertThat(violations).extracting(Violation::line).containsExactly(3, 8);
        assertThat(violations.get(0).column()).isEqualTo(9);
        assertThat(violations.get(0).message()).isEqualTo("Forbidden pattern found: 'System.out.println'");
        assertThat(violations.get(0).suggestion().action()).isEqualTo(Suggestion.Action.REMOVE);
    }

    @Test
    void forbidPattern_functionIntentExemption_skipsMatch() {
        Constraint constraint = Constraint.builder("forbid_pattern")
            .pattern("System\\.out\\.println")
            .unless(List.of("@intent:cli-output"))
            .alternative("log.info")
            .build();

        List<Violation> violations = forbidPattern.validate(constraint,
            javaContext("src/Report.java", PRINTING_SOURCE)).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.line()).isEqualTo(3);
            assertThat(v.fixHint()).isEqualTo("Replace with 'log.info'");
            assertThat(v.suggestion().replacement()).isEqualTo("log.info");
            assertThat(v.didYouMean().file()).isEqualTo("log.info");
        });
    }

    @Test
    void forbidPattern_missingPattern_reportsMisconfiguration() {
        var context = javaContext("src/Order.java", "public class Order {}");

        assertThat(forbidPattern.validate(Constraint.builder("forbid_pattern").build(), context).violations())
            .singleElement()
            .satisfies(v -> assertThat(v.message()).isEqualTo("forbid_pattern constraint is missing 'pattern' field"));
    }
}
