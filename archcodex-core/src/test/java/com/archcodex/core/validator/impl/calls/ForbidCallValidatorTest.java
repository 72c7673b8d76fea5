package com.archcodex.core.validator.impl.calls;

import com.archcodex.core.model.Alternative;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Suggestion;
import com.archcodex.core.model.Violation;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ForbidCallValidator}.
 */
class ForbidCallValidatorTest extends ValidatorTestBase {

    private static final String SOURCE = """
        public class OrderClient {
            void load() {
                api.client.get("/orders");
                api.client.cache.get("/orders");
                System.exit(1);
            }
        }
        """;

    private final ForbidCallValidator validator = new ForbidCallValidator();

    @Test
    void validate_singleStarGlob_matchesOneSegment() {
        Constraint constraint = Constraint.of("forbid_call", "api.client.*", Severity.ERROR);

        List<Violation> violations = validator.validate(constraint, javaContext("src/OrderClient.java", SOURCE))
            .violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E014");
            assertThat(v.line()).isEqualTo(3);
            assertThat(v.message()).isEqualTo("Call to 'api.client.get' is forbidden");
            assertThat(v.fixHint()).isEqualTo("Remove or replace the forbidden call(s): api.client.*");
            assertThat(v.suggestion().action()).isEqualTo(Suggestion.Action.REMOVE);
        });
    }

    @Test
    void validate_doubleStarGlob_matchesNestedSegments() {
        Constraint constraint = Constraint.of("forbid_call", "api.**", Severity.ERROR);

        assertThat(validator.validate(constraint, javaContext("src/OrderClient.java", SOURCE)).violations())
            .extracting(Violation::message)
            .containsExactly("Call to 'api.client.get' is forbidden", "Call to 'api.client.cache.get' is forbidden");
    }

    @Test
    void validate_alternatives_offerReplaceWithImport() {
        Constraint constraint = Constraint.builder("forbid_call")
            .value(List.of("System.exit"))
            .alternatives(List.of(new Alternative("com.acme.lifecycle", "Shutdown", "Use graceful shutdown", null)))
            .build();

        assertThat(validator.validate(constraint, javaContext("src/OrderClient.java", SOURCE)).violations())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.fixHint()).isEqualTo("Replace with 'com.acme.lifecycle' (use Shutdown)");
                assertThat(v.suggestion().replacement()).isEqualTo("Shutdown");
                assertThat(v.suggestion().importStatement()).isEqualTo("import { Shutdown } from 'com.acme.lifecycle';");
                assertThat(v.didYouMean().description()).isEqualTo("Use graceful shutdown");
            });
    }

    @Test
    void validate_regexPattern_matchesCallee() {
        Constraint constraint = Constraint.of("forbid_call", "/exit$/", Severity.WARNING);

        assertThat(validator.validate(constraint, javaContext("src/OrderClient.java", SOURCE)).violations())
            .singleElement()
            .satisfies(v -> assertThat(v.severity()).isEqualTo(Severity.WARNING));
    }

    @Test
    void validate_fileIntentExemption_passes() {
        Constraint constraint = Constraint.builder("forbid_call")
            .value("System.exit")
            .unless(List.of("@intent:cli-entrypoint"))
            .build();
        String source = "// @intent:cli-entrypoint\n" + SOURCE;

        assertThat(validator.validate(constraint, javaContext("src/OrderClient.java", source)).passed()).isTrue();
    }
}
