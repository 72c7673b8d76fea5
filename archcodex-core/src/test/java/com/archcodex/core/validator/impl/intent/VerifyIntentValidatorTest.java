package com.archcodex.core.validator.impl.intent;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.IntentDefinition;
import com.archcodex.core.model.IntentRegistry;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.validator.ConstraintContext;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VerifyIntentValidator}.
 */
class VerifyIntentValidatorTest extends ValidatorTestBase {

    private static final IntentRegistry REGISTRY = IntentRegistry.of(List.of(
        new IntentDefinition("stateless", "No instance state", null, List.of("/private\\s+(?!static|final)\\w+\\s+\\w+;/"),
            List.of("cached"), null, "design"),
        new IntentDefinition("cached", "Results are cached", List.of("@Cacheable"), null, null, null, "performance"),
        new IntentDefinition("admin-only", "Admin endpoints", List.of("checkAdmin("), null, null,
            List.of("audited"), "security"),
        new IntentDefinition("audited", "Writes an audit trail", null, null, null, null, "security")));

    private final VerifyIntentValidator validator = new VerifyIntentValidator();
    private final Constraint constraint = Constraint.of("verify_intent", true, Severity.WARNING);

    private ConstraintContext context(String content) {
        return javaContext("src/OrderService.java", content).withIntentRegistry(REGISTRY);
    }

    @Test
    void validate_forbiddenPatternPresent_reportsI002() {
        List<Violation> violations = validator.validate(constraint, context("""
            // @intent:stateless
            public class OrderService {
                private int counter;
            }
            """)).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("I002");
            assertThat(v.line()).isEqualTo(1);
            assertThat(v.severity()).isEqualTo(Severity.WARNING);
            assertThat(v.message()).startsWith("Intent '@intent:stateless' forbids pattern ");
        });
    }

    @Test
    void validate_requiredPatternMissing_reportsI002() {
        List<Violation> violations = validator.validate(constraint, context("""
            // @intent:cached
            public class OrderService {
            }
            """)).violations();

        assertThat(violations).extracting(Violation::message)
            .containsExactly("Intent '@intent:cached' requires pattern '@Cacheable'");
    }

    @Test
    void validate_conflictingIntents_reportedOncePerPair() {
        List<Violation> violations = validator.validate(constraint, context("""
            // @intent:stateless @intent:cached
            public class OrderService {
                @Cacheable
                public String load() { return ""; }
            }
            """)).violations();

        assertThat(violations).filteredOn(v -> v.code().equals("I003"))
            .singleElement()
            .satisfies(v -> assertThat(v.message())
                .isEqualTo("Intent '@intent:stateless' conflicts with '@intent:cached'"));
    }

    @Test
    void validate_functionIntentRequiringAnother_reportsI004() {
        List<Violation> violations = validator.validate(constraint, context("""
            public class AdminController {

                /** @intent:admin-only */
                public void purge() {
                    checkAdmin(user);
                }
            }
            """)).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("I004");
            assertThat(v.message()).isEqualTo("Intent '@intent:admin-only' requires '@intent:audited'");
        });
    }

    @Test
    void validate_undefinedIntentOrEmptyRegistry_passes() {
        String content = """
            // @intent:unknown-thing
            public class OrderService {
            }
            """;

        assertThat(validator.validate(constraint, context(content)).passed()).isTrue();
        assertThat(validator.validate(constraint, javaContext("src/OrderService.java", content)).passed()).isTrue();
    }
}
