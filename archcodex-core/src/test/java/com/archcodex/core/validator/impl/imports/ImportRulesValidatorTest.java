package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Alternative;
import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.MatchMode;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ForbidImportValidator} and {@link RequireImportValidator}.
 */
class ImportRulesValidatorTest extends ValidatorTestBase {

    private static final String SOURCE = """
        package com.acme.orders;

        import com.acme.infrastructure.db.OrderTable;
        import java.util.List;
        import org.slf4j.Logger;

        public class OrderService {
        }
        """;

    // ========== forbid_import Tests ==========

    @Test
    void forbidImport_prefixMatch_reportsImportWithSource() {
        Constraint constraint = Constraint.builder("forbid_import")
            .value(List.of("com.acme.infrastructure"))
            .source("domain.service")
            .build();

        List<Violation> violations = new ForbidImportValidator()
            .validate(constraint, javaContext("src/OrderService.java", SOURCE)).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E003");
            assertThat(v.line()).isEqualTo(3);
            assertThat(v.message()).isEqualTo(
                "Import 'com.acme.infrastructure.db.OrderTable' is forbidden (from domain.service)");
            assertThat(v.fixHint()).isEqualTo("Receive 'com.acme.infrastructure.db.OrderTable' through dependency "
                + "injection instead of importing it directly");
        });
    }

    @Test
    void forbidImport_constraintSource_winsOverContextSource() {
        Constraint constraint = Constraint.builder("forbid_import")
            .value(List.of("com.acme.infrastructure"))
            .source("mixin:tested")
            .build();
        var context = javaContext("src/OrderService.java", SOURCE).withConstraintSource("svc.orders");

        List<Violation> violations = new ForbidImportValidator().validate(constraint, context).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.source()).isEqualTo("mixin:tested");
            assertThat(v.message()).endsWith("(from mixin:tested)");
        });
    }

    @Test
    void forbidImport_constraintWithoutSource_fallsBackToContext() {
        var context = javaContext("src/OrderService.java", SOURCE);

        List<Violation> violations = new ForbidImportValidator()
            .validate(Constraint.of("forbid_import", "com.acme.infrastructure", Severity.ERROR), context)
            .violations();

        assertThat(violations).singleElement()
            .satisfies(v -> assertThat(v.source()).isEqualTo(ARCH_ID));
    }

    @Test
    void forbidImport_singleStarGlob_matchesOneSegmentOnly() {
        var context = javaContext("src/OrderService.java", SOURCE);

        assertThat(new ForbidImportValidator()
            .validate(Constraint.of("forbid_import", "java.*.List", Severity.ERROR), context).violations())
            .hasSize(1);
        assertThat(new ForbidImportValidator()
            .validate(Constraint.of("forbid_import", "java.*", Severity.ERROR), context).violations())
            .isEmpty();
        assertThat(new ForbidImportValidator()
            .validate(Constraint.of("forbid_import", "java.**", Severity.ERROR), context).violations())
            .hasSize(1);
    }

    @Test
    void forbidImport_alternatives_listedInFixHint() {
        Constraint constraint = Constraint.builder("forbid_import")
            .value("org.slf4j")
            .alternatives(List.of(Alternative.of("com.acme.logging")))
            .build();

        assertThat(new ForbidImportValidator()
            .validate(constraint, javaContext("src/OrderService.java", SOURCE)).violations())
            .singleElement()
            .satisfies(v -> {
                assertThat(v.fixHint()).isEqualTo("Use an approved alternative: com.acme.logging");
                assertThat(v.suggestion().importStatement()).isEqualTo("import * from 'com.acme.logging';");
                assertThat(v.didYouMean().file()).isEqualTo("com.acme.logging");
            });
    }

    // ========== require_import Tests ==========

    @Test
    void requireImport_namedImportSatisfiesRequirement() {
        Constraint constraint = Constraint.of("require_import", List.of("Logger", "java.util"), Severity.ERROR);

        assertThat(new RequireImportValidator()
            .validate(constraint, javaContext("src/OrderService.java", SOURCE)).passed()).isTrue();
    }

    @Test
    void requireImport_allMode_reportsEachMissing() {
        Constraint constraint = Constraint.of("require_import",
            List.of("org.slf4j", "io.micrometer", "jakarta.inject"), Severity.ERROR);

        assertThat(new RequireImportValidator()
            .validate(constraint, javaContext("src/OrderService.java", SOURCE)).violations())
            .extracting(Violation::message)
            .containsExactly("Missing required import 'io.micrometer'", "Missing required import 'jakarta.inject'");
    }

    @Test
    void requireImport_anyMode_failsOnlyWhenNoneFound() {
        Constraint satisfied = Constraint.builder("require_import")
            .value(List.of("io.micrometer", "org.slf4j"))
            .match(MatchMode.ANY)
            .build();
        Constraint unsatisfied = Constraint.builder("require_import")
            .value(List.of("io.micrometer", "jakarta.inject"))
            .match(MatchMode.ANY)
            .build();
        var context = javaContext("src/OrderService.java", SOURCE);

        assertThat(new RequireImportValidator().validate(satisfied, context).passed()).isTrue();
        assertThat(new RequireImportValidator().validate(unsatisfied, context).violations())
            .singleElement()
            .satisfies(v -> assertThat(v.message())
                .isEqualTo("None of the required imports found: 'io.micrometer', 'jakarta.inject'"));
    }
}
