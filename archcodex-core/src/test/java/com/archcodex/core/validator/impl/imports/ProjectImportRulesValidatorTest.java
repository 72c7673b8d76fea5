package com.archcodex.core.validator.impl.imports;

import com.archcodex.core.model.Constraint;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.validator.ValidatorTestBase;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the import-graph rules {@link ImportableByValidator} and {@link ForbidCircularDepsValidator}.
 */
class ProjectImportRulesValidatorTest extends ValidatorTestBase {

    // ========== importable_by Tests ==========

    @Test
    void importableBy_reportsImportersOutsideAllowedArchitectures() throws IOException {
        createFile("src/com/acme/core/Money.java", """
            /** @arch domain.value */
            package com.acme.core;
            public class Money {}
            """);
        createFile("src/com/acme/orders/OrderService.java", """
            /** @arch domain.service */
            package com.acme.orders;
            import com.acme.core.Money;
            public class OrderService {}
            """);
        createFile("src/com/acme/web/OrderController.java", """
            /** @arch api.controller */
            package com.acme.web;
            import com.acme.core.Money;
            public class OrderController {}
            """);
        createFile("src/com/acme/tools/Script.java", """
            package com.acme.tools;
            import com.acme.core.Money;
            public class Script {}
            """);
        Constraint constraint = Constraint.of("importable_by", List.of("domain.*"), Severity.ERROR);

        List<Violation> violations = new ImportableByValidator()
            .validate(constraint, projectFileContext("src/com/acme/core/Money.java")).violations();

        assertThat(violations).extracting(Violation::message).containsExactly(
            "'src/com/acme/tools/Script.java' (untagged) imports this file, but it is only importable by 'domain.*'",
            "'src/com/acme/web/OrderController.java' (@arch api.controller) imports this file, "
                + "but it is only importable by 'domain.*'");
        assertThat(violations).allSatisfy(v -> assertThat(v.code()).isEqualTo("E023"));
    }

    @Test
    void importableBy_withoutProject_isNotEvaluated() {
        var context = javaContext("src/Money.java", "public class Money {}");

        var outcome = new ImportableByValidator()
            .validate(Constraint.of("importable_by", "domain.*", Severity.ERROR), context);

        assertThat(outcome.passed()).isTrue();
        assertThat(outcome.violations()).singleElement().satisfies(v -> {
            assertThat(v.severity()).isEqualTo(Severity.INFO);
            assertThat(v.message()).isEqualTo("importable_by not evaluated: no project context available");
        });
    }

    // ========== forbid_circular_deps Tests ==========

    @Test
    void forbidCircularDeps_reportsShortestCycle() throws IOException {
        createFile("src/com/acme/a/A.java", """
            package com.acme.a;
            import com.acme.b.B;
            import com.acme.c.C;
            public class A {}
            """);
        createFile("src/com/acme/b/B.java", """
            package com.acme.b;
            import com.acme.c.C;
            public class B {}
            """);
        createFile("src/com/acme/c/C.java", """
            package com.acme.c;
            import com.acme.a.A;
            public class C {}
            """);

        var violations = new ForbidCircularDepsValidator().validate(
            Constraint.of("forbid_circular_deps", true, Severity.ERROR),
            projectFileContext("src/com/acme/a/A.java")).violations();

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E024");
            assertThat(v.message())
                .isEqualTo("Circular dependency: src/com/acme/a/A.java → src/com/acme/c/C.java → src/com/acme/a/A.java");
        });
    }

    @Test
    void forbidCircularDeps_acyclicGraph_passes() throws IOException {
        createFile("src/com/acme/a/A.java", """
            package com.acme.a;
            import com.acme.b.B;
            public class A {}
            """);
        createFile("src/com/acme/b/B.java", """
            package com.acme.b;
            public class B {}
            """);

        assertThat(new ForbidCircularDepsValidator().validate(
            Constraint.of("forbid_circular_deps", true, Severity.ERROR),
            projectFileContext("src/com/acme/a/A.java")).passed()).isTrue();
    }

    @Test
    void forbidCircularDeps_falseValue_disablesCheck() {
        var context = javaContext("src/A.java", "public class A {}");

        var outcome = new ForbidCircularDepsValidator()
            .validate(Constraint.of("forbid_circular_deps", false, Severity.ERROR), context);

        assertThat(outcome.passed()).isTrue();
        assertThat(outcome.violations()).isEmpty();
    }
}
