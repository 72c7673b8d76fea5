package com.archcodex.core.validation;

import com.archcodex.core.config.ArchCodexConfig.OverrideSettings;
import com.archcodex.core.model.Severity;
import com.archcodex.core.model.Violation;
import com.archcodex.core.tag.OverrideAnnotation;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OverrideValidator}.
 */
class OverrideValidatorTest {

    private static final Clock TODAY = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    private static OverrideAnnotation override(String reason, String expires) {
        return new OverrideAnnotation("forbid_import", "axios", reason, expires, null, null, 7);
    }

    private static OverrideValidator validator(OverrideSettings settings) {
        return new OverrideValidator(settings, TODAY);
    }

    // ========== Evaluation Tests ==========

    @Test
    void evaluate_validOverride_isActive() {
        var evaluation = validator(OverrideSettings.defaults())
            .evaluate(List.of(override("Legacy client", "2026-06-30")));

        assertThat(evaluation.issues()).isEmpty();
        assertThat(evaluation.active()).singleElement().satisfies(active -> {
            assertThat(active.rule()).isEqualTo("forbid_import");
            assertThat(active.value()).isEqualTo("axios");
            assertThat(active.line()).isEqualTo(7);
        });
    }

    @Test
    void evaluate_missingReason_reportsO001AndDeactivates() {
        var evaluation = validator(OverrideSettings.defaults()).evaluate(List.of(override(null, "2026-06-30")));

        assertThat(evaluation.active()).isEmpty();
        assertThat(evaluation.issues()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("O001");
            assertThat(v.severity()).isEqualTo(Severity.ERROR);
            assertThat(v.message()).isEqualTo("Override of forbid_import:axios has no @reason");
        });
    }

    @Test
    void evaluate_expired_isNeverActive() {
        var lenient = validator(new OverrideSettings(true, null, false, false, null))
            .evaluate(List.of(override("Legacy", "2026-01-14")));
        var strict = validator(new OverrideSettings(true, null, false, true, null))
            .evaluate(List.of(override("Legacy", "2026-01-14")));

        assertThat(lenient.active()).isEmpty();
        assertThat(strict.active()).isEmpty();
        assertThat(lenient.issues()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("O002");
            assertThat(v.severity()).isEqualTo(Severity.WARNING);
        });
        assertThat(strict.issues()).singleElement()
            .satisfies(v -> assertThat(v.severity()).isEqualTo(Severity.ERROR));
    }

    @Test
    void evaluate_expiringToday_isStillActive() {
        var evaluation = validator(OverrideSettings.defaults()).evaluate(List.of(override("Legacy", "2026-01-15")));

        assertThat(evaluation.active()).hasSize(1);
    }

    @Test
    void evaluate_invalidDate_reportsO003() {
        var evaluation = validator(OverrideSettings.defaults()).evaluate(List.of(override("Legacy", "31/12/2026")));

        assertThat(evaluation.active()).isEmpty();
        assertThat(evaluation.issues()).extracting(Violation::message)
            .containsExactly("Invalid expiry date format: 31/12/2026 (expected YYYY-MM-DD)");
    }

    @Test
    void evaluate_expiryBeyondMaximum_reportsO004() {
        var evaluation = validator(new OverrideSettings(true, 30, false, false, null))
            .evaluate(List.of(override("Legacy", "2026-06-30")));

        assertThat(evaluation.active()).isEmpty();
        assertThat(evaluation.issues()).extracting(Violation::code).containsExactly("O004");
    }

    @Test
    void evaluate_noExpiryWithWarning_staysActiveAndWarns() {
        var evaluation = validator(new OverrideSettings(true, null, true, false, null))
            .evaluate(List.of(override("Legacy", null)));

        assertThat(evaluation.active()).hasSize(1);
        assertThat(evaluation.issues()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("O006");
            assertThat(v.severity()).isEqualTo(Severity.WARNING);
        });
    }

    @Test
    void evaluate_tooManyOverrides_reportsO005AtFirstExcessLine() {
        var overrides = List.of(
            new OverrideAnnotation("forbid_import", "axios", "a", null, null, null, 2),
            new OverrideAnnotation("forbid_import", "lodash", "b", null, null, null, 5),
            new OverrideAnnotation("forbid_call", "eval", "c", null, null, null, 9));

        var evaluation = validator(new OverrideSettings(true, null, false, false, 2)).evaluate(overrides);

        assertThat(evaluation.active()).hasSize(3);
        assertThat(evaluation.issues()).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("O005");
            assertThat(v.line()).isEqualTo(9);
            assertThat(v.message()).isEqualTo("File has 3 overrides, maximum is 2");
        });
    }

    // ========== Matching Tests ==========

    @Test
    void matches_valueListMessageAndWildcard() {
        ActiveOverride axios = new ActiveOverride("forbid_import", "axios", "r", null, null, null, 1, 0);
        ActiveOverride any = new ActiveOverride("forbid_import", "*", "r", null, null, null, 1, 0);
        Violation listValue = Violation.builder("E003", "forbid_import", Severity.ERROR)
            .value(List.of("lodash", "axios"))
            .message("Import 'axios' is forbidden")
            .build();
        Violation otherImport = Violation.builder("E003", "forbid_import", Severity.ERROR)
            .value("lodash")
            .message("Import 'lodash' is forbidden")
            .build();
        Violation otherRule = Violation.builder("E014", "forbid_call", Severity.ERROR)
            .value("axios")
            .message("Call to 'axios' is forbidden")
            .build();

        assertThat(OverrideValidator.matches(axios, listValue)).isTrue();
        assertThat(OverrideValidator.matches(axios, otherImport)).isFalse();
        assertThat(OverrideValidator.matches(axios, otherRule)).isFalse();
        assertThat(OverrideValidator.matches(any, otherImport)).isTrue();
    }
}
