package com.archcodex.core.validator;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for constraint validators.
 *
 * <p>Catches typos in {@code META-INF/services}, missing classes, constructor failures and
 * duplicate rule names before they surface as "unknown rule" at validation time.
 *
 * <p>Expected validator count: 27
 * <ul>
 *   <li>6 structure rules (must_extend, implements, decorators, exports, public methods)</li>
 *   <li>5 file rules (naming, location, size, test file, companion file)</li>
 *   <li>3 content rules (require/forbid pattern, require_one_of)</li>
 *   <li>6 call rules (forbid_call, require_call, ordering, try/catch, companion call, mutation)</li>
 *   <li>4 import rules (forbid/require import, importable_by, circular deps)</li>
 *   <li>2 project rules (require_coverage, max_similarity)</li>
 *   <li>verify_intent</li>
 * </ul>
 *
 * @see ConstraintValidator
 * @since 1.0.0
 */
class ValidatorServiceLoaderTest {

    /**
     * Expected number of validator implementations.
     * Update this constant when adding new rules.
     */
    private static final int EXPECTED_VALIDATOR_COUNT = 27;

    @Test
    void serviceLoader_discoversAllRegisteredValidators() {
        List<ConstraintValidator> validators = ServiceLoader.load(ConstraintValidator.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(validators)
            .as("ServiceLoader should discover all %d registered validators", EXPECTED_VALIDATOR_COUNT)
            .hasSize(EXPECTED_VALIDATOR_COUNT);
    }

    @Test
    void serviceLoader_ruleNamesAndErrorCodesAreUnique() {
        List<ConstraintValidator> validators = ServiceLoader.load(ConstraintValidator.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        Set<String> rules = validators.stream().map(ConstraintValidator::getRule).collect(Collectors.toSet());
        Set<String> codes = validators.stream().map(ConstraintValidator::getErrorCode).collect(Collectors.toSet());

        assertThat(rules).hasSize(EXPECTED_VALIDATOR_COUNT);
        assertThat(codes).hasSize(EXPECTED_VALIDATOR_COUNT);
    }

    @Test
    void loadDefault_coversEveryRuleName() {
        ValidatorRegistry registry = ValidatorRegistry.loadDefault();

        assertThat(registry.rules()).containsExactlyInAnyOrder(
            "must_extend", "implements", "forbid_import", "require_import", "require_decorator",
            "forbid_decorator", "naming_pattern", "location_pattern", "max_public_methods", "max_file_lines",
            "require_test_file", "require_pattern", "forbid_pattern", "forbid_call", "require_try_catch",
            "forbid_mutation", "require_call", "require_export", "require_call_before", "require_one_of",
            "require_companion_call", "require_companion_file", "importable_by", "forbid_circular_deps",
            "require_coverage", "max_similarity", "verify_intent");
        assertThat(registry.supports("no_such_rule")).isFalse();
        assertThat(registry.find("implements")).get()
            .extracting(ConstraintValidator::getErrorCode)
            .isEqualTo("E002");
    }
}
