package com.archcodex.core.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table of constraint validators keyed by rule name.
 *
 * <p>Adding a rule kind means registering another {@link ConstraintValidator}; nothing here changes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ValidatorRegistry validators = ValidatorRegistry.loadDefault();
 * validators.find("must_extend").ifPresent(v -> v.validate(constraint, context));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, ConstraintValidator> byRule = new ConcurrentHashMap<>();

    /**
     * Registry populated with every validator found by {@link ServiceLoader}.
     *
     * @return loaded registry
     */
    public static ValidatorRegistry loadDefault() {
        ValidatorRegistry registry = new ValidatorRegistry();
        ServiceLoader.load(ConstraintValidator.class).forEach(registry::register);
        log.debug("Loaded {} constraint validator(s) via ServiceLoader", registry.byRule.size());
        return registry;
    }

    public ValidatorRegistry register(ConstraintValidator validator) {
        ConstraintValidator previous = byRule.put(validator.getRule(), validator);
        if (previous != null && previous != validator) {
            log.warn("Validator {} replaces {} for rule '{}'", validator.getClass().getSimpleName(),
                previous.getClass().getSimpleName(), validator.getRule());
        }
        return this;
    }

    public Optional<ConstraintValidator> find(String rule) {
        return Optional.ofNullable(byRule.get(rule));
    }

    public boolean supports(String rule) {
        return byRule.containsKey(rule);
    }

    public Set<String> rules() {
        return new TreeMap<>(byRule).keySet();
    }

    public List<ConstraintValidator> getValidators() {
        return new TreeMap<>(byRule).values().stream().toList();
    }
}
