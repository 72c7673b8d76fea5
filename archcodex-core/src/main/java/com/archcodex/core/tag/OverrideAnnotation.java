package com.archcodex.core.tag;

import java.util.Objects;

/**
 * An in-file {@code @override rule:value} block and its metadata.
 *
 * <p>Fields are kept as written; validity (reason present, expiry parseable and in range) is
 * judged by the validation orchestrator.
 *
 * @param rule overridden rule
 * @param value overridden value, {@code *} for every value
 * @param reason {@code @reason} text, may be null
 * @param expires {@code @expires} text as written (YYYY-MM-DD), may be null
 * @param ticket {@code @ticket}, may be null
 * @param approvedBy {@code @approved_by}, may be null
 * @param line 1-based line of the {@code @override} tag
 */
public record OverrideAnnotation(
    String rule,
    String value,
    String reason,
    String expires,
    String ticket,
    String approvedBy,
    int line
) {
    public OverrideAnnotation {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
