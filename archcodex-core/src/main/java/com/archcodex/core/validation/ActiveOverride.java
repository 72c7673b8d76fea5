package com.archcodex.core.validation;

import java.util.Objects;

/**
 * A well-formed in-file override that is in force, reported alongside the result.
 *
 * @param rule overridden rule
 * @param value overridden value, or {@code *}
 * @param reason stated reason
 * @param expires expiry date as written, may be null
 * @param ticket tracking ticket, may be null
 * @param approvedBy approver, may be null
 * @param line line of the {@code @override} tag
 * @param suppressedCount number of violations it suppressed
 */
public record ActiveOverride(
    String rule,
    String value,
    String reason,
    String expires,
    String ticket,
    String approvedBy,
    int line,
    int suppressedCount
) {
    public ActiveOverride {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    ActiveOverride withSuppressedCount(int count) {
        return new ActiveOverride(rule, value, reason, expires, ticket, approvedBy, line, count);
    }
}
