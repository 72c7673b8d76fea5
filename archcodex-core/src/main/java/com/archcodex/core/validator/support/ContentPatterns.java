package com.archcodex.core.validator.support;

import java.util.regex.Pattern;

/**
 * Pattern compilation shared by content-matching rules.
 *
 * @since 1.0.0
 */
public final class ContentPatterns {

    private ContentPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Compiles a content pattern: {@code ^}/{@code $} match per line and {@code .} matches newlines.
     *
     * @param regex pattern source
     * @return compiled pattern
     * @throws java.util.regex.PatternSyntaxException for an invalid pattern
     */
    public static Pattern multiline(String regex) {
        return Pattern.compile(regex, Pattern.MULTILINE | Pattern.DOTALL);
    }

    /**
     * Compiles {@code /regex/flags} as a regex and anything else as a literal.
     *
     * <p>Supported flags are {@code i}, {@code m} and {@code s}.
     *
     * @param text literal or slash-delimited regex
     * @return compiled pattern
     * @throws java.util.regex.PatternSyntaxException for an invalid regex literal
     */
    public static Pattern literalOrRegex(String text) {
        int close = text.lastIndexOf('/');
        if (text.length() > 2 && text.startsWith("/") && close > 0) {
            String flags = text.substring(close + 1);
            if (flags.chars().allMatch(c -> c == 'i' || c == 'm' || c == 's' || c == 'g')) {
                int bits = 0;
                if (flags.indexOf('i') >= 0) {
                    bits |= Pattern.CASE_INSENSITIVE;
                }
                if (flags.indexOf('m') >= 0) {
                    bits |= Pattern.MULTILINE;
                }
                if (flags.indexOf('s') >= 0) {
                    bits |= Pattern.DOTALL;
                }
                return Pattern.compile(text.substring(1, close), bits);
            }
        }
        return Pattern.compile(Pattern.quote(text));
    }
}
