package com.archcodex.core.tag;

import com.archcodex.core.util.SourcePatterns;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code @arch}, {@code @override} and file-level {@code @intent:} annotations from source text.
 *
 * <p>Works on comment syntax shared by the supported languages ({@code //}, {@code /* *\/},
 * {@code #} and Python docstrings). File-level intents are taken from the header: comments that
 * precede the first line of code, plus the comment block holding the {@code @arch} tag.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * /**
 *  * @arch svc.payment +tested
 *  * @intent:stateless
 *  *\/
 * ...
 * // @override forbid_import:axios
 * // @reason Legacy client until the gateway migration
 * // @expires 2026-12-31
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ArchTagParser {

    private static final Pattern ARCH_TAG_PATTERN =
        Pattern.compile("@arch\\s+([\\w-]+\\.[\\w.-]+|[\\w-]+)((?:\\s+\\+[\\w-]+)*)");
    private static final Pattern INLINE_MIXIN_PATTERN = Pattern.compile("\\+([\\w-]+)");
    private static final Pattern OVERRIDE_PATTERN = Pattern.compile("@override\\s+(\\w+):(.+)");
    private static final Pattern REASON_PATTERN = Pattern.compile("@reason\\s+(.+)");
    private static final Pattern EXPIRES_PATTERN = Pattern.compile("@expires\\s+(\\S+)");
    private static final Pattern TICKET_PATTERN = Pattern.compile("@ticket\\s+(\\S+)");
    private static final Pattern APPROVED_BY_PATTERN = Pattern.compile("@approved_by\\s+(@?\\S+)");

    private ArchTagParser() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Parses the tags of one file.
     *
     * @param content file content
     * @return extracted tags; {@link ParsedTags#tag()} is empty for untagged files
     */
    public static ParsedTags parse(String content) {
        String[] lines = content.split("\r?\n", -1);

        ArchTag archTag = null;
        List<OverrideAnnotation> overrides = new ArrayList<>();
        List<IntentAnnotation> intents = new ArrayList<>();
        Set<String> seenIntents = new LinkedHashSet<>();

        boolean inBlock = false;
        String blockClose = null;
        boolean codeSeen = false;
        boolean archBlockOpen = false;
        OverrideBuilder current = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.trim();
            int lineNumber = i + 1;

            boolean blockStartsHere = false;
            if (!inBlock) {
                String opener = blockOpener(trimmed);
                if (opener != null) {
                    blockClose = opener.equals("/*") ? "*/" : opener;
                    String rest = trimmed.substring(opener.length());
                    inBlock = !rest.contains(blockClose);
                    blockStartsHere = true;
                }
            }
            boolean isComment = blockStartsHere || inBlock || trimmed.startsWith("//") || trimmed.startsWith("#")
                || trimmed.startsWith("*");
            if (!isComment && !trimmed.isEmpty()) {
                codeSeen = true;
                if (current != null) {
                    overrides.add(current.build());
                    current = null;
                }
            }

            if (archTag == null && isComment) {
                Matcher arch = ARCH_TAG_PATTERN.matcher(line);
                if (arch.find()) {
                    List<String> mixins = new ArrayList<>();
                    Matcher mixin = INLINE_MIXIN_PATTERN.matcher(arch.group(2));
                    while (mixin.find()) {
                        mixins.add(mixin.group(1));
                    }
                    archTag = new ArchTag(arch.group(1), mixins, lineNumber, line.indexOf("@arch") + 1);
                    archBlockOpen = inBlock;
                }
            }

            if (isComment && (!codeSeen || archBlockOpen)) {
                Matcher intent = SourcePatterns.INTENT_PATTERN.matcher(line);
                while (intent.find()) {
                    List<String> names = SourcePatterns.extractIntents(intent.group());
                    for (String name : names) {
                        if (seenIntents.add(name)) {
                            intents.add(new IntentAnnotation(name.toLowerCase(Locale.ROOT), lineNumber,
                                intent.start() + 1));
                        }
                    }
                }
            }

            if (isComment) {
                current = parseOverrideLine(line, lineNumber, current, overrides);
            }

            if (inBlock && !blockStartsHere && line.contains(blockClose)) {
                inBlock = false;
            }
            if (!inBlock) {
                archBlockOpen = false;
                if (current != null && blockClose != null && line.contains(blockClose)) {
                    overrides.add(current.build());
                    current = null;
                }
            }
        }
        if (current != null) {
            overrides.add(current.build());
        }
        return new ParsedTags(archTag, overrides, intents);
    }

    private static OverrideBuilder parseOverrideLine(String line, int lineNumber, OverrideBuilder current,
                                                     List<OverrideAnnotation> overrides) {
        Matcher override = OVERRIDE_PATTERN.matcher(line);
        if (override.find()) {
            if (current != null) {
                overrides.add(current.build());
            }
            return new OverrideBuilder(override.group(1).trim(), stripCommentEnd(override.group(2)), lineNumber);
        }
        if (current == null) {
            return null;
        }
        Matcher reason = REASON_PATTERN.matcher(line);
        if (reason.find()) {
            current.reason = stripCommentEnd(reason.group(1));
            return current;
        }
        Matcher expires = EXPIRES_PATTERN.matcher(line);
        if (expires.find()) {
            current.expires = stripCommentEnd(expires.group(1));
            return current;
        }
        Matcher ticket = TICKET_PATTERN.matcher(line);
        if (ticket.find()) {
            current.ticket = stripCommentEnd(ticket.group(1));
            return current;
        }
        Matcher approved = APPROVED_BY_PATTERN.matcher(line);
        if (approved.find()) {
            current.approvedBy = stripCommentEnd(approved.group(1));
        }
        return current;
    }

    private static String blockOpener(String trimmed) {
        if (trimmed.startsWith("/*")) {
            return "/*";
        }
        if (trimmed.startsWith("\"\"\"")) {
            return "\"\"\"";
        }
        if (trimmed.startsWith("'''")) {
            return "'''";
        }
        return null;
    }

    private static String stripCommentEnd(String text) {
        String result = text.trim();
        for (String closer : List.of("*/", "\"\"\"", "'''")) {
            if (result.endsWith(closer)) {
                result = result.substring(0, result.length() - closer.length()).trim();
            }
        }
        return result;
    }

    private static final class OverrideBuilder {
        private final String rule;
        private final String value;
        private final int line;
        private String reason;
        private String expires;
        private String ticket;
        private String approvedBy;

        private OverrideBuilder(String rule, String value, int line) {
            this.rule = rule;
            this.value = value;
            this.line = line;
        }

        private OverrideAnnotation build() {
            return new OverrideAnnotation(rule, value, reason, expires, ticket, approvedBy, line);
        }
    }
}
