package com.archcodex.core.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared regex patterns and text helpers for adapters, the tag parser and validators.
 *
 * <p>Patterns are compiled once at class loading time.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<String> intents = SourcePatterns.extractIntents("/** @intent:stateless @intent:cli-output *\/");
 * int line = SourcePatterns.lineOf(content, matcher.start());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SourcePatterns {

    /** {@code @intent:name}, names are lowercase letters, digits and dashes */
    public static final Pattern INTENT_PATTERN =
        Pattern.compile("@intent:([a-z][a-z0-9-]*)", Pattern.CASE_INSENSITIVE);

    /** Placeholder names used in documentation, never real intents */
    private static final Set<String> PLACEHOLDER_INTENTS = Set.of("name", "example", "placeholder");

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private SourcePatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Extracts {@code @intent:} names from a comment or doc block.
     *
     * @param text text to scan
     * @return distinct lowercase intent names in order of appearance
     */
    public static List<String> extractIntents(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> intents = new LinkedHashSet<>();
        Matcher matcher = INTENT_PATTERN.matcher(text);
        while (matcher.find()) {
            String intent = matcher.group(1).toLowerCase(Locale.ROOT);
            if (!PLACEHOLDER_INTENTS.contains(intent)) {
                intents.add(intent);
            }
        }
        return List.copyOf(intents);
    }

    /**
     * 1-based line number of a character offset.
     *
     * @param content text
     * @param offset character offset
     * @return line number
     */
    public static int lineOf(String content, int offset) {
        int line = 1;
        int limit = Math.min(offset, content.length());
        for (int i = 0; i < limit; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * 1-based column of a character offset.
     *
     * @param content text
     * @param offset character offset
     * @return column number
     */
    public static int columnOf(String content, int offset) {
        int lineStart = content.lastIndexOf('\n', Math.max(0, offset - 1));
        return offset - lineStart;
    }

    /**
     * Number of lines, ignoring a single trailing newline.
     *
     * @param content text
     * @return line count
     */
    public static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int count = LINE_BREAK.split(content, -1).length;
        return content.endsWith("\n") ? count - 1 : count;
    }

    /**
     * Counts non-blank lines that are not entirely comments.
     *
     * @param content text
     * @param lineComment line comment prefix, e.g. {@code //} or {@code #}
     * @param blockOpen block comment opener, may be null
     * @param blockClose block comment closer, may be null
     * @return lines of code
     */
    public static int countLinesOfCode(String content, String lineComment, String blockOpen, String blockClose) {
        int loc = 0;
        boolean inBlock = false;
        for (String raw : LINE_BREAK.split(content, -1)) {
            String line = raw.trim();
            if (inBlock) {
                int close = line.indexOf(blockClose);
                if (close < 0) {
                    continue;
                }
                inBlock = false;
                line = line.substring(close + blockClose.length()).trim();
            }
            if (blockOpen != null && line.startsWith(blockOpen)) {
                int close = line.indexOf(blockClose, blockOpen.length());
                if (close < 0) {
                    inBlock = true;
                    continue;
                }
                line = line.substring(close + blockClose.length()).trim();
            }
            if (line.isEmpty() || line.startsWith(lineComment)) {
                continue;
            }
            loc++;
        }
        return loc;
    }

    /**
     * Comment texts of a C-family source ({@code //} and block comments), with their start offsets.
     *
     * @param content source text
     * @return comments in source order
     */
    public static List<Comment> cStyleComments(String content) {
        List<Comment> comments = new ArrayList<>();
        int i = 0;
        int length = content.length();
        char quote = 0;
        while (i < length) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
                i++;
            } else if (c == '/' && i + 1 < length && content.charAt(i + 1) == '/') {
                int end = content.indexOf('\n', i);
                end = end < 0 ? length : end;
                comments.add(new Comment(content.substring(i, end), i));
                i = end;
            } else if (c == '/' && i + 1 < length && content.charAt(i + 1) == '*') {
                int end = content.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                comments.add(new Comment(content.substring(i, end), i));
                i = end;
            } else {
                i++;
            }
        }
        return comments;
    }

    /**
     * Comment texts of a hash-commented source ({@code #} and docstrings).
     *
     * @param content source text
     * @return comments in source order
     */
    public static List<Comment> hashComments(String content) {
        List<Comment> comments = new ArrayList<>();
        Matcher matcher = Pattern.compile("#[^\n]*|\"\"\"[\\s\\S]*?\"\"\"|'''[\\s\\S]*?'''").matcher(content);
        while (matcher.find()) {
            comments.add(new Comment(matcher.group(), matcher.start()));
        }
        return comments;
    }

    /**
     * A comment and where it starts.
     *
     * @param text comment text including delimiters
     * @param offset start offset in the source
     */
    public record Comment(String text, int offset) {}
}
