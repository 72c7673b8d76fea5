package com.archcodex.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob matching for dotted names (calls, mutation targets, modules) and file paths.
 *
 * <p>Dotted globs: {@code *} matches one segment, {@code **} matches any number of segments.
 * A pattern written as {@code /regex/} is treated as a regular expression.
 *
 * @since 1.0.0
 */
public final class GlobPatterns {

    private static final Map<String, Pattern> DOTTED_CACHE = new ConcurrentHashMap<>();
    private static final Map<String, PathMatcher> PATH_CACHE = new ConcurrentHashMap<>();

    private GlobPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Whether the pattern is a {@code /regex/} literal.
     *
     * @param pattern pattern text
     * @return true for slash-delimited regexes
     */
    public static boolean isRegexLiteral(String pattern) {
        return pattern.length() > 2 && pattern.startsWith("/") && pattern.endsWith("/");
    }

    /**
     * Matches a dotted name such as {@code api.client.get} against a glob or {@code /regex/}.
     *
     * @param pattern exact name, glob or regex literal
     * @param name dotted name
     * @return true on match
     */
    public static boolean matchesDotted(String pattern, String name) {
        if (isRegexLiteral(pattern)) {
            return DOTTED_CACHE.computeIfAbsent(pattern,
                p -> Pattern.compile(p.substring(1, p.length() - 1))).matcher(name).find();
        }
        if (!pattern.contains("*")) {
            return pattern.equals(name);
        }
        return DOTTED_CACHE.computeIfAbsent(pattern, GlobPatterns::compileDotted).matcher(name).matches();
    }

    /**
     * Matches a path against a file glob ({@code **}/{@code *}/{@code ?}).
     *
     * <p>A glob without a slash is matched against the file name only, so {@code *.test.ts}
     * matches {@code src/a/b.test.ts}.
     *
     * @param glob file glob
     * @param filePath path with forward slashes
     * @return true on match
     */
    public static boolean matchesPath(String glob, String filePath) {
        String normalized = filePath.replace('\\', '/');
        if (!glob.contains("/")) {
            String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
            return PATH_CACHE.computeIfAbsent(glob, g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .matches(Path.of(fileName));
        }
        PathMatcher matcher = PATH_CACHE.computeIfAbsent(glob,
            g -> FileSystems.getDefault().getPathMatcher("glob:" + g));
        if (matcher.matches(Path.of(normalized))) {
            return true;
        }
        // "**/x" should also match "x" at the root
        return glob.startsWith("**/") && matchesPath(glob.substring(3), normalized);
    }

    private static Pattern compileDotted(String glob) {
        StringBuilder regex = new StringBuilder("^");
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^.]*");
                i++;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }
}
