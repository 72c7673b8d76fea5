package com.archcodex.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourcePatterns}.
 */
class SourcePatternsTest {

    @Test
    void extractIntents_lowercasesAndSkipsPlaceholders() {
        assertThat(SourcePatterns.extractIntents("@intent:Stateless @intent:name @intent:cli-output @intent:stateless"))
            .containsExactly("stateless", "cli-output");
    }

    @Test
    void lineOfAndColumnOf_areOneBased() {
        String content = "ab\ncd";

        assertThat(SourcePatterns.lineOf(content, 0)).isEqualTo(1);
        assertThat(SourcePatterns.columnOf(content, 0)).isEqualTo(1);
        assertThat(SourcePatterns.lineOf(content, 4)).isEqualTo(2);
        assertThat(SourcePatterns.columnOf(content, 4)).isEqualTo(2);
    }

    @Test
    void countLines_ignoresTrailingNewline() {
        assertThat(SourcePatterns.countLines("")).isZero();
        assertThat(SourcePatterns.countLines("a\nb\n")).isEqualTo(2);
        assertThat(SourcePatterns.countLines("a\nb")).isEqualTo(2);
    }

    @Test
    void countLinesOfCode_skipsBlankAndCommentLines() {
        String content = """
            /*
             * header
             */
            int a = 1; // trailing

            // comment
            /* inline */ int b = 2;
            """;

        assertThat(SourcePatterns.countLinesOfCode(content, "//", "/*", "*/")).isEqualTo(2);
    }

    @Test
    void cStyleComments_ignoresCommentMarkersInStrings() {
        String content = "String url = \"http://x\"; // real\n/* block */";

        assertThat(SourcePatterns.cStyleComments(content))
            .extracting(SourcePatterns.Comment::text)
            .containsExactly("// real", "/* block */");
    }

    @Test
    void hashComments_includesDocstrings() {
        String content = "\"\"\"Module doc.\"\"\"\nx = 1  # note\n";

        assertThat(SourcePatterns.hashComments(content))
            .extracting(SourcePatterns.Comment::text)
            .containsExactly("\"\"\"Module doc.\"\"\"", "# note");
    }
}
