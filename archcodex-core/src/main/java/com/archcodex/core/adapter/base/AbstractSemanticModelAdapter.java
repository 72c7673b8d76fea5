package com.archcodex.core.adapter.base;

import com.archcodex.core.adapter.SemanticModelAdapter;
import com.archcodex.core.model.semantic.Visibility;
import com.archcodex.core.util.SourcePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Base class for semantic model adapters providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per adapter class)</li>
 *   <li>Line and lines-of-code counting</li>
 *   <li>Intent extraction from doc comments</li>
 *   <li>Name-based visibility for languages without modifiers</li>
 * </ul>
 *
 * @see SemanticModelAdapter
 * @since 1.0.0
 */
public abstract class AbstractSemanticModelAdapter implements SemanticModelAdapter {

    /**
     * Logger instance for this adapter.
     * Automatically initialized with the concrete adapter class name.
     */
    protected final Logger log;

    protected AbstractSemanticModelAdapter() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Line Counting ====================

    protected int countLines(String content) {
        return SourcePatterns.countLines(content);
    }

    /**
     * Lines of code for C-family syntax ({@code //} and block comments).
     *
     * @param content file content
     * @return non-blank, non-comment lines
     */
    protected int countCStyleLoc(String content) {
        return SourcePatterns.countLinesOfCode(content, "//", "/*", "*/");
    }

    // ==================== Intents ====================

    /**
     * Intent names declared in a doc comment.
     *
     * @param docText comment text, may be null
     * @return lowercase intent names
     */
    protected List<String> intentsIn(String docText) {
        return SourcePatterns.extractIntents(docText);
    }

    // ==================== Visibility ====================

    /**
     * Visibility by naming convention: {@code __x} private, {@code _x} protected, dunder and plain public.
     *
     * @param name member name
     * @return inferred visibility
     */
    protected Visibility visibilityFromName(String name) {
        if (name.startsWith("__") && !name.endsWith("__")) {
            return Visibility.PRIVATE;
        }
        if (name.startsWith("_") && !name.startsWith("__")) {
            return Visibility.PROTECTED;
        }
        return Visibility.PUBLIC;
    }

    protected static String fileNameOf(String filePath) {
        String normalized = filePath.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }
}
