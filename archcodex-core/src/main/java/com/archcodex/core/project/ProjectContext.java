package com.archcodex.core.project;

import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.tag.ParsedTags;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Project-level view needed by cross-file rules ({@code importable_by}, {@code forbid_circular_deps},
 * {@code require_coverage}, {@code max_similarity}, companion files).
 *
 * <p>All paths exchanged through this interface are project-relative with forward slashes;
 * absolute paths under the root are accepted as input and relativized.
 *
 * @see FileSystemProjectContext
 * @since 1.0.0
 */
public interface ProjectContext {

    /**
     * Project root directory.
     *
     * @return root path
     */
    Path root();

    /**
     * Normalizes a path to project-relative form.
     *
     * @param path absolute or relative path
     * @return relative path with forward slashes
     */
    String relativize(String path);

    boolean exists(String path);

    Optional<String> read(String path);

    /**
     * Files matching a glob, relative to the root, in sorted order.
     *
     * @param glob file glob such as {@code src/**}{@code /*.ts}
     * @return matching relative paths
     */
    List<String> findFiles(String glob);

    /**
     * Semantic model of a project file, when an adapter supports it and it parses.
     *
     * @param path file path
     * @return model, empty if unsupported or unparseable
     */
    Optional<SemanticModel> semanticModel(String path);

    /**
     * Architecture tags of a project file.
     *
     * @param path file path
     * @return parsed tags, empty if the file cannot be read
     */
    Optional<ParsedTags> tags(String path);

    /**
     * Project files imported by a file, as resolved paths.
     *
     * @param path importing file
     * @return resolved import targets in import order
     */
    List<String> importsOf(String path);

    /**
     * Project files that import the given file.
     *
     * @param path imported file
     * @return importers in sorted order
     */
    List<String> importersOf(String path);
}
