package com.archcodex.core.project;

import com.archcodex.core.adapter.AdapterRegistry;
import com.archcodex.core.exception.ArchCodexException;
import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.tag.ArchTagParser;
import com.archcodex.core.tag.ParsedTags;
import com.archcodex.core.util.GlobPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link ProjectContext} backed by a directory on disk.
 *
 * <p>The file index and the import graph are built lazily on first use and cached for the
 * lifetime of the instance; create a new instance to observe file changes. Semantic models
 * are cached per path.
 *
 * <p>Import resolution handles relative specifiers ({@code ./x}, {@code ../x}), Python relative
 * modules ({@code .models}) and dotted or slashed module names matched against the file index
 * (so {@code com.acme.Foo} resolves to {@code src/main/java/com/acme/Foo.java}).
 *
 * @since 1.0.0
 */
public class FileSystemProjectContext implements ProjectContext {

    private static final Logger log = LoggerFactory.getLogger(FileSystemProjectContext.class);

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(".git", "node_modules", "target", "build",
        "dist", "__pycache__", ".venv");

    private final Path root;
    private final AdapterRegistry adapters;
    private final Map<String, Optional<SemanticModel>> models = new ConcurrentHashMap<>();

    private List<String> fileIndex;
    private Map<String, List<String>> importGraph;

    public FileSystemProjectContext(Path root, AdapterRegistry adapters) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public String relativize(String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            Path normalized = candidate.normalize();
            if (normalized.startsWith(root)) {
                candidate = root.relativize(normalized);
            }
        }
        return candidate.normalize().toString().replace('\\', '/');
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(root.resolve(relativize(path)));
    }

    @Override
    public Optional<String> read(String path) {
        Path file = root.resolve(relativize(path));
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public List<String> findFiles(String glob) {
        return index().stream()
            .filter(path -> GlobPatterns.matchesPath(glob, path))
            .toList();
    }

    @Override
    public Optional<SemanticModel> semanticModel(String path) {
        String relative = relativize(path);
        return models.computeIfAbsent(relative, this::parse);
    }

    @Override
    public Optional<ParsedTags> tags(String path) {
        return read(path).map(ArchTagParser::parse);
    }

    @Override
    public List<String> importsOf(String path) {
        return graph().getOrDefault(relativize(path), List.of());
    }

    @Override
    public List<String> importersOf(String path) {
        String target = relativize(path);
        return graph().entrySet().stream()
            .filter(e -> e.getValue().contains(target))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    // ==================== Indexing ====================

    private synchronized List<String> index() {
        if (fileIndex == null) {
            try (Stream<Path> paths = Files.walk(root)) {
                fileIndex = paths
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(p -> {
                        for (Path segment : p) {
                            if (IGNORED_DIRECTORIES.contains(segment.toString())) {
                                return false;
                            }
                        }
                        return true;
                    })
                    .map(p -> p.toString().replace('\\', '/'))
                    .sorted()
                    .toList();
            } catch (IOException e) {
                throw new ArchCodexException("Failed to index project " + root, e);
            }
            log.debug("Indexed {} file(s) under {}", fileIndex.size(), root);
        }
        return fileIndex;
    }

    private synchronized Map<String, List<String>> graph() {
        if (importGraph == null) {
            Map<String, List<String>> graph = new TreeMap<>();
            for (String file : index()) {
                if (!adapters.supports(file)) {
                    continue;
                }
                semanticModel(file).ifPresent(model -> graph.put(file, resolveImports(file, model)));
            }
            importGraph = graph;
            log.debug("Built import graph with {} node(s)", graph.size());
        }
        return importGraph;
    }

    private Optional<SemanticModel> parse(String relative) {
        if (!adapters.supports(relative)) {
            return Optional.empty();
        }
        Optional<String> content = read(relative);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(adapters.parseFile(relative, content.get()));
        } catch (SemanticModelException e) {
            log.warn("Skipping {} in project analysis: {}", relative, e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== Import Resolution ====================

    private List<String> resolveImports(String file, SemanticModel model) {
        Map<String, Boolean> resolved = new LinkedHashMap<>();
        for (ImportInfo importInfo : model.imports()) {
            resolveImport(file, model.extension(), importInfo.moduleSpecifier()).ifPresent(t -> resolved.put(t, true));
        }
        return List.copyOf(resolved.keySet());
    }

    private Optional<String> resolveImport(String fromFile, String extension, String specifier) {
        String directory = fromFile.contains("/") ? fromFile.substring(0, fromFile.lastIndexOf('/')) : "";
        List<String> candidates = new ArrayList<>();

        if (specifier.startsWith("./") || specifier.startsWith("../")) {
            String base = Path.of(directory.isEmpty() ? "." : directory).resolve(specifier).normalize().toString()
                .replace('\\', '/');
            candidates.add(base);
            candidates.add(base + extension);
            candidates.add(base + "/index" + extension);
        } else if (specifier.startsWith(".")) {
            int dots = 0;
            while (dots < specifier.length() && specifier.charAt(dots) == '.') {
                dots++;
            }
            Path base = Path.of(directory.isEmpty() ? "." : directory);
            for (int i = 1; i < dots; i++) {
                base = base.resolve("..");
            }
            String module = specifier.substring(dots).replace('.', '/');
            String resolved = base.resolve(module).normalize().toString().replace('\\', '/');
            candidates.add(resolved + extension);
            candidates.add(resolved + "/__init__" + extension);
        } else {
            String slashed = specifier.endsWith(".*") ? specifier.substring(0, specifier.length() - 2) : specifier;
            slashed = slashed.contains("/") ? slashed : slashed.replace('.', '/');
            for (String file : index()) {
                String withoutExtension = file.contains(".") ? file.substring(0, file.lastIndexOf('.')) : file;
                if (withoutExtension.equals(slashed) || withoutExtension.endsWith("/" + slashed)) {
                    return Optional.of(file);
                }
            }
            return Optional.empty();
        }

        List<String> files = index();
        return candidates.stream().map(c -> c.startsWith("./") ? c.substring(2) : c).filter(files::contains).findFirst();
    }
}
