package com.archcodex.core.adapter;

import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.SemanticModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability-tagged registry mapping file extensions to semantic model adapters.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AdapterRegistry adapters = AdapterRegistry.loadDefault();
 * if (adapters.supports("src/PaymentService.java")) {
 *     SemanticModel model = adapters.parseFile("src/PaymentService.java", content);
 * }
 * }</pre>
 *
 * <p>Thread-safe; registration is expected to happen before validation starts.
 *
 * @since 1.0.0
 */
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, SemanticModelAdapter> byExtension = new ConcurrentHashMap<>();
    private final List<SemanticModelAdapter> adapters = new ArrayList<>();

    /**
     * Creates a registry holding every adapter found by {@link ServiceLoader}.
     *
     * @return populated registry
     */
    public static AdapterRegistry loadDefault() {
        AdapterRegistry registry = new AdapterRegistry();
        ServiceLoader.load(SemanticModelAdapter.class).forEach(registry::register);
        log.debug("Loaded {} semantic model adapter(s) via ServiceLoader", registry.adapters.size());
        return registry;
    }

    /**
     * Registers an adapter for each of its extensions; a later adapter replaces an earlier one
     * for a shared extension.
     *
     * @param adapter adapter to register
     * @return this registry
     */
    public synchronized AdapterRegistry register(SemanticModelAdapter adapter) {
        adapters.add(adapter);
        for (String extension : adapter.getSupportedExtensions()) {
            SemanticModelAdapter previous = byExtension.put(normalize(extension), adapter);
            if (previous != null && previous != adapter) {
                log.warn("Adapter '{}' replaces '{}' for extension {}", adapter.getId(), previous.getId(), extension);
            }
        }
        return this;
    }

    public Optional<SemanticModelAdapter> forExtension(String extension) {
        return Optional.ofNullable(byExtension.get(normalize(extension)));
    }

    public Optional<SemanticModelAdapter> forPath(String filePath) {
        return extensionOf(filePath).flatMap(this::forExtension);
    }

    public boolean supports(String filePath) {
        return forPath(filePath).isPresent();
    }

    /**
     * Capabilities of the language a path belongs to.
     *
     * @param filePath file path
     * @return capabilities, empty if no adapter handles the extension
     */
    public Optional<LanguageCapabilities> capabilitiesFor(String filePath) {
        return forPath(filePath).map(SemanticModelAdapter::getCapabilities);
    }

    /**
     * Dispatches to the adapter registered for the path's extension.
     *
     * @param filePath file path
     * @param content file content
     * @return semantic model
     * @throws SemanticModelException if no adapter is registered or the adapter fails
     */
    public SemanticModel parseFile(String filePath, String content) {
        SemanticModelAdapter adapter = forPath(filePath)
            .orElseThrow(() -> new SemanticModelException(filePath, "No semantic model adapter for " + filePath));
        return adapter.parseFile(filePath, content);
    }

    public synchronized List<SemanticModelAdapter> getAdapters() {
        return List.copyOf(adapters);
    }

    private static Optional<String> extensionOf(String filePath) {
        String normalized = filePath.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? Optional.of(fileName.substring(dot)) : Optional.empty();
    }

    private static String normalize(String extension) {
        String lower = extension.toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
