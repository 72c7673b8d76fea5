package com.archcodex.core.adapter;

import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.SemanticModel;

import java.util.Set;

/**
 * Service Provider Interface for language adapters that turn file text into a {@link SemanticModel}.
 *
 * <p>Adapters are discovered through {@link java.util.ServiceLoader} (listed in
 * {@code META-INF/services/com.archcodex.core.adapter.SemanticModelAdapter}) or registered on an
 * {@link AdapterRegistry} directly. Validators never look at the language id: applicability is
 * decided from {@link #getCapabilities()} alone, so adding a language never touches a validator.
 *
 * <p><b>Implementation requirements:</b>
 * <ul>
 *   <li>Stateless, or thread-safe: the same adapter parses files concurrently in batch mode</li>
 *   <li>{@link #parseFile(String, String)} is a pure function of its arguments</li>
 *   <li>Public no-arg constructor for ServiceLoader instantiation</li>
 * </ul>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * public class KotlinSemanticModelAdapter extends AbstractSemanticModelAdapter {
 *     public String getId() { return "kotlin"; }
 *     public Set<String> getSupportedExtensions() { return Set.of(".kt"); }
 *     public LanguageCapabilities getCapabilities() { return LanguageCapabilities.all(); }
 *     public SemanticModel parseFile(String path, String content) { ... }
 * }
 * }</pre>
 *
 * @see AdapterRegistry
 * @since 1.0.0
 */
public interface SemanticModelAdapter {

    /**
     * Language identifier, also used as {@link SemanticModel#language()}.
     *
     * @return language id, e.g. "java"
     */
    String getId();

    /**
     * File extensions handled, including the dot.
     *
     * @return extensions such as {@code .java}
     */
    Set<String> getSupportedExtensions();

    /**
     * Capability flags gating rule applicability for this language.
     *
     * @return capability set
     */
    LanguageCapabilities getCapabilities();

    /**
     * Builds the semantic model of one file.
     *
     * @param filePath path of the file (used for naming and location rules, not read)
     * @param content file content
     * @return semantic model
     * @throws SemanticModelException if no model can be produced
     */
    SemanticModel parseFile(String filePath, String content);
}
