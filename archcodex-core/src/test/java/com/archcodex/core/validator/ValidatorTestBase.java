package com.archcodex.core.validator;

import com.archcodex.core.adapter.AdapterRegistry;
import com.archcodex.core.adapter.impl.java.JavaSemanticModelAdapter;
import com.archcodex.core.adapter.impl.python.PythonSemanticModelAdapter;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.project.FileSystemProjectContext;
import com.archcodex.core.tag.ArchTagParser;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for validator tests.
 *
 * <p>Provides:
 * <ul>
 *   <li>Contexts built from Java or Python source through the real adapters</li>
 *   <li>A temporary project directory with a {@link FileSystemProjectContext} over it</li>
 *   <li>Helpers for writing project files</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class ValidatorTestBase {

    protected static final String ARCH_ID = "test.arch";

    @TempDir
    protected Path tempDir;

    /**
     * Context over a Java source file, with the file-level intents found in its header.
     *
     * @param filePath file path, used for naming and location rules
     * @param content Java source
     * @return context without project
     */
    protected ConstraintContext javaContext(String filePath, String content) {
        SemanticModel model = new JavaSemanticModelAdapter().parseFile(filePath, content);
        return ConstraintContext.of(model, ARCH_ID).withIntents(ArchTagParser.parse(content).intents());
    }

    protected ConstraintContext pythonContext(String filePath, String content) {
        SemanticModel model = new PythonSemanticModelAdapter().parseFile(filePath, content);
        return ConstraintContext.of(model, ARCH_ID).withIntents(ArchTagParser.parse(content).intents());
    }

    /**
     * Context over a file in the temporary project, with the project attached.
     *
     * @param relativePath path relative to the project root
     * @return context with project
     * @throws IOException if the file cannot be read
     */
    protected ConstraintContext projectFileContext(String relativePath) throws IOException {
        String content = Files.readString(tempDir.resolve(relativePath));
        AdapterRegistry adapters = AdapterRegistry.loadDefault();
        SemanticModel model = adapters.parseFile(relativePath, content);
        return ConstraintContext.of(model, ARCH_ID)
            .withIntents(ArchTagParser.parse(content).intents())
            .withProject(new FileSystemProjectContext(tempDir, adapters));
    }

    /**
     * Creates a file in the temporary project.
     *
     * @param relativePath path relative to tempDir (e.g., "src/payment/PaymentService.java")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }
}
