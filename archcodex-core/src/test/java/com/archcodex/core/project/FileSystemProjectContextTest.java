package com.archcodex.core.project;

import com.archcodex.core.adapter.AdapterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileSystemProjectContext}.
 */
class FileSystemProjectContextTest {

    private static final String CONTROLLER = "src/main/java/com/acme/api/PaymentController.java";
    private static final String SERVICE = "src/main/java/com/acme/core/PaymentService.java";

    @TempDir
    Path tempDir;

    private FileSystemProjectContext context;

    @BeforeEach
    void setUp() throws IOException {
        write(CONTROLLER, """
            package com.acme.api;

            import com.acme.core.PaymentService;
            import java.util.List;

            public class PaymentController {}
            """);
        write(SERVICE, """
            /** @arch svc.payment */
            package com.acme.core;

            public class PaymentService {}
            """);
        write("app/views.py", "from .models import Order\n");
        write("app/models.py", "class Order:\n    pass\n");
        write("node_modules/lib/Ignored.java", "public class Ignored {}\n");
        write("src/main/java/com/acme/Broken.java", "public class {\n");
        write("README.md", "# Payments\n");

        context = new FileSystemProjectContext(tempDir, AdapterRegistry.loadDefault());
    }

    // ========== File Index Tests ==========

    @Test
    void findFiles_skipsIgnoredDirectories() {
        assertThat(context.findFiles("**/*.java"))
            .containsExactly("src/main/java/com/acme/Broken.java", CONTROLLER, SERVICE);
    }

    @Test
    void relativize_absolutePathUnderRoot_becomesRelative() {
        assertThat(context.relativize(tempDir.resolve(SERVICE).toString())).isEqualTo(SERVICE);
        assertThat(context.relativize(SERVICE)).isEqualTo(SERVICE);
    }

    @Test
    void readAndExists_reflectDisk() {
        assertThat(context.exists(SERVICE)).isTrue();
        assertThat(context.exists("src/Missing.java")).isFalse();
        assertThat(context.read("README.md")).contains("# Payments\n");
        assertThat(context.read("src/Missing.java")).isEmpty();
    }

    // ========== Model Tests ==========

    @Test
    void semanticModel_unsupportedOrBrokenFile_isEmpty() {
        assertThat(context.semanticModel("README.md")).isEmpty();
        assertThat(context.semanticModel("src/main/java/com/acme/Broken.java")).isEmpty();
        assertThat(context.semanticModel(SERVICE)).isPresent();
    }

    @Test
    void tags_readsArchTag() {
        assertThat(context.tags(SERVICE)).get()
            .satisfies(tags -> assertThat(tags.archTag().archId()).isEqualTo("svc.payment"));
    }

    // ========== Import Graph Tests ==========

    @Test
    void importsOf_resolvesDottedJavaImports() {
        assertThat(context.importsOf(CONTROLLER)).containsExactly(SERVICE);
        assertThat(context.importersOf(SERVICE)).containsExactly(CONTROLLER);
    }

    @Test
    void importsOf_resolvesPythonRelativeModules() {
        assertThat(context.importsOf("app/views.py")).containsExactly("app/models.py");
        assertThat(context.importersOf("app/models.py")).containsExactly("app/views.py");
    }

    private void write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
