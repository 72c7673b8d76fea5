package com.archcodex.core.adapter;

import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.LanguageCapabilities;
import com.archcodex.core.model.semantic.SemanticModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AdapterRegistry} and adapter discovery through {@link ServiceLoader}.
 */
class AdapterRegistryTest {

    private static final int EXPECTED_ADAPTER_COUNT = 2;

    @Test
    void serviceLoader_discoversAllAdapters() {
        List<SemanticModelAdapter> adapters = ServiceLoader.load(SemanticModelAdapter.class)
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(adapters).hasSize(EXPECTED_ADAPTER_COUNT);
        assertThat(adapters).extracting(SemanticModelAdapter::getId).containsExactlyInAnyOrder("java", "python");
    }

    @Test
    void loadDefault_dispatchesByExtension() {
        AdapterRegistry registry = AdapterRegistry.loadDefault();

        assertThat(registry.supports("src/PaymentService.java")).isTrue();
        assertThat(registry.supports("app/payment.py")).isTrue();
        assertThat(registry.supports("web/payment.ts")).isFalse();
        assertThat(registry.capabilitiesFor("app/payment.py")).get()
            .satisfies(c -> assertThat(c.hasInterfaces()).isFalse());
        assertThat(registry.parseFile("src/PaymentService.java", "public class PaymentService {}").language())
            .isEqualTo("java");
    }

    @Test
    void parseFile_unsupportedExtension_throwsSemanticModelException() {
        AdapterRegistry registry = AdapterRegistry.loadDefault();

        assertThatThrownBy(() -> registry.parseFile("web/payment.ts", "export class Payment {}"))
            .isInstanceOf(SemanticModelException.class);
    }

    @Test
    void register_laterAdapterReplacesEarlierForSharedExtension() {
        SemanticModelAdapter custom = new SemanticModelAdapter() {
            @Override
            public String getId() {
                return "custom-java";
            }

            @Override
            public Set<String> getSupportedExtensions() {
                return Set.of(".java");
            }

            @Override
            public LanguageCapabilities getCapabilities() {
                return LanguageCapabilities.none();
            }

            @Override
            public SemanticModel parseFile(String filePath, String content) {
                return SemanticModel.builder(filePath, content, "java").build();
            }
        };

        AdapterRegistry registry = AdapterRegistry.loadDefault().register(custom);

        assertThat(registry.forPath("src/A.java")).get().extracting(SemanticModelAdapter::getId)
            .isEqualTo("custom-java");
        assertThat(registry.capabilitiesFor("src/A.java")).contains(LanguageCapabilities.none());
    }
}
