package com.archcodex.core.config;

import com.archcodex.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("archcodex.yaml");
        Files.writeString(configFile, """
            validation:
              strict: true
              untaggedPolicy: deny
              skipRules: [max_similarity]
              severities: [error, warning]
              requireWhyForForbid: true
              concurrency: 2

            overrides:
              requireReason: false
              maxExpiryDays: 90
              warnNoExpiry: true
              failOnExpired: true
              maxOverridesPerFile: 3

            files:
              testPatterns:
                - "**/*Spec.java"
            """);

        ArchCodexConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().strict()).isTrue();
        assertThat(config.validation().untaggedPolicy()).isEqualTo(ArchCodexConfig.UntaggedPolicy.DENY);
        assertThat(config.validation().skipRules()).containsExactly("max_similarity");
        assertThat(config.validation().severities()).containsExactly(Severity.ERROR, Severity.WARNING);
        assertThat(config.validation().includes(Severity.INFO)).isFalse();
        assertThat(config.validation().requireWhyForForbid()).isTrue();
        assertThat(config.validation().concurrency()).isEqualTo(2);
        assertThat(config.overrides().requireReason()).isFalse();
        assertThat(config.overrides().maxExpiryDays()).isEqualTo(90);
        assertThat(config.overrides().warnNoExpiry()).isTrue();
        assertThat(config.overrides().failOnExpired()).isTrue();
        assertThat(config.overrides().maxOverridesPerFile()).isEqualTo(3);
        assertThat(config.files().testPatterns()).containsExactly("**/*Spec.java");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archcodex.yaml");
        Files.writeString(configFile, """
            validation:
              strict: true
            """);

        ArchCodexConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().strict()).isTrue();
        assertThat(config.validation().untaggedPolicy()).isEqualTo(ArchCodexConfig.UntaggedPolicy.WARN);
        assertThat(config.validation().includes(Severity.INFO)).isTrue();
        assertThat(config.overrides().requireReason()).isTrue();
        assertThat(config.overrides().maxExpiryDays()).isNull();
        assertThat(config.files().testPatterns()).isNotEmpty();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("archcodex.yaml");
        Files.writeString(configFile, """
            registry: .arch/registry
            validation:
              untaggedPolicy: allow
              colour: blue
            """);

        ArchCodexConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().untaggedPolicy()).isEqualTo(ArchCodexConfig.UntaggedPolicy.ALLOW);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        ArchCodexConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ArchCodexConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archcodex.yaml");
        Files.writeString(configFile, """
            validation:
              untaggedPolicy: [unclosed
            """);

        ArchCodexConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ArchCodexConfig.defaults());
    }

    @Test
    void load_unknownEnumValue_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archcodex.yaml");
        Files.writeString(configFile, """
            validation:
              untaggedPolicy: sometimes
            """);

        ArchCodexConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().untaggedPolicy()).isEqualTo(ArchCodexConfig.UntaggedPolicy.WARN);
    }

    @Test
    void loadFromProject_readsConventionalFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), """
            overrides:
              maxOverridesPerFile: 1
            """);

        ArchCodexConfig config = ConfigLoader.loadFromProject(tempDir);

        assertThat(config.overrides().maxOverridesPerFile()).isEqualTo(1);
    }
}
