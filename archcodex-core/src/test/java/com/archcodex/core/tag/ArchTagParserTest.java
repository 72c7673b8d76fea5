package com.archcodex.core.tag;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArchTagParser}.
 */
class ArchTagParserTest {

    // ========== Arch Tag Tests ==========

    @Test
    void parse_javadocHeader_extractsTagMixinsAndIntents() {
        String content = """
            /**
             * @arch svc.payment +tested +audited
             * @intent:stateless
             */
            package com.acme.payment;

            // @intent:late
            public class PaymentService {}
            """;

        ParsedTags tags = ArchTagParser.parse(content);

        assertThat(tags.isTagged()).isTrue();
        assertThat(tags.archTag().archId()).isEqualTo("svc.payment");
        assertThat(tags.archTag().inlineMixins()).containsExactly("tested", "audited");
        assertThat(tags.archTag().line()).isEqualTo(2);
        assertThat(tags.archTag().column()).isEqualTo(4);
        assertThat(tags.intentNames()).containsExactly("stateless");
    }

    @Test
    void parse_pythonDocstring_extractsTagAndIntents() {
        String content = """
            \"\"\"Payment module.

            @arch svc.payment
            @intent:Idempotent
            \"\"\"
            import os
            """;

        ParsedTags tags = ArchTagParser.parse(content);

        assertThat(tags.archTag().archId()).isEqualTo("svc.payment");
        assertThat(tags.archTag().inlineMixins()).isEmpty();
        assertThat(tags.intentNames()).containsExactly("idempotent");
    }

    @Test
    void parse_hashComment_extractsTag() {
        ParsedTags tags = ArchTagParser.parse("# @arch cli +logged\nimport sys\n");

        assertThat(tags.archTag().archId()).isEqualTo("cli");
        assertThat(tags.archTag().inlineMixins()).containsExactly("logged");
        assertThat(tags.archTag().line()).isEqualTo(1);
    }

    @Test
    void parse_tagInsideStringLiteral_isIgnored() {
        ParsedTags tags = ArchTagParser.parse("""
            public class Fixture {
                String tag = "@arch fake.arch";
            }
            """);

        assertThat(tags.isTagged()).isFalse();
        assertThat(tags.tag()).isEmpty();
        assertThat(tags.overrides()).isEmpty();
    }

    @Test
    void parse_untaggedFile_tagIsEmptyAndTaggedFileHasValue() {
        ParsedTags untagged = ArchTagParser.parse("public class Plain {}\n");
        ParsedTags tagged = ArchTagParser.parse("// @arch cli\n");

        assertThat(untagged.tag()).isEmpty();
        assertThat(untagged.archTag()).isNull();
        assertThat(tagged.tag()).hasValueSatisfying(tag -> assertThat(tag.archId()).isEqualTo("cli"));
    }

    // ========== Override Tests ==========

    @Test
    void parse_overrideBlock_collectsAllFields() {
        String content = """
            // @arch svc.payment
            import com.acme.http.LegacyClient;
            // @override forbid_import:com.acme.http.LegacyClient
            // @reason Legacy client until the gateway migration
            // @expires 2026-12-31
            // @ticket PAY-142
            // @approved_by @alice
            public class PaymentService {}
            """;

        ParsedTags tags = ArchTagParser.parse(content);

        assertThat(tags.overrides()).singleElement().satisfies(o -> {
            assertThat(o.rule()).isEqualTo("forbid_import");
            assertThat(o.value()).isEqualTo("com.acme.http.LegacyClient");
            assertThat(o.reason()).isEqualTo("Legacy client until the gateway migration");
            assertThat(o.expires()).isEqualTo("2026-12-31");
            assertThat(o.ticket()).isEqualTo("PAY-142");
            assertThat(o.approvedBy()).isEqualTo("@alice");
            assertThat(o.line()).isEqualTo(3);
        });
    }

    @Test
    void parse_consecutiveOverrides_areSeparated() {
        String content = """
            // @arch svc.payment
            // @override forbid_import:axios
            // @reason Migrating
            // @override max_file_lines:500
            // @reason Generated mapping table
            class Mapper {}
            """;

        ParsedTags tags = ArchTagParser.parse(content);

        assertThat(tags.overrides()).extracting(OverrideAnnotation::rule)
            .containsExactly("forbid_import", "max_file_lines");
        assertThat(tags.overrides().get(0).reason()).isEqualTo("Migrating");
        assertThat(tags.overrides().get(1).value()).isEqualTo("500");
        assertThat(tags.overrides().get(1).expires()).isNull();
    }

    @Test
    void parse_overrideInBlockComment_stripsCommentEnd() {
        String content = """
            /* @arch svc.payment */
            /* @override forbid_call:eval */
            class Scripting {}
            """;

        ParsedTags tags = ArchTagParser.parse(content);

        assertThat(tags.overrides()).singleElement().satisfies(o -> {
            assertThat(o.value()).isEqualTo("eval");
            assertThat(o.reason()).isNull();
        });
    }
}
