package com.archcodex.core.adapter.impl.python;

import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.model.semantic.FunctionInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.MethodInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.model.semantic.Visibility;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PythonSemanticModelAdapter}.
 */
class PythonSemanticModelAdapterTest {

    private static final String SOURCE = """
        # @arch svc.payment
        import logging
        from .gateway import submit, refund as do_refund

        class PaymentService(BaseService):
            @retry(3)
            def charge(self, payment):
                \"\"\"Charge once. @intent:idempotent\"\"\"
                try:
                    submit(payment)
                except Exception:
                    logging.warning("failed")
                self.attempts += 1

            def _audit(self):
                pass

        def helper():
            pass
        """;

    private final PythonSemanticModelAdapter adapter = new PythonSemanticModelAdapter();
    private final SemanticModel model = adapter.parseFile("app/payment.py", SOURCE);

    @Test
    void capabilities_excludeInterfacesAndVisibility() {
        assertThat(adapter.getCapabilities().hasClassInheritance()).isTrue();
        assertThat(adapter.getCapabilities().hasDecorators()).isTrue();
        assertThat(adapter.getCapabilities().hasInterfaces()).isFalse();
        assertThat(adapter.getCapabilities().hasVisibilityModifiers()).isFalse();
    }

    @Test
    void parseFile_extractsPlainAndFromImports() {
        assertThat(model.imports()).extracting(ImportInfo::moduleSpecifier).containsExactly("logging", ".gateway");
        assertThat(model.imports().get(1).namedImports()).containsExactly("submit", "refund");
    }

    @Test
    void parseFile_extractsClassWithBaseAndMethods() {
        ClassInfo service = model.classes().get(0);

        assertThat(service.name()).isEqualTo("PaymentService");
        assertThat(service.extendsClass()).isEqualTo("BaseService");
        assertThat(service.methods()).extracting(MethodInfo::name).containsExactly("charge", "_audit");
        assertThat(service.methods().get(0).decorators()).extracting(d -> d.name()).containsExactly("retry");
        assertThat(service.methods().get(1).visibility()).isEqualTo(Visibility.PROTECTED);
    }

    @Test
    void parseFile_docstringIntents_attachToFunction() {
        FunctionInfo charge = model.functions().stream()
            .filter(f -> f.name().equals("charge"))
            .findFirst()
            .orElseThrow();

        assertThat(charge.intents()).containsExactly("idempotent");
        assertThat(charge.exported()).isFalse();
    }

    @Test
    void parseFile_callsInsideTry_areMarked() {
        FunctionCallInfo submit = model.functionCalls().stream()
            .filter(c -> c.callee().equals("submit"))
            .findFirst()
            .orElseThrow();
        FunctionCallInfo warning = model.functionCalls().stream()
            .filter(c -> c.callee().equals("logging.warning"))
            .findFirst()
            .orElseThrow();

        assertThat(submit.controlFlow().inTryBlock()).isTrue();
        assertThat(submit.parentFunction()).isEqualTo("charge");
        assertThat(warning.controlFlow().inTryBlock()).isFalse();
        assertThat(warning.controlFlow().inCatchBlock()).isTrue();
    }

    @Test
    void parseFile_selfAttributeAssignment_isMutation() {
        assertThat(model.mutations()).singleElement().satisfies(m -> {
            assertThat(m.target()).isEqualTo("attempts");
            assertThat(m.location().line()).isEqualTo(13);
        });
    }

    @Test
    void parseFile_topLevelNamesWithoutAll_areExported() {
        assertThat(model.exports()).extracting(ExportInfo::name).containsExactly("PaymentService", "helper");
    }
}
