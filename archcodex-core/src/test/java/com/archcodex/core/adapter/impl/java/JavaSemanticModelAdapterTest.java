package com.archcodex.core.adapter.impl.java;

import com.archcodex.core.exception.SemanticModelException;
import com.archcodex.core.model.semantic.ClassInfo;
import com.archcodex.core.model.semantic.DecoratorInfo;
import com.archcodex.core.model.semantic.ExportInfo;
import com.archcodex.core.model.semantic.FunctionCallInfo;
import com.archcodex.core.model.semantic.ImportInfo;
import com.archcodex.core.model.semantic.MethodInfo;
import com.archcodex.core.model.semantic.SemanticModel;
import com.archcodex.core.model.semantic.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link JavaSemanticModelAdapter}.
 */
class JavaSemanticModelAdapterTest {

    private static final String SOURCE = """
        /** @arch svc.payment */
        package com.acme.payment;

        import com.acme.core.BaseService;
        import java.util.*;

        @Service
        public class PaymentService extends BaseService<Payment> implements PaymentPort {

            /** @intent:idempotent */
            public void charge(Payment payment) {
                try {
                    gateway.submit(payment);
                } catch (RuntimeException e) {
                    log.warn("charge failed", e);
                }
                this.attempts++;
            }

            protected void refund() {}

            private void audit() {}

            void reconcile() {}

            static class Retry {}
        }
        """;

    private JavaSemanticModelAdapter adapter;
    private SemanticModel model;

    @BeforeEach
    void setUp() {
        adapter = new JavaSemanticModelAdapter();
        model = adapter.parseFile("src/PaymentService.java", SOURCE);
    }

    // ========== Declaration Tests ==========

    @Test
    void parseFile_extractsImports() {
        assertThat(model.imports()).extracting(ImportInfo::moduleSpecifier)
            .containsExactly("com.acme.core.BaseService", "java.util.*");
        assertThat(model.imports().get(0).namedImports()).containsExactly("BaseService");
        assertThat(model.imports().get(0).location().line()).isEqualTo(4);
    }

    @Test
    void parseFile_extractsClassShape() {
        ClassInfo service = model.classes().stream()
            .filter(c -> c.name().equals("PaymentService"))
            .findFirst()
            .orElseThrow();

        assertThat(service.exported()).isTrue();
        assertThat(service.extendsClass()).isEqualTo("BaseService<Payment>");
        assertThat(service.implementsInterfaces()).containsExactly("PaymentPort");
        assertThat(service.decorators()).extracting(DecoratorInfo::name).containsExactly("Service");
        assertThat(service.methods()).extracting(MethodInfo::name, MethodInfo::visibility).containsExactly(
            tuple("charge", Visibility.PUBLIC),
            tuple("refund", Visibility.PROTECTED),
            tuple("audit", Visibility.PRIVATE),
            tuple("reconcile", Visibility.INTERNAL));
    }

    @Test
    void parseFile_nestedNonPublicClass_isNotExported() {
        assertThat(model.exports()).extracting(ExportInfo::name).containsExactly("PaymentService");
        assertThat(model.exportedClasses()).extracting(ClassInfo::name).containsExactly("PaymentService");
    }

    @Test
    void parseFile_methodDocComment_yieldsFunctionIntents() {
        assertThat(model.functionAt(13).name()).isEqualTo("charge");
        assertThat(model.functionAt(13).intents()).containsExactly("idempotent");
    }

    // ========== Call and Mutation Tests ==========

    @Test
    void parseFile_callsCarryControlFlowAndParent() {
        FunctionCallInfo submit = model.functionCalls().stream()
            .filter(c -> c.callee().equals("gateway.submit"))
            .findFirst()
            .orElseThrow();

        assertThat(submit.receiver()).isEqualTo("gateway");
        assertThat(submit.methodName()).isEqualTo("submit");
        assertThat(submit.controlFlow().inTryBlock()).isTrue();
        assertThat(submit.parentFunction()).isEqualTo("charge");
        assertThat(submit.location().line()).isEqualTo(13);
    }

    @Test
    void parseFile_callsInFinallyBlock_areMarked() {
        SemanticModel closing = adapter.parseFile("src/Closer.java", """
            public class Closer {
                void run() {
                    try {
                        open();
                    } finally {
                        close();
                    }
                }
            }
            """);

        FunctionCallInfo open = closing.functionCalls().stream()
            .filter(c -> c.callee().equals("open"))
            .findFirst()
            .orElseThrow();
        FunctionCallInfo close = closing.functionCalls().stream()
            .filter(c -> c.callee().equals("close"))
            .findFirst()
            .orElseThrow();

        assertThat(open.controlFlow().inTryBlock()).isTrue();
        assertThat(open.controlFlow().inFinallyBlock()).isFalse();
        assertThat(close.controlFlow().inTryBlock()).isFalse();
        assertThat(close.controlFlow().inFinallyBlock()).isTrue();
    }

    @Test
    void parseFile_incrementOnField_isMutationWithoutThisPrefix() {
        assertThat(model.mutations()).singleElement().satisfies(m -> {
            assertThat(m.target()).isEqualTo("attempts");
            assertThat(m.operator()).isEqualTo("++");
        });
    }

    @Test
    void parseFile_countsLinesAndCode() {
        assertThat(model.lineCount()).isEqualTo(27);
        assertThat(model.locCount()).isLessThan(model.lineCount());
    }

    // ========== Error Tests ==========

    @Test
    void parseFile_syntaxError_throwsSemanticModelException() {
        assertThatThrownBy(() -> adapter.parseFile("src/Broken.java", "public class {"))
            .isInstanceOf(SemanticModelException.class)
            .hasMessageContaining("src/Broken.java");
    }
}
