package org.azula.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void newEngineHasNoErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
        assertThat(engine.summary()).isEmpty();
    }

    @Test
    void warningsAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("Suspicious", "a.az", 1, 2);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.errorCount()).isZero();
        assertThat(engine.getDiagnostics()).hasSize(1);
    }

    @Test
    void summaryListsDiagnosticsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportError("Unexpected character: '@'", "a.az", 3, 7);
        engine.reportWarning("Suspicious", "a.az", 4, 1);

        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.errorCount()).isEqualTo(1);
        assertThat(engine.summary()).isEqualTo(
                "[ERROR] a.az:3:7: Unexpected character: '@'\n[WARNING] a.az:4:1: Suspicious");
    }

    @Test
    void diagnosticsViewIsUnmodifiable() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError("x", "a.az", 1, 1);

        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
