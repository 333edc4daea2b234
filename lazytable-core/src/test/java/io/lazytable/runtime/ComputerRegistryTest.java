package io.lazytable.runtime;

import io.lazytable.kernel.ColumnSpec;
import io.lazytable.kernel.ComputeResult;
import io.lazytable.kernel.IntColumn;
import io.lazytable.kernel.OutputType;
import io.lazytable.kernel.selection.IndexSelector;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputerRegistryTest {

    private static final ColumnSpec COUNT = new ColumnSpec("n", "spikes", "Event Count", OutputType.INT);
    private static final ColumnSpec PEAK = new ColumnSpec("peak", "lfp", "Analog Max", OutputType.DOUBLE);

    @Test
    void dispatchesOnComputationKind() {
        var registry = new ComputerRegistry()
                .register("Event Count", (window, spec) -> ComputeResult.success(IntColumn.of(new int[window.length()])))
                .register("Analog Max", (window, spec) -> ComputeResult.failure("no analog data"));

        assertThat(registry.compute(IndexSelector.range(3), COUNT)).isInstanceOf(ComputeResult.Success.class);
        assertThat(registry.compute(IndexSelector.range(3), PEAK))
                .isEqualTo(ComputeResult.failure("no analog data"));
    }

    @Test
    void unknownKindIsAFailureResult() {
        var result = new ComputerRegistry().compute(IndexSelector.range(3), COUNT);

        assertThat(result).isInstanceOf(ComputeResult.Failure.class);
        assertThat(((ComputeResult.Failure) result).message()).contains("'Event Count'");
    }

    @Test
    void rejectsDuplicateRegistration() {
        var registry = new ComputerRegistry().register("Event Count", (window, spec) -> null);

        assertThatThrownBy(() -> registry.register("Event Count", (window, spec) -> null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Event Count");
    }

    @Test
    void reportsRegisteredKinds() {
        var registry = new ComputerRegistry().register("Event Count", (window, spec) -> null);

        assertThat(registry.supports("Event Count")).isTrue();
        assertThat(registry.supports("Analog Max")).isFalse();
        assertThat(registry.computationKinds()).containsExactly("Event Count");
    }
}
