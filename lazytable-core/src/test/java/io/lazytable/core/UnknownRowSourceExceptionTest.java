package io.lazytable.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UnknownRowSourceExceptionTest {

    @Test
    void carriesRowSourceAndIsALazyTableException() {
        var exception = new UnknownRowSourceException("Widgets: abc", "Unknown row source format");

        assertThat(exception).isInstanceOf(LazyTableException.class);
        assertThat(exception.rowSource()).isEqualTo("Widgets: abc");
        assertThat(exception).hasMessage("Unknown row source format: Widgets: abc");
    }
}
