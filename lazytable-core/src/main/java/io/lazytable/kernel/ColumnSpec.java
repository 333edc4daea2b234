package io.lazytable.kernel;

import java.util.Objects;

/**
 * Description of one computed column, supplied when a table is configured.
 *
 * @param name            display name, also used in diagnostics
 * @param sourceKey       key of the data source the column reads
 * @param computationKind which computation produces the values, e.g. {@code "Event Count"}
 * @param outputType      declared type of the realized values
 */
public record ColumnSpec(String name, String sourceKey, String computationKind, OutputType outputType) {

    public ColumnSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sourceKey, "sourceKey");
        Objects.requireNonNull(computationKind, "computationKind");
        Objects.requireNonNull(outputType, "outputType");
        if (name.isBlank()) {
            throw new IllegalArgumentException("column name must not be blank");
        }
    }
}
