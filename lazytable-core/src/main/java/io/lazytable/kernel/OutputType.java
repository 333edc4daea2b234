package io.lazytable.kernel;

import java.util.Objects;

/**
 * Declared type of a column: a scalar of an element type, or a vector of it.
 */
public record OutputType(ValueType elementType, boolean vector) {

    public static final OutputType BOOL = new OutputType(ValueType.BOOL, false);
    public static final OutputType INT = new OutputType(ValueType.INT, false);
    public static final OutputType LONG = new OutputType(ValueType.LONG, false);
    public static final OutputType FLOAT = new OutputType(ValueType.FLOAT, false);
    public static final OutputType DOUBLE = new OutputType(ValueType.DOUBLE, false);

    private static final String VECTOR_PREFIX = "vector<";

    public OutputType {
        Objects.requireNonNull(elementType, "elementType");
    }

    public static OutputType scalar(ValueType elementType) {
        return new OutputType(elementType, false);
    }

    public static OutputType vectorOf(ValueType elementType) {
        return new OutputType(elementType, true);
    }

    /**
     * Parse a type tag such as {@code "double"} or {@code "vector<int>"}.
     *
     * @throws IllegalArgumentException if the tag is not recognized
     */
    public static OutputType parse(String tag) {
        Objects.requireNonNull(tag, "tag");
        String trimmed = tag.trim();
        if (trimmed.startsWith(VECTOR_PREFIX) && trimmed.endsWith(">")) {
            String element = trimmed.substring(VECTOR_PREFIX.length(), trimmed.length() - 1).trim();
            return vectorOf(ValueType.fromTypeName(element));
        }
        return scalar(ValueType.fromTypeName(trimmed));
    }

    @Override
    public String toString() {
        return vector ? VECTOR_PREFIX + elementType.typeName() + ">" : elementType.typeName();
    }
}
