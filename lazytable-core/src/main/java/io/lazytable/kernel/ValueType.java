package io.lazytable.kernel;

/**
 * Primitive element types a computed column can hold.
 */
public enum ValueType {
    BOOL("bool"),
    INT("int"),
    LONG("long"),
    FLOAT("float"),
    DOUBLE("double");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static ValueType fromTypeName(String typeName) {
        for (ValueType type : values()) {
            if (type.typeName.equals(typeName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + typeName);
    }
}
