package io.aim.core.metric.model;

/// Declared type of one metric result value.
///
/// Each constant carries the code used for it in the registry document.
public enum ValueType {
    /// Whole number, classified against score bands.
    INTEGER("int"),

    /// Floating point number, classified against score bands.
    FLOAT("float"),

    /// Base64-encoded image payload, forwarded unclassified.
    IMAGE("b64");

    private final String code;

    ValueType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /// Returns whether values of this type are classified into judgments.
    ///
    /// @return `true` for numeric types
    public boolean isNumeric() {
        return this != IMAGE;
    }

    /// Resolves a document code to a value type.
    ///
    /// @param code the code as written in the registry document, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if the code is unknown
    public static ValueType fromCode(String code) {
        for (ValueType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + code);
    }
}
