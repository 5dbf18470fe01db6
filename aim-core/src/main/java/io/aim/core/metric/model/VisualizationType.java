package io.aim.core.metric.model;

/// How a metric's results are presented to the user.
public enum VisualizationType {
    TABLE("table"),
    IMAGE("b64");

    private final String code;

    VisualizationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /// Resolves a document code. Both `"b64"` and `"image"` map to {@link #IMAGE}.
    ///
    /// @param code the document code, not null
    /// @return the matching type, never null
    /// @throws IllegalArgumentException if the code is unknown
    public static VisualizationType fromCode(String code) {
        if ("image".equalsIgnoreCase(code)) {
            return IMAGE;
        }
        for (VisualizationType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown visualization type: " + code);
    }
}
