package io.aim.core.evaluator;

import io.aim.core.metric.model.ValueType;
import java.util.Objects;
import java.util.OptionalDouble;

/// One value produced by a metric evaluator.
///
/// A closed union: integer, floating point, or base64-encoded image. Numeric
/// values are classified against score bands; image values are forwarded
/// as-is, including the empty payload an evaluator may return when it could
/// not produce an image.
public sealed interface ResultValue
        permits ResultValue.IntegerValue, ResultValue.FloatValue, ResultValue.ImageValue {

    /// Returns the value type this value satisfies exactly.
    ///
    /// @return the value type, never null
    ValueType type();

    /// Returns the value as a double for classification.
    ///
    /// @return the numeric value, or empty for images
    OptionalDouble numeric();

    static ResultValue of(long value) {
        return new IntegerValue(value);
    }

    static ResultValue of(double value) {
        return new FloatValue(value);
    }

    static ResultValue image(String base64) {
        return new ImageValue(base64);
    }

    record IntegerValue(long value) implements ResultValue {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(value);
        }
    }

    record FloatValue(double value) implements ResultValue {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(value);
        }
    }

    /// @param base64 base64-encoded PNG, empty when the image could not be produced
    record ImageValue(String base64) implements ResultValue {
        public ImageValue {
            Objects.requireNonNull(base64, "base64 must not be null");
        }

        @Override
        public ValueType type() {
            return ValueType.IMAGE;
        }

        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.empty();
        }

        public boolean isEmpty() {
            return base64.isEmpty();
        }

        @Override
        public String toString() {
            return "ImageValue[" + base64.length() + " chars]";
        }
    }
}
