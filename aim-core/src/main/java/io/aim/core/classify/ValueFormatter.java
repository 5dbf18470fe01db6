package io.aim.core.classify;

import io.aim.core.evaluator.ResultValue;
import java.math.BigDecimal;
import java.math.RoundingMode;

/// Presentation formatting for result values.
///
/// Floats are shown with two decimals (half-up), integers verbatim and
/// images untouched. Formatting never feeds back into classification.
public final class ValueFormatter {

    static final int FLOAT_SCALE = 2;

    private ValueFormatter() {}

    public static String format(ResultValue value) {
        if (value instanceof ResultValue.IntegerValue integer) {
            return Long.toString(integer.value());
        }
        if (value instanceof ResultValue.FloatValue floating) {
            return format(floating.value());
        }
        return ((ResultValue.ImageValue) value).base64();
    }

    /// Formats a float with fixed precision.
    ///
    /// @param value the value
    /// @return decimal string with two fraction digits, or `NaN`/`Infinity` verbatim
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).setScale(FLOAT_SCALE, RoundingMode.HALF_UP).toPlainString();
    }
}
