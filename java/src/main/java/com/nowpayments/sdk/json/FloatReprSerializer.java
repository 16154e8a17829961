package com.nowpayments.sdk.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Writes non-integral numbers in the shortest round-trip form used by the
 * notification sender: plain notation for decimal exponents -4 to 15
 * ({@code 0.00025}, {@code 12345678.5}, {@code 100.0}), scientific notation
 * with a signed two-digit exponent otherwise ({@code 1e-05}, {@code 1.5e+20}).
 */
final class FloatReprSerializer extends StdSerializer<Number> {

    private static final long serialVersionUID = 1L;

    // Decimals with more digits than a double holds are rounded through one first.
    private static final int DOUBLE_DIGITS = 15;

    FloatReprSerializer() {
        super(Number.class);
    }

    @Override
    public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeNumber(repr(value));
    }

    static String repr(Number value) {
        if (value instanceof BigDecimal) {
            BigDecimal bd = (BigDecimal) value;
            if (bd.precision() > DOUBLE_DIGITS) {
                return repr(bd.doubleValue());
            }
            return format(bd);
        }
        if (value instanceof Float) {
            // widen through the float's own shortest digits, not its binary value
            return repr(Double.parseDouble(value.toString()));
        }
        return repr(value.doubleValue());
    }

    static String repr(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0.0) {
            return Double.doubleToRawLongBits(d) < 0 ? "-0.0" : "0.0";
        }
        return format(new BigDecimal(Double.toString(d)));
    }

    private static String format(BigDecimal value) {
        if (value.signum() == 0) {
            return "0.0";
        }
        BigDecimal bd = value.stripTrailingZeros();
        String digits = bd.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - bd.scale();

        if (exponent >= -4 && exponent < 16) {
            String plain = bd.toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        StringBuilder sb = new StringBuilder();
        if (bd.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        return sb.append('e').append(String.format("%+03d", exponent)).toString();
    }
}
