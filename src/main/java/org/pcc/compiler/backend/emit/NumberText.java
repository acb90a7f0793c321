package org.pcc.compiler.backend.emit;

import java.math.BigDecimal;

/**
 * Formats number literals for output.
 */
final class NumberText {

    private NumberText() {
    }

    /**
     * Formats a finite value in its shortest decimal form: {@code 3}, {@code 2.5}, {@code 0.1}.
     * Integral values print without fraction. Non-finite values print as {@code NaN},
     * {@code Infinity} or {@code -Infinity}.
     */
    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
