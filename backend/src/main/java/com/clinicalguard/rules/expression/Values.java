package com.clinicalguard.rules.expression;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;

/**
 * Coercions shared by the expression nodes.
 */
final class Values {

    private Values() {
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number) {
            BigDecimal n = toNumber(value);
            return n != null && n.signum() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    /**
     * Numeric view of a value; numeric strings are accepted. {@code null} if not a number.
     */
    static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof Number n) {
            double asDouble = n.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return null;
            }
            return new BigDecimal(n.toString());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty() || !trimmed.matches("[-+]?\\d*\\.?\\d+([eE][-+]?\\d+)?")) {
                return null;
            }
            return new BigDecimal(trimmed);
        }
        return null;
    }

    static boolean looselyEqual(Object a, Object b) {
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number || b instanceof Number) {
            BigDecimal x = toNumber(a);
            BigDecimal y = toNumber(b);
            return x != null && y != null && x.compareTo(y) == 0;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return asText(a).equalsIgnoreCase(asText(b));
        }
        return Objects.equals(a, b);
    }

    static String asText(Object value) {
        if (value instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
