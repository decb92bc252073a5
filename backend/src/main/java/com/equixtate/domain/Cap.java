package com.equixtate.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Upper bound on an amount or count. A null amount means unlimited (+Infinity).
 * Serialized to JSON as the number itself, or the string "Infinity".
 */
public record Cap(BigDecimal amount) {

    public static final String INFINITY = "Infinity";
    public static final Cap UNLIMITED = new Cap(null);
    public static final Cap ZERO = new Cap(BigDecimal.ZERO);

    public static Cap of(long amount) {
        return new Cap(BigDecimal.valueOf(amount));
    }

    public boolean isUnlimited() {
        return amount == null;
    }

    /** True when value is non-negative and does not exceed the cap. */
    public boolean permits(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return false;
        }
        return isUnlimited() || value.compareTo(amount) <= 0;
    }

    @JsonValue
    Object jsonValue() {
        return isUnlimited() ? INFINITY : amount;
    }

    @JsonCreator
    static Cap fromJson(Object value) {
        if (value == null || INFINITY.equals(value) || "+Infinity".equals(value)) {
            return UNLIMITED;
        }
        return new Cap(new BigDecimal(value.toString()));
    }

    @Override
    public String toString() {
        return isUnlimited() ? "+" + INFINITY : amount.toPlainString();
    }
}
