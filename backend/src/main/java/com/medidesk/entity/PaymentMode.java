package com.medidesk.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum PaymentMode {
    CASH,
    UPI,
    CARD;

    /**
     * Case-insensitive lookup; blank or unknown input yields empty.
     */
    public static Optional<PaymentMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(mode -> mode.name().equals(normalized))
            .findFirst();
    }
}
