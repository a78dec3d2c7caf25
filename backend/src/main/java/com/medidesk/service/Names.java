package com.medidesk.service;

import java.util.Locale;

/**
 * Normalization of human-entered names and departments.
 */
final class Names {

    private Names() {
    }

    /**
     * Trims, collapses inner whitespace and capitalizes the first letter of each word.
     */
    static String titleCase(String value) {
        String[] words = value.trim().split("\\s+");
        StringBuilder result = new StringBuilder(value.length());
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return result.toString();
    }
}
