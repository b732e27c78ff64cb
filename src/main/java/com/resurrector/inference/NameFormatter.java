package com.resurrector.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns source identifiers into display labels: {@code email_address -> "Email Address"},
 * {@code createdAt -> "Created At"}. Pure and idempotent; no network calls.
 */
public final class NameFormatter {

    private static final String FALLBACK_LABEL = "Field";

    private NameFormatter() {
    }

    public static String format(String identifier) {
        List<String> words = words(identifier);
        if (words.isEmpty()) {
            return FALLBACK_LABEL;
        }
        StringBuilder label = new StringBuilder();
        for (String word : words) {
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0)));
            label.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return label.toString();
    }

    /**
     * Splits an identifier on {@code _ - .} and whitespace, and before an upper-case letter that
     * follows a lower-case letter or digit.
     */
    public static List<String> words(String identifier) {
        List<String> words = new ArrayList<>();
        if (identifier == null) {
            return words;
        }
        StringBuilder current = new StringBuilder();
        char previous = 0;
        for (char c : identifier.toCharArray()) {
            if (c == '_' || c == '-' || c == '.' || Character.isWhitespace(c)) {
                flush(current, words);
            } else {
                if (Character.isUpperCase(c) && (Character.isLowerCase(previous) || Character.isDigit(previous))) {
                    flush(current, words);
                }
                current.append(c);
            }
            previous = c;
        }
        flush(current, words);
        return words;
    }

    private static void flush(StringBuilder current, List<String> words) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }
}
