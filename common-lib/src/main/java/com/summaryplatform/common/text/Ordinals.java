package com.summaryplatform.common.text;

import java.util.List;

/**
 * Ordinal words for week references ("first week", "second week", …).
 * Indices are zero-based. Beyond the word list ordinals fall back to numeric
 * form ("11th", "22nd", "103rd").
 */
public final class Ordinals {

    private static final List<String> WORDS = List.of(
        "first", "second", "third", "fourth", "fifth",
        "sixth", "seventh", "eighth", "ninth", "tenth");

    private Ordinals() {}

    public static String of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Ordinal index must be >= 0, got " + index);
        }
        if (index < WORDS.size()) return WORDS.get(index);

        int n = index + 1;
        int lastTwo = n % 100;
        if (lastTwo >= 11 && lastTwo <= 13) return n + "th";
        return switch (n % 10) {
            case 1 -> n + "st";
            case 2 -> n + "nd";
            case 3 -> n + "rd";
            default -> n + "th";
        };
    }
}
