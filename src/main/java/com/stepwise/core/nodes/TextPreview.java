package com.stepwise.core.nodes;

/**
 * Truncation for prompt economy.
 */
final class TextPreview {

    private TextPreview() {}

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
