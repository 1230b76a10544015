package com.phillippitts.tsaugment.service.augment;

import java.util.Locale;

/**
 * Canonicalizes names that come from loosely-typed configuration (augmenter names, enumeration
 * values, parameter keys) so that {@code "window_size"}, {@code "window-size"},
 * {@code "Window Size"} and {@code "windowSize"} all compare equal.
 */
public final class ConfigNames {

    private ConfigNames() {}

    /** Lower-cases and strips underscores, hyphens and whitespace. Null becomes the empty string. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        String lower = text.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c != '_' && c != '-' && !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
