package com.agentid.api.registry;

import java.util.regex.Pattern;

/**
 * Cleans display names before they are stored: markup is stripped, stray
 * angle brackets removed, whitespace trimmed, length capped.
 */
public final class NameSanitizer {

    public static final int MAX_LENGTH = 255;

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern ANGLE_BRACKET = Pattern.compile("[<>]");

    private NameSanitizer() {}

    /**
     * @return the cleaned name, possibly empty; never null
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = ANGLE_BRACKET.matcher(TAG.matcher(raw).replaceAll("")).replaceAll("").trim();
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH).trim() : cleaned;
    }
}
