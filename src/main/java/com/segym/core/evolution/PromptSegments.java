package com.segym.core.evolution;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits prompts into sentence-like segments and joins them back.
 */
final class PromptSegments {

    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private PromptSegments() {}

    static List<String> split(String prompt) {
        var segments = new ArrayList<String>();
        for (String part : BOUNDARY.split(prompt.trim())) {
            if (!part.isBlank()) {
                segments.add(part.trim());
            }
        }
        if (segments.isEmpty()) {
            segments.add(prompt.trim());
        }
        return segments;
    }

    static String join(List<String> segments) {
        return String.join(" ", segments).trim();
    }
}
