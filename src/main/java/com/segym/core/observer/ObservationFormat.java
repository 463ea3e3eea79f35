package com.segym.core.observer;

/**
 * Markdown rendering of one file inside an observation.
 */
final class ObservationFormat {

    static final String TRUNCATION_MARKER = "\n... [truncated]\n";

    private ObservationFormat() {}

    static String header(String path) {
        return "### " + path + "\n```\n";
    }

    static String footer() {
        return "\n```\n\n";
    }

    static String render(String path, String content) {
        return header(path) + content + footer();
    }
}
