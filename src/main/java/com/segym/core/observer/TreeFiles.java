package com.segym.core.observer;

import com.segym.core.model.State;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * File access against a state's tree: overlay contents win over the canonical root.
 */
final class TreeFiles {

    /** Directories to skip when walking a tree. */
    static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".pytest_cache", ".tox", ".venv"
    );

    private TreeFiles() {}

    /**
     * Bytes that are not valid UTF-8 (latin-1 or cp1252 sources) are decoded as U+FFFD
     * instead of failing the read.
     *
     * @return file content, or null when the file does not exist in the state's tree
     */
    static String read(State state, String relativePath) throws IOException {
        String overlaid = state.overlay().get(relativePath);
        if (overlaid != null) {
            return overlaid;
        }
        Path file = state.root().resolve(relativePath).normalize();
        if (!file.startsWith(state.root().normalize()) || !Files.isRegularFile(file)) {
            return null;
        }
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    static boolean isIgnored(Path root, Path path) {
        Path relative = root.relativize(path);
        for (Path part : relative) {
            if (IGNORE_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
