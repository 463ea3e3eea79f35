package com.segym.sandbox;

import com.segym.core.model.Action;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Applies an {@link Action}'s replacement edit to a working copy.
 *
 * <p>The first occurrence of {@code oldCode} is replaced by {@code newCode}. An empty
 * {@code oldCode} creates the file, and only when it does not exist yet.
 */
public class PatchApplier {

    /**
     * @return the patched file keyed by its relative path, empty for no-op actions
     * @throws MalformedPatchException when the edit cannot be applied
     */
    public Map<String, String> apply(Path workDir, Action action) {
        if (action.noop()) {
            return Map.of();
        }
        String filename = action.filename();
        if (filename == null || filename.isBlank()) {
            throw new MalformedPatchException("Patch names no file");
        }
        Path root = workDir.toAbsolutePath().normalize();
        Path relative = Path.of(filename.replace('\\', '/'));
        if (relative.isAbsolute()) {
            throw new MalformedPatchException("Patch path must be relative: " + filename);
        }
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new MalformedPatchException("Patch path escapes the project: " + filename);
        }
        String key = root.relativize(target).toString().replace('\\', '/');
        String oldCode = action.oldCode() != null ? action.oldCode() : "";
        String newCode = action.newCode() != null ? action.newCode() : "";

        try {
            if (!Files.exists(target)) {
                if (!oldCode.isEmpty()) {
                    throw new MalformedPatchException("File not found: " + key);
                }
                Files.createDirectories(target.getParent());
                Files.writeString(target, newCode, StandardCharsets.UTF_8);
                return Map.of(key, newCode);
            }
            if (!Files.isRegularFile(target)) {
                throw new MalformedPatchException("Not a regular file: " + key);
            }
            if (oldCode.isEmpty()) {
                throw new MalformedPatchException("oldCode is required to edit existing file " + key);
            }
            String content = Files.readString(target, StandardCharsets.UTF_8);
            int at = content.indexOf(oldCode);
            if (at < 0) {
                throw new MalformedPatchException("oldCode not found in " + key);
            }
            String patched = content.substring(0, at) + newCode + content.substring(at + oldCode.length());
            Files.writeString(target, patched, StandardCharsets.UTF_8);
            return Map.of(key, patched);
        } catch (IOException e) {
            throw new MalformedPatchException("Could not apply patch to " + key + ": " + e.getMessage(), e);
        }
    }
}
