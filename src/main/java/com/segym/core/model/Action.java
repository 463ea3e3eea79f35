package com.segym.core.model;

import java.io.Serializable;

/**
 * A schema-validated edit proposal produced by one sampler call for one genome.
 *
 * <p>The edit replaces the first occurrence of {@code oldCode} in {@code filename}
 * with {@code newCode}. An empty {@code oldCode} creates the file when it does not exist.
 *
 * @param genomeId the genome whose prompt produced this action
 * @param filename path of the target file, relative to the project root
 * @param oldCode  exact text to replace
 * @param newCode  replacement text
 * @param noop     true when the action leaves the tree unchanged
 * @param degraded true when the sampler gave up and fell back to a no-op
 */
public record Action(
    String genomeId,
    String filename,
    String oldCode,
    String newCode,
    boolean noop,
    boolean degraded
) implements Serializable {

    public static Action edit(String genomeId, String filename, String oldCode, String newCode) {
        return new Action(genomeId, filename, oldCode != null ? oldCode : "", newCode, false, false);
    }

    public static Action noop(String genomeId, boolean degraded) {
        return new Action(genomeId, null, "", "", true, degraded);
    }
}
