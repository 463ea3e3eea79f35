package com.segym.core.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * Snapshot of one sandbox slot: the working tree it ran against plus its latest test report.
 *
 * <p>The tree is the canonical {@code root} with {@code overlay} applied on top, where the
 * overlay maps relative paths to the content the action wrote. Reset states have an empty
 * overlay and no action.
 *
 * @param slot         sandbox slot index (-1 for the baseline slot used by reset)
 * @param epoch        reset counter this state belongs to
 * @param root         canonical, read-only project tree
 * @param overlay      patched file contents keyed by relative path
 * @param action       action that produced this state, null for reset states
 * @param report       test execution report
 * @param sandboxError true when the sandbox crashed or timed out
 * @param errorMessage why the report is a maximal failure, null otherwise
 */
public record State(
    int slot,
    long epoch,
    Path root,
    Map<String, String> overlay,
    Action action,
    TestReport report,
    boolean sandboxError,
    String errorMessage
) {

    public static final int BASELINE_SLOT = -1;

    public State {
        overlay = overlay != null ? Map.copyOf(overlay) : Map.of();
    }

    public static State baseline(long epoch, Path root, TestReport report) {
        return new State(BASELINE_SLOT, epoch, root, Map.of(), null, report, false, null);
    }

    public boolean isMaximalFailure() {
        return errorMessage != null;
    }
}
