package com.segym.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing SE-Gym MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setGeneration(String runId, int generation) {
        MDC.put("runId", runId);
        MDC.put("generation", String.valueOf(generation));
    }

    public static void setGenome(String genomeId) {
        MDC.put("genomeId", genomeId);
    }

    public static void setSlot(int slot) {
        MDC.put("slot", String.valueOf(slot));
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("generation");
        MDC.remove("genomeId");
        MDC.remove("slot");
    }
}
