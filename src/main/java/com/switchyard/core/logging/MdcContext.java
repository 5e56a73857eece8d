package com.switchyard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchyard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setInvocation(String tool, String fingerprint) {
        MDC.put("tool", tool);
        MDC.put("fingerprint", shorten(fingerprint));
    }

    public static void setJob(String jobId, String tool, String fingerprint) {
        MDC.put("jobId", jobId);
        setInvocation(tool, fingerprint);
    }

    public static void clear() {
        MDC.remove("tool");
        MDC.remove("fingerprint");
        MDC.remove("jobId");
    }

    /** First 12 hex chars are enough to correlate log lines. */
    static String shorten(String fingerprint) {
        if (fingerprint == null) {
            return null;
        }
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
