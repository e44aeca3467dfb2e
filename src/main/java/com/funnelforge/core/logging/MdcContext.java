package com.funnelforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing engine-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId, String taskType, String streamKey) {
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
        MDC.put("streamKey", streamKey);
    }

    public static void setArm(String armId) {
        MDC.put("armId", armId);
    }

    public static void setDecision(String decisionId) {
        MDC.put("decisionId", decisionId);
    }

    public static void clearDecision() {
        MDC.remove("decisionId");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("taskType");
        MDC.remove("streamKey");
        MDC.remove("armId");
        MDC.remove("decisionId");
    }
}
