package com.easybuild.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing EasyBuild-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRelease(String projectName) {
        MDC.put("project", projectName);
    }

    public static void setStage(String projectName, String stage) {
        MDC.put("project", projectName);
        MDC.put("releaseStage", stage);
    }

    public static void clear() {
        MDC.remove("project");
        MDC.remove("releaseStage");
    }
}
