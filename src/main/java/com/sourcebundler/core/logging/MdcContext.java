package com.sourcebundler.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing bundler MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setEntry(String displayPath) {
        MDC.put("entry", displayPath);
    }

    public static void clearEntry() {
        MDC.remove("entry");
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("entry");
    }
}
