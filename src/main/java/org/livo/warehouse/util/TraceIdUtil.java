package org.livo.warehouse.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Request trace id holder
 * - one id per inbound request, set by {@link org.livo.warehouse.filter.TraceIdFilter}
 * - mirrored into the SLF4J MDC under {@value #MDC_KEY} so every log line carries it
 */
public final class TraceIdUtil {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    /**
     * @return the current trace id, or null outside a request
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
        MDC.remove(MDC_KEY);
    }
}
