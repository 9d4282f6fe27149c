package org.livo.warehouse.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response body shared by every endpoint: {@code code}, {@code message}, optional {@code data}, {@code traceId}.
 */
public final class ResponseUtil {

    public static final String SUCCESS = "SUCCESS";

    private ResponseUtil() {
    }

    public static Map<String, Object> success(String message, Object data) {
        Map<String, Object> response = body(SUCCESS, message);
        if (data != null) {
            response.put("data", data);
        }
        return response;
    }

    public static Map<String, Object> success(String message) {
        return success(message, null);
    }

    public static Map<String, Object> error(String code, String message) {
        return body(code, message);
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("code", code);
        response.put("message", message);
        response.put("traceId", TraceIdUtil.getTraceId());
        return response;
    }
}
