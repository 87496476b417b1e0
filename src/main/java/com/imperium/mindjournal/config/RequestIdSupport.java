package com.imperium.mindjournal.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 请求 ID：优先沿用调用方传入的 X-Request-Id，否则生成 req_ 前缀的短 ID。
 */
public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    /** 只接受可安全写入日志和响应头的 ID */
    private static final Pattern ACCEPTED = Pattern.compile("^[A-Za-z0-9_.-]{1,64}$");

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /** 调用方提供的 ID 合法则沿用，否则生成新的 */
    public static String acceptOrGenerate(String provided) {
        if (provided != null && ACCEPTED.matcher(provided.trim()).matches()) {
            return provided.trim();
        }
        return newRequestId();
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        if (request.getAttribute(ATTR_REQUEST_ID) instanceof String value && !value.isBlank()) {
            return value;
        }
        String id = acceptOrGenerate(request.getHeader(HEADER_REQUEST_ID));
        request.setAttribute(ATTR_REQUEST_ID, id);
        return id;
    }
}
