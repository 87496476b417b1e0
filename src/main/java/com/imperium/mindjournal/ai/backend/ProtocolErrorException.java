package com.imperium.mindjournal.ai.backend;

/**
 * 模型服务返回的报文结构不符合预期（非 JSON、缺少字段等）。
 */
public class ProtocolErrorException extends ModelBackendException {

    public ProtocolErrorException(String message) {
        super(message);
    }

    public ProtocolErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
