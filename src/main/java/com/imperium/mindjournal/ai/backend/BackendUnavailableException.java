package com.imperium.mindjournal.ai.backend;

/**
 * 模型服务不可达：连接失败、传输中断或返回非 2xx 状态。
 */
public class BackendUnavailableException extends ModelBackendException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
