package com.imperium.mindjournal.ai.orchestrator;

/**
 * 对话请求处理失败。对外只暴露稳定的 {@link Reason}，原始异常仅用于日志。
 */
public class ChatProcessingException extends RuntimeException {

    public enum Reason {
        /** 模型服务不可达或超时，稍后重试即可 */
        BACKEND_UNAVAILABLE,
        /** 其他处理失败 */
        PROCESSING_FAILED
    }

    private final Reason reason;

    public ChatProcessingException(Reason reason, Throwable cause) {
        super("Chat processing failed: " + reason, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
