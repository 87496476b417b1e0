package com.imperium.mindjournal.ai.orchestrator;

/**
 * 调用方输入不满足约束（空消息、超长等），在任何后端或持久化操作之前拒绝。
 */
public class ChatValidationException extends RuntimeException {

    private final String field;

    public ChatValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
