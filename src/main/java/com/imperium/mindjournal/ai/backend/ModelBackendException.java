package com.imperium.mindjournal.ai.backend;

/**
 * 模型后端调用失败的基类。子类区分不可达、拉取失败、超时与协议错误。
 */
public abstract class ModelBackendException extends RuntimeException {

    protected ModelBackendException(String message) {
        super(message);
    }

    protected ModelBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
