package com.imperium.mindjournal.ai.backend;

/**
 * 配置的模型不存在且拉取失败。启动检查时视为配置错误。
 */
public class ModelProvisionFailedException extends ModelBackendException {

    public ModelProvisionFailedException(String message) {
        super(message);
    }

    public ModelProvisionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
