package com.imperium.mindjournal.ai.backend;

import java.time.Duration;

/**
 * 推理调用超过等待上限。
 */
public class InferenceTimeoutException extends ModelBackendException {

    private final Duration timeout;

    public InferenceTimeoutException(Duration timeout, Throwable cause) {
        super("Inference did not complete within " + timeout.toMillis() + " ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
