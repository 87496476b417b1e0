package com.imperium.mindjournal.ai.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 启动时检查模型服务。
 * <p>
 * 模型拉取失败或协议错误视为配置错误，直接中止启动；服务暂时不可达时只记录告警，
 * 首次对话请求会再次检查。
 */
@Component
@ConditionalOnProperty(name = "app.llm.check-on-startup", havingValue = "true", matchIfMissing = true)
public class ModelAvailabilityRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelAvailabilityRunner.class);

    private final ModelBackendClient modelBackendClient;

    public ModelAvailabilityRunner(ModelBackendClient modelBackendClient) {
        this.modelBackendClient = modelBackendClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            modelBackendClient.checkAvailability();
            log.info("Model {} is ready", modelBackendClient.modelName());
        } catch (BackendUnavailableException e) {
            log.warn("Ollama is not reachable at startup, continuing degraded: {}", e.getMessage());
        }
    }
}
