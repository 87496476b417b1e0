package com.imperium.mindjournal.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Ollama HTTP 客户端配置。
 * <p>
 * 读超时只是兜底，单次推理的超时由调用方按 app.llm.inference-timeout 控制；
 * 模型拉取可能持续数分钟，所以读超时要足够长。
 */
@Configuration
public class ModelBackendConfig {

    @Bean
    public RestTemplate modelBackendRestTemplate(
            @Value("${app.llm.connect-timeout:5s}") Duration connectTimeout,
            @Value("${app.llm.read-timeout:10m}") Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplate(factory);
    }
}
