package com.imperium.mindjournal.ai.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Ollama REST API 的模型后端客户端。
 * <p>
 * 接口：/api/version（探活）、/api/tags（模型列表）、/api/pull（NDJSON 进度流）、/api/chat（非流式推理）。
 * 传输层异常统一转换为 {@link ModelBackendException} 的子类。
 */
@Service
public class OllamaModelBackendClient implements ModelBackendClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelBackendClient.class);

    private static final String LATEST_TAG = ":latest";
    private static final String PULL_SUCCESS = "success";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final boolean verifyOnFirstUse;

    private final AtomicBoolean verified = new AtomicBoolean(false);
    private final Object verifyLock = new Object();

    public OllamaModelBackendClient(RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${app.llm.base-url:http://localhost:11434}") String baseUrl,
            @Value("${app.llm.model:phi3}") String model,
            @Value("${app.llm.verify-on-first-use:true}") boolean verifyOnFirstUse) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.model = model;
        this.verifyOnFirstUse = verifyOnFirstUse;
    }

    // ==================== 可用性 ====================

    @Override
    public void checkAvailability() {
        String version = fetchVersion();
        log.info("Connected to Ollama server at {} (version: {})", baseUrl, version);

        List<String> models = listModels();
        log.info("Available models: {}", models);

        if (!containsModel(models)) {
            log.info("Model {} not found, pulling from Ollama...", model);
            pullModel();
            log.info("Model {} pulled", model);
        }
        verified.set(true);
    }

    @Override
    public void ensureAvailable() {
        if (!verifyOnFirstUse || verified.get()) {
            return;
        }
        synchronized (verifyLock) {
            if (!verified.get()) {
                checkAvailability();
            }
        }
    }

    private String fetchVersion() {
        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url("/api/version"), String.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            throw new BackendUnavailableException(
                    "Ollama server returned status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new BackendUnavailableException("Failed to connect to Ollama server at " + baseUrl, e);
        }
        if (body == null) {
            return "unknown";
        }
        // 新版本返回 {"version":"x.y.z"}，旧版本可能是纯文本
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.hasNonNull("version")) {
                return node.get("version").asText();
            }
        } catch (JsonProcessingException ignored) {
            // 非 JSON，按纯文本处理
        }
        return body.trim();
    }

    private List<String> listModels() {
        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url("/api/tags"), String.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            throw new BackendUnavailableException(
                    "Failed to list models, status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new BackendUnavailableException("Failed to list models at " + baseUrl, e);
        }
        if (body == null || body.isBlank()) {
            throw new ProtocolErrorException("Empty model listing from Ollama");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolErrorException("Failed to parse Ollama model listing", e);
        }
        JsonNode models = root != null ? root.get("models") : null;
        if (models == null || !models.isArray()) {
            throw new ProtocolErrorException("Model listing lacks a models array");
        }

        List<String> names = new ArrayList<>();
        for (JsonNode m : models) {
            JsonNode name = m.get("name");
            if (name != null && name.isTextual()) {
                names.add(name.asText());
            }
        }
        return names;
    }

    private boolean containsModel(List<String> names) {
        for (String name : names) {
            if (name.equals(model)
                    || name.equals(model + LATEST_TAG)
                    || model.equals(name + LATEST_TAG)) {
                return true;
            }
        }
        return false;
    }

    private void pullModel() {
        Boolean success;
        try {
            success = restTemplate.execute(url("/api/pull"), HttpMethod.POST,
                    request -> {
                        request.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                        request.getBody().write(objectMapper.writeValueAsBytes(
                                Map.of("name", model, "stream", true)));
                    },
                    this::readPullProgress);
        } catch (ModelProvisionFailedException e) {
            throw e;
        } catch (RestClientException e) {
            throw new ModelProvisionFailedException("Failed to pull model " + model, e);
        }
        if (!Boolean.TRUE.equals(success)) {
            throw new ModelProvisionFailedException("Pull of model " + model + " ended without success");
        }
    }

    /** 逐行读取 pull 的进度流；遇到 error 行立即失败。 */
    private Boolean readPullProgress(ClientHttpResponse response) throws IOException {
        boolean success = false;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    throw new ModelProvisionFailedException("Malformed pull progress line for model " + model, e);
                }
                if (node.hasNonNull("error")) {
                    throw new ModelProvisionFailedException(
                            "Failed to pull model " + model + ": " + node.get("error").asText());
                }
                JsonNode status = node.get("status");
                if (status != null) {
                    log.info("Pull {}: {}", model, status.asText());
                    if (PULL_SUCCESS.equals(status.asText())) {
                        success = true;
                    }
                }
            }
        }
        return success;
    }

    // ==================== 推理 ====================

    @Override
    public String infer(List<Message> history, Duration timeout) {
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(timeout, "timeout");
        byte[] payload = buildChatPayload(history);

        long startMs = System.currentTimeMillis();
        String reply = Mono.fromCallable(() -> postChat(payload, timeout))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new InferenceTimeoutException(timeout, e))
                .block();
        log.debug("Inference completed: model={}, turns={}, latencyMs={}",
                model, history.size(), System.currentTimeMillis() - startMs);
        return reply;
    }

    private String postChat(byte[] payload, Duration timeout) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(URI.create(url("/api/chat")), HttpMethod.POST,
                    new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientResponseException e) {
            throw new BackendUnavailableException(
                    "Ollama chat returned status " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            if (isReadTimeout(e)) {
                throw new InferenceTimeoutException(timeout, e);
            }
            throw new BackendUnavailableException("Failed to reach Ollama chat endpoint at " + baseUrl, e);
        } catch (RestClientException e) {
            throw new BackendUnavailableException("Ollama chat call failed", e);
        }
        return extractReply(response.getBody());
    }

    private String extractReply(String body) {
        if (body == null || body.isBlank()) {
            throw new ProtocolErrorException("Empty chat response from Ollama");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolErrorException("Chat response is not valid JSON", e);
        }
        JsonNode content = root.path("message").path("content");
        if (!content.isTextual()) {
            throw new ProtocolErrorException("Chat response lacks message.content");
        }
        return content.asText();
    }

    private byte[] buildChatPayload(List<Message> history) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        ArrayNode messages = root.putArray("messages");
        for (Message m : history) {
            ObjectNode node = messages.addObject();
            node.put("role", m.getMessageType().getValue());
            node.put("content", m.getText());
        }
        root.put("stream", false);
        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new ProtocolErrorException("Failed to encode chat request", e);
        }
    }

    // ==================== 工具方法 ====================

    @Override
    public String modelName() {
        return model;
    }

    private String url(String path) {
        return baseUrl + path;
    }

    private static boolean isReadTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String stripTrailingSlash(String url) {
        String v = url == null ? "" : url.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }
}
