package com.imperium.mindjournal.ai.backend;

import org.springframework.ai.chat.messages.Message;

import java.time.Duration;
import java.util.List;

/**
 * 本地 LLM 服务客户端：可用性检查、模型拉取、单次推理。
 * <p>
 * 推理是原子的请求/响应，不做流式输出；客户端不修改传入的历史，结果由调用方自行追加。
 */
public interface ModelBackendClient {

    /**
     * 检查服务是否可达、配置的模型是否存在；模型缺失时拉取并阻塞至完成。
     *
     * @throws BackendUnavailableException   服务不可达
     * @throws ModelProvisionFailedException 模型拉取失败
     * @throws ProtocolErrorException        响应格式不正确
     */
    void checkAvailability();

    /**
     * 本进程内首次使用前执行一次 {@link #checkAvailability()}，成功后不再重复检查。
     */
    void ensureAvailable();

    /**
     * 发送完整的有序对话历史，返回 assistant 回复文本。
     *
     * @param history 有序历史（首条通常为 system）
     * @param timeout 最长等待时间
     * @throws InferenceTimeoutException   超过等待上限
     * @throws BackendUnavailableException 传输失败
     * @throws ProtocolErrorException      响应缺少 message.content
     */
    String infer(List<Message> history, Duration timeout);

    /** 当前配置的模型名 */
    String modelName();
}
