package com.imperium.mindjournal.ai.orchestrator;

import com.imperium.mindjournal.ai.backend.BackendUnavailableException;
import com.imperium.mindjournal.ai.backend.InferenceTimeoutException;
import com.imperium.mindjournal.ai.backend.ModelBackendClient;
import com.imperium.mindjournal.ai.backend.ProtocolErrorException;
import com.imperium.mindjournal.ai.context.JournalContextAssembler;
import com.imperium.mindjournal.ai.memory.ConversationStateStore;
import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.model.entity.Message;
import com.imperium.mindjournal.persistence.PersistenceGateway;
import com.imperium.mindjournal.policy.ChatInputPolicy;
import com.imperium.mindjournal.policy.JournalContextPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 日记陪伴对话编排器。
 * <p>
 * 单次请求：校验 → 解析会话 → 落库用户消息 → 拼装日记上下文 → 确保内存会话 → 推理 → 落库 assistant 回复。
 * <p>
 * 失败策略：已落库的用户消息不回滚（用户自己的话不丢），失败时不写 assistant 消息；
 * 对调用方只抛出带稳定原因的 {@link ChatProcessingException}，内部错误只进日志。本层不重试。
 * <p>
 * 同一用户的整个请求在 {@link ConversationStateStore#withUserLock} 内执行，保证历史按到达顺序变更。
 */
@Service
public class JournalChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JournalChatOrchestrator.class);

    private final PersistenceGateway persistenceGateway;
    private final JournalContextAssembler contextAssembler;
    private final ConversationStateStore stateStore;
    private final ModelBackendClient modelBackendClient;
    private final Clock clock;
    private final Duration inferenceTimeout;

    public JournalChatOrchestrator(PersistenceGateway persistenceGateway,
            JournalContextAssembler contextAssembler,
            ConversationStateStore stateStore,
            ModelBackendClient modelBackendClient,
            Clock clock,
            @Value("${app.llm.inference-timeout:60s}") Duration inferenceTimeout) {
        this.persistenceGateway = persistenceGateway;
        this.contextAssembler = contextAssembler;
        this.stateStore = stateStore;
        this.modelBackendClient = modelBackendClient;
        this.clock = clock;
        this.inferenceTimeout = inferenceTimeout;
    }

    // ==================== 公开入口 ====================

    /**
     * 发送一条用户消息并返回 assistant 回复。
     *
     * @throws ChatValidationException 输入不合法
     * @throws ChatProcessingException 处理失败
     */
    public String chat(String userId, String message) {
        validate(userId, message);
        return stateStore.withUserLock(userId, () -> exchange(userId, message));
    }

    /** 内存中的对话历史（只读快照） */
    public List<org.springframework.ai.chat.messages.Message> getHistory(String userId) {
        return stateStore.getHistory(userId);
    }

    /** 清空内存历史，只保留 system prompt；不影响已持久化的消息 */
    public void clearHistory(String userId) {
        stateStore.clearHistory(userId);
    }

    /**
     * 切换会话的归档状态。
     *
     * @return 切换后的 archived 值
     * @throws ConversationNotFoundException 会话不存在或不属于该用户
     */
    public boolean archiveConversation(String userId, String conversationId) {
        Conversation conversation = persistenceGateway.findConversation(conversationId)
                .filter(c -> Objects.equals(c.getUserId(), userId))
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));
        boolean archived = !Boolean.TRUE.equals(conversation.getArchived());
        persistenceGateway.setArchived(conversationId, archived);
        log.info("Conversation {} {}", conversationId, archived ? "archived" : "unarchived");
        return archived;
    }

    /**
     * 显式创建会话；标题为空时由首条用户消息派生。
     */
    public Conversation createConversation(String userId, String title) {
        String t = title == null || title.isBlank() ? null : title.trim();
        return persistenceGateway.createConversation(userId, t);
    }

    // ==================== 私有：单次交换 ====================

    private String exchange(String userId, String text) {
        // ---------- 1~2. 解析会话 + 落库用户消息 ----------
        Conversation conversation;
        try {
            conversation = resolveConversation(userId);
            persistenceGateway.createMessage(conversation.getId(), Message.ROLE_USER, text);
            if (conversation.getTitle() == null || conversation.getTitle().isBlank()) {
                persistenceGateway.assignTitle(conversation.getId(), deriveTitle(text));
            }
            persistenceGateway.touchConversation(conversation.getId());
        } catch (RuntimeException e) {
            throw failure("user turn persistence", userId, e);
        }

        // ---------- 3~5. 上下文 + 会话 + 推理 ----------
        long startMs = System.currentTimeMillis();
        String context;
        String reply;
        try {
            context = contextAssembler.assemble(userId, LocalDateTime.now(clock)).orElse(null);
            stateStore.ensureSession(userId);
            modelBackendClient.ensureAvailable();

            stateStore.appendTurn(userId, MessageType.USER, text);
            reply = modelBackendClient.infer(buildPrompt(stateStore.getHistory(userId), context), inferenceTimeout);
            if (reply == null) {
                throw new ProtocolErrorException("Model returned no reply");
            }
        } catch (RuntimeException e) {
            throw failure("inference", userId, e);
        }
        long latencyMs = System.currentTimeMillis() - startMs;

        // ---------- 6. 落库 assistant 回复 ----------
        try {
            Map<String, Object> metadata = Map.of(
                    "model", modelBackendClient.modelName(),
                    "latencyMs", latencyMs,
                    "contextApplied", context != null);
            persistenceGateway.createMessage(conversation.getId(), Message.ROLE_ASSISTANT, reply, metadata);
            stateStore.appendTurn(userId, MessageType.ASSISTANT, reply);
            persistenceGateway.touchConversation(conversation.getId());
        } catch (RuntimeException e) {
            throw failure("assistant turn persistence", userId, e);
        }

        log.info("Chat exchange completed: userId={}, conversationId={}, latencyMs={}, contextApplied={}",
                userId, conversation.getId(), latencyMs, context != null);
        return reply;
    }

    private Conversation resolveConversation(String userId) {
        return persistenceGateway.findActiveConversation(userId).orElseGet(() -> {
            long existing = persistenceGateway.countConversations(userId);
            Conversation created = persistenceGateway.createConversation(userId, "Conversation " + (existing + 1));
            log.info("Created conversation {} for user {}", created.getId(), userId);
            return created;
        });
    }

    /**
     * 日记上下文作为第二条 system 记录插在原 system prompt 之后，不与之合并。
     */
    static List<org.springframework.ai.chat.messages.Message> buildPrompt(
            List<org.springframework.ai.chat.messages.Message> history, String context) {
        List<org.springframework.ai.chat.messages.Message> prompt = new ArrayList<>(history);
        if (context != null && !context.isBlank()) {
            prompt.add(Math.min(1, prompt.size()), new SystemMessage(JournalContextPolicy.CONTEXT_PREFIX + context));
        }
        return prompt;
    }

    // ==================== 私有：校验与工具 ====================

    private static void validate(String userId, String message) {
        if (userId == null || userId.isBlank()) {
            throw new ChatValidationException("userId", "userId is required");
        }
        if (message == null || message.isBlank()) {
            throw new ChatValidationException("message", "message is required");
        }
        if (ChatInputPolicy.charCount(message) > ChatInputPolicy.MAX_MESSAGE_CHARS) {
            throw new ChatValidationException("message",
                    "message length must be 1~" + ChatInputPolicy.MAX_MESSAGE_CHARS);
        }
    }

    static String deriveTitle(String text) {
        String normalized = text.strip().replaceAll("\\s+", " ");
        if (ChatInputPolicy.charCount(normalized) <= ChatInputPolicy.DERIVED_TITLE_MAX_CHARS) {
            return normalized;
        }
        return ChatInputPolicy.truncate(normalized, ChatInputPolicy.DERIVED_TITLE_MAX_CHARS).strip() + "...";
    }

    private static ChatProcessingException failure(String stage, String userId, RuntimeException e) {
        ChatProcessingException.Reason reason =
                e instanceof BackendUnavailableException || e instanceof InferenceTimeoutException
                        ? ChatProcessingException.Reason.BACKEND_UNAVAILABLE
                        : ChatProcessingException.Reason.PROCESSING_FAILED;
        log.error("Chat {} failed: userId={}, reason={}", stage, userId, reason, e);
        return new ChatProcessingException(reason, e);
    }
}
