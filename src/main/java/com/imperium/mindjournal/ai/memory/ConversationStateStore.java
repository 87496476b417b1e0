package com.imperium.mindjournal.ai.memory;

import org.springframework.ai.chat.memory.ChatMemoryRepository;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按用户维护的内存对话历史，用于拼装模型 prompt。
 * <p>
 * 与数据库中的 messages 相互独立：清空这里的历史不会删除任何持久化记录。
 * 不变式：会话存在时首条永远是当前 system prompt，清空后只剩这一条；从未开始的用户历史为空。
 * <p>
 * 存储交给 Spring AI 的 {@link ChatMemoryRepository}，以 userId 作为 conversationId；不做窗口截断。
 * <p>
 * 并发：每个用户一把公平锁，同一用户的操作按到达顺序串行，不同用户互不阻塞。
 */
@Component
public class ConversationStateStore {

    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a supportive, empathetic AI therapist. Your role is to help users "
                    + "reflect on their thoughts and feelings in a non-judgmental way. Ask open-ended "
                    + "questions and provide thoughtful responses based on their journal entries.";

    private final ChatMemoryRepository chatMemoryRepository;
    private final String defaultSystemPrompt;

    /** 用户数上限即锁数上限；endSession 时在无人排队的情况下回收 */
    private final Map<String, ReentrantLock> lockByUser = new ConcurrentHashMap<>();

    public ConversationStateStore(ChatMemoryRepository chatMemoryRepository,
            @Value("${app.chat.system-prompt:}") String defaultSystemPrompt) {
        this.chatMemoryRepository = chatMemoryRepository;
        this.defaultSystemPrompt = defaultSystemPrompt == null || defaultSystemPrompt.isBlank()
                ? DEFAULT_SYSTEM_PROMPT
                : defaultSystemPrompt;
    }

    /**
     * (重新)初始化会话，只保留一条 system 记录。多次调用结果相同。
     *
     * @param systemPrompt 为空时使用默认 prompt
     */
    public void startSession(String userId, String systemPrompt) {
        String prompt = systemPrompt == null || systemPrompt.isBlank() ? defaultSystemPrompt : systemPrompt;
        withUserLock(userId, () -> {
            chatMemoryRepository.saveAll(userId, List.of(new SystemMessage(prompt)));
            return null;
        });
    }

    public void startSession(String userId) {
        startSession(userId, null);
    }

    /**
     * 会话不存在时以默认 prompt 创建。
     *
     * @return 本次是否新建了会话
     */
    public boolean ensureSession(String userId) {
        return withUserLock(userId, () -> {
            if (hasSession(userId)) {
                return false;
            }
            startSession(userId, null);
            return true;
        });
    }

    /**
     * 追加一轮；会话不存在时先以默认 prompt 创建。
     */
    public void appendTurn(String userId, MessageType role, String content) {
        Message message = toMessage(role, content);
        withUserLock(userId, () -> {
            ensureSession(userId);
            List<Message> history = new ArrayList<>(chatMemoryRepository.findByConversationId(userId));
            history.add(message);
            chatMemoryRepository.saveAll(userId, history);
            return null;
        });
    }

    /**
     * 返回历史快照（不可变）；从未开始过的用户返回空列表。
     */
    public List<Message> getHistory(String userId) {
        return withUserLock(userId, () -> List.copyOf(chatMemoryRepository.findByConversationId(userId)));
    }

    /** 移除该用户的会话，并回收其锁。 */
    public void endSession(String userId) {
        withUserLock(userId, () -> {
            chatMemoryRepository.deleteByConversationId(userId);
            ReentrantLock lock = lockByUser.get(userId);
            // 嵌套在外层 withUserLock 内时不回收，否则外层持有的锁会脱离映射
            if (lock != null && lock.getHoldCount() == 1 && !lock.hasQueuedThreads()) {
                lockByUser.remove(userId, lock);
            }
            return null;
        });
    }

    /**
     * 截断到首条 system 记录；会话不存在时什么也不做，也不会创建。
     */
    public void clearHistory(String userId) {
        withUserLock(userId, () -> {
            List<Message> history = chatMemoryRepository.findByConversationId(userId);
            if (history.size() > 1) {
                chatMemoryRepository.saveAll(userId, List.of(history.get(0)));
            }
            return null;
        });
    }

    public boolean hasSession(String userId) {
        return withUserLock(userId, () -> !chatMemoryRepository.findByConversationId(userId).isEmpty());
    }

    /**
     * 在持有该用户锁的情况下执行一组操作。锁可重入，action 内可继续调用本类的其他方法。
     */
    public <T> T withUserLock(String userId, Supplier<T> action) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        while (true) {
            ReentrantLock lock = lockByUser.computeIfAbsent(userId, k -> new ReentrantLock(true));
            lock.lock();
            try {
                // 等锁期间该锁可能已被 endSession 回收，此时换用新锁重试
                if (lockByUser.get(userId) != lock) {
                    continue;
                }
                return action.get();
            } finally {
                lock.unlock();
            }
        }
    }

    int lockCount() {
        return lockByUser.size();
    }

    public String defaultSystemPrompt() {
        return defaultSystemPrompt;
    }

    private static Message toMessage(MessageType role, String content) {
        String text = content == null ? "" : content;
        return switch (role) {
            case SYSTEM -> new SystemMessage(text);
            case USER -> new UserMessage(text);
            case ASSISTANT -> new AssistantMessage(text);
            default -> throw new IllegalArgumentException("Unsupported role: " + role);
        };
    }
}
