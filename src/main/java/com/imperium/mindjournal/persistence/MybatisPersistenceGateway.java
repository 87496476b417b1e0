package com.imperium.mindjournal.persistence;

import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.model.entity.JournalEntry;
import com.imperium.mindjournal.model.entity.Message;
import com.imperium.mindjournal.service.ConversationService;
import com.imperium.mindjournal.service.JournalEntryService;
import com.imperium.mindjournal.service.MessageService;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于 MyBatis-Plus 的持久化实现。
 */
@Component
public class MybatisPersistenceGateway implements PersistenceGateway {

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final JournalEntryService journalEntryService;
    private final Clock clock;

    /** 消息 created_at 在进程内严格递增，保证同一会话内的顺序稳定 */
    private final AtomicReference<LocalDateTime> lastMessageTime = new AtomicReference<>(LocalDateTime.MIN);

    public MybatisPersistenceGateway(ConversationService conversationService,
            MessageService messageService,
            JournalEntryService journalEntryService,
            Clock clock) {
        this.conversationService = conversationService;
        this.messageService = messageService;
        this.journalEntryService = journalEntryService;
        this.clock = clock;
    }

    @Override
    public List<String> findRecentJournalText(String userId, LocalDateTime since) {
        return journalEntryService.lambdaQuery()
                .eq(JournalEntry::getUserId, userId)
                .ge(JournalEntry::getCreatedAt, since)
                .orderByDesc(JournalEntry::getCreatedAt)
                .list()
                .stream()
                .map(JournalEntry::getContent)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public Optional<Conversation> findActiveConversation(String userId) {
        Conversation conversation = conversationService.lambdaQuery()
                .eq(Conversation::getUserId, userId)
                .eq(Conversation::getArchived, false)
                .orderByDesc(Conversation::getUpdatedAt)
                .orderByDesc(Conversation::getCreatedAt)
                .last("LIMIT 1")
                .one();
        return Optional.ofNullable(conversation);
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversationService.getById(conversationId));
    }

    @Override
    public long countConversations(String userId) {
        return conversationService.lambdaQuery()
                .eq(Conversation::getUserId, userId)
                .count();
    }

    @Override
    public Conversation createConversation(String userId, String title) {
        LocalDateTime now = LocalDateTime.now(clock);
        Conversation conversation = new Conversation();
        conversation.setId(newId("c_"));
        conversation.setUserId(userId);
        conversation.setTitle(title);
        conversation.setArchived(false);
        conversation.setCreatedAt(now);
        conversation.setUpdatedAt(now);
        conversationService.save(conversation);
        return conversation;
    }

    @Override
    public Message createMessage(String conversationId, String role, String content) {
        return createMessage(conversationId, role, content, Map.of());
    }

    @Override
    public Message createMessage(String conversationId, String role, String content, Map<String, Object> metadata) {
        Message message = new Message();
        message.setId(newId("msg_"));
        message.setConversationId(conversationId);
        message.setRole(role);
        message.setContent(content);
        message.setMetadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>());
        message.setCreatedAt(nextMessageTime());
        messageService.save(message);
        return message;
    }

    @Override
    public void touchConversation(String conversationId) {
        conversationService.lambdaUpdate()
                .set(Conversation::getUpdatedAt, LocalDateTime.now(clock))
                .eq(Conversation::getId, conversationId)
                .update();
    }

    @Override
    public void assignTitle(String conversationId, String title) {
        conversationService.lambdaUpdate()
                .set(Conversation::getTitle, title)
                .eq(Conversation::getId, conversationId)
                .and(w -> w.isNull(Conversation::getTitle).or().eq(Conversation::getTitle, ""))
                .update();
    }

    @Override
    public void setArchived(String conversationId, boolean archived) {
        conversationService.lambdaUpdate()
                .set(Conversation::getArchived, archived)
                .eq(Conversation::getId, conversationId)
                .update();
    }

    private LocalDateTime nextMessageTime() {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        return lastMessageTime.updateAndGet(last -> now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS));
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
