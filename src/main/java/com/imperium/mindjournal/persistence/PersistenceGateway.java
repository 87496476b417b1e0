package com.imperium.mindjournal.persistence;

import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.model.entity.Message;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 对话编排所依赖的持久化能力。
 * <p>
 * 约定：create 类操作返回前已落库；同一进程内读取能看到此前的写入。
 * 编排层不关心背后的存储引擎。
 */
public interface PersistenceGateway {

    /**
     * 查询用户在 since 之后创建的日记正文，按创建时间倒序。
     */
    List<String> findRecentJournalText(String userId, LocalDateTime since);

    /**
     * 用户最近更新的未归档会话。
     */
    Optional<Conversation> findActiveConversation(String userId);

    Optional<Conversation> findConversation(String conversationId);

    /** 用户的会话总数（含已归档），用于自动编号标题 */
    long countConversations(String userId);

    Conversation createConversation(String userId, String title);

    Message createMessage(String conversationId, String role, String content);

    Message createMessage(String conversationId, String role, String content, Map<String, Object> metadata);

    /** 刷新会话的 updated_at */
    void touchConversation(String conversationId);

    /** 仅当会话尚无标题时设置标题 */
    void assignTitle(String conversationId, String title);

    void setArchived(String conversationId, boolean archived);
}
