package com.imperium.mindjournal.ai.orchestrator;

import com.imperium.mindjournal.model.entity.Conversation;
import com.imperium.mindjournal.model.entity.Message;
import com.imperium.mindjournal.persistence.PersistenceGateway;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 编排测试用的内存持久化，时间由测试显式推进。
 */
class InMemoryPersistenceGateway implements PersistenceGateway {

	record JournalText(String userId, String content, LocalDateTime createdAt) {
	}

	final Map<String, Conversation> conversations = new LinkedHashMap<>();
	final List<Message> messages = new ArrayList<>();
	final List<JournalText> journal = new ArrayList<>();

	private final AtomicInteger ids = new AtomicInteger();
	private LocalDateTime now = LocalDateTime.of(2026, 3, 10, 9, 0);

	/** 设为 true 时 createMessage 对 assistant 角色抛异常 */
	boolean failAssistantWrites;

	LocalDateTime now() {
		return now;
	}

	private LocalDateTime tick() {
		now = now.plusSeconds(1);
		return now;
	}

	void addJournal(String userId, String content, LocalDateTime createdAt) {
		journal.add(new JournalText(userId, content, createdAt));
	}

	List<Message> messagesOf(String conversationId, String role) {
		return messages.stream()
				.filter(m -> m.getConversationId().equals(conversationId))
				.filter(m -> role == null || role.equals(m.getRole()))
				.collect(Collectors.toList());
	}

	@Override
	public List<String> findRecentJournalText(String userId, LocalDateTime since) {
		return journal.stream()
				.filter(j -> j.userId().equals(userId) && !j.createdAt().isBefore(since))
				.sorted(Comparator.comparing(JournalText::createdAt).reversed())
				.map(JournalText::content)
				.collect(Collectors.toList());
	}

	@Override
	public Optional<Conversation> findActiveConversation(String userId) {
		return conversations.values().stream()
				.filter(c -> c.getUserId().equals(userId) && !c.getArchived())
				.max(Comparator.comparing(Conversation::getUpdatedAt));
	}

	@Override
	public Optional<Conversation> findConversation(String conversationId) {
		return Optional.ofNullable(conversations.get(conversationId));
	}

	@Override
	public long countConversations(String userId) {
		return conversations.values().stream().filter(c -> c.getUserId().equals(userId)).count();
	}

	@Override
	public Conversation createConversation(String userId, String title) {
		LocalDateTime at = tick();
		Conversation c = new Conversation();
		c.setId("c_" + ids.incrementAndGet());
		c.setUserId(userId);
		c.setTitle(title);
		c.setArchived(false);
		c.setCreatedAt(at);
		c.setUpdatedAt(at);
		conversations.put(c.getId(), c);
		return c;
	}

	@Override
	public Message createMessage(String conversationId, String role, String content) {
		return createMessage(conversationId, role, content, Map.of());
	}

	@Override
	public Message createMessage(String conversationId, String role, String content, Map<String, Object> metadata) {
		if (failAssistantWrites && Message.ROLE_ASSISTANT.equals(role)) {
			throw new IllegalStateException("database is read-only");
		}
		Message m = new Message();
		m.setId("msg_" + ids.incrementAndGet());
		m.setConversationId(conversationId);
		m.setRole(role);
		m.setContent(content);
		m.setMetadata(new HashMap<>(metadata));
		m.setCreatedAt(tick());
		messages.add(m);
		return m;
	}

	@Override
	public void touchConversation(String conversationId) {
		conversations.get(conversationId).setUpdatedAt(tick());
	}

	@Override
	public void assignTitle(String conversationId, String title) {
		Conversation c = conversations.get(conversationId);
		if (c.getTitle() == null || c.getTitle().isBlank()) {
			c.setTitle(title);
		}
	}

	@Override
	public void setArchived(String conversationId, boolean archived) {
		Objects.requireNonNull(conversations.get(conversationId)).setArchived(archived);
	}
}
