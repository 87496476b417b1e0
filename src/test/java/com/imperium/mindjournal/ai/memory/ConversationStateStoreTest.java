package com.imperium.mindjournal.ai.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.memory.InMemoryChatMemoryRepository;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;

class ConversationStateStoreTest {

	private ConversationStateStore store;

	@BeforeEach
	void setup() {
		store = new ConversationStateStore(new InMemoryChatMemoryRepository(), "");
	}

	@Test
	void unknownUserHasEmptyHistory() {
		assertThat(store.getHistory("nobody")).isEmpty();
		assertThat(store.hasSession("nobody")).isFalse();
	}

	@Test
	void startSessionSeedsSingleSystemEntry() {
		store.startSession("u1");

		List<Message> history = store.getHistory("u1");
		assertThat(history).hasSize(1);
		assertThat(history.get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
		assertThat(history.get(0).getText()).isEqualTo(ConversationStateStore.DEFAULT_SYSTEM_PROMPT);
	}

	@Test
	void startSessionTwiceKeepsOneEntry() {
		store.startSession("u1");
		store.appendTurn("u1", MessageType.USER, "hi");
		store.startSession("u1");

		assertThat(store.getHistory("u1")).hasSize(1);
	}

	@Test
	void customPromptOverridesDefault() {
		store.startSession("u1", "Be brief.");

		assertThat(store.getHistory("u1").get(0).getText()).isEqualTo("Be brief.");
	}

	@Test
	void configuredPromptBecomesDefault() {
		ConversationStateStore configured = new ConversationStateStore(new InMemoryChatMemoryRepository(),
				"You are a journaling coach.");
		configured.ensureSession("u1");

		assertThat(configured.defaultSystemPrompt()).isEqualTo("You are a journaling coach.");
		assertThat(configured.getHistory("u1").get(0).getText()).isEqualTo("You are a journaling coach.");
	}

	@Test
	void ensureSessionIsIdempotent() {
		assertThat(store.ensureSession("u1")).isTrue();
		store.appendTurn("u1", MessageType.USER, "hi");

		assertThat(store.ensureSession("u1")).isFalse();
		assertThat(store.getHistory("u1")).hasSize(2);
	}

	@Test
	void appendedPairsGrowHistoryInOrder() {
		store.startSession("u1");
		for (int i = 0; i < 3; i++) {
			store.appendTurn("u1", MessageType.USER, "q" + i);
			store.appendTurn("u1", MessageType.ASSISTANT, "a" + i);
		}

		List<Message> history = store.getHistory("u1");
		assertThat(history).hasSize(1 + 2 * 3);
		assertThat(history.get(1).getMessageType()).isEqualTo(MessageType.USER);
		assertThat(history.get(1).getText()).isEqualTo("q0");
		assertThat(history.get(6).getMessageType()).isEqualTo(MessageType.ASSISTANT);
		assertThat(history.get(6).getText()).isEqualTo("a2");
	}

	@Test
	void appendWithoutSessionCreatesOne() {
		store.appendTurn("u1", MessageType.USER, "hello");

		List<Message> history = store.getHistory("u1");
		assertThat(history).hasSize(2);
		assertThat(history.get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
	}

	@Test
	void clearHistoryKeepsOriginalSystemEntry() {
		store.startSession("u1", "Listen carefully.");
		store.appendTurn("u1", MessageType.USER, "hi");
		store.appendTurn("u1", MessageType.ASSISTANT, "hello");

		store.clearHistory("u1");

		List<Message> history = store.getHistory("u1");
		assertThat(history).hasSize(1);
		assertThat(history.get(0).getText()).isEqualTo("Listen carefully.");
	}

	@Test
	void clearingAbsentSessionDoesNotCreateOne() {
		store.clearHistory("ghost");

		assertThat(store.hasSession("ghost")).isFalse();
		assertThat(store.getHistory("ghost")).isEmpty();
	}

	@Test
	void endSessionForgetsHistory() {
		store.startSession("u1");
		store.endSession("u1");

		assertThat(store.hasSession("u1")).isFalse();
	}

	@Test
	void endSessionReleasesUserLock() {
		store.startSession("u1");
		store.startSession("u2");
		store.endSession("u1");

		assertThat(store.lockCount()).isEqualTo(1);

		store.appendTurn("u1", MessageType.USER, "back again");
		assertThat(store.getHistory("u1")).extracting(Message::getText)
				.containsExactly(ConversationStateStore.DEFAULT_SYSTEM_PROMPT, "back again");
	}

	@Test
	void endSessionInsideHeldLockKeepsLockMapped() {
		store.startSession("u1");
		store.withUserLock("u1", () -> {
			store.endSession("u1");
			store.appendTurn("u1", MessageType.USER, "same lock");
			return null;
		});

		assertThat(store.lockCount()).isEqualTo(1);
		assertThat(store.getHistory("u1")).hasSize(2);
	}

	@Test
	void historyIsKeptInChatMemoryRepository() {
		InMemoryChatMemoryRepository repository = new InMemoryChatMemoryRepository();
		ConversationStateStore backed = new ConversationStateStore(repository, "");
		backed.appendTurn("u1", MessageType.USER, "hi");
		backed.appendTurn("u1", MessageType.ASSISTANT, "hello");

		assertThat(repository.findByConversationId("u1")).extracting(Message::getMessageType)
				.containsExactly(MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT);

		backed.clearHistory("u1");
		assertThat(repository.findByConversationId("u1")).hasSize(1);

		backed.endSession("u1");
		assertThat(repository.findConversationIds()).doesNotContain("u1");
	}

	@Test
	void concurrentEndAndAppendNeverLoseExclusion() throws Exception {
		int rounds = 200;
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < 4; t++) {
				boolean ender = t % 2 == 0;
				futures.add(pool.submit(() -> {
					for (int i = 0; i < rounds; i++) {
						if (ender) {
							store.endSession("u1");
						} else {
							store.appendTurn("u1", MessageType.USER, "x");
						}
					}
					return null;
				}));
			}
			for (Future<?> f : futures) {
				f.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		List<Message> history = store.getHistory("u1");
		if (!history.isEmpty()) {
			assertThat(history.get(0).getMessageType()).isEqualTo(MessageType.SYSTEM);
		}
		assertThat(store.lockCount()).isLessThanOrEqualTo(1);
	}

	@Test
	void historySnapshotIsImmutable() {
		store.startSession("u1");
		List<Message> snapshot = store.getHistory("u1");

		assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
				.isInstanceOf(UnsupportedOperationException.class);
		store.appendTurn("u1", MessageType.USER, "later");
		assertThat(snapshot).hasSize(1);
	}

	@Test
	void blankUserIdIsRejected() {
		assertThatThrownBy(() -> store.startSession(" "))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void concurrentAppendsForOneUserAreAllKept() throws Exception {
		store.startSession("u1");
		int threads = 8;
		int perThread = 50;
		ExecutorService pool = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<?>> futures = new ArrayList<>();
		try {
			for (int t = 0; t < threads; t++) {
				int id = t;
				futures.add(pool.submit(() -> {
					start.await();
					for (int i = 0; i < perThread; i++) {
						store.appendTurn("u1", MessageType.USER, id + ":" + i);
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> f : futures) {
				f.get(10, TimeUnit.SECONDS);
			}
		} finally {
			pool.shutdownNow();
		}

		assertThat(store.getHistory("u1")).hasSize(1 + threads * perThread);
	}

	@Test
	void usersDoNotShareHistory() {
		store.appendTurn("alice", MessageType.USER, "from alice");
		store.appendTurn("bob", MessageType.USER, "from bob");

		assertThat(store.getHistory("alice")).extracting(Message::getText)
				.containsExactly(ConversationStateStore.DEFAULT_SYSTEM_PROMPT, "from alice");
		assertThat(store.getHistory("bob")).extracting(Message::getText)
				.containsExactly(ConversationStateStore.DEFAULT_SYSTEM_PROMPT, "from bob");
	}
}
