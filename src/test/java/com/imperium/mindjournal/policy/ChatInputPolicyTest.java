package com.imperium.mindjournal.policy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChatInputPolicyTest {

	@Test
	void supplementaryCharactersCountOnce() {
		assertThat(ChatInputPolicy.charCount("😊".repeat(2000))).isEqualTo(2000);
		assertThat(ChatInputPolicy.charCount("abc")).isEqualTo(3);
	}

	@Test
	void truncateKeepsSurrogatePairsWhole() {
		String cut = ChatInputPolicy.truncate("a" + "😊".repeat(10), 5);

		assertThat(cut).isEqualTo("a" + "😊".repeat(4));
		assertThat(Character.isHighSurrogate(cut.charAt(cut.length() - 1))).isFalse();
	}

	@Test
	void shortTextIsReturnedAsIs() {
		assertThat(ChatInputPolicy.truncate("hello", 100)).isEqualTo("hello");
	}
}
