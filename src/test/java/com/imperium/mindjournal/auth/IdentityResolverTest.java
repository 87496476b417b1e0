package com.imperium.mindjournal.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.imperium.mindjournal.model.entity.User;
import com.imperium.mindjournal.service.UserService;
import java.time.LocalDateTime;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class IdentityResolverTest {

	@Autowired
	private IdentityResolver resolver;

	@Autowired
	private UserService userService;

	private String suffix;
	private User saved;

	@BeforeEach
	void setup() {
		suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
		saved = new User();
		saved.setId("u_" + suffix);
		saved.setUsername("Riley_" + suffix);
		saved.setEmail("Riley." + suffix + "@Example.com");
		saved.setPasswordHash("$2a$10$unused");
		saved.setStatus("active");
		saved.setCreatedAt(LocalDateTime.now());
		saved.setUpdatedAt(LocalDateTime.now());
		userService.save(saved);
	}

	@Test
	void emailLookupIgnoresCase() {
		assertThat(resolver.resolve("riley." + suffix + "@example.COM"))
				.map(User::getId)
				.contains(saved.getId());
	}

	@Test
	void usernameLookupIgnoresCase() {
		assertThat(resolver.resolve("  RILEY_" + suffix + " "))
				.map(User::getId)
				.contains(saved.getId());
	}

	@Test
	void emailIsNotMatchedAgainstUsername() {
		// 含 @ 的标识只按邮箱匹配
		assertThat(resolver.resolve("riley_" + suffix + "@nowhere.test")).isEmpty();
	}

	@Test
	void unknownOrBlankIdentifierResolvesToNothing() {
		assertThat(resolver.resolve("nobody_" + suffix)).isEmpty();
		assertThat(resolver.resolve(" ")).isEmpty();
		assertThat(resolver.resolve(null)).isEmpty();
	}

	@Test
	void classifiesIdentifierByAtSign() {
		assertThat(IdentityResolver.isEmail("a@b.c")).isTrue();
		assertThat(IdentityResolver.isEmail("alice")).isFalse();
	}
}
