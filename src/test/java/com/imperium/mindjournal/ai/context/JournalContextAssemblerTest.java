package com.imperium.mindjournal.ai.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.imperium.mindjournal.persistence.PersistenceGateway;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JournalContextAssemblerTest {

	private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 10, 21, 30);

	private PersistenceGateway gateway;
	private JournalContextAssembler assembler;

	@BeforeEach
	void setup() {
		gateway = mock(PersistenceGateway.class);
		assembler = new JournalContextAssembler(gateway, 3, 3);
	}

	@Test
	void queriesThreeDayWindow() {
		when(gateway.findRecentJournalText(eq("u1"), any())).thenReturn(List.of());

		assembler.assemble("u1", NOW);

		verify(gateway).findRecentJournalText("u1", NOW.minusDays(3));
	}

	@Test
	void emptyWhenNoEntries() {
		when(gateway.findRecentJournalText(eq("u1"), any())).thenReturn(List.of());

		assertThat(assembler.assemble("u1", NOW)).isEmpty();
	}

	@Test
	void keepsThreeNewestInGivenOrder() {
		when(gateway.findRecentJournalText(eq("u1"), any()))
				.thenReturn(List.of("today", "yesterday", "two days ago", "three days ago", "older"));

		Optional<String> context = assembler.assemble("u1", NOW);

		assertThat(context).contains("today\nyesterday\ntwo days ago");
	}

	@Test
	void singleEntryIsUsedAsIs() {
		when(gateway.findRecentJournalText(eq("u1"), any())).thenReturn(List.of("Felt calm after a walk."));

		assertThat(assembler.assemble("u1", NOW)).contains("Felt calm after a walk.");
	}

	@Test
	void blankEntriesAreSkipped() {
		when(gateway.findRecentJournalText(eq("u1"), any()))
				.thenReturn(Arrays.asList("  ", "slept badly", null, "argued with my sister"));

		assertThat(assembler.assemble("u1", NOW)).contains("slept badly\nargued with my sister");
	}

	@Test
	void onlyBlankEntriesMeansNoContext() {
		when(gateway.findRecentJournalText(eq("u1"), any())).thenReturn(List.of("", "   "));

		assertThat(assembler.assemble("u1", NOW)).isEmpty();
	}

	@Test
	void configuredLimitsApply() {
		JournalContextAssembler wide = new JournalContextAssembler(gateway, 7, 1);
		when(gateway.findRecentJournalText(eq("u1"), any())).thenReturn(List.of("a", "b"));

		assertThat(wide.assemble("u1", NOW)).contains("a");
		verify(gateway).findRecentJournalText("u1", NOW.minusDays(7));
	}

	@Test
	void zeroEntriesDisablesLookup() {
		JournalContextAssembler disabled = new JournalContextAssembler(gateway, 3, 0);

		assertThat(disabled.assemble("u1", NOW)).isEmpty();
		verify(gateway, never()).findRecentJournalText(any(), any());
	}
}
