package com.imperium.mindjournal.ai.backend;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class ModelAvailabilityRunnerTest {

	private final ModelBackendClient backend = mock(ModelBackendClient.class);
	private final ModelAvailabilityRunner runner = new ModelAvailabilityRunner(backend);

	@Test
	void checksBackendAtStartup() throws Exception {
		runner.run(new DefaultApplicationArguments());

		verify(backend).checkAvailability();
	}

	@Test
	void unreachableBackendDoesNotAbortStartup() {
		doThrow(new BackendUnavailableException("connection refused")).when(backend).checkAvailability();

		assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
	}

	@Test
	void failedProvisioningAbortsStartup() {
		doThrow(new ModelProvisionFailedException("manifest not found")).when(backend).checkAvailability();

		assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
				.isInstanceOf(ModelProvisionFailedException.class);
	}

	@Test
	void protocolErrorAbortsStartup() {
		doThrow(new ProtocolErrorException("unexpected listing")).when(backend).checkAvailability();

		assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
				.isInstanceOf(ProtocolErrorException.class);
	}
}
