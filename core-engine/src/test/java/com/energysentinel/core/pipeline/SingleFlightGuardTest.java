package com.energysentinel.core.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SingleFlightGuard}.
 */
class SingleFlightGuardTest {

    private final SingleFlightGuard guard = new SingleFlightGuard();

    @Test
    @DisplayName("Should reject a second acquire of the same job id")
    void shouldRejectConcurrentRun() {
        guard.acquire("daily");

        assertThatThrownBy(() -> guard.acquire("daily"))
                .isInstanceOf(CycleAlreadyRunningException.class)
                .hasMessageContaining("daily");
        assertThat(guard.isRunning("daily")).isTrue();
    }

    @Test
    @DisplayName("Should let different job ids run side by side")
    void shouldAllowDifferentJobs() {
        guard.acquire("retrain");
        guard.acquire("detect");

        assertThat(guard.isRunning("retrain")).isTrue();
        assertThat(guard.isRunning("detect")).isTrue();
    }

    @Test
    @DisplayName("Should allow a new run once released")
    void shouldAllowRunAfterRelease() {
        guard.acquire("daily");
        guard.release("daily");

        guard.acquire("daily");

        assertThat(guard.isRunning("daily")).isTrue();
    }
}
