package com.energysentinel.core.detection;

import com.energysentinel.core.config.DetectorSettings;
import com.energysentinel.core.model.TestWindows;
import com.energysentinel.core.model.TimeSeriesWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MovingAverageDetector}.
 */
class MovingAverageDetectorTest {

    private static DetectorSettings windowOf(int size) {
        DetectorSettings settings = DetectorSettings.ofType("moving_average");
        settings.setWindowSize(size);
        return settings;
    }

    @Test
    @DisplayName("Should flag a jump away from the trailing mean")
    void shouldFlagJump() {
        TimeSeriesWindow window = TestWindows.minutely(TestWindows.START, 15, i -> i == 10 ? 2.0 : 1.0);

        DetectorResult result = new MovingAverageDetector(windowOf(5)).detect(window);

        assertThat(result.getFlagged()).containsExactly(TestWindows.START.plusMinutes(10));
    }

    @Test
    @DisplayName("Should not evaluate points before the window fills")
    void shouldSkipWarmUp() {
        TimeSeriesWindow window = TestWindows.minutely(TestWindows.START, 15, i -> i == 1 ? 5.0 : 1.0);

        DetectorResult result = new MovingAverageDetector(windowOf(5)).detect(window);

        // the spike is only inside the window for indices 4 and 5, where 1.0 deviates by 0.44
        assertThat(result.getEvaluatedCount()).isEqualTo(11);
        assertThat(result.isFlagged(TestWindows.START.plusMinutes(1))).isFalse();
        assertThat(result.getFlagged()).containsExactly(
                TestWindows.START.plusMinutes(4), TestWindows.START.plusMinutes(5));
    }

    @Test
    @DisplayName("Should flag any non-zero value when the moving average is zero")
    void shouldFlagAgainstZeroAverage() {
        double[] values = {-1, 1, -1, 1, 0, 2};
        TimeSeriesWindow window = TestWindows.minutely(TestWindows.START, values.length, i -> values[i]);

        DetectorResult result = new MovingAverageDetector(windowOf(2)).detect(window);

        // averages: 0, 0, 0, 0.5, 1 at indices 1..5
        assertThat(result.isFlagged(TestWindows.START.plusMinutes(1))).isTrue();
        assertThat(result.isFlagged(TestWindows.START.plusMinutes(3))).isTrue();
        assertThat(result.isFlagged(TestWindows.START.plusMinutes(4))).isTrue();
        assertThat(result.isFlagged(TestWindows.START.plusMinutes(5))).isTrue();
    }

    @Test
    @DisplayName("Should reject a window of one reading")
    void shouldRejectTinyWindow() {
        assertThatThrownBy(() -> new MovingAverageDetector(windowOf(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
