package com.retrywrap.core.backoff;

import com.retrywrap.model.RetryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExponentialJitterBackoffPolicyTest {

    private final ExponentialJitterBackoffPolicy policy = new ExponentialJitterBackoffPolicy();

    @ParameterizedTest(name = "attempt {0} -> {1} ms")
    @CsvSource({"0, 100", "1, 200", "2, 400", "3, 800"})
    @DisplayName("Should grow geometrically from the base interval")
    void shouldGrowGeometrically(int attemptIndex, double expected) {
        RetryConfig config = RetryConfig.builder().baseIntervalMs(100L).backoffFactor(2.0).build();

        assertThat(policy.delayMillis(attemptIndex, config)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should cap each delay at the max interval")
    void shouldCapAtMaxInterval() {
        RetryConfig config = RetryConfig.builder()
                .baseIntervalMs(1000L).backoffFactor(3.0).maxIntervalMs(2000L).build();

        assertThat(policy.delayMillis(0, config)).isEqualTo(1000.0);
        assertThat(policy.delayMillis(1, config)).isEqualTo(2000.0);
        assertThat(policy.delayMillis(2, config)).isEqualTo(2000.0);
    }

    @Test
    @DisplayName("Should return zero for a zero base interval regardless of factor")
    void shouldReturnZeroForZeroBase() {
        RetryConfig config = RetryConfig.builder()
                .baseIntervalMs(0L).backoffFactor(10.0).jitterEnabled(true).build();

        assertThat(policy.delayMillis(0, config)).isZero();
        assertThat(policy.delayMillis(5, config)).isZero();
    }

    @Test
    @DisplayName("Should scale by the injected jitter factor within [0.8, 1.2)")
    void shouldApplyInjectedJitter() {
        RetryConfig config = RetryConfig.builder().baseIntervalMs(1000L).jitterEnabled(true).build();

        assertThat(new ExponentialJitterBackoffPolicy(() -> 0.0).delayMillis(0, config)).isCloseTo(800.0, within(1e-9));
        assertThat(new ExponentialJitterBackoffPolicy(() -> 0.5).delayMillis(1, config)).isCloseTo(2000.0, within(1e-9));
        assertThat(new ExponentialJitterBackoffPolicy(() -> 0.999).delayMillis(0, config)).isLessThan(1200.0);
    }

    @Test
    @DisplayName("Should cap after jitter is applied")
    void shouldCapAfterJitter() {
        RetryConfig config = RetryConfig.builder()
                .baseIntervalMs(1000L).maxIntervalMs(900L).jitterEnabled(true).build();

        // 1000 * 0.8 = 800 未超上限
        assertThat(new ExponentialJitterBackoffPolicy(() -> 0.0).delayMillis(0, config)).isCloseTo(800.0, within(1e-9));
        // 1000 * 1.1 = 1100 封顶
        assertThat(new ExponentialJitterBackoffPolicy(() -> 0.75).delayMillis(0, config)).isEqualTo(900.0);
    }

    @Test
    @DisplayName("Should not consume randomness when jitter is disabled")
    void shouldNotDrawRandomWithoutJitter() {
        RetryConfig config = RetryConfig.builder().baseIntervalMs(100L).build();
        ExponentialJitterBackoffPolicy strict = new ExponentialJitterBackoffPolicy(() -> {
            throw new AssertionError("random drawn");
        });

        assertThat(strict.delayMillis(2, config)).isEqualTo(400.0);
    }

    @RepeatedTest(50)
    void shouldKeepRandomJitterWithinBounds() {
        RetryConfig config = RetryConfig.builder().baseIntervalMs(500L).backoffFactor(2.0).jitterEnabled(true).build();

        double delay = policy.delayMillis(1, config);

        assertThat(delay).isGreaterThanOrEqualTo(800.0).isLessThan(1200.0);
    }

    @Test
    void shouldNotOverflowForHugeExponents() {
        RetryConfig uncapped = RetryConfig.builder().baseIntervalMs(1000L).backoffFactor(10.0).build();
        RetryConfig capped = RetryConfig.builder().baseIntervalMs(1000L).backoffFactor(10.0).maxIntervalMs(5000L).build();

        assertThat(policy.delayMillis(400, uncapped)).isEqualTo((double) Long.MAX_VALUE);
        assertThat(policy.delayMillis(400, capped)).isEqualTo(5000.0);
    }
}
