package com.metering.fetch.jobs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofMinutes(5));

    @ParameterizedTest(name = "retry {0} waits {1} ms")
    @CsvSource({
        "0, 1000",
        "1, 2000",
        "2, 4000",
        "8, 256000",
        "9, 300000",
        "40, 300000"
    })
    @DisplayName("Should double per retry up to the cap")
    void testExponentialWithCap(int retryCount, long expectedMillis) {
        assertThat(policy.delayFor(retryCount)).isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    @DisplayName("Should treat a negative retry count as the first retry")
    void testNegativeRetryCount() {
        assertThat(policy.delayFor(-1)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should allow a zero base delay")
    void testZeroBase() {
        assertThat(new BackoffPolicy(Duration.ZERO, Duration.ZERO).delayFor(3)).isZero();
    }

    @Test
    @DisplayName("Should reject negative delays")
    void testNegativeDelays() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(-1), Duration.ofMinutes(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
