package com.metering.fetch.routing;

import com.metering.fetch.domain.RouteType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RequestRouter Tests")
class RequestRouterTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private final RequestRouter router = new RequestRouter(100, 1_000, 100_000);

    @Nested
    @DisplayName("Size estimation")
    class Estimation {

        @Test
        @DisplayName("Should multiply points, days and samples per day")
        void testWholeDays() {
            assertThat(router.estimateSamples(5, START, START.plus(Duration.ofDays(2)))).isEqualTo(1_000);
        }

        @Test
        @DisplayName("Should count fractional days")
        void testFractionalDays() {
            // 1 point * 0.5 day * 100
            assertThat(router.estimateSamples(1, START, START.plus(Duration.ofHours(12)))).isEqualTo(50);
        }

        @Test
        @DisplayName("Should estimate zero for an empty or inverted range")
        void testEmptyRange() {
            assertThat(router.estimateSamples(3, START, START)).isZero();
            assertThat(router.estimateSamples(3, START, START.minusSeconds(60))).isZero();
        }

        @Test
        @DisplayName("Should estimate zero without points")
        void testNoPoints() {
            assertThat(router.estimateSamples(0, START, START.plus(Duration.ofDays(1)))).isZero();
        }
    }

    @Nested
    @DisplayName("Route selection")
    class Routing {

        @ParameterizedTest(name = "estimate {0} -> {1}")
        @CsvSource({
            "0, DIRECT",
            "999, DIRECT",
            "1000, CACHED",
            "99999, CACHED",
            "100000, QUEUED",
            "5000000, QUEUED"
        })
        @DisplayName("Should apply strict lower thresholds")
        void testThresholdBoundaries(long estimate, RouteType expected) {
            assertThat(router.routeFor(estimate)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should queue a 10 point, 100 day request")
        void testLargeRequest() {
            RoutingDecision decision = router.decide(10, START, START.plus(Duration.ofDays(100)), null);

            assertThat(decision.estimatedSamples()).isEqualTo(100_000);
            assertThat(decision.route()).isEqualTo(RouteType.QUEUED);
            assertThat(decision.overridden()).isFalse();
        }

        @Test
        @DisplayName("Should honour an explicit override regardless of size")
        void testOverride() {
            RoutingDecision decision = router.decide(10, START, START.plus(Duration.ofDays(100)), RouteType.DIRECT);

            assertThat(decision.route()).isEqualTo(RouteType.DIRECT);
            assertThat(decision.overridden()).isTrue();
            assertThat(decision.estimatedSamples()).isEqualTo(100_000);
        }
    }

    @Test
    @DisplayName("Should reject inverted thresholds")
    void testInvalidThresholds() {
        assertThatThrownBy(() -> new RequestRouter(100, 5_000, 1_000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid thresholds");
    }
}
