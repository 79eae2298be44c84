package fr.lapetina.mcs.loadbalancer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendEndpointTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Nested
    @DisplayName("address parsing")
    class AddressParsing {

        @Test
        @DisplayName("should split host and port")
        void shouldSplitHostAndPort() {
            BackendEndpoint backend = BackendEndpoint.of("10.0.0.5:7000");

            assertThat(backend.getHost()).isEqualTo("10.0.0.5");
            assertThat(backend.getPort()).isEqualTo(7000);
            assertThat(backend.getAddress()).isEqualTo("10.0.0.5:7000");
        }

        @Test
        @DisplayName("should accept bracketed IPv6 addresses")
        void shouldAcceptIpv6() {
            BackendEndpoint backend = BackendEndpoint.builder().address("::1", 7000).build();

            assertThat(backend.getAddress()).isEqualTo("[::1]:7000");
            assertThat(backend.getHost()).isEqualTo("::1");
            assertThat(backend.getPort()).isEqualTo(7000);
        }

        @Test
        @DisplayName("should reject malformed addresses")
        void shouldRejectMalformedAddresses() {
            assertThatThrownBy(() -> BackendEndpoint.of("no-port")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackendEndpoint.of("host:")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackendEndpoint.of(":7000")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackendEndpoint.of("host:abc")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> BackendEndpoint.of("host:70000")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should compare by address only")
        void shouldCompareByAddress() {
            BackendEndpoint a = BackendEndpoint.builder().address("a:1").health(BackendHealth.HEALTHY).build();
            BackendEndpoint b = BackendEndpoint.builder().address("a:1").health(BackendHealth.UNHEALTHY).build();

            assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        }
    }

    @Nested
    @DisplayName("eligibility")
    class Eligibility {

        @Test
        @DisplayName("should be eligible when present and not unhealthy")
        void shouldBeEligibleWhenPresentAndNotUnhealthy() {
            assertThat(BackendEndpoint.builder().address("a:1").health(BackendHealth.UNKNOWN).build().isEligible())
                    .isTrue();
            assertThat(BackendEndpoint.builder().address("a:1").health(BackendHealth.HEALTHY).build().isEligible())
                    .isTrue();
            assertThat(BackendEndpoint.builder().address("a:1").health(BackendHealth.UNHEALTHY).build().isEligible())
                    .isFalse();
            assertThat(BackendEndpoint.builder().address("a:1").registryPresent(false).build().isEligible())
                    .isFalse();
        }

        @Test
        @DisplayName("should track absence once and clear it when seen again")
        void shouldTrackAbsence() {
            BackendEndpoint backend = BackendEndpoint.builder().address("a:1").createdAt(T0).build();
            assertThat(backend.getLastSeen()).isEqualTo(T0);
            assertThat(backend.getAbsentSince()).isNull();

            backend.apply(false, null, T0.plusSeconds(5));
            backend.apply(false, null, T0.plusSeconds(9));
            assertThat(backend.getAbsentSince()).isEqualTo(T0.plusSeconds(5));
            assertThat(backend.isRegistryPresent()).isFalse();

            backend.apply(true, null, T0.plusSeconds(12));
            assertThat(backend.getAbsentSince()).isNull();
            assertThat(backend.getLastSeen()).isEqualTo(T0.plusSeconds(12));
        }

        @Test
        @DisplayName("should be drained only when absent with no connection")
        void shouldBeDrainedOnlyWhenAbsentAndIdle() {
            BackendEndpoint backend = BackendEndpoint.of("a:1");
            backend.incrementConnections();
            backend.apply(false, null, T0);
            assertThat(backend.isDrained()).isFalse();

            backend.decrementConnections();
            assertThat(backend.isDrained()).isTrue();
        }
    }

    @Nested
    @DisplayName("health state machine")
    class HealthStateMachine {

        @Test
        @DisplayName("should become unhealthy only at the failure threshold")
        void shouldDebounceFailures() {
            BackendEndpoint backend = BackendEndpoint.builder().address("a:1").health(BackendHealth.HEALTHY).build();

            HealthTransition first = backend.recordProbeFailure(3);
            HealthTransition second = backend.recordProbeFailure(3);
            assertThat(first.changed()).isFalse();
            assertThat(second.current()).isEqualTo(BackendHealth.HEALTHY);
            assertThat(backend.isEligible()).isTrue();

            HealthTransition third = backend.recordProbeFailure(3);
            assertThat(third.previous()).isEqualTo(BackendHealth.HEALTHY);
            assertThat(third.current()).isEqualTo(BackendHealth.UNHEALTHY);
            assertThat(third.consecutiveFailures()).isEqualTo(3);
            assertThat(backend.isEligible()).isFalse();
        }

        @Test
        @DisplayName("should recover on a single success and reset the counter")
        void shouldRecoverOnSingleSuccess() {
            BackendEndpoint backend = BackendEndpoint.of("a:1");
            for (int i = 0; i < 5; i++) {
                backend.recordProbeFailure(3);
            }
            assertThat(backend.getHealth()).isEqualTo(BackendHealth.UNHEALTHY);

            HealthTransition transition = backend.recordProbeSuccess();

            assertThat(transition.previous()).isEqualTo(BackendHealth.UNHEALTHY);
            assertThat(transition.current()).isEqualTo(BackendHealth.HEALTHY);
            assertThat(backend.getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should reset the counter when a success interrupts failures")
        void shouldResetCounterOnSuccess() {
            BackendEndpoint backend = BackendEndpoint.of("a:1");
            backend.recordProbeFailure(3);
            backend.recordProbeFailure(3);
            backend.recordProbeSuccess();
            backend.recordProbeFailure(3);
            backend.recordProbeFailure(3);

            assertThat(backend.getHealth()).isEqualTo(BackendHealth.HEALTHY);
            assertThat(backend.getConsecutiveFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("should move from UNKNOWN straight to UNHEALTHY")
        void shouldMoveFromUnknownToUnhealthy() {
            BackendEndpoint backend = BackendEndpoint.of("a:1");

            backend.recordProbeFailure(1);

            assertThat(backend.getHealth()).isEqualTo(BackendHealth.UNHEALTHY);
        }
    }

    @Nested
    @DisplayName("connection counter")
    class ConnectionCounter {

        @Test
        @DisplayName("should never go below zero")
        void shouldNeverGoBelowZero() {
            BackendEndpoint backend = BackendEndpoint.of("a:1");

            assertThat(backend.decrementConnections()).isEqualTo(-1);
            assertThat(backend.getActiveConnections()).isZero();
        }

        @Test
        @DisplayName("should stay consistent under concurrent updates")
        void shouldStayConsistentUnderConcurrency() throws InterruptedException {
            BackendEndpoint backend = BackendEndpoint.of("a:1");
            int threads = 8;
            int iterations = 1000;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                executor.execute(() -> {
                    for (int i = 0; i < iterations; i++) {
                        backend.incrementConnections();
                        backend.decrementConnections();
                    }
                    done.countDown();
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            assertThat(backend.getActiveConnections()).isZero();
        }
    }
}
