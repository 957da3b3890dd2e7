package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.model.Signal;
import com.bank.dispute.model.SignalKind;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static com.bank.dispute.testutil.TestDataFactory.FILED_AT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SignalDispatcherTest {

    @Mock private SignalNotifier notifier;

    private SignalDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new SignalDispatcher(deliveryService(notifier), new MetricsConfig(new SimpleMeterRegistry()));
    }

    static SignalDeliveryService deliveryService(SignalNotifier notifier) {
        return new SignalDeliveryService(notifier, RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build()));
    }

    @Test
    void raise_deliversOnceForSameKey() {
        assertThat(dispatcher.raise("D-1:SLA_BREACH:1", signal())).isTrue();
        assertThat(dispatcher.raise("D-1:SLA_BREACH:1", signal())).isFalse();

        assertThat(dispatcher.state("D-1:SLA_BREACH:1")).isEqualTo(SignalDispatcher.DeliveryState.DELIVERED);
        verify(notifier, times(1)).deliver(any(Signal.class));
    }

    @Test
    void raise_retriesFailedAttemptWithinBudget() {
        doThrow(new RuntimeException("gateway timeout")).doNothing().when(notifier).deliver(any(Signal.class));

        dispatcher.raise("D-1:SLA_BREACH:1", signal());

        assertThat(dispatcher.state("D-1:SLA_BREACH:1")).isEqualTo(SignalDispatcher.DeliveryState.DELIVERED);
        verify(notifier, times(2)).deliver(any(Signal.class));
    }

    @Test
    void raise_failedDeliveryIsReattemptedOnNextRaise() {
        doThrow(new RuntimeException("gateway timeout")).when(notifier).deliver(any(Signal.class));

        assertThat(dispatcher.raise("D-1:SLA_BREACH:1", signal())).isTrue();
        assertThat(dispatcher.state("D-1:SLA_BREACH:1")).isEqualTo(SignalDispatcher.DeliveryState.FAILED);

        doNothing().when(notifier).deliver(any(Signal.class));
        assertThat(dispatcher.raise("D-1:SLA_BREACH:1", signal())).isTrue();

        assertThat(dispatcher.state("D-1:SLA_BREACH:1")).isEqualTo(SignalDispatcher.DeliveryState.DELIVERED);
        verify(notifier, times(3)).deliver(any(Signal.class));
    }

    @Test
    void clear_allowsKeyToBeRaisedAgain() {
        dispatcher.raise("QUEUE_BACKLOG:AUTO", signal());
        dispatcher.clear("QUEUE_BACKLOG:AUTO");

        assertThat(dispatcher.state("QUEUE_BACKLOG:AUTO")).isNull();
        assertThat(dispatcher.raise("QUEUE_BACKLOG:AUTO", signal())).isTrue();
        assertThat(dispatcher.snapshot()).containsOnlyKeys("QUEUE_BACKLOG:AUTO");
    }

    @Test
    void publish_deliversWithoutKeepingState() {
        dispatcher.publish(Signal.builder()
                .disputeId("D-1")
                .kind(SignalKind.GUARDRAIL_VIOLATION)
                .detail("note rejected: PAN")
                .occurredAt(FILED_AT)
                .build());
        dispatcher.publish(signal());

        verify(notifier, times(2)).deliver(any(Signal.class));
        assertThat(dispatcher.snapshot()).isEmpty();
    }

    @Test
    void forgetDispute_dropsOnlyThatDisputesKeys() {
        dispatcher.raise("D-1:1:SLA_BREACH:1", signal());
        dispatcher.raise("D-1:DEADLINE_MISSED:Reg E provisional credit", signal());
        dispatcher.raise("D-10:DEADLINE_MISSED:Reg E provisional credit", signal());
        dispatcher.raise("QUEUE_BACKLOG:AUTO", signal());

        assertThat(dispatcher.forgetDispute("D-1")).isEqualTo(2);

        assertThat(dispatcher.snapshot()).containsOnlyKeys(
                "D-10:DEADLINE_MISSED:Reg E provisional credit", "QUEUE_BACKLOG:AUTO");
    }

    private static Signal signal() {
        return Signal.builder()
                .disputeId("D-1")
                .kind(SignalKind.SLA_BREACH)
                .detail("SPECIALIST queue item D-1:1 not acknowledged")
                .occurredAt(FILED_AT)
                .build();
    }
}
