package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.config.RoutingConfig;
import com.bank.dispute.model.*;
import com.bank.dispute.repository.DisputeRepository;
import com.bank.dispute.repository.RoutedItemRepository;
import com.bank.dispute.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.bank.dispute.testutil.TestDataFactory.FILED_AT;
import static com.bank.dispute.testutil.TestDataFactory.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RoutingEngineTest {

    @Mock private RoutedItemRepository itemRepository;
    @Mock private DisputeRepository disputeRepository;
    @Mock private SignalNotifier notifier;

    private RoutingConfig config;
    private SignalDispatcher signalDispatcher;
    private RoutingEngine routingEngine;

    @BeforeEach
    void setUp() {
        when(itemRepository.findAll()).thenReturn(new ArrayList<>());
        when(disputeRepository.findOpen()).thenReturn(List.of());

        config = new RoutingConfig();
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        signalDispatcher = new SignalDispatcher(SignalDispatcherTest.deliveryService(notifier), metricsConfig);

        routingEngine = new RoutingEngine(itemRepository, disputeRepository, config,
                TestDataFactory.businessCalendar(), TestDataFactory.deadlineCalculator(),
                signalDispatcher, metricsConfig, Clock.fixed(FILED_AT, ZoneOffset.UTC));
        routingEngine.loadItems();
    }

    @Test
    void assign_specialistQueue_setsBusinessHourSla() {
        RoutedItem item = routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);

        assertThat(item.getItemId()).isEqualTo("D-1:1");
        assertThat(item.getStatus()).isEqualTo(RoutedItemStatus.QUEUED);
        // Monday 10:00 + 4 business hours
        assertThat(item.getSlaDueAt()).isEqualTo(at(2026, 3, 2, 14, 0));
        verify(itemRepository).save(item);
    }

    @Test
    void assign_autoQueue_hasNoSla() {
        RoutedItem item = routingEngine.assign(dispute("D-1"), QueueType.AUTO, "straight-through", FILED_AT);

        assertThat(item.getSlaDueAt()).isNull();
    }

    @Test
    void assign_newQueue_actionsPreviousItem() {
        routingEngine.assign(dispute("D-1"), QueueType.AUTO, "straight-through", FILED_AT);
        routingEngine.assign(dispute("D-1"), QueueType.MANAGER, "high value", FILED_AT.plusSeconds(60));

        List<RoutedItem> history = routingEngine.history("D-1");
        assertThat(history).extracting(RoutedItem::getStatus)
                .containsExactly(RoutedItemStatus.ACTIONED, RoutedItemStatus.QUEUED);
        assertThat(routingEngine.findOpenItem("D-1").getQueue()).isEqualTo(QueueType.MANAGER);
        assertThat(routingEngine.depth(QueueType.AUTO)).isZero();
        assertThat(routingEngine.depth(QueueType.MANAGER)).isEqualTo(1);
    }

    @Test
    void assign_none_onlyReleases() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);

        assertThat(routingEngine.assign(dispute("D-1"), QueueType.NONE, "closed", FILED_AT)).isNull();
        assertThat(routingEngine.findOpenItem("D-1")).isNull();
    }

    @Test
    void tick_unacknowledgedPastSla_raisesBreachOnce() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);
        Instant afterSla = at(2026, 3, 2, 15, 0);

        TickReport first = routingEngine.tick(afterSla);
        TickReport second = routingEngine.tick(afterSla.plusSeconds(60));

        assertThat(first.getSlaBreaches()).isEqualTo(1);
        assertThat(second.getSlaBreaches()).isZero();
        verify(notifier, times(1)).deliver(argThat(s -> s.getKind() == SignalKind.SLA_BREACH));
    }

    @Test
    void tick_beforeSla_raisesNothing() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);

        assertThat(routingEngine.tick(at(2026, 3, 2, 13, 59)).getSlaBreaches()).isZero();
    }

    @Test
    void tick_acknowledgedItem_isNotBreached() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);
        routingEngine.acknowledge("D-1", FILED_AT.plusSeconds(600));

        assertThat(routingEngine.findOpenItem("D-1").getStatus()).isEqualTo(RoutedItemStatus.ACKNOWLEDGED);
        assertThat(routingEngine.tick(at(2026, 3, 3, 10, 0)).getSlaBreaches()).isZero();
    }

    @Test
    void reopen_requeuesPreviousItemAndCountsReopen() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);
        routingEngine.assign(dispute("D-1"), QueueType.MANAGER, "timeout", FILED_AT.plusSeconds(60));

        RoutedItem reopened = routingEngine.reopen(dispute("D-1"), QueueType.SPECIALIST, "re-opened", FILED_AT.plusSeconds(120));

        assertThat(reopened.getItemId()).isEqualTo("D-1:1");
        assertThat(reopened.getReopenCount()).isEqualTo(1);
        assertThat(reopened.getStatus()).isEqualTo(RoutedItemStatus.QUEUED);
        assertThat(reopened.getAssignedAt()).isEqualTo(FILED_AT.plusSeconds(120));
        assertThat(routingEngine.history("D-1")).hasSize(2);
        assertThat(routingEngine.depth(QueueType.MANAGER)).isZero();
    }

    @Test
    void reopen_withoutPriorItem_assignsFresh() {
        RoutedItem item = routingEngine.reopen(dispute("D-1"), QueueType.SPECIALIST, "re-opened", FILED_AT);

        assertThat(item.getItemId()).isEqualTo("D-1:1");
        assertThat(item.getReopenCount()).isZero();
    }

    @Test
    void tick_backlogRaisedOnceAndReArmedAfterDraining() {
        Map<QueueType, Integer> thresholds = new EnumMap<>(QueueType.class);
        thresholds.put(QueueType.AUTO, 1);
        config.setBacklogThresholds(thresholds);

        routingEngine.assign(dispute("D-1"), QueueType.AUTO, "straight-through", FILED_AT);
        routingEngine.assign(dispute("D-2"), QueueType.AUTO, "straight-through", FILED_AT);

        assertThat(routingEngine.tick(FILED_AT.plusSeconds(60)).getBacklogSignals()).isEqualTo(1);
        assertThat(routingEngine.tick(FILED_AT.plusSeconds(120)).getBacklogSignals()).isZero();

        routingEngine.release("D-2", FILED_AT.plusSeconds(180));
        assertThat(routingEngine.tick(FILED_AT.plusSeconds(240)).getBacklogSignals()).isZero();
        assertThat(signalDispatcher.state("QUEUE_BACKLOG:AUTO")).isNull();

        routingEngine.assign(dispute("D-3"), QueueType.AUTO, "straight-through", FILED_AT.plusSeconds(300));
        assertThat(routingEngine.tick(FILED_AT.plusSeconds(360)).getBacklogSignals()).isEqualTo(1);
    }

    @Test
    void tick_missedDeadline_signalledOncePerLabel() {
        Dispute open = dispute("D-1");
        open.setStatus(DisputeStatus.UNDER_REVIEW);
        open.getDeadlines().add(Deadline.builder()
                .label("Investigation Deadline")
                .dueAt(FILED_AT.plusSeconds(3600))
                .regulation(Regulation.REG_E)
                .actionRequired(DeadlineAction.RESOLUTION)
                .build());
        when(disputeRepository.findOpen()).thenReturn(List.of(open));

        Instant late = FILED_AT.plusSeconds(7200);
        assertThat(routingEngine.tick(late).getDeadlinesMissed()).isEqualTo(1);
        assertThat(routingEngine.tick(late.plusSeconds(60)).getDeadlinesMissed()).isZero();
        assertThat(open.getStatus()).isEqualTo(DisputeStatus.UNDER_REVIEW);
        verify(notifier).deliver(argThat(s -> s.getKind() == SignalKind.DEADLINE_MISSED && "D-1".equals(s.getDisputeId())));
    }

    @Test
    void stats_reportsDepthAndBreaches() {
        routingEngine.assign(dispute("D-1"), QueueType.MANAGER, "low confidence", FILED_AT);
        routingEngine.assign(dispute("D-2"), QueueType.MANAGER, "low confidence", FILED_AT.plusSeconds(60));
        routingEngine.acknowledge("D-2", FILED_AT.plusSeconds(120));

        QueueStats manager = routingEngine.stats(at(2026, 3, 3, 12, 0)).stream()
                .filter(s -> s.getQueue() == QueueType.MANAGER)
                .findFirst()
                .orElseThrow();

        assertThat(manager.getDepth()).isEqualTo(2);
        assertThat(manager.getUnacknowledged()).isEqualTo(1);
        assertThat(manager.getSlaBreached()).isEqualTo(1);
        assertThat(manager.getOldestAssignedAt()).isEqualTo(FILED_AT);
    }

    @Test
    void retire_dropsClosedDisputeFromMemory() {
        routingEngine.assign(dispute("D-1"), QueueType.SPECIALIST, "manual", FILED_AT);
        routingEngine.assign(dispute("D-1"), QueueType.MANAGER, "timeout", FILED_AT.plusSeconds(60));
        routingEngine.assign(dispute("D-2"), QueueType.AUTO, "straight-through", FILED_AT);
        routingEngine.tick(at(2026, 3, 3, 12, 0));
        assertThat(signalDispatcher.snapshot()).containsKey("D-1:2:SLA_BREACH:" + FILED_AT.plusSeconds(60).toEpochMilli());

        routingEngine.retire("D-1", at(2026, 3, 3, 13, 0));

        assertThat(routingEngine.trackedItems()).isEqualTo(1);
        assertThat(routingEngine.depth(QueueType.MANAGER)).isZero();
        assertThat(signalDispatcher.snapshot().keySet()).noneMatch(key -> key.startsWith("D-1:"));
        verify(itemRepository).save(argThat(item -> "D-1:2".equals(item.getItemId())
                && item.getStatus() == RoutedItemStatus.ACTIONED));
    }

    @Test
    void history_ofRetiredDispute_isReadFromRepository() {
        routingEngine.assign(dispute("D-1"), QueueType.AUTO, "straight-through", FILED_AT);
        routingEngine.retire("D-1", FILED_AT.plusSeconds(60));
        List<RoutedItem> stored = List.of(
                TestDataFactory.createRoutedItem("D-1", QueueType.AUTO, RoutedItemStatus.ACTIONED, FILED_AT));
        when(itemRepository.findByDisputeId("D-1")).thenReturn(stored);

        assertThat(routingEngine.history("D-1")).isEqualTo(stored);
    }

    @Test
    void loadItems_skipsItemsOfClosedDisputes() {
        List<RoutedItem> stored = new ArrayList<>(List.of(
                TestDataFactory.createRoutedItem("D-8", QueueType.AUTO, RoutedItemStatus.ACTIONED, FILED_AT),
                TestDataFactory.createRoutedItem("D-9", QueueType.SPECIALIST, RoutedItemStatus.QUEUED, FILED_AT)));
        when(itemRepository.findAll()).thenReturn(stored);
        when(disputeRepository.findOpen()).thenReturn(List.of(dispute("D-9")));

        RoutingEngine restarted = new RoutingEngine(itemRepository, disputeRepository, config,
                TestDataFactory.businessCalendar(), TestDataFactory.deadlineCalculator(),
                signalDispatcher, new MetricsConfig(new SimpleMeterRegistry()), Clock.fixed(FILED_AT, ZoneOffset.UTC));
        restarted.loadItems();

        assertThat(restarted.trackedItems()).isEqualTo(1);
    }

    @Test
    void loadItems_rebuildsQueuesFromRepository() {
        List<RoutedItem> stored = new ArrayList<>(List.of(
                TestDataFactory.createRoutedItem("D-9", QueueType.SPECIALIST, RoutedItemStatus.QUEUED, FILED_AT)));
        when(itemRepository.findAll()).thenReturn(stored);
        when(disputeRepository.findOpen()).thenReturn(List.of(dispute("D-9")));

        RoutingEngine restarted = new RoutingEngine(itemRepository, disputeRepository, config,
                TestDataFactory.businessCalendar(), TestDataFactory.deadlineCalculator(),
                signalDispatcher, new MetricsConfig(new SimpleMeterRegistry()), Clock.fixed(FILED_AT, ZoneOffset.UTC));
        restarted.loadItems();

        assertThat(restarted.getQueue(QueueType.SPECIALIST)).extracting(RoutedItem::getDisputeId).containsExactly("D-9");
        assertThat(restarted.assign(dispute("D-9"), QueueType.MANAGER, "escalated", FILED_AT).getItemId())
                .isEqualTo("D-9:2");
        verify(itemRepository, atLeastOnce()).save(any(RoutedItem.class));
    }

    private static Dispute dispute(String id) {
        return TestDataFactory.createDispute(id, PaymentInstrumentClass.DEBIT, DisputeStatus.FILED);
    }
}
