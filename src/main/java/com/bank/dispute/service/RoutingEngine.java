package com.bank.dispute.service;

import com.bank.dispute.config.MetricsConfig;
import com.bank.dispute.config.RoutingConfig;
import com.bank.dispute.engine.BusinessCalendar;
import com.bank.dispute.engine.DeadlineCalculator;
import com.bank.dispute.model.Deadline;
import com.bank.dispute.model.Dispute;
import com.bank.dispute.model.QueueStats;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutedItem;
import com.bank.dispute.model.RoutedItemStatus;
import com.bank.dispute.model.Signal;
import com.bank.dispute.model.SignalKind;
import com.bank.dispute.model.TickReport;
import com.bank.dispute.repository.DisputeRepository;
import com.bank.dispute.repository.RoutedItemRepository;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Owns the work queues. Each dispute has at most one open routed item; assigning
 * a new queue actions the previous item. Items are written through to Aerospike
 * and reloaded on startup.
 *
 * The periodic tick raises:
 *   - SLA_BREACH once per assignment when a human queue item is not acknowledged
 *     within its business-hours window
 *   - QUEUE_BACKLOG while a queue is deeper than its threshold, re-armed once it drains
 *   - DEADLINE_MISSED once per dispute and deadline label
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final Map<String, RoutedItem> itemsById = new LinkedHashMap<>();
    private final Map<String, List<String>> itemIdsByDispute = new HashMap<>();

    private final RoutedItemRepository itemRepository;
    private final DisputeRepository disputeRepository;
    private final RoutingConfig config;
    private final BusinessCalendar calendar;
    private final DeadlineCalculator deadlineCalculator;
    private final SignalDispatcher signalDispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RoutingEngine(RoutedItemRepository itemRepository,
                         DisputeRepository disputeRepository,
                         RoutingConfig config,
                         BusinessCalendar calendar,
                         DeadlineCalculator deadlineCalculator,
                         SignalDispatcher signalDispatcher,
                         MetricsConfig metricsConfig,
                         Clock clock) {
        this.itemRepository = itemRepository;
        this.disputeRepository = disputeRepository;
        this.config = config;
        this.calendar = calendar;
        this.deadlineCalculator = deadlineCalculator;
        this.signalDispatcher = signalDispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Rebuild the queues from Aerospike. Only items of disputes still open are
     * held in memory; history of closed disputes is read from the repository.
     */
    @PostConstruct
    public synchronized void loadItems() {
        Set<String> openDisputes = disputeRepository.findOpen().stream()
                .map(Dispute::getId)
                .collect(Collectors.toSet());
        List<RoutedItem> stored = itemRepository.findAll();
        stored.sort(Comparator.comparing(RoutedItem::getAssignedAt));
        int loaded = 0;
        for (RoutedItem item : stored) {
            if (openDisputes.contains(item.getDisputeId())) {
                index(item);
                loaded++;
            }
        }
        log.info("Routing engine loaded {} of {} routed item(s)", loaded, stored.size());
        refreshGauges();
    }

    /**
     * Put the dispute on {@code queue}, actioning whatever item it held before.
     * {@link QueueType#NONE} only actions the previous item.
     *
     * @return the new open item, or null for NONE
     */
    public synchronized RoutedItem assign(Dispute dispute, QueueType queue, String reason, Instant now) {
        actionOpenItem(dispute.getId(), now);
        if (!queue.isActive()) {
            refreshGauges();
            return null;
        }

        List<String> history = itemIdsByDispute.getOrDefault(dispute.getId(), List.of());
        RoutedItem item = RoutedItem.builder()
                .itemId(dispute.getId() + ":" + (history.size() + 1))
                .disputeId(dispute.getId())
                .queue(queue)
                .status(RoutedItemStatus.QUEUED)
                .reason(reason)
                .amountMinor(dispute.getAmountMinor())
                .assignedAt(now)
                .slaDueAt(slaDue(queue, now))
                .build();
        store(item);
        log.info("Dispute {} assigned to {} queue: {}", dispute.getId(), queue, reason);
        refreshGauges();
        return item;
    }

    /**
     * Re-queue the most recently actioned item of {@code queue} for the dispute,
     * keeping its identity and counting the re-open. Falls back to a fresh
     * assignment when the dispute never sat on that queue.
     */
    public synchronized RoutedItem reopen(Dispute dispute, QueueType queue, String reason, Instant now) {
        actionOpenItem(dispute.getId(), now);

        RoutedItem previous = null;
        for (String itemId : itemIdsByDispute.getOrDefault(dispute.getId(), List.of())) {
            RoutedItem candidate = itemsById.get(itemId);
            if (candidate.getQueue() == queue && candidate.getStatus() == RoutedItemStatus.ACTIONED) {
                previous = candidate;
            }
        }
        if (previous == null) {
            return assign(dispute, queue, reason, now);
        }

        RoutedItem reopened = previous.toBuilder()
                .status(RoutedItemStatus.QUEUED)
                .reason(reason)
                .assignedAt(now)
                .acknowledgedAt(null)
                .actionedAt(null)
                .slaDueAt(slaDue(queue, now))
                .reopenCount(previous.getReopenCount() + 1)
                .build();
        store(reopened);
        log.info("Dispute {} re-opened on {} queue (item {}, re-open #{})",
                dispute.getId(), queue, reopened.getItemId(), reopened.getReopenCount());
        refreshGauges();
        return reopened;
    }

    public synchronized void acknowledge(String disputeId, Instant now) {
        RoutedItem open = openItem(disputeId);
        if (open == null || open.getStatus() != RoutedItemStatus.QUEUED) {
            log.debug("No unacknowledged item for dispute {}", disputeId);
            return;
        }
        store(open.toBuilder()
                .status(RoutedItemStatus.ACKNOWLEDGED)
                .acknowledgedAt(now)
                .build());
    }

    public synchronized void release(String disputeId, Instant now) {
        actionOpenItem(disputeId, now);
        refreshGauges();
    }

    /**
     * Release a dispute that has closed for good: its open item is actioned and
     * its items and signal keys are dropped from memory. The items stay in the
     * repository.
     */
    public synchronized void retire(String disputeId, Instant now) {
        actionOpenItem(disputeId, now);
        List<String> ids = itemIdsByDispute.remove(disputeId);
        if (ids != null) {
            ids.forEach(itemsById::remove);
        }
        int forgotten = signalDispatcher.forgetDispute(disputeId);
        log.info("Dispute {} retired from routing ({} item(s), {} signal key(s))",
                disputeId, ids != null ? ids.size() : 0, forgotten);
        refreshGauges();
    }

    public synchronized RoutedItem findOpenItem(String disputeId) {
        return openItem(disputeId);
    }

    public synchronized List<RoutedItem> history(String disputeId) {
        List<String> ids = itemIdsByDispute.get(disputeId);
        if (ids == null) {
            return itemRepository.findByDisputeId(disputeId);
        }
        List<RoutedItem> items = new ArrayList<>();
        for (String itemId : ids) {
            items.add(itemsById.get(itemId));
        }
        return items;
    }

    synchronized int trackedItems() {
        return itemsById.size();
    }

    /**
     * Open items on the queue, oldest assignment first.
     */
    public synchronized List<RoutedItem> getQueue(QueueType queue) {
        return itemsById.values().stream()
                .filter(i -> i.getQueue() == queue && i.getStatus().isOpen())
                .sorted(Comparator.comparing(RoutedItem::getAssignedAt))
                .toList();
    }

    public synchronized int depth(QueueType queue) {
        return (int) itemsById.values().stream()
                .filter(i -> i.getQueue() == queue && i.getStatus().isOpen())
                .count();
    }

    public synchronized List<QueueStats> stats(Instant now) {
        List<QueueStats> stats = new ArrayList<>();
        for (QueueType queue : QueueType.values()) {
            if (!queue.isActive()) continue;
            List<RoutedItem> open = getQueue(queue);
            stats.add(QueueStats.builder()
                    .queue(queue)
                    .depth(open.size())
                    .unacknowledged((int) open.stream().filter(i -> i.getStatus() == RoutedItemStatus.QUEUED).count())
                    .slaBreached((int) open.stream().filter(i -> isSlaBreached(i, now)).count())
                    .backlogThreshold(config.backlogThreshold(queue))
                    .oldestAssignedAt(open.isEmpty() ? null : open.get(0).getAssignedAt())
                    .build());
        }
        return stats;
    }

    @Scheduled(fixedRateString = "${dispute.routing.tick-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${dispute.routing.tick-interval-seconds:60}")
    @Observed(name = "routing.tick", contextualName = "sla-tick")
    public void scheduledTick() {
        TickReport report = tick(clock.instant());
        if (report.getSlaBreaches() + report.getBacklogSignals() + report.getDeadlinesMissed() > 0) {
            log.info("SLA tick raised {} SLA breach(es), {} backlog signal(s), {} missed deadline(s)",
                    report.getSlaBreaches(), report.getBacklogSignals(), report.getDeadlinesMissed());
        }
    }

    /**
     * Evaluate SLAs, backlogs and deadlines as of {@code now}. Calling it again
     * with no state change raises nothing new.
     */
    public TickReport tick(Instant now) {
        int slaBreaches = 0;
        int backlogSignals = 0;

        synchronized (this) {
            for (RoutedItem item : itemsById.values()) {
                if (isSlaBreached(item, now)) {
                    String key = item.getItemId() + ":" + SignalKind.SLA_BREACH + ":" + item.getAssignedAt().toEpochMilli();
                    Signal signal = Signal.builder()
                            .disputeId(item.getDisputeId())
                            .kind(SignalKind.SLA_BREACH)
                            .detail(String.format("%s queue item %s not acknowledged by %s",
                                    item.getQueue(), item.getItemId(), item.getSlaDueAt()))
                            .occurredAt(now)
                            .build();
                    if (signalDispatcher.raise(key, signal)) {
                        slaBreaches++;
                    }
                }
            }

            Map<QueueType, Integer> depths = new EnumMap<>(QueueType.class);
            for (RoutedItem item : itemsById.values()) {
                if (item.getStatus().isOpen()) {
                    depths.merge(item.getQueue(), 1, Integer::sum);
                }
            }
            for (QueueType queue : QueueType.values()) {
                if (!queue.isActive()) continue;
                int depth = depths.getOrDefault(queue, 0);
                metricsConfig.updateQueueDepth(queue, depth);

                String key = SignalKind.QUEUE_BACKLOG + ":" + queue;
                int threshold = config.backlogThreshold(queue);
                if (depth > threshold) {
                    Signal signal = Signal.builder()
                            .kind(SignalKind.QUEUE_BACKLOG)
                            .detail(String.format("%s queue depth %d exceeds threshold %d", queue, depth, threshold))
                            .occurredAt(now)
                            .build();
                    if (signalDispatcher.raise(key, signal)) {
                        backlogSignals++;
                    }
                } else {
                    signalDispatcher.clear(key);
                }
            }
        }

        int deadlinesMissed = 0;
        for (Dispute dispute : disputeRepository.findOpen()) {
            for (Deadline missed : deadlineCalculator.breached(dispute.getDeadlines(), now)) {
                String key = dispute.getId() + ":" + SignalKind.DEADLINE_MISSED + ":" + missed.getLabel();
                Signal signal = Signal.builder()
                        .disputeId(dispute.getId())
                        .kind(SignalKind.DEADLINE_MISSED)
                        .detail(String.format("%s (%s) was due %s", missed.getLabel(), missed.getRegulation(), missed.getDueAt()))
                        .occurredAt(now)
                        .build();
                if (signalDispatcher.raise(key, signal)) {
                    deadlinesMissed++;
                }
            }
        }

        return TickReport.builder()
                .tickedAt(now)
                .slaBreaches(slaBreaches)
                .backlogSignals(backlogSignals)
                .deadlinesMissed(deadlinesMissed)
                .build();
    }

    private boolean isSlaBreached(RoutedItem item, Instant now) {
        return item.getStatus() == RoutedItemStatus.QUEUED
                && item.getQueue().isHumanQueue()
                && item.getSlaDueAt() != null
                && item.getSlaDueAt().isBefore(now);
    }

    private Instant slaDue(QueueType queue, Instant assignedAt) {
        return queue.isHumanQueue() ? calendar.plusBusinessHours(assignedAt, config.ackWindowHours(queue)) : null;
    }

    private RoutedItem openItem(String disputeId) {
        List<String> ids = itemIdsByDispute.getOrDefault(disputeId, List.of());
        for (int i = ids.size() - 1; i >= 0; i--) {
            RoutedItem item = itemsById.get(ids.get(i));
            if (item.getStatus().isOpen()) {
                return item;
            }
        }
        return null;
    }

    private void actionOpenItem(String disputeId, Instant now) {
        RoutedItem open = openItem(disputeId);
        if (open != null) {
            store(open.toBuilder()
                    .status(RoutedItemStatus.ACTIONED)
                    .actionedAt(now)
                    .build());
        }
    }

    private void store(RoutedItem item) {
        itemRepository.save(item);
        index(item);
    }

    private void index(RoutedItem item) {
        if (itemsById.put(item.getItemId(), item) == null) {
            itemIdsByDispute.computeIfAbsent(item.getDisputeId(), id -> new ArrayList<>()).add(item.getItemId());
        }
    }

    private void refreshGauges() {
        for (QueueType queue : QueueType.values()) {
            if (queue.isActive()) {
                metricsConfig.updateQueueDepth(queue, depth(queue));
            }
        }
    }
}
