package com.bank.dispute.controller;

import com.bank.dispute.model.QueueStats;
import com.bank.dispute.model.QueueType;
import com.bank.dispute.model.RoutedItem;
import com.bank.dispute.model.TickReport;
import com.bank.dispute.service.RoutingEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/routing")
@Tag(name = "Routing", description = "Work queues and SLA monitoring")
public class RoutingController {

    private final RoutingEngine routingEngine;
    private final Clock clock;

    public RoutingController(RoutingEngine routingEngine, Clock clock) {
        this.routingEngine = routingEngine;
        this.clock = clock;
    }

    @GetMapping("/queues/{queue}")
    @Operation(summary = "List a queue", description = "Open items on AUTO, SPECIALIST or MANAGER, oldest first")
    public ResponseEntity<List<RoutedItem>> getQueue(@PathVariable String queue) {
        QueueType queueType = QueueType.valueOf(queue.toUpperCase());
        if (!queueType.isActive()) {
            throw new IllegalArgumentException("Not a work queue: " + queue);
        }
        return ResponseEntity.ok(routingEngine.getQueue(queueType));
    }

    @GetMapping("/stats")
    @Operation(summary = "Queue statistics", description = "Depth, unacknowledged and SLA-breached counts per queue")
    public ResponseEntity<List<QueueStats>> getStats() {
        return ResponseEntity.ok(routingEngine.stats(clock.instant()));
    }

    @PostMapping("/tick")
    @Operation(summary = "Run the SLA tick now",
               description = "Raises SLA breach, backlog and missed-deadline signals not yet raised")
    public ResponseEntity<TickReport> tick() {
        return ResponseEntity.ok(routingEngine.tick(clock.instant()));
    }
}
