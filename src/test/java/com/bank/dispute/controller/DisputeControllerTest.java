package com.bank.dispute.controller;

import com.bank.dispute.exception.ComplianceViolationException;
import com.bank.dispute.exception.DisputeNotFoundException;
import com.bank.dispute.exception.InvalidTransitionException;
import com.bank.dispute.model.*;
import com.bank.dispute.service.AuditLogService;
import com.bank.dispute.service.DisputeWorkflowService;
import com.bank.dispute.service.RoutingEngine;
import com.bank.dispute.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.bank.dispute.testutil.TestDataFactory.FILED_AT;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DisputeController.class)
class DisputeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DisputeWorkflowService workflowService;

    @MockBean
    private AuditLogService auditLogService;

    @MockBean
    private RoutingEngine routingEngine;

    @Test
    void createDispute_created() throws Exception {
        CreateDisputeRequest request = TestDataFactory.createRequest(
                PaymentInstrumentClass.DEBIT, DisputeReason.GOODS_NOT_RECEIVED, 5000, 0.9);
        when(workflowService.createDispute(any(CreateDisputeRequest.class)))
                .thenReturn(TestDataFactory.createDispute("DSP-1", PaymentInstrumentClass.DEBIT, DisputeStatus.FILED));

        mockMvc.perform(post("/api/v1/disputes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("DSP-1"))
                .andExpect(jsonPath("$.status").value("FILED"));
    }

    @Test
    void createDispute_cardDataInNarrative_unprocessable() throws Exception {
        when(workflowService.createDispute(any(CreateDisputeRequest.class)))
                .thenThrow(new ComplianceViolationException("DSP-1", "narrative", List.of(PatternKind.CARD_NUMBER)));

        mockMvc.perform(post("/api/v1/disputes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"narrative\":\"card 4539578763621486\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("COMPLIANCE_VIOLATION"))
                .andExpect(jsonPath("$.details.categories[0]").value("card-number-like data detected"));
    }

    @Test
    void getDispute_notFound() throws Exception {
        when(workflowService.getDispute("missing")).thenThrow(new DisputeNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/disputes/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("DISPUTE_NOT_FOUND"));
    }

    @Test
    void applyEvent_passesIdempotencyHeader() throws Exception {
        TransitionResult result = TransitionResult.builder()
                .disputeId("DSP-1")
                .eventType(EventType.REQUEST_EVIDENCE)
                .fromStatus(DisputeStatus.FILED)
                .toStatus(DisputeStatus.AWAITING_EVIDENCE)
                .queue(QueueType.AUTO)
                .appliedAt(FILED_AT)
                .build();
        when(workflowService.applyEvent(eq("DSP-1"), argThat(e -> "req-1".equals(e.getIdempotencyKey()))))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/disputes/DSP-1/events")
                        .header("Idempotency-Key", "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"REQUEST_EVIDENCE\",\"actor\":\"specialist:jdoe\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.toStatus").value("AWAITING_EVIDENCE"));
    }

    @Test
    void applyEvent_missingIdempotencyHeader_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/disputes/DSP-1/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"REQUEST_EVIDENCE\"}"))
                .andExpect(status().isBadRequest());

        verify(workflowService, never()).applyEvent(anyString(), any());
    }

    @Test
    void applyEvent_invalidTransition_conflictWithValidEvents() throws Exception {
        when(workflowService.applyEvent(eq("DSP-1"), any(DisputeEvent.class)))
                .thenThrow(new InvalidTransitionException("DSP-1", DisputeStatus.FILED, EventType.APPROVE,
                        EnumSet.of(EventType.REQUEST_EVIDENCE, EventType.REFUND)));

        mockMvc.perform(post("/api/v1/disputes/DSP-1/events")
                        .header("Idempotency-Key", "k-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"APPROVE\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    void recordNetworkOutcome_parsesOutcome() throws Exception {
        when(workflowService.recordNetworkOutcome("DSP-1", NetworkOutcome.ACCEPTED, "net-1", "visa"))
                .thenReturn(TransitionResult.builder().disputeId("DSP-1").toStatus(DisputeStatus.APPROVED).build());

        mockMvc.perform(post("/api/v1/disputes/DSP-1/network-outcome")
                        .header("Idempotency-Key", "net-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("outcome", "accepted", "actor", "visa"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.toStatus").value("APPROVED"));
    }

    @Test
    void getDeadlines_withAsOf() throws Exception {
        when(workflowService.computeDeadlines(eq("DSP-1"), eq(FILED_AT)))
                .thenReturn(DeadlineSchedule.builder()
                        .regulation(Regulation.REG_E)
                        .deadlines(List.of())
                        .asOf(FILED_AT)
                        .build());

        mockMvc.perform(get("/api/v1/disputes/DSP-1/deadlines").param("asOf", FILED_AT.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regulation").value("REG_E"));
    }

    @Test
    void getValidEvents() throws Exception {
        when(workflowService.validEvents("DSP-1")).thenReturn(List.of("REQUEST_EVIDENCE", "REFUND"));

        mockMvc.perform(get("/api/v1/disputes/DSP-1/valid-events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("REFUND"));
    }

    @Test
    void getAuditTrail() throws Exception {
        when(auditLogService.forDispute("DSP-1"))
                .thenReturn(List.of(TestDataFactory.createAuditEntry("DSP-1", 1, "FILED")));

        mockMvc.perform(get("/api/v1/disputes/DSP-1/audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].action").value("FILED"));
    }

    @Test
    void getRoutingHistory() throws Exception {
        when(routingEngine.history("DSP-1")).thenReturn(List.of(TestDataFactory.createRoutedItem(
                "DSP-1", QueueType.SPECIALIST, RoutedItemStatus.QUEUED, FILED_AT)));

        mockMvc.perform(get("/api/v1/disputes/DSP-1/routing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].queue").value("SPECIALIST"));
    }
}
