package com.bank.dispute.controller;

import com.bank.dispute.engine.ComplianceGuardrail;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GuardrailController.class)
@Import(ComplianceGuardrail.class)
class GuardrailControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void scan_cleanText() throws Exception {
        mockMvc.perform(post("/api/v1/guardrail/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"order 12345 never arrived\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clean").value(true));
    }

    @Test
    void scan_cardNumber_redacted() throws Exception {
        mockMvc.perform(post("/api/v1/guardrail/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"card 4539578763621486 exp 11/25\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clean").value(false))
                .andExpect(jsonPath("$.matches[0]").value("CARD_NUMBER"))
                .andExpect(jsonPath("$.redactedText").value("card [REDACTED-PAN] exp 11/25"));
    }

    @Test
    void scan_missingText_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/guardrail/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }
}
