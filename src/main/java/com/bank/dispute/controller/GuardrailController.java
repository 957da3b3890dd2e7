package com.bank.dispute.controller;

import com.bank.dispute.engine.ComplianceGuardrail;
import com.bank.dispute.model.GuardrailResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/guardrail")
@Tag(name = "Compliance Guardrail", description = "Scan free text for card data before it is captured")
public class GuardrailController {

    private final ComplianceGuardrail guardrail;

    public GuardrailController(ComplianceGuardrail guardrail) {
        this.guardrail = guardrail;
    }

    @PostMapping("/scan")
    @Operation(summary = "Scan text",
               description = "Returns whether the text is clean, the detected categories and a redacted copy")
    public ResponseEntity<GuardrailResult> scan(@RequestBody Map<String, String> body) {
        String text = body.get("text");
        if (text == null) {
            throw new IllegalArgumentException("text is required");
        }
        return ResponseEntity.ok(guardrail.scan(text));
    }
}
