package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Intake request captured by the conversational front-end")
public class CreateDisputeRequest {

    @Schema(description = "Reference of the disputed charge", example = "CH-2026-000184")
    private String chargeReference;

    @Schema(example = "UNAUTHORIZED")
    private DisputeReason reason;

    @Schema(description = "Amount in minor units", example = "5000")
    private long amountMinor;

    @Schema(example = "USD")
    private String currency;

    @Schema(description = "debit, credit or prepaid; anything else is treated as unrecognized", example = "DEBIT")
    private PaymentInstrumentClass instrumentClass;

    @Schema(description = "Customer narrative; rejected if it contains card data")
    private String narrative;

    @Schema(example = "400")
    private Integer accountAgeDays;

    private boolean crossBorder;

    private boolean pointOfSale;

    @Schema(example = "30")
    private Integer billingCycleDays;

    @Schema(description = "Scoring confidence supplied by the intake channel, if already known", example = "0.9")
    private Double confidence;

    @Schema(example = "intake:chatbot")
    private String actor;
}
