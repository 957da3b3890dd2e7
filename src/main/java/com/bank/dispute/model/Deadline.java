package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A regulatory due-date derived from the dispute attributes")
public class Deadline {

    @Schema(description = "Deadline label", example = "Investigation Deadline")
    private String label;

    @Schema(description = "Due instant (UTC)", example = "2026-02-19T15:00:00Z")
    private Instant dueAt;

    @Schema(description = "Regulation the deadline derives from", example = "REG_E")
    private Regulation regulation;

    @Schema(description = "What must happen before the due date", example = "RESOLUTION")
    private DeadlineAction actionRequired;

    @Schema(description = "Human readable explanation")
    private String description;

    @Schema(description = "Whether the required action happened on time")
    private boolean satisfied;
}
