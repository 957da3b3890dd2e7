package com.bank.dispute.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of scanning text for prohibited payment data")
public class GuardrailResult {

    @Schema(description = "True when no prohibited data was found")
    private boolean clean;

    @Schema(description = "Input with every matched span replaced by a fixed mask")
    private String redactedText;

    @Schema(description = "Distinct kinds of prohibited data detected")
    private List<PatternKind> matches;

    public List<String> categories() {
        return matches.stream().map(PatternKind::getCategory).toList();
    }
}
