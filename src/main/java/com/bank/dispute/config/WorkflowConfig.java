package com.bank.dispute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "dispute.workflow")
public class WorkflowConfig {

    // Evidence bounds; exceeding them rejects the evidence without touching status
    private int maxEvidenceItems = 20;
    private int maxEvidenceItemBytes = 65536;
    private int maxEvidenceTotalBytes = 262144;

    // How long a replayed idempotency key returns the stored result
    private int idempotencyWindowHours = 24;
}
