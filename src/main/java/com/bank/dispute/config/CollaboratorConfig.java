package com.bank.dispute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Endpoints of the external classification and network-submission services.
 * A blank URL means the collaborator is not deployed. Retries, circuit breakers
 * and the classification time limit are configured under {@code resilience4j.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "collaborators")
public class CollaboratorConfig {

    private Endpoint classification = new Endpoint(2000);
    private Endpoint network = new Endpoint(5000);

    @Data
    public static class Endpoint {
        private String url = "";
        // HTTP connect and read timeout
        private long timeoutMs;

        public Endpoint() {
        }

        public Endpoint(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }
}
