package com.bank.dispute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Signal delivery channel. Delivery retries use the {@code notifier} retry instance.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "dispute.notifier")
public class NotifierConfig {

    private Twilio twilio = new Twilio();

    @Data
    public static class Twilio {
        private boolean enabled = false;
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private String channel = "sms";  // "sms" or "whatsapp"
    }
}
