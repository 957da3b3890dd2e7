package com.bank.dispute.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI disputeWorkflowOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Dispute Resolution Workflow API")
                        .version("1.0.0")
                        .description(
                                "Card dispute lifecycle engine.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Intake posts `POST /disputes`; the narrative is scanned for card data\n" +
                                "2. Events move the dispute through `FILED → AWAITING_EVIDENCE → UNDER_REVIEW → " +
                                "APPROVED|DENIED → RESOLVED` (with specialist/manager escalations)\n" +
                                "3. Regulatory deadlines are stamped whenever an investigation clock runs\n" +
                                "4. Routing assigns the case to the **AUTO**, **SPECIALIST** or **MANAGER** queue\n" +
                                "5. Every transition, routing decision and rejection lands in the audit feed\n\n" +
                                "**Regimes:**\n" +
                                "- `REG_E` (debit/prepaid): provisional credit in 10 business days, " +
                                "investigation in 45 days (90 when extended)\n" +
                                "- `REG_Z` (credit): acknowledgment in 30 days, resolution in two billing " +
                                "cycles capped at 90 days\n\n" +
                                "Mutating event calls require an `Idempotency-Key` header.")
                        .contact(new Contact().name("Disputes Platform Team")));
    }
}
