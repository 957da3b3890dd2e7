package com.bank.dispute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "dispute.deadlines")
public class DeadlineConfig {

    // Zone in which calendar and business days are counted
    private String zone = "America/New_York";

    // Bank holidays excluded from business-day arithmetic
    private List<LocalDate> holidays = new ArrayList<>();

    // Regime A (Reg E: debit / prepaid)
    private int provisionalCreditBusinessDays = 10;
    private int investigationDays = 45;
    private int extendedInvestigationDays = 90;
    private int newAccountDays = 30;

    // Regime B (Reg Z: credit)
    private int acknowledgmentDays = 30;
    private int defaultBillingCycleDays = 30;
    private int resolutionCapDays = 90;
}
