package com.bank.dispute.service;

import com.bank.dispute.config.CollaboratorConfig;
import com.bank.dispute.exception.DownstreamUnavailableException;
import com.bank.dispute.model.ClassificationResult;
import com.bank.dispute.model.Dispute;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Component
public class RestClassificationClient implements ClassificationClient {

    private static final String NAME = "classification";

    private final RestTemplate restTemplate;
    private final CollaboratorConfig config;

    public RestClassificationClient(@Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
                                    CollaboratorConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public ClassificationResult classify(Dispute dispute) {
        CollaboratorConfig.Endpoint endpoint = config.getClassification();
        if (!endpoint.isConfigured()) {
            throw new DownstreamUnavailableException(NAME, "no endpoint configured", null);
        }

        // Only structured attributes leave the service; free text stays inside
        Map<String, Object> request = new HashMap<>();
        request.put("disputeId", dispute.getId());
        request.put("reason", dispute.getReason());
        request.put("amountMinor", dispute.getAmountMinor());
        request.put("currency", dispute.getCurrency());
        request.put("instrumentClass", dispute.getInstrumentClass());
        request.put("crossBorder", dispute.isCrossBorder());
        request.put("pointOfSale", dispute.isPointOfSale());
        request.put("accountAgeDays", dispute.getAccountAgeDays());

        try {
            ClassificationResult response = restTemplate.postForObject(endpoint.getUrl(), request, ClassificationResult.class);
            if (response == null) {
                throw new DownstreamUnavailableException(NAME, "empty response", null);
            }
            return ClassificationResult.of(response.getConfidence(), response.isRequiresManualClassification());
        } catch (RestClientException e) {
            throw new DownstreamUnavailableException(NAME, e.getMessage(), e);
        }
    }
}
