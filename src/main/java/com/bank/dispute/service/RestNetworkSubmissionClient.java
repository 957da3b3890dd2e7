package com.bank.dispute.service;

import com.bank.dispute.config.CollaboratorConfig;
import com.bank.dispute.exception.DownstreamUnavailableException;
import com.bank.dispute.model.EvidencePackage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class RestNetworkSubmissionClient implements NetworkSubmissionClient {

    private static final String NAME = "network-submission";

    private final RestTemplate restTemplate;
    private final CollaboratorConfig config;

    public RestNetworkSubmissionClient(@Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
                                       CollaboratorConfig config) {
        this.restTemplate = restTemplate;
        this.config = config;
    }

    @Override
    public boolean isAvailable() {
        return config.getNetwork().isConfigured();
    }

    @Override
    public void submit(EvidencePackage evidencePackage) {
        if (!isAvailable()) {
            throw new DownstreamUnavailableException(NAME, "no endpoint configured", null);
        }
        try {
            restTemplate.postForLocation(config.getNetwork().getUrl(), evidencePackage);
        } catch (RestClientException e) {
            throw new DownstreamUnavailableException(NAME, e.getMessage(), e);
        }
    }
}
