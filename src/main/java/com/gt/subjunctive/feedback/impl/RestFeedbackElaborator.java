package com.gt.subjunctive.feedback.impl;

import com.gt.subjunctive.feedback.FeedbackElaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.web.client.RestTemplate;

// Posts {prompt, maxTokens} to a text-generation endpoint and reads {text} back
public class RestFeedbackElaborator implements FeedbackElaborator {

    private static final Logger log = LoggerFactory.getLogger(RestFeedbackElaborator.class);

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;
    private final int maxTokens;

    public RestFeedbackElaborator(RestTemplate restTemplate, String url, String apiKey, int maxTokens) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.apiKey = apiKey;
        this.maxTokens = maxTokens;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String elaborate(String prompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        HttpEntity<ElaborationRequest> request = new HttpEntity<>(new ElaborationRequest(prompt, maxTokens), headers);
        ResponseEntity<ElaborationResponse> response = restTemplate.exchange(url, HttpMethod.POST, request, ElaborationResponse.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null || response.getBody().text() == null) {
            String errMsg = "Elaboration endpoint returned " + response.getStatusCode() + " without text";

            log.warn(errMsg);
            throw new IllegalStateException(errMsg);
        }

        return response.getBody().text().trim();
    }

    public record ElaborationRequest(String prompt, int maxTokens) { }

    public record ElaborationResponse(String text) { }
}
