package com.easycashflows.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ProviderClientConfig {

    @Bean
    RestClient aiRestClient(AiProperties properties) {
        return RestClient.builder()
                .baseUrl(properties.resolveBaseUrl())
                .build();
    }

    @Bean
    RestClient twilioRestClient(WebhookProperties properties) {
        return RestClient.builder()
                .baseUrl(orDefault(properties.twilio().apiBase(), "https://api.twilio.com"))
                .build();
    }

    @Bean
    RestClient skebbyRestClient(WebhookProperties properties) {
        return RestClient.builder()
                .baseUrl(orDefault(properties.skebby().apiBase(), "https://api.skebby.it/API/v1.0/REST/"))
                .build();
    }

    @Bean
    RestClient sendGridRestClient(WebhookProperties properties) {
        return RestClient.builder()
                .baseUrl(orDefault(properties.sendgrid().apiBase(), "https://api.sendgrid.com"))
                .build();
    }

    @Bean
    RestClient facebookRestClient(WebhookProperties properties) {
        return RestClient.builder()
                .baseUrl(orDefault(properties.facebook().graphBase(), "https://graph.facebook.com/v18.0"))
                .build();
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
