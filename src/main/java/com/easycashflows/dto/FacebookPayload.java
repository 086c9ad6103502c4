package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FacebookPayload(String object, List<Entry> entry) implements ProviderPayload {

    @Override
    public Provider provider() {
        return Provider.FACEBOOK;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String id, Long time, List<Messaging> messaging) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Messaging(Party sender, Party recipient, Long timestamp, Message message, Delivery delivery) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Party(String id) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String mid, String text, Boolean is_echo) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Delivery(List<String> mids, Long watermark) {
    }
}
