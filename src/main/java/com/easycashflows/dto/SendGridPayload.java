package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendGridPayload(
        String from,
        String to,
        String subject,
        String text,
        String html,
        String timestamp,
        String attachments,
        String headers
) implements ProviderPayload {

    public static SendGridPayload fromForm(Map<String, String> form) {
        return new SendGridPayload(form.get("from"), form.get("to"), form.get("subject"), form.get("text"),
                form.get("html"), form.get("timestamp"), form.get("attachments"), form.get("headers"));
    }

    @Override
    public Provider provider() {
        return Provider.SENDGRID;
    }
}
