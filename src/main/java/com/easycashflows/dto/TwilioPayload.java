package com.easycashflows.dto;

import com.easycashflows.domain.enums.Provider;

import java.util.Map;

public record TwilioPayload(String body, String from, String to, String messageSid, String smsStatus)
        implements ProviderPayload {

    public static TwilioPayload fromForm(Map<String, String> form) {
        String status = form.get("SmsStatus");
        if (status == null) {
            status = form.get("MessageStatus");
        }
        String sid = form.get("MessageSid");
        if (sid == null) {
            sid = form.get("SmsSid");
        }
        return new TwilioPayload(form.get("Body"), form.get("From"), form.get("To"), sid, status);
    }

    @Override
    public Provider provider() {
        return Provider.TWILIO;
    }
}
