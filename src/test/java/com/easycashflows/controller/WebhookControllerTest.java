package com.easycashflows.controller;

import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.DeliveryStatusUpdate;
import com.easycashflows.domain.message.WebhookEvent;
import com.easycashflows.dto.LinkMobilityPayload;
import com.easycashflows.dto.TwilioPayload;
import com.easycashflows.security.WebhookAuthenticator;
import com.easycashflows.service.AiAnalyticsService;
import com.easycashflows.service.InboundMessageNormalizer;
import com.easycashflows.service.WebhookCatalogService;
import com.easycashflows.service.WebhookIngressService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WebhookController.class)
@DisplayName("WebhookController")
class WebhookControllerTest {

    private static final String TWILIO_FORM =
            "Body=Ciao&From=whatsapp%3A%2B393331234567&To=whatsapp%3A%2B390212345678&MessageSid=SM123";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WebhookAuthenticator webhookAuthenticator;
    @MockBean
    private InboundMessageNormalizer inboundMessageNormalizer;
    @MockBean
    private WebhookIngressService webhookIngressService;
    @MockBean
    private WebhookCatalogService webhookCatalogService;
    @MockBean
    private AiAnalyticsService aiAnalyticsService;

    @Test
    @DisplayName("Twilio webhook with a valid signature is acknowledged with empty TwiML")
    void twilioAccepted() throws Exception {
        // Given
        List<WebhookEvent> events = List.of(new WebhookEvent.StatusReported(
                new DeliveryStatusUpdate(Provider.TWILIO, "SM123", "delivered", Instant.EPOCH)));
        when(webhookAuthenticator.verify(eq(Provider.TWILIO), any(), eq("sig"))).thenReturn(true);
        when(inboundMessageNormalizer.normalize(any())).thenReturn(events);

        // When / Then
        mockMvc.perform(post("/webhooks/twilio/whatsapp")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .header("X-Twilio-Signature", "sig")
                        .content(TWILIO_FORM))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_XML))
                .andExpect(content().string(WebhookController.EMPTY_TWIML));

        ArgumentCaptor<TwilioPayload> payload = ArgumentCaptor.forClass(TwilioPayload.class);
        verify(inboundMessageNormalizer).normalize(payload.capture());
        assertThat(payload.getValue().from()).isEqualTo("whatsapp:+393331234567");
        assertThat(payload.getValue().messageSid()).isEqualTo("SM123");
        verify(webhookIngressService).submit(events);
    }

    @Test
    @DisplayName("Invalid signature returns 401 and nothing is processed")
    void invalidSignatureRejected() throws Exception {
        when(webhookAuthenticator.verify(eq(Provider.TWILIO), any(), any())).thenReturn(false);

        mockMvc.perform(post("/webhooks/twilio/whatsapp")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(TWILIO_FORM))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid signature"));

        verifyNoInteractions(inboundMessageNormalizer, webhookIngressService);
    }

    @Test
    @DisplayName("LinkMobility JSON is parsed and acknowledged with success")
    void linkMobilityAccepted() throws Exception {
        when(webhookAuthenticator.verify(eq(Provider.LINKMOBILITY), any(), eq("abc"))).thenReturn(true);
        when(inboundMessageNormalizer.normalize(any())).thenReturn(List.of());

        mockMvc.perform(post("/webhooks/linkmobility/whatsapp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Link-Signature", "abc")
                        .content("{\"message\":\"Ciao\",\"sender\":\"+39333\",\"extra\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<LinkMobilityPayload> payload = ArgumentCaptor.forClass(LinkMobilityPayload.class);
        verify(inboundMessageNormalizer).normalize(payload.capture());
        assertThat(payload.getValue().message()).isEqualTo("Ciao");
    }

    @Test
    @DisplayName("Malformed JSON is still acknowledged so the provider does not redeliver")
    void malformedJsonAcknowledged() throws Exception {
        when(webhookAuthenticator.verify(eq(Provider.SKEBBY), any(), isNull())).thenReturn(true);

        mockMvc.perform(post("/webhooks/skebby/sms")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verifyNoInteractions(inboundMessageNormalizer, webhookIngressService);
    }

    @Test
    @DisplayName("Shared status endpoint routes on X-Provider")
    void statusEndpointRoutesOnHeader() throws Exception {
        when(webhookAuthenticator.verify(eq(Provider.TWILIO), any(), eq("sig"))).thenReturn(true);
        when(inboundMessageNormalizer.normalize(any())).thenReturn(List.of());

        mockMvc.perform(post("/webhooks/whatsapp/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .header("X-Provider", "twilio")
                        .header("X-Twilio-Signature", "sig")
                        .content("MessageSid=SM1&SmsStatus=delivered"))
                .andExpect(status().isOk())
                .andExpect(content().string(WebhookController.EMPTY_TWIML));
    }

    @Test
    @DisplayName("Shared status endpoint without a known provider returns 400")
    void statusEndpointWithoutProvider() throws Exception {
        mockMvc.perform(post("/webhooks/whatsapp/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Provider not specified"));

        verifyNoInteractions(webhookAuthenticator, inboundMessageNormalizer);
    }

    @Test
    @DisplayName("Messenger handshake echoes the challenge or answers 403")
    void messengerHandshake() throws Exception {
        when(webhookAuthenticator.verifySubscription("subscribe", "good", "1234")).thenReturn(Optional.of("1234"));
        when(webhookAuthenticator.verifySubscription("subscribe", "bad", "1234")).thenReturn(Optional.empty());

        mockMvc.perform(get("/webhooks/facebook/messenger")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "good")
                        .param("hub.challenge", "1234"))
                .andExpect(status().isOk())
                .andExpect(content().string("1234"));

        mockMvc.perform(get("/webhooks/facebook/messenger")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "bad")
                        .param("hub.challenge", "1234"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("SendGrid multipart inbound parse is acknowledged")
    void sendGridMultipart() throws Exception {
        when(inboundMessageNormalizer.normalize(any())).thenReturn(List.of());

        mockMvc.perform(multipart("/webhooks/sendgrid/inbound")
                        .param("from", "Mario <mario@example.it>")
                        .param("text", "Ciao"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(inboundMessageNormalizer).normalize(any());
    }

    @Test
    @DisplayName("Diagnostics expose the endpoint inventory")
    void diagnostics() throws Exception {
        when(webhookCatalogService.status()).thenReturn(Map.of("success", true, "endpoints", List.of("/webhooks/twilio/whatsapp")));
        when(webhookCatalogService.info(anyString())).thenReturn(Map.of("security", Map.of("production", false)));

        mockMvc.perform(get("/webhooks/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints[0]").value("/webhooks/twilio/whatsapp"));
        mockMvc.perform(get("/webhooks/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.security.production").value(false));
    }

    @Test
    @DisplayName("AI analytics summarize handled messages")
    void aiAnalytics() throws Exception {
        when(aiAnalyticsService.summary()).thenReturn(new AiAnalyticsService.AiAnalytics(
                40, 30, 75, List.of(new AiAnalyticsService.IntentShare("question", 22)), 87.3));

        mockMvc.perform(get("/webhooks/ai/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalMessages").value(40))
                .andExpect(jsonPath("$.aiResponses").value(30))
                .andExpect(jsonPath("$.responseRate").value(75))
                .andExpect(jsonPath("$.commonIntents[0].intent").value("question"))
                .andExpect(jsonPath("$.commonIntents[0].count").value(22))
                .andExpect(jsonPath("$.averageConfidence").value(87.3));
    }
}
