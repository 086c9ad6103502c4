package com.easycashflows.service.dispatch;

import com.easycashflows.config.WebhookProperties;
import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.DispatchStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

@DisplayName("SendGridSender")
class SendGridSenderTest {

    private static final String SEND_URL = "https://api.sendgrid.test/v3/mail/send";

    private MockRestServiceServer server;
    private SendGridSender sender;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.sendgrid.test");
        server = MockRestServiceServer.bindTo(builder).build();
        sender = new SendGridSender(properties(new WebhookProperties.SendGrid("SG.key", null,
                "info@easycashflows.it", "EasyCashFlows", "support@easycashflows.it", null)), builder.build());
    }

    @Test
    @DisplayName("Mail is posted with the bearer key and the id comes from X-Message-Id")
    void sendsMail() {
        HttpHeaders responseHeaders = new HttpHeaders();
        responseHeaders.add("X-Message-Id", "msg-77");
        server.expect(requestTo(SEND_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer SG.key"))
                .andExpect(jsonPath("$.personalizations[0].to[0].email").value("mario@example.it"))
                .andExpect(jsonPath("$.from.email").value("info@easycashflows.it"))
                .andExpect(jsonPath("$.from.name").value("EasyCashFlows"))
                .andExpect(jsonPath("$.reply_to.email").value("support@easycashflows.it"))
                .andExpect(jsonPath("$.subject").value("Risposta da EasyCashFlows"))
                .andExpect(jsonPath("$.content[0].type").value("text/plain"))
                .andExpect(jsonPath("$.content[0].value").value("Grazie, le rispondiamo a breve."))
                .andRespond(withStatus(HttpStatus.ACCEPTED).headers(responseHeaders));

        DispatchResult result = sender.send(Channel.EMAIL, "mario@example.it", "Grazie, le rispondiamo a breve.");

        assertThat(result.status()).isEqualTo(DispatchStatus.SENT);
        assertThat(result.messageId()).isEqualTo("msg-77");
        server.verify();
    }

    @Test
    @DisplayName("Rejected request becomes a failed result")
    void upstreamError() {
        server.expect(requestTo(SEND_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        DispatchResult result = sender.send(Channel.EMAIL, "mario@example.it", "Ciao");

        assertThat(result.status()).isEqualTo(DispatchStatus.FAILED);
        assertThat(result.error()).isNotBlank();
    }

    @Test
    @DisplayName("Missing API key fails without calling SendGrid")
    void missingCredentials() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer untouched = MockRestServiceServer.bindTo(builder).build();
        SendGridSender unconfigured = new SendGridSender(properties(null), builder.build());

        assertThat(unconfigured.send(Channel.EMAIL, "mario@example.it", "Ciao").status())
                .isEqualTo(DispatchStatus.FAILED);
        untouched.verify();
    }

    @Test
    @DisplayName("Only email is supported")
    void supportsEmailOnly() {
        assertThat(sender.supports(Channel.EMAIL)).isTrue();
        assertThat(sender.supports(Channel.SMS)).isFalse();
    }

    private static WebhookProperties properties(WebhookProperties.SendGrid sendGrid) {
        return new WebhookProperties(null, null, null, null, null, null, null, null, null, null, sendGrid, null);
    }
}
