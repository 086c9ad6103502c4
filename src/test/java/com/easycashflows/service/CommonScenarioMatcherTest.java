package com.easycashflows.service;

import com.easycashflows.domain.enums.Channel;
import com.easycashflows.domain.enums.Provider;
import com.easycashflows.domain.message.InboundMessage;
import com.easycashflows.service.CommonScenarioMatcher.Scenario;
import com.easycashflows.service.CommonScenarioMatcher.ScenarioMatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CommonScenarioMatcher")
class CommonScenarioMatcherTest {

    private static final ZoneId ROME = ZoneId.of("Europe/Rome");
    private static final Instant WEDNESDAY_10 = Instant.parse("2024-05-15T08:00:00Z");
    private static final Instant SUNDAY_10 = Instant.parse("2024-05-19T08:00:00Z");

    @Test
    @DisplayName("Greeting keywords match case-insensitively with the in-hours wording")
    void greetingDuringOfficeHours() {
        ScenarioMatch match = matcherAt(WEDNESDAY_10).match(message("BUONGIORNO a tutti")).orElseThrow();

        assertThat(match.scenario()).isEqualTo(Scenario.GREETING);
        assertThat(match.reply()).contains("Come posso aiutarti");
        assertThat(match.escalate()).isFalse();
    }

    @Test
    @DisplayName("Out of hours the greeting mentions office hours")
    void greetingOutOfHours() {
        ScenarioMatch match = matcherAt(SUNDAY_10).match(message("Ciao, buongiorno")).orElseThrow();

        assertThat(match.scenario()).isEqualTo(Scenario.GREETING);
        assertThat(match.reply()).contains("orario di ufficio");
        assertThat(match.escalate()).isFalse();
    }

    @Test
    @DisplayName("Payment and support keywords pick their rows")
    void paymentAndSupport() {
        CommonScenarioMatcher matcher = matcherAt(WEDNESDAY_10);

        assertThat(matcher.match(message("Info sul saldo")).orElseThrow().scenario()).isEqualTo(Scenario.PAYMENT);
        assertThat(matcher.match(message("Ho un problema con l'app")).orElseThrow().scenario())
                .isEqualTo(Scenario.SUPPORT);
    }

    @Test
    @DisplayName("Urgent keywords escalate even when an earlier row supplies the reply")
    void urgentEscalatesAlongsideGreeting() {
        ScenarioMatch match = matcherAt(WEDNESDAY_10).match(message("Ciao, è urgente")).orElseThrow();

        assertThat(match.scenario()).isEqualTo(Scenario.GREETING);
        assertThat(match.escalate()).isTrue();
    }

    @Test
    @DisplayName("No keyword, no match")
    void noMatch() {
        assertThat(matcherAt(WEDNESDAY_10).match(message("Vorrei un preventivo"))).isEmpty();
    }

    @Test
    @DisplayName("Every canned reply fits the reply ceiling")
    void repliesFitCeiling() {
        for (Instant at : new Instant[]{WEDNESDAY_10, SUNDAY_10}) {
            CommonScenarioMatcher matcher = matcherAt(at);
            for (String body : new String[]{"ciao", "fattura", "aiuto", "subito"}) {
                assertThat(matcher.match(message(body)).orElseThrow().reply())
                        .hasSizeLessThanOrEqualTo(Channel.MAX_REPLY_LENGTH);
            }
        }
    }

    private CommonScenarioMatcher matcherAt(Instant instant) {
        return new CommonScenarioMatcher(new BusinessHoursPolicy(Clock.fixed(instant, ROME)));
    }

    private InboundMessage message(String body) {
        return new InboundMessage("+393331234567", null, body, Channel.WHATSAPP, Provider.TWILIO, "SM1",
                Instant.parse("2024-05-15T08:00:00Z"), null);
    }
}
