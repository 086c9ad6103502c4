package com.easycashflows.service;

import com.easycashflows.domain.message.InboundMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Zero-cost keyword replies used when the AI path is unavailable or not confident enough.
 * Rows are tried in order; the urgent keywords always request an escalation, whichever row replied.
 */
@Component
@RequiredArgsConstructor
public class CommonScenarioMatcher {

    public enum Scenario {
        GREETING,
        PAYMENT,
        SUPPORT,
        URGENT
    }

    public record ScenarioMatch(Scenario scenario, String reply, boolean escalate) {
    }

    private record Row(Scenario scenario, List<String> keywords, String openReply, String closedReply) {

        boolean matches(String text) {
            return keywords.stream().anyMatch(text::contains);
        }
    }

    private static final List<Row> ROWS = List.of(
            new Row(Scenario.GREETING, List.of("ciao", "salve", "buongiorno"),
                    "Ciao! Sono l'assistente di EasyCashFlows. Come posso aiutarti oggi?",
                    "Ciao! Sono l'assistente di EasyCashFlows. Ti risponderemo durante l'orario di ufficio (9-18). Grazie!"),
            new Row(Scenario.PAYMENT, List.of("pagamento", "saldo", "fattura"),
                    "Per informazioni su pagamenti e fatture contatta il nostro ufficio amministrativo.",
                    "Per informazioni su pagamenti e fatture contatta il nostro ufficio amministrativo."),
            new Row(Scenario.SUPPORT, List.of("aiuto", "supporto", "problema"),
                    "Ti mettiamo subito in contatto con il nostro supporto tecnico. Attendi un momento...",
                    "Il supporto tecnico è disponibile dalle 9 alle 18. Ti ricontatteremo appena possibile!"),
            new Row(Scenario.URGENT, List.of("urgente", "importante", "subito"),
                    "Messaggio ricevuto come urgente. Ti ricontatteremo entro 30 minuti.",
                    "Messaggio ricevuto come urgente. Ti ricontatteremo entro 30 minuti durante l'orario di ufficio.")
    );

    private static final Row URGENT_ROW = ROWS.get(3);

    private final BusinessHoursPolicy businessHoursPolicy;

    public Optional<ScenarioMatch> match(InboundMessage message) {
        String text = message.body().toLowerCase(Locale.ROOT);
        boolean urgent = URGENT_ROW.matches(text);
        boolean open = businessHoursPolicy.isOpen();
        return ROWS.stream()
                .filter(row -> row.matches(text))
                .findFirst()
                .map(row -> new ScenarioMatch(row.scenario(), open ? row.openReply() : row.closedReply(), urgent));
    }
}
