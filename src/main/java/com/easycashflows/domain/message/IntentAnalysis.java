package com.easycashflows.domain.message;

import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.IntentType;
import com.easycashflows.domain.enums.Urgency;

import java.util.Set;

public record IntentAnalysis(
        IntentType intent,
        boolean shouldRespond,
        double confidence,
        Urgency urgency,
        Set<String> topics,
        AnalysisOutcome outcome
) {

    public IntentAnalysis {
        topics = topics == null ? Set.of() : Set.copyOf(topics);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static IntentAnalysis unavailable() {
        return fallback(AnalysisOutcome.UNAVAILABLE);
    }

    public static IntentAnalysis unparseable() {
        return fallback(AnalysisOutcome.UNPARSEABLE);
    }

    private static IntentAnalysis fallback(AnalysisOutcome outcome) {
        return new IntentAnalysis(IntentType.OTHER, false, 0.0, Urgency.LOW, Set.of(), outcome);
    }

    public boolean isConfidentAbove(double threshold) {
        return outcome == AnalysisOutcome.CLASSIFIED && confidence >= threshold;
    }

    public boolean flagsUrgency() {
        return outcome == AnalysisOutcome.CLASSIFIED && (urgency == Urgency.HIGH || intent == IntentType.URGENT);
    }
}
