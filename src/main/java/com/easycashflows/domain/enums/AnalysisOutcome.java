package com.easycashflows.domain.enums;

/**
 * How an intent analysis was obtained. Anything other than {@link #CLASSIFIED}
 * carries zero confidence.
 */
public enum AnalysisOutcome {
    CLASSIFIED,
    UNPARSEABLE,
    UNAVAILABLE
}
