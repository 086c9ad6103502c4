package com.easycashflows.domain.message;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of the customer's business data embedded in AI prompts.
 */
public record BusinessContext(
        List<Map<String, Object>> recentMovements,
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        int companyCount,
        int customerHistory
) {

    public BusinessContext {
        recentMovements = recentMovements == null ? List.of() : List.copyOf(recentMovements);
        totalIncome = totalIncome == null ? BigDecimal.ZERO : totalIncome;
        totalExpenses = totalExpenses == null ? BigDecimal.ZERO : totalExpenses;
    }

    public static BusinessContext empty() {
        return new BusinessContext(List.of(), BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);
    }
}
