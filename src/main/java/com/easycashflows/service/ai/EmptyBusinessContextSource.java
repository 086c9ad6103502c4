package com.easycashflows.service.ai;

import com.easycashflows.domain.message.BusinessContext;

/**
 * Used until the back office registers its own {@link BusinessContextSource}.
 */
public class EmptyBusinessContextSource implements BusinessContextSource {

    @Override
    public BusinessContext snapshotFor(String customerAddress) {
        return BusinessContext.empty();
    }
}
