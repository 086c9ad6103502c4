package com.easycashflows.service.ai;

import com.easycashflows.domain.message.BusinessContext;

/**
 * Business data lookup owned by the back office store. Implementations must not throw for unknown customers.
 */
public interface BusinessContextSource {

    BusinessContext snapshotFor(String customerAddress);
}
