package com.propertyintel.leads.usage;

import java.util.Map;

/**
 * Port to the usage-metering system that enforces plan quotas.
 */
public interface UsageMeter {

    /**
     * @throws UsageLimitExceededException when the account has used up its plan
     *                                     allowance for {@code eventType}
     */
    void ensureWithinPlan(String eventType, String accountId);

    /** Record a metered event. Must not block or fail the calling request. */
    void logEvent(String eventType, Map<String, Object> payload, Map<String, Object> metadata,
                  String accountId, String userId);
}
