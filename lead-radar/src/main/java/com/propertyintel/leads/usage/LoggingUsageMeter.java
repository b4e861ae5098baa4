package com.propertyintel.leads.usage;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Default meter used when no metering system is wired in: every plan check
 * passes and events are written to the log.
 */
@Slf4j
public class LoggingUsageMeter implements UsageMeter {

    @Override
    public void ensureWithinPlan(String eventType, String accountId) {
        log.debug("Plan check for {} (account={}): unmetered", eventType, accountId);
    }

    @Override
    public void logEvent(String eventType, Map<String, Object> payload, Map<String, Object> metadata,
                         String accountId, String userId) {
        log.info("Usage event {} account={} user={} payload={} metadata={}",
                eventType, accountId, userId, payload, metadata);
    }
}
