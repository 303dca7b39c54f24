package com.aigreentick.services.conversations.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes alerts to the log at ERROR level, where log-based alerting picks them up.
 */
@Component
@Slf4j
public class LoggingAlertPublisher implements AlertPublisher {

    @Override
    public void publish(String alertType, Long organizationId, String contactPhone, String message) {
        log.error("ALERT type={} organizationId={} contact={} message={}",
                alertType, organizationId, contactPhone, message);
    }
}
