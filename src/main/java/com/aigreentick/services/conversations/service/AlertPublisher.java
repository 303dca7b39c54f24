package com.aigreentick.services.conversations.service;

/**
 * Raises operational alerts for failures nobody is waiting on:
 * exhausted dispatch retries, failed conversation turns.
 */
public interface AlertPublisher {

    void publish(String alertType, Long organizationId, String contactPhone, String message);
}
