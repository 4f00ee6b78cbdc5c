package com.metering.fetch.queue;

import com.metering.fetch.domain.ErrorCategory;

/**
 * Why a delivery was moved to the dead-letter queue.
 *
 * @param detail optional diagnostic text such as a stack trace
 */
public record DeadLetterReason(String error, ErrorCategory category, String detail) {
}
