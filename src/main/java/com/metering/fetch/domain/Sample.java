package com.metering.fetch.domain;

/**
 * One raw upstream reading. {@code time} is passed through exactly as the upstream sent it.
 */
public record Sample(String time, double value) {
}
