package com.metering.fetch.service;

/**
 * Either data returned inline ({@link DataResponse}) or a queued job handle ({@link QueuedResponse}).
 */
public interface FetchResponse {
}
