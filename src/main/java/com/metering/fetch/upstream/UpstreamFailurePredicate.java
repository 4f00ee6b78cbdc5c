package com.metering.fetch.upstream;

import com.metering.fetch.domain.ErrorCategory;
import com.metering.fetch.exception.UpstreamException;

import java.util.function.Predicate;

/**
 * Circuit breaker failure predicate: client faults (bad site, unauthorized) say nothing about
 * upstream health and are not counted.
 */
public class UpstreamFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream.getCategory() != ErrorCategory.CLIENT_FAULT;
        }
        return true;
    }
}
