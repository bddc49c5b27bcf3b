package com.atomicswap.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * Durations, in seconds, of the consecutive stages of a staged order. Boundaries are the
 * cumulative sums from the creation time.
 */
@Value
@Builder
public class StageDurations {

    long finalityDelay;
    long takerExclusiveDuration;
    long privateResolverDuration;
    long publicResolverDuration;
    long privateCancellationDuration;

    /**
     * Seconds from creation until public cancellation opens.
     *
     * @throws ArithmeticException if the sum does not fit in a long
     */
    public long getTotal() {
        long total = Math.addExact(finalityDelay, takerExclusiveDuration);
        total = Math.addExact(total, privateResolverDuration);
        total = Math.addExact(total, publicResolverDuration);
        return Math.addExact(total, privateCancellationDuration);
    }
}
