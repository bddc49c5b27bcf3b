package com.atomicswap.event;

import com.atomicswap.domain.enums.AckOutcome;
import org.springframework.context.ApplicationEvent;

/**
 * An acknowledgement delivery, including duplicates and unknown sequences that were ignored.
 */
public class AckEvent extends ApplicationEvent {

    private final long sequence;
    private final AckOutcome outcome;
    private final boolean applied;

    public AckEvent(Object source, long sequence, AckOutcome outcome, boolean applied) {
        super(source);
        this.sequence = sequence;
        this.outcome = outcome;
        this.applied = applied;
    }

    public long getSequence() {
        return sequence;
    }

    public AckOutcome getOutcome() {
        return outcome;
    }

    /** False when the delivery was a no-op (duplicate or unknown sequence). */
    public boolean isApplied() {
        return applied;
    }
}
