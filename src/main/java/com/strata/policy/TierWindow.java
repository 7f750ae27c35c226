package com.strata.policy;

import com.strata.domain.TimeRange;

import java.time.Instant;

/**
 * Tier boundaries derived from policy durations at evaluation time. Never persisted.
 *
 * Rows in {@code [warmCutoff, hotCutoff)} are downsampling candidates; rows
 * before {@code warmCutoff} are cold candidates.
 */
public final class TierWindow {

    private final Instant hotCutoff;
    private final Instant warmCutoff;

    public TierWindow(Instant hotCutoff, Instant warmCutoff) {
        if (warmCutoff.isAfter(hotCutoff)) {
            throw new IllegalArgumentException("warm cutoff " + warmCutoff + " is after hot cutoff " + hotCutoff);
        }
        this.hotCutoff = hotCutoff;
        this.warmCutoff = warmCutoff;
    }

    public Instant getHotCutoff() {
        return hotCutoff;
    }

    public Instant getWarmCutoff() {
        return warmCutoff;
    }

    public TimeRange downsampleRange() {
        return TimeRange.of(warmCutoff, hotCutoff);
    }

    public TimeRange coldRange() {
        return TimeRange.before(warmCutoff);
    }

    @Override
    public String toString() {
        return "TierWindow{hot<" + hotCutoff + ", warm<" + warmCutoff + "}";
    }
}
