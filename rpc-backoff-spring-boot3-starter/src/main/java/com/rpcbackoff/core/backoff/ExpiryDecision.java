package com.rpcbackoff.core.backoff;

import com.rpcbackoff.exception.Backoff;

public final class ExpiryDecision {

    private static final ExpiryDecision CONTINUE = new ExpiryDecision(null);

    private final Backoff.Expired expired;

    private ExpiryDecision(Backoff.Expired expired) {
        this.expired = expired;
    }

    public static ExpiryDecision proceed() { return CONTINUE; }

    public static ExpiryDecision expired(Backoff.Expired e) { return new ExpiryDecision(e); }

    public boolean isExpired() { return expired != null; }

    public Backoff.Expired getExpired() { return expired; }
}
