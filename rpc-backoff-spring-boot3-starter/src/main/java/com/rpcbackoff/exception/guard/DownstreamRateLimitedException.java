package com.rpcbackoff.exception.guard;

public class DownstreamRateLimitedException extends RuntimeException {
    public DownstreamRateLimitedException(Throwable cause) { super("downstream rate limited", cause); }
}
