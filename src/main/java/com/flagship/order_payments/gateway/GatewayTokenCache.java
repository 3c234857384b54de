package com.flagship.order_payments.gateway;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide cache of the gateway access token.
 *
 * Reads return the cached token while it is usable. When it is missing or about to expire,
 * one thread fetches a new token under {@link #refreshLock}; threads arriving meanwhile wait
 * and then reuse that token instead of fetching their own.
 */
@Slf4j
public class GatewayTokenCache {

    private final Supplier<GatewayAccessToken> tokenSource;
    private final Clock clock;
    private final Duration expirySkew;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile GatewayAccessToken current;

    public GatewayTokenCache(Supplier<GatewayAccessToken> tokenSource, Clock clock, Duration expirySkew) {
        this.tokenSource = tokenSource;
        this.clock = clock;
        this.expirySkew = expirySkew;
    }

    /**
     * @throws GatewayException when a refresh is needed and fails
     */
    public String getToken() {
        GatewayAccessToken token = current;
        if (isUsable(token)) {
            return token.getValue();
        }

        refreshLock.lock();
        try {
            // another thread may have refreshed while we waited
            token = current;
            if (isUsable(token)) {
                return token.getValue();
            }

            GatewayAccessToken refreshed = tokenSource.get();
            if (refreshed == null || refreshed.getValue() == null || refreshed.getValue().isBlank()) {
                throw new GatewayException(GatewayException.Reason.MALFORMED_RESPONSE,
                        "Gateway returned an empty access token");
            }
            current = refreshed;
            log.info("Gateway access token refreshed, valid until {}", refreshed.getExpiresAt());
            return refreshed.getValue();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops the cached token if it is still the one the gateway rejected.
     * A token refreshed by another thread in the meantime is kept.
     */
    public void invalidate(String rejectedToken) {
        refreshLock.lock();
        try {
            GatewayAccessToken token = current;
            if (token != null && token.getValue().equals(rejectedToken)) {
                current = null;
                log.info("Gateway access token invalidated");
            }
        } finally {
            refreshLock.unlock();
        }
    }

    private boolean isUsable(GatewayAccessToken token) {
        return token != null && token.isUsableAt(clock.instant(), expirySkew);
    }
}
