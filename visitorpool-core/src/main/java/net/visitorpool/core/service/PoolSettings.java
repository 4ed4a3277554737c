package net.visitorpool.core.service;

import java.time.Duration;

/**
 * @param poolSize      N. 1..N 번 identity 만 할당 대상
 * @param leaseLifetime 리스 유효 기간
 */
public record PoolSettings(int poolSize, Duration leaseLifetime) {
    public static final int DEFAULT_POOL_SIZE = 4;
    public static final Duration DEFAULT_LEASE_LIFETIME = Duration.ofHours(1);

    public PoolSettings {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1: " + poolSize);
        if (leaseLifetime == null || leaseLifetime.isZero() || leaseLifetime.isNegative())
            throw new IllegalArgumentException("leaseLifetime must be positive: " + leaseLifetime);
    }

    public static PoolSettings defaults() {
        return new PoolSettings(DEFAULT_POOL_SIZE, DEFAULT_LEASE_LIFETIME);
    }
}
