package net.visitorpool.core.model;

import java.time.Instant;

public record Lease(
        Long id,
        Integer identityNumber,
        String token,          // 세션이 들고 있는 소유 증명 값
        String sessionKey,     // 상관관계용 (보안 토큰 아님)
        Instant createdAt,
        Instant expiresAt,
        boolean active,
        Instant releasedAt,
        EndReason endReason    // 비활성화 사유, 활성 상태면 null
) {
    /** active && expiresAt > now */
    public boolean liveAt(Instant now) {
        return active && expiresAt != null && expiresAt.isAfter(now);
    }

    public boolean expiredAt(Instant now) {
        return active && expiresAt != null && !expiresAt.isAfter(now);
    }

    public enum EndReason {
        EXPIRED, RELEASED, CLAIMED, UNKNOWN;

        public static EndReason from(String s) {
            if (s == null) return null;
            try { return EndReason.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
