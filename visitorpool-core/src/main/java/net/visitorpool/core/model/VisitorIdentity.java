package net.visitorpool.core.model;

import java.time.Instant;

public record VisitorIdentity(
        Integer number,          // 1..N, 슬롯 번호
        String accountRef,       // visitor-001 ...
        Long workspaceId,        // 현재 짝지어진 기본 워크스페이스
        Instant createdAt,
        Instant updatedAt
) {
    public static final String ACCOUNT_PREFIX = "visitor-";

    public static String accountRefOf(int number) {
        return ACCOUNT_PREFIX + String.format("%03d", number);
    }
}
