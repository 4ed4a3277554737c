package net.visitorpool.core.model;

import java.time.Instant;

public record Workspace(
        Long id,
        String ownerRef,     // 현재 소유자 (방문자 계정 or 가입 계정)
        String slug,
        String name,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_SLUG = "default-project";
    public static final String DEFAULT_NAME = "default-project";

    public boolean ownedBy(String accountRef) {
        return ownerRef != null && ownerRef.equals(accountRef);
    }
}
