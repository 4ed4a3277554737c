package net.visitorpool.core.model;

import java.time.Instant;

/** 상태 페이지용 슬롯 단위 뷰 */
public record SlotView(
        int number,
        State state,
        String accountRef,       // FREE 면 null
        Instant expiresAt,
        Long minutesRemaining,
        boolean currentSession
) {
    public enum State { ALLOCATED, FREE }
}
