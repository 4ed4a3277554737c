package net.visitorpool.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static Lease lease(boolean active) {
        return new Lease(1L, 1, "t", null, T0, T0.plusSeconds(60), active, null, null);
    }

    @Test
    void expiry_boundary_is_inclusive() {
        var l = lease(true);
        assertThat(l.liveAt(T0.plusSeconds(59))).isTrue();
        assertThat(l.liveAt(T0.plusSeconds(60))).isFalse();
        assertThat(l.expiredAt(T0.plusSeconds(60))).isTrue();
    }

    @Test
    void inactive_lease_is_neither_live_nor_expired() {
        var l = lease(false);
        assertThat(l.liveAt(T0)).isFalse();
        assertThat(l.expiredAt(T0.plusSeconds(120))).isFalse();
    }

    @Test
    void end_reason_codes() {
        assertThat(Lease.EndReason.from("CLAIMED")).isEqualTo(Lease.EndReason.CLAIMED);
        assertThat(Lease.EndReason.from(null)).isNull();
        assertThat(Lease.EndReason.from("whatever")).isEqualTo(Lease.EndReason.UNKNOWN);
        assertThat(VisitorIdentity.accountRefOf(7)).isEqualTo("visitor-007");
    }
}
