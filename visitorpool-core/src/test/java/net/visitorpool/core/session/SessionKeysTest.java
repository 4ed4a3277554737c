package net.visitorpool.core.session;

import net.visitorpool.core.model.AllocationResult;
import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionKeysTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void bind_then_clear() {
        var session = new MapVisitorSession("s-1");
        var identity = new VisitorIdentity(2, VisitorIdentity.accountRefOf(2), 20L, T0, T0);
        var ws = new Workspace(20L, "visitor-002", Workspace.DEFAULT_SLUG, Workspace.DEFAULT_NAME, T0, T0);
        var lease = new Lease(7L, 2, "abcdef0123456789", "s-1", T0, T0.plusSeconds(3600), true, null, null);

        SessionKeys.bind(session, AllocationResult.allocated(identity, ws, lease));

        assertThat(session.snapshot())
                .containsEntry(SessionKeys.ALLOCATION_TOKEN, "abcdef0123456789")
                .containsEntry(SessionKeys.IDENTITY_NUMBER, "2")
                .containsEntry(SessionKeys.WORKSPACE_ID, "20");
        assertThat(SessionKeys.token(session)).isEqualTo("abcdef0123456789");

        session.set("other", "kept");
        SessionKeys.clear(session);
        assertThat(session.snapshot()).containsOnlyKeys("other");
        assertThat(SessionKeys.token(session)).isNull();
    }

    @Test
    void blank_token_counts_as_absent() {
        var session = new MapVisitorSession("s-2");
        session.set(SessionKeys.ALLOCATION_TOKEN, "  ");
        assertThat(SessionKeys.token(session)).isNull();
    }

    @Test
    void abbreviate_keeps_the_first_eight_chars() {
        assertThat(SessionKeys.abbreviate("0123456789abcdef")).isEqualTo("01234567...");
        assertThat(SessionKeys.abbreviate("short")).isEqualTo("short");
        assertThat(SessionKeys.abbreviate(null)).isEqualTo("null");
    }
}
