package net.visitorpool.core.session;

import net.visitorpool.core.model.AllocationResult;

public final class SessionKeys {
    public static final String ALLOCATION_TOKEN = "visitor_allocation_token";
    public static final String IDENTITY_NUMBER = "visitor_identity_number";
    public static final String WORKSPACE_ID = "visitor_workspace_id";

    private SessionKeys() {}

    public static void bind(VisitorSession session, AllocationResult r) {
        session.set(ALLOCATION_TOKEN, r.lease().token());
        session.set(IDENTITY_NUMBER, String.valueOf(r.identity().number()));
        session.set(WORKSPACE_ID, String.valueOf(r.workspace().id()));
    }

    public static void clear(VisitorSession session) {
        session.remove(WORKSPACE_ID);
        session.remove(IDENTITY_NUMBER);
        session.remove(ALLOCATION_TOKEN);
    }

    public static String token(VisitorSession session) {
        String t = session.get(ALLOCATION_TOKEN);
        return (t == null || t.isBlank()) ? null : t;
    }

    /** 로그용 앞 8자리 */
    public static String abbreviate(String token) {
        if (token == null) return "null";
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
