package net.visitorpool.integration.spring.web;

import jakarta.servlet.http.HttpSession;
import net.visitorpool.core.session.VisitorSession;

/** 서블릿 세션 어댑터. 값은 문자열로만 저장한다 */
public final class HttpVisitorSession implements VisitorSession {
    private final HttpSession session;

    public HttpVisitorSession(HttpSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String get(String key) {
        Object v = session.getAttribute(key);
        return v == null ? null : v.toString();
    }

    @Override
    public void set(String key, String value) {
        if (value == null) session.removeAttribute(key);
        else session.setAttribute(key, value);
    }

    @Override
    public void remove(String key) {
        session.removeAttribute(key);
    }
}
