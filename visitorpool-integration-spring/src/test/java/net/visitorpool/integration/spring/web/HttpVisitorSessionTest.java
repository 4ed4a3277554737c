package net.visitorpool.integration.spring.web;

import net.visitorpool.core.session.SessionKeys;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpSession;

import static org.assertj.core.api.Assertions.assertThat;

class HttpVisitorSessionTest {

    @Test
    void reads_and_writes_servlet_attributes() {
        var http = new MockHttpSession(null, "sess-42");
        var session = new HttpVisitorSession(http);

        session.set(SessionKeys.ALLOCATION_TOKEN, "abc");
        assertThat(http.getAttribute(SessionKeys.ALLOCATION_TOKEN)).isEqualTo("abc");
        assertThat(session.id()).isEqualTo("sess-42");

        // 다른 타입으로 넣은 값도 문자열로 읽힌다
        http.setAttribute(SessionKeys.IDENTITY_NUMBER, 3);
        assertThat(session.get(SessionKeys.IDENTITY_NUMBER)).isEqualTo("3");

        session.set(SessionKeys.ALLOCATION_TOKEN, null);
        assertThat(http.getAttribute(SessionKeys.ALLOCATION_TOKEN)).isNull();

        session.remove(SessionKeys.IDENTITY_NUMBER);
        assertThat(session.get(SessionKeys.IDENTITY_NUMBER)).isNull();
    }
}
