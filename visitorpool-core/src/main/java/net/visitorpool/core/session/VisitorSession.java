package net.visitorpool.core.session;

/**
 * 호출 측(웹 계층)이 제공하는 클라이언트 세션.
 * 위조 불가능성은 호출 측 책임이며 여기서는 신뢰한다.
 */
public interface VisitorSession {
    /** 상관관계용 식별자. 보안 토큰이 아니다. null 가능 */
    String id();

    String get(String key);

    void set(String key, String value);

    void remove(String key);
}
