package net.visitorpool.core.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 서블릿 세션이 없는 호출자(CLI, 테스트)용 */
public final class MapVisitorSession implements VisitorSession {
    private final String id;
    private final Map<String, String> values = new ConcurrentHashMap<>();

    public MapVisitorSession(String id) {
        this.id = id;
    }

    @Override public String id() { return id; }

    @Override public String get(String key) { return values.get(key); }

    @Override public void set(String key, String value) {
        if (value == null) values.remove(key);
        else values.put(key, value);
    }

    @Override public void remove(String key) { values.remove(key); }

    public Map<String, String> snapshot() { return Map.copyOf(values); }

    @Override public String toString() {
        return "MapVisitorSession{id='" + id + "', keys=" + values.keySet() + '}';
    }
}
