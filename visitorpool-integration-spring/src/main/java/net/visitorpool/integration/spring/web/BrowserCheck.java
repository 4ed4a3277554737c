package net.visitorpool.integration.spring.web;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * User-Agent 로 실제 브라우저인지 추정한다.
 * 크롤러/헬스체크가 슬롯을 잡아먹지 않도록 allocate 앞에서 거른다.
 */
public final class BrowserCheck implements Predicate<String> {
    public static final List<String> DEFAULT_BOT_MARKERS = List.of(
            "bot", "crawler", "spider", "slurp", "curl", "wget",
            "python-requests", "httpclient", "okhttp", "headless", "monitor");

    private final List<String> botMarkers;

    public BrowserCheck(List<String> botMarkers) {
        this.botMarkers = botMarkers.stream()
                .filter(m -> m != null && !m.isBlank())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static BrowserCheck defaults() {
        return new BrowserCheck(DEFAULT_BOT_MARKERS);
    }

    /** 모든 주요 브라우저는 "Mozilla/" 로 시작한다 */
    @Override
    public boolean test(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) return false;
        String ua = userAgent.toLowerCase(Locale.ROOT);
        if (!ua.startsWith("mozilla/")) return false;
        for (String m : botMarkers) {
            if (ua.contains(m)) return false;
        }
        return true;
    }
}
