package net.visitorpool.integration.spring.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import net.visitorpool.core.model.AllocationResult;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.spi.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.function.Predicate;

/**
 * 익명 요청을 방문자 슬롯에 묶는다.
 *
 * <p>결과는 요청 속성 {@link #RESULT_ATTRIBUTE} 로 뒤쪽 핸들러에 넘긴다.
 * 풀 고갈은 요청을 막지 않는다(속성 값이 EXHAUSTED). 저장소 장애는 그대로 전파한다.
 */
public class VisitorSessionFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(VisitorSessionFilter.class);

    public static final String RESULT_ATTRIBUTE = VisitorSessionFilter.class.getName() + ".RESULT";

    private final VisitorPool pool;
    private final Predicate<String> browserCheck;
    private final Predicate<HttpServletRequest> anonymous;

    /**
     * @param anonymous 인증 여부 판단. 보안 프레임워크가 없으면 {@code r -> r.getUserPrincipal() == null}
     */
    public VisitorSessionFilter(VisitorPool pool,
                                Predicate<String> browserCheck,
                                Predicate<HttpServletRequest> anonymous) {
        this.pool = pool;
        this.browserCheck = browserCheck;
        this.anonymous = anonymous;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        if (anonymous.test(request) && browserCheck.test(request.getHeader(HttpHeaders.USER_AGENT))) {
            bind(request);
        }
        chain.doFilter(request, response);
    }

    private void bind(HttpServletRequest request) throws ServletException {
        var session = new HttpVisitorSession(request.getSession(true));
        AllocationResult result;
        try {
            result = pool.allocate(session);
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException("visitor allocation failed", e);
        }

        if (result.isExhausted()) {
            log.warn("No visitor slot for {} {}", request.getMethod(), request.getRequestURI());
        }
        request.setAttribute(RESULT_ATTRIBUTE, result);
    }
}
