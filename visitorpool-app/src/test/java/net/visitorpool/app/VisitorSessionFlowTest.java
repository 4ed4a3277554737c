package net.visitorpool.app;

import net.visitorpool.core.model.PoolStatus;
import net.visitorpool.core.service.VisitorPool;
import net.visitorpool.core.session.SessionKeys;
import net.visitorpool.integration.spring.sched.VisitorPoolSchedulers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestMethodOrder(MethodOrderer.MethodName.class)
class VisitorSessionFlowTest {
    static final String BROWSER = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/126.0 Safari/537.36";
    static final String BOT = "Mozilla/5.0 (compatible; bingbot/2.0; +http://www.bing.com/bingbot.htm)";

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;
    @Autowired VisitorPool pool;
    @Autowired VisitorPoolSchedulers schedulers;

    @BeforeEach
    void clearLeases() {
        jdbc.update("DELETE FROM TB_VISITOR_LEASE");
    }

    @Test
    void a1_pool_is_initialized_on_startup() throws Exception {
        Integer identities = jdbc.queryForObject("SELECT COUNT(*) FROM TB_VISITOR_IDENTITY", Integer.class);
        assertThat(identities).isEqualTo(2);
        assertThat(pool.status()).isEqualTo(new PoolStatus(2, 0, 2, 0));
    }

    @Test
    void a2_browser_gets_a_slot_and_keeps_it() throws Exception {
        var session = new MockHttpSession();

        mvc.perform(get("/writer").session(session).header("User-Agent", BROWSER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ALLOCATED"))
                .andExpect(jsonPath("$.visitor").value("visitor-001"));
        assertThat(session.getAttribute(SessionKeys.ALLOCATION_TOKEN)).isNotNull();
        assertThat(session.getAttribute(SessionKeys.IDENTITY_NUMBER)).isEqualTo("1");

        mvc.perform(get("/writer").session(session).header("User-Agent", BROWSER))
                .andExpect(jsonPath("$.status").value("REUSED"))
                .andExpect(jsonPath("$.visitor").value("visitor-001"));

        Integer rows = jdbc.queryForObject("SELECT COUNT(*) FROM TB_VISITOR_LEASE", Integer.class);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void a3_bots_are_not_bound() throws Exception {
        var session = new MockHttpSession();
        mvc.perform(get("/writer").session(session).header("User-Agent", BOT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.demo").value(false));
        assertThat(session.getAttribute(SessionKeys.ALLOCATION_TOKEN)).isNull();
        assertThat(pool.status().allocated()).isZero();
    }

    @Test
    void a4_exhaustion_does_not_fail_the_request() throws Exception {
        mvc.perform(get("/writer").session(new MockHttpSession()).header("User-Agent", BROWSER))
                .andExpect(jsonPath("$.visitor").value("visitor-001"));
        mvc.perform(get("/writer").session(new MockHttpSession()).header("User-Agent", BROWSER))
                .andExpect(jsonPath("$.visitor").value("visitor-002"));

        mvc.perform(get("/writer").session(new MockHttpSession()).header("User-Agent", BROWSER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.poolExhausted").value(true));
    }

    @Test
    void a5_signup_claims_the_visitor_workspace() throws Exception {
        var session = new MockHttpSession();
        mvc.perform(get("/writer").session(session).header("User-Agent", BROWSER))
                .andExpect(jsonPath("$.visitor").value("visitor-001"));
        Object workspaceId = session.getAttribute(SessionKeys.WORKSPACE_ID);

        mvc.perform(post("/signup").param("account", "alice").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claimed").value(true))
                .andExpect(jsonPath("$.owner").value("alice"));

        assertThat(session.getAttribute(SessionKeys.ALLOCATION_TOKEN)).isNull();
        String owner = jdbc.queryForObject("SELECT OWNER_REF FROM TB_WORKSPACE WHERE ID = ?",
                String.class, Long.valueOf(workspaceId.toString()));
        assertThat(owner).isEqualTo("alice");
        // 슬롯은 비었고, visitor-001 은 새 기본 워크스페이스를 받았다
        assertThat(pool.status().allocated()).isZero();
        Long current = jdbc.queryForObject("SELECT WORKSPACE_ID FROM TB_VISITOR_IDENTITY WHERE IDENTITY_NO = 1", Long.class);
        assertThat(current).isNotEqualTo(Long.valueOf(workspaceId.toString()));
    }

    @Test
    void a6_scheduled_reclaim_runs_against_the_spring_transaction() throws Exception {
        jdbc.update("""
                INSERT INTO TB_VISITOR_LEASE (IDENTITY_NO, TOKEN, SESSION_KEY, CREATED_AT, EXPIRES_AT, IS_ACTIVE)
                VALUES (2, 'stale-token', 'old', TIMESTAMP '2020-01-01 00:00:00', TIMESTAMP '2020-01-01 01:00:00', TRUE)
                """);
        assertThat(pool.status().expired()).isEqualTo(1);

        schedulers.reclaim();

        String reason = jdbc.queryForObject(
                "SELECT RELEASE_REASON FROM TB_VISITOR_LEASE WHERE TOKEN = 'stale-token'", String.class);
        assertThat(reason).isEqualTo("EXPIRED");
        assertThat(pool.status()).isEqualTo(new PoolStatus(2, 0, 2, 0));
    }
}
