package net.visitorpool.adapter.jdbc.repo;

import net.visitorpool.adapter.jdbc.JdbcUtil;
import net.visitorpool.adapter.jdbc.TxContext;
import net.visitorpool.adapter.jdbc.mapper.RowMappers;
import net.visitorpool.core.model.Lease;
import net.visitorpool.core.spi.LeaseRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 리스는 지우지 않는다. 비활성화만 하고 이력으로 남김 */
public final class JdbcLeaseRepository implements LeaseRepository {
    private final DataSource ds;

    public JdbcLeaseRepository(DataSource ds) {
        this.ds = ds;
    }

    // === utils ===
    private Connection mustConn() {
        return TxContext.required();
    }

    // === interface impl ===

    @Override
    public Lease insert(Lease lease) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_VISITOR_LEASE
                   (IDENTITY_NO, TOKEN, SESSION_KEY, CREATED_AT, EXPIRES_AT, IS_ACTIVE)
            VALUES (?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setInt(1, lease.identityNumber());
            ps.setString(2, lease.token());
            ps.setString(3, lease.sessionKey());
            ps.setTimestamp(4, JdbcUtil.ts(lease.createdAt()));
            ps.setTimestamp(5, JdbcUtil.ts(lease.expiresAt()));
            ps.setBoolean(6, lease.active());
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for TB_VISITOR_LEASE");
                id = keys.getLong(1);
            }
        }
        return new Lease(id, lease.identityNumber(), lease.token(), lease.sessionKey(),
                lease.createdAt(), lease.expiresAt(), lease.active(), null, null);
    }

    @Override
    public Optional<Lease> findLiveByToken(String token, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_VISITOR_LEASE
             WHERE TOKEN = ?
               AND IS_ACTIVE = TRUE
               AND EXPIRES_AT > ?
        """)) {
            ps.setString(1, token);
            ps.setTimestamp(2, JdbcUtil.ts(now));
            return one(ps);
        }
    }

    @Override
    public Optional<Lease> findByToken(String token) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_VISITOR_LEASE WHERE TOKEN = ?")) {
            ps.setString(1, token);
            return one(ps);
        }
    }

    @Override
    public Optional<Lease> lockByToken(String token) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT * FROM TB_VISITOR_LEASE WHERE TOKEN = ? FOR UPDATE")) {
            ps.setString(1, token);
            return one(ps);
        }
    }

    @Override
    public List<Lease> findActiveByIdentity(int identityNumber) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_VISITOR_LEASE
             WHERE IDENTITY_NO = ?
               AND IS_ACTIVE = TRUE
             ORDER BY ID
        """)) {
            ps.setInt(1, identityNumber);
            return many(ps);
        }
    }

    @Override
    public List<Lease> findAllActive() throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT * FROM TB_VISITOR_LEASE WHERE IS_ACTIVE = TRUE ORDER BY IDENTITY_NO, ID
        """)) {
            return many(ps);
        }
    }

    @Override
    public List<Lease> findExpired(Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_VISITOR_LEASE
             WHERE IS_ACTIVE = TRUE
               AND EXPIRES_AT <= ?
             ORDER BY IDENTITY_NO, ID
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            return many(ps);
        }
    }

    /** 활성인 경우에만 (조건부 UPDATE) */
    @Override
    public int deactivate(long leaseId, Instant at, Lease.EndReason reason) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_VISITOR_LEASE
               SET IS_ACTIVE      = FALSE,
                   RELEASED_AT    = ?,
                   RELEASE_REASON = ?
             WHERE ID = ?
               AND IS_ACTIVE = TRUE
        """)) {
            ps.setTimestamp(1, JdbcUtil.ts(at));
            ps.setString(2, reason.code());
            ps.setLong(3, leaseId);
            return ps.executeUpdate();
        }
    }

    @Override
    public int countLive(Instant now) throws Exception {
        return count("SELECT COUNT(*) FROM TB_VISITOR_LEASE WHERE IS_ACTIVE = TRUE AND EXPIRES_AT > ?", now);
    }

    @Override
    public int countExpired(Instant now) throws Exception {
        return count("SELECT COUNT(*) FROM TB_VISITOR_LEASE WHERE IS_ACTIVE = TRUE AND EXPIRES_AT <= ?", now);
    }

    // === helpers ===

    private int count(String sql, Instant now) throws Exception {
        try (var ps = mustConn().prepareStatement(sql)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private static Optional<Lease> one(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toLease(rs)) : Optional.empty();
        }
    }

    private static List<Lease> many(PreparedStatement ps) throws Exception {
        try (var rs = ps.executeQuery()) {
            List<Lease> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toLease(rs));
            return out;
        }
    }
}
