package net.visitorpool.adapter.jdbc.repo;

import net.visitorpool.adapter.jdbc.JdbcUtil;
import net.visitorpool.adapter.jdbc.TxContext;
import net.visitorpool.adapter.jdbc.mapper.RowMappers;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.spi.VisitorIdentityRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

public final class JdbcVisitorIdentityRepository implements VisitorIdentityRepository {
    private final DataSource ds;

    public JdbcVisitorIdentityRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.required();
    }

    @Override
    public void insert(VisitorIdentity identity) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_VISITOR_IDENTITY (IDENTITY_NO, ACCOUNT_REF, WORKSPACE_ID, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?)
        """)) {
            ps.setInt(1, identity.number());
            ps.setString(2, identity.accountRef());
            ps.setLong(3, identity.workspaceId());
            ps.setTimestamp(4, JdbcUtil.ts(identity.createdAt()));
            ps.setTimestamp(5, JdbcUtil.ts(identity.updatedAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<VisitorIdentity> findByNumber(int number) throws Exception {
        return selectOne("SELECT * FROM TB_VISITOR_IDENTITY WHERE IDENTITY_NO = ?", number);
    }

    /** 슬롯 선점/이전은 이 행 잠금으로 직렬화된다 */
    @Override
    public Optional<VisitorIdentity> lockByNumber(int number) throws Exception {
        return selectOne("SELECT * FROM TB_VISITOR_IDENTITY WHERE IDENTITY_NO = ? FOR UPDATE", number);
    }

    @Override
    public void repointWorkspace(int number, long workspaceId, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_VISITOR_IDENTITY
               SET WORKSPACE_ID = ?,
                   UPDATED_AT   = ?
             WHERE IDENTITY_NO = ?
        """)) {
            ps.setLong(1, workspaceId);
            ps.setTimestamp(2, JdbcUtil.ts(at));
            ps.setInt(3, number);
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("visitor identity not found: " + number);
            }
        }
    }

    @Override
    public int count() throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_VISITOR_IDENTITY");
             var rs = ps.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private Optional<VisitorIdentity> selectOne(String sql, int number) throws Exception {
        try (var ps = mustConn().prepareStatement(sql)) {
            ps.setInt(1, number);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toIdentity(rs)) : Optional.empty();
            }
        }
    }
}
