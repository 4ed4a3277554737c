package net.visitorpool.adapter.jdbc.repo;

import net.visitorpool.adapter.jdbc.JdbcUtil;
import net.visitorpool.adapter.jdbc.TxContext;
import net.visitorpool.adapter.jdbc.mapper.RowMappers;
import net.visitorpool.core.model.Workspace;
import net.visitorpool.core.spi.WorkspaceRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;

public final class JdbcWorkspaceRepository implements WorkspaceRepository {
    private final DataSource ds;

    public JdbcWorkspaceRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.required();
    }

    @Override
    public Workspace insert(String ownerRef, String slug, String name, Instant at) throws Exception {
        long id;
        try (var ps = mustConn().prepareStatement("""
            INSERT INTO TB_WORKSPACE (OWNER_REF, SLUG, NAME, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, ownerRef);
            ps.setString(2, slug);
            ps.setString(3, name);
            ps.setTimestamp(4, JdbcUtil.ts(at));
            ps.setTimestamp(5, JdbcUtil.ts(at));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for TB_WORKSPACE");
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow();
    }

    @Override
    public Optional<Workspace> findById(long id) throws Exception {
        return selectOne("SELECT * FROM TB_WORKSPACE WHERE ID = ?", id);
    }

    @Override
    public Optional<Workspace> lockById(long id) throws Exception {
        return selectOne("SELECT * FROM TB_WORKSPACE WHERE ID = ? FOR UPDATE", id);
    }

    @Override
    public int changeOwner(long id, String newOwnerRef, Instant at) throws Exception {
        try (var ps = mustConn().prepareStatement("""
            UPDATE TB_WORKSPACE
               SET OWNER_REF  = ?,
                   UPDATED_AT = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, newOwnerRef);
            ps.setTimestamp(2, JdbcUtil.ts(at));
            ps.setLong(3, id);
            return ps.executeUpdate();
        }
    }

    private Optional<Workspace> selectOne(String sql, long id) throws Exception {
        try (var ps = mustConn().prepareStatement(sql)) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toWorkspace(rs)) : Optional.empty();
            }
        }
    }
}
