package net.visitorpool.adapter.jdbc.mapper;

import net.visitorpool.adapter.jdbc.JdbcUtil;
import net.visitorpool.core.model.Lease;
import net.visitorpool.core.model.VisitorIdentity;
import net.visitorpool.core.model.Workspace;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- VisitorIdentity ---
    public static VisitorIdentity toIdentity(ResultSet rs) throws SQLException {
        return new VisitorIdentity(
                rs.getInt("IDENTITY_NO"),
                rs.getString("ACCOUNT_REF"),
                rs.getLong("WORKSPACE_ID"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Lease ---
    public static Lease toLease(ResultSet rs) throws SQLException {
        return new Lease(
                rs.getLong("ID"),
                rs.getInt("IDENTITY_NO"),
                rs.getString("TOKEN"),
                rs.getString("SESSION_KEY"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("EXPIRES_AT").toInstant(),
                rs.getBoolean("IS_ACTIVE"),
                JdbcUtil.toInstant(rs.getTimestamp("RELEASED_AT")),
                Lease.EndReason.from(rs.getString("RELEASE_REASON"))
        );
    }

    // --- Workspace ---
    public static Workspace toWorkspace(ResultSet rs) throws SQLException {
        return new Workspace(
                rs.getLong("ID"),
                rs.getString("OWNER_REF"),
                rs.getString("SLUG"),
                rs.getString("NAME"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
