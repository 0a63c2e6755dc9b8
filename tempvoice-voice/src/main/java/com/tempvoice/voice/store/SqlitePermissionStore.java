package com.tempvoice.voice.store;

import com.tempvoice.voice.model.AutokickEntry;
import com.tempvoice.voice.model.BypassFlag;
import com.tempvoice.voice.model.Effect;
import com.tempvoice.voice.model.OwnershipChange;
import com.tempvoice.voice.model.PermissionKind;
import com.tempvoice.voice.model.PermissionRule;
import com.tempvoice.voice.model.TargetRef;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed permission store over a single JDBC connection. Statements
 * are serialized on the store; writes are short and local.
 * <p>
 * Pass {@code ":memory:"} as the path for a throwaway database.
 */
@Slf4j
public class SqlitePermissionStore implements PermissionStore, AutoCloseable {

    private final Connection connection;
    private final Clock clock;

    public SqlitePermissionStore(String dbPath, Clock clock) throws SQLException {
        String path = dbPath != null && !dbPath.isBlank() ? expandHome(dbPath) : ":memory:";
        createParentDirectories(path);
        this.connection = DriverManager.getConnection("jdbc:sqlite:" + path);
        this.clock = clock;
        PermissionStoreSchema.initialize(connection);
        log.info("Permission store opened: {}", path);
    }

    public SqlitePermissionStore(String dbPath) throws SQLException {
        this(dbPath, Clock.systemUTC());
    }

    // ── Permission rules ────────────────────────────────────────────────

    @Override
    public synchronized PermissionRule upsertRule(long guildId, long ownerId, TargetRef target,
            PermissionKind kind, Effect effect) {
        Instant now = clock.instant();
        String sql = """
                INSERT INTO permission_rules
                (guild_id, owner_id, target_type, target_id, kind, effect, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (guild_id, owner_id, target_type, target_id, kind)
                DO UPDATE SET effect = excluded.effect, updated_at = excluded.updated_at
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setString(3, target.type());
            stmt.setLong(4, target.id());
            stmt.setString(5, kind.name());
            stmt.setString(6, effect.name());
            stmt.setLong(7, now.toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("upsert rule", e);
        }
        log.debug("Rule upserted: guild={} owner={} target={} {}={}", guildId, ownerId, target, kind, effect);
        return new PermissionRule(guildId, ownerId, target, kind, effect, Instant.ofEpochMilli(now.toEpochMilli()));
    }

    @Override
    public synchronized Optional<PermissionRule> findRule(long guildId, long ownerId, TargetRef target,
            PermissionKind kind) {
        String sql = """
                SELECT guild_id, owner_id, target_type, target_id, kind, effect, updated_at
                FROM permission_rules
                WHERE guild_id = ? AND owner_id = ? AND target_type = ? AND target_id = ? AND kind = ?
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setString(3, target.type());
            stmt.setLong(4, target.id());
            stmt.setString(5, kind.name());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readRule(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("find rule", e);
        }
    }

    @Override
    public synchronized boolean deleteRule(long guildId, long ownerId, TargetRef target, PermissionKind kind) {
        String sql = """
                DELETE FROM permission_rules
                WHERE guild_id = ? AND owner_id = ? AND target_type = ? AND target_id = ? AND kind = ?
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setString(3, target.type());
            stmt.setLong(4, target.id());
            stmt.setString(5, kind.name());
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete rule", e);
        }
    }

    @Override
    public synchronized List<PermissionRule> rulesForOwner(long guildId, long ownerId) {
        String sql = """
                SELECT guild_id, owner_id, target_type, target_id, kind, effect, updated_at
                FROM permission_rules
                WHERE guild_id = ? AND owner_id = ?
                ORDER BY updated_at, target_type, target_id, kind
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            return readRules(stmt);
        } catch (SQLException e) {
            throw failure("list rules", e);
        }
    }

    @Override
    public synchronized int clearRules(long guildId, long ownerId, TargetRef target) {
        String sql = target == null
                ? "DELETE FROM permission_rules WHERE guild_id = ? AND owner_id = ?"
                : "DELETE FROM permission_rules WHERE guild_id = ? AND owner_id = ? AND target_type = ? AND target_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            if (target != null) {
                stmt.setString(3, target.type());
                stmt.setLong(4, target.id());
            }
            int deleted = stmt.executeUpdate();
            log.debug("Cleared {} rules of owner {} in guild {}", deleted, ownerId, guildId);
            return deleted;
        } catch (SQLException e) {
            throw failure("clear rules", e);
        }
    }

    @Override
    public synchronized List<Long> moderatorsOf(long guildId, long ownerId) {
        String sql = """
                SELECT target_id FROM permission_rules
                WHERE guild_id = ? AND owner_id = ? AND target_type = 'member'
                  AND kind = 'MODERATOR' AND effect = 'ALLOW'
                ORDER BY updated_at
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            List<Long> ids = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw failure("list moderators", e);
        }
    }

    // ── Autokick ────────────────────────────────────────────────────────

    @Override
    public synchronized boolean addAutokick(long guildId, long ownerId, long targetId) {
        String sql = """
                INSERT OR IGNORE INTO autokick_entries (guild_id, owner_id, target_id, created_at)
                VALUES (?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setLong(3, targetId);
            stmt.setLong(4, clock.millis());
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("add autokick", e);
        }
    }

    @Override
    public synchronized boolean removeAutokick(long guildId, long ownerId, long targetId) {
        String sql = "DELETE FROM autokick_entries WHERE guild_id = ? AND owner_id = ? AND target_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setLong(3, targetId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("remove autokick", e);
        }
    }

    @Override
    public synchronized boolean isAutokicked(long guildId, long ownerId, long targetId) {
        String sql = "SELECT 1 FROM autokick_entries WHERE guild_id = ? AND owner_id = ? AND target_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            stmt.setLong(3, targetId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw failure("check autokick", e);
        }
    }

    @Override
    public synchronized List<AutokickEntry> autokicksOf(long guildId, long ownerId) {
        String sql = """
                SELECT guild_id, owner_id, target_id, created_at FROM autokick_entries
                WHERE guild_id = ? AND owner_id = ?
                ORDER BY created_at, target_id
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            List<AutokickEntry> entries = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new AutokickEntry(rs.getLong(1), rs.getLong(2), rs.getLong(3),
                            Instant.ofEpochMilli(rs.getLong(4))));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw failure("list autokicks", e);
        }
    }

    @Override
    public synchronized int clearAutokicks(long guildId, long ownerId) {
        String sql = "DELETE FROM autokick_entries WHERE guild_id = ? AND owner_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, ownerId);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("clear autokicks", e);
        }
    }

    // ── Bypass ──────────────────────────────────────────────────────────

    @Override
    public synchronized BypassFlag upsertBypass(long guildId, long memberId, Instant expiresAt) {
        String sql = """
                INSERT INTO bypass_flags (guild_id, member_id, expires_at) VALUES (?, ?, ?)
                ON CONFLICT (guild_id, member_id) DO UPDATE SET expires_at = excluded.expires_at
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, memberId);
            stmt.setLong(3, expiresAt.toEpochMilli());
            stmt.executeUpdate();
            return new BypassFlag(guildId, memberId, Instant.ofEpochMilli(expiresAt.toEpochMilli()));
        } catch (SQLException e) {
            throw failure("upsert bypass", e);
        }
    }

    @Override
    public synchronized Optional<BypassFlag> findBypass(long guildId, long memberId) {
        String sql = "SELECT guild_id, member_id, expires_at FROM bypass_flags WHERE guild_id = ? AND member_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, memberId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readBypass(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw failure("find bypass", e);
        }
    }

    @Override
    public synchronized boolean deleteBypass(long guildId, long memberId) {
        String sql = "DELETE FROM bypass_flags WHERE guild_id = ? AND member_id = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, memberId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete bypass", e);
        }
    }

    @Override
    public synchronized List<BypassFlag> activeBypasses(long guildId, Collection<Long> memberIds, Instant now) {
        if (memberIds.isEmpty()) {
            return List.of();
        }
        String sql = "SELECT guild_id, member_id, expires_at FROM bypass_flags WHERE guild_id = ? AND expires_at > ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, now.toEpochMilli());
            List<BypassFlag> flags = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    BypassFlag flag = readBypass(rs);
                    if (memberIds.contains(flag.memberId())) {
                        flags.add(flag);
                    }
                }
            }
            return flags;
        } catch (SQLException e) {
            throw failure("list bypasses", e);
        }
    }

    @Override
    public synchronized List<BypassFlag> deleteExpiredBypasses(Instant now) {
        List<BypassFlag> expired = new ArrayList<>();
        try (PreparedStatement select = connection.prepareStatement(
                "SELECT guild_id, member_id, expires_at FROM bypass_flags WHERE expires_at <= ?")) {
            select.setLong(1, now.toEpochMilli());
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    expired.add(readBypass(rs));
                }
            }
            if (!expired.isEmpty()) {
                try (PreparedStatement delete = connection.prepareStatement(
                        "DELETE FROM bypass_flags WHERE expires_at <= ?")) {
                    delete.setLong(1, now.toEpochMilli());
                    delete.executeUpdate();
                }
            }
            return expired;
        } catch (SQLException e) {
            throw failure("sweep bypasses", e);
        }
    }

    // ── Ownership log ───────────────────────────────────────────────────

    @Override
    public synchronized void appendOwnershipChange(OwnershipChange change) {
        String sql = """
                INSERT INTO channel_ownership_log
                (guild_id, channel_id, previous_owner_id, new_owner_id, reason, recorded_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, change.guildId());
            stmt.setLong(2, change.channelId());
            setNullableLong(stmt, 3, change.previousOwnerId());
            setNullableLong(stmt, 4, change.newOwnerId());
            stmt.setString(5, change.reason().name());
            stmt.setLong(6, change.recordedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("append ownership change", e);
        }
    }

    @Override
    public synchronized List<OwnershipChange> ownershipHistory(long guildId, long channelId) {
        String sql = """
                SELECT guild_id, channel_id, previous_owner_id, new_owner_id, reason, recorded_at
                FROM channel_ownership_log
                WHERE guild_id = ? AND channel_id = ?
                ORDER BY id
                """;
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setLong(1, guildId);
            stmt.setLong(2, channelId);
            List<OwnershipChange> changes = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    changes.add(new OwnershipChange(
                            rs.getLong(1),
                            rs.getLong(2),
                            getNullableLong(rs, 3),
                            getNullableLong(rs, 4),
                            OwnershipChange.Reason.valueOf(rs.getString(5)),
                            Instant.ofEpochMilli(rs.getLong(6))));
                }
            }
            return changes;
        } catch (SQLException e) {
            throw failure("read ownership log", e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close permission store: {}", e.getMessage());
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static List<PermissionRule> readRules(PreparedStatement stmt) throws SQLException {
        List<PermissionRule> rules = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rules.add(readRule(rs));
            }
        }
        return rules;
    }

    private static PermissionRule readRule(ResultSet rs) throws SQLException {
        return new PermissionRule(
                rs.getLong("guild_id"),
                rs.getLong("owner_id"),
                TargetRef.of(rs.getString("target_type"), rs.getLong("target_id")),
                PermissionKind.valueOf(rs.getString("kind")),
                Effect.valueOf(rs.getString("effect")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    private static BypassFlag readBypass(ResultSet rs) throws SQLException {
        return new BypassFlag(rs.getLong(1), rs.getLong(2), Instant.ofEpochMilli(rs.getLong(3)));
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value);
        }
    }

    private static Long getNullableLong(ResultSet rs, int index) throws SQLException {
        long value = rs.getLong(index);
        return rs.wasNull() ? null : value;
    }

    private static PermissionStoreException failure(String operation, SQLException e) {
        log.error("Permission store failed to {}: {}", operation, e.getMessage(), e);
        return new PermissionStoreException("Failed to " + operation, e);
    }

    private static String expandHome(String path) {
        return path.startsWith("~") ? System.getProperty("user.home") + path.substring(1) : path;
    }

    private static void createParentDirectories(String path) throws SQLException {
        if (path.startsWith(":memory:")) {
            return;
        }
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SQLException("Cannot create database directory " + parent, e);
        }
    }
}
