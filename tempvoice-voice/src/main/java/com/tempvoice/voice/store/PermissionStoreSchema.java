package com.tempvoice.voice.store;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite schema of the permission store. Idempotent.
 */
@Slf4j
public final class PermissionStoreSchema {

    private PermissionStoreSchema() {
    }

    public static void initialize(Connection conn) throws SQLException {
        log.debug("Initializing permission store schema");

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS permission_rules (
                    guild_id INTEGER NOT NULL,
                    owner_id INTEGER NOT NULL,
                    target_type TEXT NOT NULL,
                    target_id INTEGER NOT NULL,
                    kind TEXT NOT NULL,
                    effect TEXT NOT NULL,
                    updated_at INTEGER NOT NULL,
                    PRIMARY KEY (guild_id, owner_id, target_type, target_id, kind)
                )
                """);

            // Moderator lookups and per-target restoration
            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_rules_target
                ON permission_rules(guild_id, target_type, target_id)
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS autokick_entries (
                    guild_id INTEGER NOT NULL,
                    owner_id INTEGER NOT NULL,
                    target_id INTEGER NOT NULL,
                    created_at INTEGER NOT NULL,
                    PRIMARY KEY (guild_id, owner_id, target_id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS bypass_flags (
                    guild_id INTEGER NOT NULL,
                    member_id INTEGER NOT NULL,
                    expires_at INTEGER NOT NULL,
                    PRIMARY KEY (guild_id, member_id)
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_bypass_expiry
                ON bypass_flags(expires_at)
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS channel_ownership_log (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    guild_id INTEGER NOT NULL,
                    channel_id INTEGER NOT NULL,
                    previous_owner_id INTEGER,
                    new_owner_id INTEGER,
                    reason TEXT NOT NULL,
                    recorded_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_ownership_channel
                ON channel_ownership_log(guild_id, channel_id, id)
                """);
        }

        log.debug("Permission store schema initialized");
    }
}
