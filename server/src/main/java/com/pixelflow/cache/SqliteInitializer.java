package com.pixelflow.cache;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // Enable WAL mode
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per cached payload file
                stmt.execute("CREATE TABLE IF NOT EXISTS cache_entry (" +
                        "cache_key TEXT PRIMARY KEY, " +
                        "file_name TEXT NOT NULL, " +
                        "payload_size INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "last_accessed_ts INTEGER NOT NULL" +
                        ");");

                // LRU scans
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_cache_entry_access " +
                        "ON cache_entry (last_accessed_ts);");
            }
        }
    }
}
