package com.pixelflow.cache;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class CacheIndexDao {

    private final String dbPath;

    public CacheIndexDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public Optional<CacheEntry> findByKey(String key) throws SQLException {
        String sql = "SELECT cache_key, file_name, payload_size, created_ts, last_accessed_ts " +
                "FROM cache_entry WHERE cache_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All entries, least recently accessed first.
     */
    public List<CacheEntry> findAllByAccessOrder() throws SQLException {
        String sql = "SELECT cache_key, file_name, payload_size, created_ts, last_accessed_ts " +
                "FROM cache_entry ORDER BY last_accessed_ts ASC, cache_key ASC";
        List<CacheEntry> entries = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(map(rs));
            }
        }
        return entries;
    }

    public void upsert(CacheEntry entry) throws SQLException {
        String sql = "INSERT INTO cache_entry (cache_key, file_name, payload_size, created_ts, last_accessed_ts) " +
                "VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT(cache_key) DO UPDATE SET " +
                "file_name = excluded.file_name, payload_size = excluded.payload_size, " +
                "created_ts = excluded.created_ts, last_accessed_ts = excluded.last_accessed_ts";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, entry.getKey());
            ps.setString(2, entry.getFileName());
            ps.setLong(3, entry.getPayloadSize());
            ps.setLong(4, entry.getCreatedAt());
            ps.setLong(5, entry.getLastAccessedAt());
            ps.executeUpdate();
        }
    }

    public void touch(String key, long timestamp) throws SQLException {
        String sql = "UPDATE cache_entry SET last_accessed_ts = ? WHERE cache_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, timestamp);
            ps.setString(2, key);
            ps.executeUpdate();
        }
    }

    public void delete(String key) throws SQLException {
        String sql = "DELETE FROM cache_entry WHERE cache_key = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    public void deleteAll() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM cache_entry");
        }
    }

    private static CacheEntry map(ResultSet rs) throws SQLException {
        return new CacheEntry(
                rs.getString("cache_key"),
                rs.getString("file_name"),
                rs.getLong("payload_size"),
                rs.getLong("created_ts"),
                rs.getLong("last_accessed_ts"));
    }
}
