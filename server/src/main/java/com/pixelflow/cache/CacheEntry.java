package com.pixelflow.cache;

public class CacheEntry {

    private final String key;
    private final String fileName;
    private final long payloadSize;
    private final long createdAt;
    private final long lastAccessedAt;

    public CacheEntry(String key, String fileName, long payloadSize, long createdAt, long lastAccessedAt) {
        this.key = key;
        this.fileName = fileName;
        this.payloadSize = payloadSize;
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
    }

    public String getKey() {
        return key;
    }

    public String getFileName() {
        return fileName;
    }

    public long getPayloadSize() {
        return payloadSize;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessedAt() {
        return lastAccessedAt;
    }

    public CacheEntry withLastAccessedAt(long timestamp) {
        return new CacheEntry(key, fileName, payloadSize, createdAt, timestamp);
    }

    @Override
    public String toString() {
        return "CacheEntry{key='" + key + "', file='" + fileName + "', size=" + payloadSize + "}";
    }
}
