package com.vtb.discovery.models;

import java.util.Locale;

/**
 * Типы хранилищ, которые распознает система
 */
public enum AssetType {
    POSTGRESQL,
    SQLITE,
    DUCKDB,
    FILE_STORAGE,
    OTHER;

    /**
     * Определить тип по названию движка, схеме строки подключения или расширению.
     * Неизвестные значения дают OTHER, null - null.
     */
    public static AssetType fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String value = hint.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("postgres") || value.equals("pg") || value.contains("postgresql")) {
            return POSTGRESQL;
        }
        if (value.startsWith("sqlite") || value.equals(".db") || value.equals(".sqlite") || value.equals(".sqlite3")) {
            return SQLITE;
        }
        if (value.startsWith("duckdb") || value.equals(".duckdb")) {
            return DUCKDB;
        }
        if (value.equals("file_storage") || value.equals("file") || value.equals("minio") || value.equals("s3")) {
            return FILE_STORAGE;
        }
        return OTHER;
    }
}
