package com.vtb.discovery.util;

import com.vtb.discovery.models.AssetType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Утилиты для строк подключения к БД: поиск в тексте, разбор, удаление учетных данных.
 * Пароли никогда не покидают этот класс в открытом виде.
 */
public final class ConnectionStrings {

    /** URL-формы: postgresql://, postgres://, sqlite:///, duckdb:///, jdbc:postgresql:// и т.п. */
    private static final Pattern URL_PATTERN = Pattern.compile(
        "(?i)\\b(?:jdbc:)?(postgresql|postgres|sqlite|duckdb|mysql|mariadb|mongodb(?:\\+srv)?|redis)://[^\\s'\"`<>,;)]+");

    /** JDBC-формы без //: jdbc:sqlite:/path/app.db, jdbc:duckdb:data.duckdb */
    private static final Pattern JDBC_FILE_PATTERN = Pattern.compile(
        "(?i)\\bjdbc:(sqlite|duckdb):(?!//)[^\\s'\"`<>,;)]+");

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^[a-zA-Z0-9+.-]+(?::[a-zA-Z0-9+.-]+)?://");

    private static final Map<String, Integer> DEFAULT_PORTS = Map.of(
        "postgresql", 5432,
        "postgres", 5432,
        "mysql", 3306,
        "mariadb", 3306,
        "mongodb", 27017,
        "redis", 6379
    );

    private ConnectionStrings() {
    }

    /**
     * Найти все строки подключения в строке текста
     */
    public static List<String> findAll(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            result.add(trimTrailing(matcher.group()));
        }
        Matcher jdbc = JDBC_FILE_PATTERN.matcher(text);
        while (jdbc.find()) {
            result.add(trimTrailing(jdbc.group()));
        }
        return result;
    }

    public static boolean looksLikeConnectionString(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return URL_PATTERN.matcher(trimmed).lookingAt() || JDBC_FILE_PATTERN.matcher(trimmed).lookingAt();
    }

    /**
     * Удалить user:password@ из строки подключения.
     * Пароль может содержать '/' и '@': граница - последний '@' до начала запроса.
     */
    public static String stripCredentials(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        String value = connectionString.trim();
        int[] userInfo = userInfoBounds(value);
        if (userInfo != null) {
            value = value.substring(0, userInfo[0]) + value.substring(userInfo[1] + 1);
        }
        return stripSecretParams(value);
    }

    public static boolean hasPassword(String connectionString) {
        if (connectionString == null) {
            return false;
        }
        String value = connectionString.trim();
        int[] userInfo = userInfoBounds(value);
        return userInfo != null && value.substring(userInfo[0], userInfo[1]).contains(":")
            || value.toLowerCase(Locale.ROOT).contains("password=");
    }

    /**
     * Границы userinfo: [начало, индекс завершающего '@'] или null.
     * Сегмент без ':' и со '/' считается путем, а не учетными данными.
     */
    static int[] userInfoBounds(String value) {
        Matcher scheme = SCHEME_PREFIX.matcher(value);
        if (!scheme.lookingAt()) {
            return null;
        }
        int start = scheme.end();
        int end = value.length();
        for (int i = start; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '?' || c == '#' || Character.isWhitespace(c)) {
                end = i;
                break;
            }
        }
        int at = value.lastIndexOf('@', end - 1);
        if (at < start) {
            return null;
        }
        String candidate = value.substring(start, at);
        if (candidate.indexOf(':') < 0 && candidate.indexOf('/') >= 0) {
            return null;
        }
        return new int[]{start, at};
    }

    /**
     * Разобрать строку подключения. Возвращает null для нераспознанных строк.
     */
    public static Parsed parse(String connectionString) {
        if (connectionString == null) {
            return null;
        }
        String value = stripCredentials(connectionString);
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("jdbc:")) {
            value = value.substring(5);
            lower = lower.substring(5);
        }
        int schemeEnd = lower.indexOf(':');
        if (schemeEnd <= 0) {
            return null;
        }
        String scheme = lower.substring(0, schemeEnd);
        if (scheme.startsWith("mongodb")) {
            scheme = "mongodb";
        }
        String rest = value.substring(schemeEnd + 1);
        AssetType type = AssetType.fromHint(scheme);

        if ("sqlite".equals(scheme) || "duckdb".equals(scheme)) {
            String path = rest;
            if (path.startsWith("///")) {
                // sqlite:///rel.db - относительный путь, sqlite:////abs.db - абсолютный
                path = path.substring(3);
            } else if (path.startsWith("//")) {
                path = path.substring(2);
            }
            path = stripQuery(path);
            if (path.isEmpty() || ":memory:".equals(path) || ":memory".equals(path)) {
                return new Parsed(scheme, type, null, null, null, true);
            }
            return new Parsed(scheme, type, null, null, path, false);
        }

        if (!rest.startsWith("//")) {
            return null;
        }
        String authority = rest.substring(2);
        int slash = indexOfAny(authority, '/', '?');
        String hostPort = slash >= 0 ? authority.substring(0, slash) : authority;
        if (hostPort.contains(",")) {
            hostPort = hostPort.substring(0, hostPort.indexOf(','));
        }
        String database = null;
        if (slash >= 0 && authority.charAt(slash) == '/') {
            database = stripQuery(authority.substring(slash + 1));
            if (database.isEmpty()) {
                database = null;
            }
        }
        String host = hostPort;
        Integer port = null;
        if (hostPort.startsWith("[")) {
            int close = hostPort.indexOf(']');
            if (close > 0) {
                host = hostPort.substring(1, close);
                port = parsePort(hostPort.substring(close + 1).replaceFirst("^:", ""));
            }
        } else {
            int colon = hostPort.lastIndexOf(':');
            if (colon >= 0) {
                host = hostPort.substring(0, colon);
                port = parsePort(hostPort.substring(colon + 1));
            }
        }
        if (host.isEmpty()) {
            host = "localhost";
        }
        if (port == null) {
            port = DEFAULT_PORTS.get(scheme);
        }
        return new Parsed(scheme, type, host, port, database, false);
    }

    public static Integer defaultPort(String scheme) {
        return scheme == null ? null : DEFAULT_PORTS.get(scheme.toLowerCase(Locale.ROOT));
    }

    private static String stripSecretParams(String value) {
        return value.replaceAll("(?i)([?&;](?:password|pwd|pass)=)[^&;\\s]*", "$1***");
    }

    private static String stripQuery(String value) {
        int q = value.indexOf('?');
        return q >= 0 ? value.substring(0, q) : value;
    }

    private static int indexOfAny(String value, char a, char b) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }

    private static Integer parsePort(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            int port = Integer.parseInt(value);
            return port > 0 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimTrailing(String value) {
        String result = value;
        while (!result.isEmpty() && ".:'\"]}".indexOf(result.charAt(result.length() - 1)) >= 0) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Результат разбора. Для файловых движков заполнен path (в поле database),
     * для серверных - host и port.
     */
    public static final class Parsed {
        private final String scheme;
        private final AssetType assetType;
        private final String host;
        private final Integer port;
        private final String databaseOrPath;
        private final boolean inMemory;

        Parsed(String scheme, AssetType assetType, String host, Integer port, String databaseOrPath, boolean inMemory) {
            this.scheme = scheme;
            this.assetType = assetType;
            this.host = host;
            this.port = port;
            this.databaseOrPath = databaseOrPath;
            this.inMemory = inMemory;
        }

        public String getScheme() {
            return scheme;
        }

        public AssetType getAssetType() {
            return assetType;
        }

        public String getHost() {
            return host;
        }

        public Integer getPort() {
            return port;
        }

        public String getDatabase() {
            return isFileEngine() ? null : databaseOrPath;
        }

        public String getPath() {
            return isFileEngine() ? databaseOrPath : null;
        }

        public boolean isInMemory() {
            return inMemory;
        }

        public boolean isFileEngine() {
            return "sqlite".equals(scheme) || "duckdb".equals(scheme);
        }
    }
}
