package com.vtb.discovery.reconciliation;

import com.vtb.discovery.util.ConnectionStrings;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Вычисление ключей идентичности и санитизация локаторов
 */
public final class IdentityKeys {

    private static final Set<String> LOOPBACK = Set.of("localhost", "127.0.0.1", "0.0.0.0", "::1", "0:0:0:0:0:0:0:1");
    private static final Pattern HOST_PORT = Pattern.compile("^([^\\s/:\\[\\]]+|\\[[0-9a-fA-F:.]+\\]):(\\d{1,5})$");
    private static final Pattern WINDOWS_PATH = Pattern.compile("^[A-Za-z]:[\\\\/].*");
    private static final String COMPOSE_PREFIX = "compose://";

    private IdentityKeys() {
    }

    public static IdentityKey of(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator не может быть пустым");
        }
        String value = locator.trim();

        if (value.startsWith(COMPOSE_PREFIX)) {
            return new IdentityKey(IdentityKey.Kind.OTHER, value);
        }
        if (ConnectionStrings.looksLikeConnectionString(value)) {
            IdentityKey key = fromConnectionString(value);
            if (key != null) {
                return key;
            }
        }
        var hostPort = HOST_PORT.matcher(value);
        if (hostPort.matches()) {
            return endpoint(hostPort.group(1), Integer.parseInt(hostPort.group(2)));
        }
        if (value.startsWith("/") || WINDOWS_PATH.matcher(value).matches()) {
            IdentityKey key = file(value);
            if (key != null) {
                return key;
            }
        }
        return new IdentityKey(IdentityKey.Kind.OTHER, value.toLowerCase(Locale.ROOT));
    }

    /**
     * Локатор без учетных данных - только такие попадают в инвентарь и отчет
     */
    public static String sanitize(String locator) {
        if (locator == null) {
            return null;
        }
        String value = locator.trim();
        return ConnectionStrings.looksLikeConnectionString(value) ? ConnectionStrings.stripCredentials(value) : value;
    }

    public static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return "localhost";
        }
        String value = host.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        return LOOPBACK.contains(value) ? "localhost" : value;
    }

    private static IdentityKey fromConnectionString(String value) {
        ConnectionStrings.Parsed parsed = ConnectionStrings.parse(value);
        if (parsed == null) {
            return null;
        }
        if (parsed.isFileEngine()) {
            if (parsed.isInMemory() || parsed.getPath() == null) {
                return new IdentityKey(IdentityKey.Kind.OTHER, ConnectionStrings.stripCredentials(value).toLowerCase(Locale.ROOT));
            }
            return file(parsed.getPath());
        }
        Integer port = parsed.getPort();
        if (port == null) {
            return new IdentityKey(IdentityKey.Kind.ENDPOINT, normalizeHost(parsed.getHost()));
        }
        return endpoint(parsed.getHost(), port);
    }

    private static IdentityKey endpoint(String host, int port) {
        return new IdentityKey(IdentityKey.Kind.ENDPOINT, normalizeHost(host) + ":" + port);
    }

    private static IdentityKey file(String rawPath) {
        try {
            Path path = Path.of(rawPath).toAbsolutePath().normalize();
            return new IdentityKey(IdentityKey.Kind.FILE, path.toString());
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
