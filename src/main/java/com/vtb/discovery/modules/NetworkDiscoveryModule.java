package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Поиск сетевых сервисов БД: TCP connect к настроенным хостам и портам,
 * затем чтение баннера или ответа на безопасный probe.
 * Ничего не пишет в сервис, кроме стандартных приветственных запросов протокола.
 */
@Slf4j
public class NetworkDiscoveryModule implements DiscoveryModule {

    static final double BANNER_MATCH_CONFIDENCE = 0.9;
    static final double OPEN_PORT_CONFIDENCE = 0.6;

    private static final int MAX_BANNER_BYTES = 256;

    /** Сигнатуры известных сервисов по порту */
    private static final Map<Integer, Signature> PORT_SIGNATURES = Map.of(
        5432, new Signature("postgresql", AssetType.POSTGRESQL,
            new byte[]{0x00, 0x00, 0x00, 0x08, 0x04, (byte) 0xd2, 0x16, 0x2f}),
        5433, new Signature("postgresql", AssetType.POSTGRESQL,
            new byte[]{0x00, 0x00, 0x00, 0x08, 0x04, (byte) 0xd2, 0x16, 0x2f}),
        3306, new Signature("mysql", AssetType.OTHER, null),
        27017, new Signature("mongodb", AssetType.OTHER, null),
        6379, new Signature("redis", AssetType.OTHER, "PING\r\n".getBytes(StandardCharsets.US_ASCII)),
        9000, new Signature("minio", AssetType.FILE_STORAGE, null)
    );

    /** Ключевые слова баннера -> сервис */
    private static final List<BannerRule> BANNER_RULES = List.of(
        new BannerRule("postgres", "postgresql", AssetType.POSTGRESQL),
        new BannerRule("mysql", "mysql", AssetType.OTHER),
        new BannerRule("mariadb", "mysql", AssetType.OTHER),
        new BannerRule("mongo", "mongodb", AssetType.OTHER),
        new BannerRule("+pong", "redis", AssetType.OTHER),
        new BannerRule("redis", "redis", AssetType.OTHER),
        new BannerRule("minio", "minio", AssetType.FILE_STORAGE),
        new BannerRule("duckdb", "duckdb", AssetType.DUCKDB)
    );

    @Override
    public String getName() {
        return "network";
    }

    @Override
    public DiscoveryMethod getMethod() {
        return DiscoveryMethod.NETWORK;
    }

    @Override
    public ModuleAvailability checkAvailability(DiscoveryConfig config) {
        DiscoveryConfig.Network network = config.getNetwork();
        if (network.getHosts().isEmpty() || network.getPorts().isEmpty()) {
            return ModuleAvailability.unavailable("Не заданы хосты или порты для сетевого обнаружения");
        }
        return ModuleAvailability.available();
    }

    @Override
    public ObservationStream discover(DiscoveryConfig config, DiscoveryDeadline deadline) {
        List<Target> targets = new ArrayList<>();
        for (String host : new LinkedHashSet<>(config.getNetwork().getHosts())) {
            if (host == null || host.isBlank()) {
                continue;
            }
            for (Integer port : new LinkedHashSet<>(config.getNetwork().getPorts())) {
                if (port != null && port > 0 && port <= 65535) {
                    targets.add(new Target(host.trim(), port));
                }
            }
        }
        return new ProbeStream(targets, config.getNetwork(), deadline);
    }

    /**
     * Определить сервис по тексту баннера. null - баннер не подтверждает БД.
     */
    static BannerRule matchBanner(String banner, int port) {
        if (banner == null || banner.isEmpty()) {
            return null;
        }
        String lower = banner.toLowerCase(Locale.ROOT);
        for (BannerRule rule : BANNER_RULES) {
            if (lower.contains(rule.keyword)) {
                return rule;
            }
        }
        Signature signature = PORT_SIGNATURES.get(port);
        // Ответ PostgreSQL на SSLRequest - один байт 'S' или 'N'
        if (signature != null && signature.assetType == AssetType.POSTGRESQL
            && (banner.equals("S") || banner.equals("N"))) {
            return new BannerRule("", "postgresql", AssetType.POSTGRESQL);
        }
        return null;
    }

    private static final class ProbeStream extends AbstractObservationStream {

        private final List<Target> targets;
        private final DiscoveryConfig.Network settings;
        private int index;

        private ProbeStream(List<Target> targets, DiscoveryConfig.Network settings, DiscoveryDeadline deadline) {
            super(deadline);
            this.targets = targets;
            this.settings = settings;
        }

        @Override
        protected CandidateObservation computeNext() {
            while (index < targets.size()) {
                if (deadlineReached()) {
                    return null;
                }
                Target target = targets.get(index++);
                CandidateObservation observation = probe(target);
                if (observation != null) {
                    return observation;
                }
            }
            return null;
        }

        private CandidateObservation probe(Target target) {
            long started = System.nanoTime();
            try (Socket socket = new Socket()) {
                int connectTimeout = deadline.boundTimeoutMillis(settings.getConnectTimeoutMs());
                socket.connect(new InetSocketAddress(target.host, target.port), connectTimeout);
                long responseMs = (System.nanoTime() - started) / 1_000_000L;

                String banner = readBanner(socket, target.port);
                BannerRule matched = matchBanner(banner, target.port);
                Signature signature = PORT_SIGNATURES.get(target.port);

                CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
                    .method(DiscoveryMethod.NETWORK)
                    .locator(target.host + ":" + target.port)
                    .attribute("host", target.host)
                    .attribute("port", String.valueOf(target.port))
                    .attribute("response_time_ms", String.valueOf(responseMs));
                if (matched != null) {
                    builder.methodConfidence(BANNER_MATCH_CONFIDENCE)
                        .assetType(matched.assetType)
                        .attribute("service", matched.service);
                } else {
                    builder.methodConfidence(OPEN_PORT_CONFIDENCE)
                        .assetType(signature != null ? signature.assetType : AssetType.OTHER);
                    if (signature != null) {
                        builder.attribute("service", signature.service);
                    }
                }
                if (!banner.isEmpty()) {
                    builder.attribute("banner", printable(banner));
                }
                log.debug("Открыт порт {}:{} (сервис: {})", target.host, target.port,
                    matched != null ? matched.service : "не подтвержден");
                return builder.build();
            } catch (IOException e) {
                log.trace("{}:{} недоступен: {}", target.host, target.port, e.getMessage());
                return null;
            }
        }

        /**
         * Сначала пассивно ждем приветствие, затем отправляем probe известного сервиса
         */
        private String readBanner(Socket socket, int port) {
            try {
                socket.setSoTimeout(deadline.boundTimeoutMillis(settings.getBannerReadTimeoutMs()));
                InputStream in = socket.getInputStream();
                String passive = readSome(in);
                if (!passive.isEmpty()) {
                    return passive;
                }
                Signature signature = PORT_SIGNATURES.get(port);
                if (signature != null && signature.probe != null && !deadline.isExpired()) {
                    OutputStream out = socket.getOutputStream();
                    out.write(signature.probe);
                    out.flush();
                    socket.setSoTimeout(deadline.boundTimeoutMillis(settings.getBannerReadTimeoutMs()));
                    return readSome(in);
                }
            } catch (IOException e) {
                log.trace("Не удалось прочитать баннер порта {}: {}", port, e.getMessage());
            }
            return "";
        }

        private static String readSome(InputStream in) throws IOException {
            byte[] buffer = new byte[MAX_BANNER_BYTES];
            try {
                int read = in.read(buffer);
                return read > 0 ? new String(buffer, 0, read, StandardCharsets.ISO_8859_1) : "";
            } catch (SocketTimeoutException e) {
                return "";
            }
        }

        private static String printable(String banner) {
            StringBuilder sb = new StringBuilder();
            for (char c : banner.toCharArray()) {
                if (c >= 0x20 && c < 0x7f) {
                    sb.append(c);
                }
                if (sb.length() >= 120) {
                    break;
                }
            }
            return sb.toString().trim();
        }
    }

    private static final class Target {
        private final String host;
        private final int port;

        private Target(String host, int port) {
            this.host = host;
            this.port = port;
        }
    }

    private static final class Signature {
        private final String service;
        private final AssetType assetType;
        private final byte[] probe;

        private Signature(String service, AssetType assetType, byte[] probe) {
            this.service = service;
            this.assetType = assetType;
            this.probe = probe;
        }
    }

    static final class BannerRule {
        private final String keyword;
        private final String service;
        private final AssetType assetType;

        private BannerRule(String keyword, String service, AssetType assetType) {
            this.keyword = keyword;
            this.service = service;
            this.assetType = assetType;
        }

        String getService() {
            return service;
        }

        AssetType getAssetType() {
            return assetType;
        }
    }
}
