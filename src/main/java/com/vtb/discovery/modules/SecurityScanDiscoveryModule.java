package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.util.ConnectionStrings;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Поиск раскрытых учетных данных и небезопасных настроек подключения.
 * Результат - наблюдение о целевом хранилище с атрибутами
 * credential_exposed / ssl_disabled. Значения секретов не сохраняются.
 */
@Slf4j
public class SecurityScanDiscoveryModule implements DiscoveryModule {

    static final double FINDING_CONFIDENCE = 0.5;

    public static final String CREDENTIAL_EXPOSED = "credential_exposed";
    public static final String SSL_DISABLED = "ssl_disabled";

    private static final Pattern PASSWORD_ASSIGNMENT = Pattern.compile(
        "(?i)\\b[a-z0-9_]*(?:db|database|postgres|postgresql|pg|mysql|mongo|redis)_?(?:password|passwd|pass|pwd)\\s*[:=]\\s*[\"']?[^\"'\\s]+");

    private static final Pattern URL_ASSIGNMENT = Pattern.compile(
        "(?i)\\b(?:database_url|db_url|connection_string|conn_str|datasource_url)\\s*[:=]\\s*[\"']?([^\"'\\s]+)");

    private static final Pattern INSECURE_CONNECTION = Pattern.compile(
        "(?i)sslmode\\s*=\\s*disable|\\bssl\\s*[:=]\\s*false\\b|\\bverify_ssl\\s*[:=]\\s*false\\b|\\buseSSL\\s*=\\s*false\\b");

    @Override
    public String getName() {
        return "security_scan";
    }

    @Override
    public DiscoveryMethod getMethod() {
        return DiscoveryMethod.SECURITY_SCAN;
    }

    @Override
    public ModuleAvailability checkAvailability(DiscoveryConfig config) {
        if (!ScopedFileWalker.anyRootExists(config)) {
            return ModuleAvailability.unavailable("Ни один путь сканирования не существует");
        }
        return ModuleAvailability.available();
    }

    @Override
    public ObservationStream discover(DiscoveryConfig config, DiscoveryDeadline deadline) {
        DiscoveryConfig.Security security = config.getSecurity();
        List<String> extensions = security.getFileExtensions();
        ScopedFileWalker walker = new ScopedFileWalker(config,
            file -> FileNames.hasExtension(file, extensions) || FileNames.lowerName(file).startsWith(".env"));
        return new FindingStream(walker, security.getExcludePaths(), deadline);
    }

    static boolean isExcluded(String relativePath, List<String> excludePaths) {
        String normalized = relativePath.toLowerCase(Locale.ROOT);
        for (String exclude : excludePaths) {
            if (exclude == null || exclude.isBlank()) {
                continue;
            }
            String prefix = exclude.trim().toLowerCase(Locale.ROOT).replace('\\', '/');
            if (normalized.startsWith(prefix) || normalized.contains("/" + prefix)) {
                return true;
            }
        }
        return false;
    }

    private static final class FindingStream extends AbstractObservationStream {

        private final ScopedFileWalker walker;
        private final List<String> excludePaths;
        private final Deque<CandidateObservation> buffered = new ArrayDeque<>();

        private FindingStream(ScopedFileWalker walker, List<String> excludePaths, DiscoveryDeadline deadline) {
            super(deadline);
            this.walker = walker;
            this.excludePaths = excludePaths;
        }

        @Override
        protected CandidateObservation computeNext() {
            while (buffered.isEmpty()) {
                if (deadlineReached() || !walker.hasNext()) {
                    return null;
                }
                Path file = walker.next().toAbsolutePath().normalize();
                Path root = walker.rootOf(file);
                String relative = FileNames.relative(root, file);
                if (isExcluded(relative, excludePaths)) {
                    continue;
                }
                scanFile(file, root, relative);
            }
            return buffered.poll();
        }

        private void scanFile(Path file, Path root, String relative) {
            Map<String, TargetFinding> targets = new LinkedHashMap<>();
            List<Integer> passwordLines = new ArrayList<>();
            List<Integer> insecureLines = new ArrayList<>();

            List<String> lines = FileNames.readLines(file);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                int lineNumber = i + 1;
                boolean lineInsecure = INSECURE_CONNECTION.matcher(line).find();
                if (lineInsecure) {
                    insecureLines.add(lineNumber);
                }
                if (PASSWORD_ASSIGNMENT.matcher(line).find()) {
                    passwordLines.add(lineNumber);
                }
                List<String> found = new ArrayList<>(ConnectionStrings.findAll(line));
                Matcher assignment = URL_ASSIGNMENT.matcher(line);
                while (assignment.find()) {
                    String value = assignment.group(1);
                    if (ConnectionStrings.looksLikeConnectionString(value) && !found.contains(value)) {
                        found.add(value);
                    }
                }
                for (String raw : found) {
                    ConnectionStrings.Parsed parsed = ConnectionStrings.parse(raw);
                    if (parsed == null || parsed.isInMemory()) {
                        continue;
                    }
                    String locator = ConnectionStrings.stripCredentials(raw);
                    TargetFinding target = targets.computeIfAbsent(locator, key -> new TargetFinding(key, parsed));
                    if (ConnectionStrings.hasPassword(raw)) {
                        target.credentialLines.add(lineNumber);
                    }
                    if (lineInsecure) {
                        target.insecureLines.add(lineNumber);
                    }
                }
            }
            if (targets.isEmpty()) {
                if (!passwordLines.isEmpty() || !insecureLines.isEmpty()) {
                    log.debug("{}: найдены небезопасные настройки без явной цели подключения", relative);
                }
                return;
            }

            for (TargetFinding target : targets.values()) {
                // Пароли и отключенный SSL на уровне файла относятся ко всем целям в нем
                boolean credential = !target.credentialLines.isEmpty() || !passwordLines.isEmpty();
                boolean insecure = !target.insecureLines.isEmpty() || !insecureLines.isEmpty();
                if (!credential && !insecure) {
                    continue;
                }
                CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
                    .method(DiscoveryMethod.SECURITY_SCAN)
                    .locator(target.locator)
                    .methodConfidence(FINDING_CONFIDENCE)
                    .assetType(target.parsed.getAssetType());
                if (credential) {
                    builder.attribute(CREDENTIAL_EXPOSED, "true");
                    builder.attribute("credential_source", relative + ":" + firstLine(target.credentialLines, passwordLines));
                }
                if (insecure) {
                    builder.attribute(SSL_DISABLED, "true");
                    builder.attribute("ssl_source", relative + ":" + firstLine(target.insecureLines, insecureLines));
                }
                if (target.parsed.isFileEngine() && target.parsed.getPath() != null) {
                    Path linked = FileNames.resolveLiteral(root, target.parsed.getPath());
                    if (linked != null) {
                        builder.link(linked.toString());
                    }
                }
                log.debug("Проблема безопасности для {} в {}", target.locator, relative);
                buffered.add(builder.build());
            }
        }

        private static int firstLine(List<Integer> specific, List<Integer> fileLevel) {
            return !specific.isEmpty() ? specific.get(0) : fileLevel.get(0);
        }
    }

    private static final class TargetFinding {
        private final String locator;
        private final ConnectionStrings.Parsed parsed;
        private final List<Integer> credentialLines = new ArrayList<>();
        private final List<Integer> insecureLines = new ArrayList<>();

        private TargetFinding(String locator, ConnectionStrings.Parsed parsed) {
            this.locator = locator;
            this.parsed = parsed;
        }
    }
}
