package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.util.ConnectionStrings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Поиск файловых БД (SQLite, DuckDB) по расширению с проверкой заголовка
 * и строк подключения в конфигурационных файлах.
 */
@Slf4j
public class FilesystemDiscoveryModule implements DiscoveryModule {

    static final double EXTENSION_MATCH_CONFIDENCE = 0.95;
    static final double HEADER_MISMATCH_CONFIDENCE = 0.5;
    static final double CONFIG_REFERENCE_CONFIDENCE = 0.6;

    private static final byte[] SQLITE_MAGIC = "SQLite format 3\u0000".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DUCKDB_MAGIC = "DUCK".getBytes(StandardCharsets.US_ASCII);
    private static final int DUCKDB_MAGIC_OFFSET = 8;

    private static final Pattern CONFIG_FILE = Pattern.compile(
        "^\\.env(\\..+)?$|^config.*\\.(ya?ml|json)$|^database.*\\.ya?ml$|.*\\.properties$");

    @Override
    public String getName() {
        return "filesystem";
    }

    @Override
    public DiscoveryMethod getMethod() {
        return DiscoveryMethod.FILESYSTEM;
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
        List<String> extensions = config.getScope().getFileExtensions();
        ScopedFileWalker walker = new ScopedFileWalker(config,
            file -> FileNames.hasExtension(file, extensions) || isConfigFile(file));
        return new FilesystemStream(walker, extensions, deadline);
    }

    static boolean isConfigFile(Path file) {
        return CONFIG_FILE.matcher(FileNames.lowerName(file)).matches();
    }

    /**
     * Тип движка по заголовку файла: null - файл пуст или не читается,
     * OTHER - заголовок не распознан
     */
    static AssetType detectHeader(Path file) {
        byte[] header = new byte[16];
        int read;
        try (InputStream in = Files.newInputStream(file)) {
            read = in.readNBytes(header, 0, header.length);
        } catch (IOException e) {
            log.debug("Не удалось прочитать заголовок {}: {}", file, e.getMessage());
            return null;
        }
        if (read == 0) {
            return null;
        }
        if (read >= SQLITE_MAGIC.length && Arrays.equals(header, 0, SQLITE_MAGIC.length, SQLITE_MAGIC, 0, SQLITE_MAGIC.length)) {
            return AssetType.SQLITE;
        }
        if (read >= DUCKDB_MAGIC_OFFSET + DUCKDB_MAGIC.length
            && Arrays.equals(header, DUCKDB_MAGIC_OFFSET, DUCKDB_MAGIC_OFFSET + DUCKDB_MAGIC.length,
            DUCKDB_MAGIC, 0, DUCKDB_MAGIC.length)) {
            return AssetType.DUCKDB;
        }
        return AssetType.OTHER;
    }

    private static final class FilesystemStream extends AbstractObservationStream {

        private final ScopedFileWalker walker;
        private final List<String> extensions;
        private final Deque<CandidateObservation> buffered = new ArrayDeque<>();

        private FilesystemStream(ScopedFileWalker walker, List<String> extensions, DiscoveryDeadline deadline) {
            super(deadline);
            this.walker = walker;
            this.extensions = extensions;
        }

        @Override
        protected CandidateObservation computeNext() {
            while (buffered.isEmpty()) {
                if (deadlineReached() || !walker.hasNext()) {
                    return null;
                }
                Path file = walker.next();
                if (FileNames.hasExtension(file, extensions)) {
                    buffered.add(databaseFile(file));
                } else {
                    scanConfigFile(file);
                }
            }
            return buffered.poll();
        }

        private CandidateObservation databaseFile(Path file) {
            Path canonical = FileNames.canonical(file);
            AssetType byExtension = AssetType.fromHint(FileNames.extension(file));
            AssetType byHeader = detectHeader(canonical);

            AssetType type = byExtension;
            double confidence = EXTENSION_MATCH_CONFIDENCE;
            String header = "empty";
            if (byHeader == AssetType.SQLITE || byHeader == AssetType.DUCKDB) {
                header = byHeader.name().toLowerCase(Locale.ROOT);
                if (byHeader != byExtension) {
                    // Заголовок другого движка: верим заголовку, но снижаем уверенность
                    type = byHeader;
                    confidence = HEADER_MISMATCH_CONFIDENCE;
                }
            } else if (byHeader == AssetType.OTHER) {
                header = "unrecognized";
                confidence = HEADER_MISMATCH_CONFIDENCE;
            }

            CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
                .method(DiscoveryMethod.FILESYSTEM)
                .locator(canonical.toString())
                .methodConfidence(confidence)
                .assetType(type)
                .attribute("file_path", canonical.toString())
                .attribute("header", header);
            try {
                builder.attribute("file_size_bytes", String.valueOf(Files.size(canonical)));
                builder.attribute("last_modified", Files.getLastModifiedTime(canonical).toInstant().toString());
            } catch (IOException e) {
                log.debug("Не удалось получить атрибуты {}: {}", canonical, e.getMessage());
            }
            log.debug("Найден файл БД: {} ({}, confidence={})", canonical, type, confidence);
            return builder.build();
        }

        private void scanConfigFile(Path file) {
            Path root = walker.rootOf(file.toAbsolutePath().normalize());
            String relative = FileNames.relative(root, file.toAbsolutePath().normalize());
            List<String> lines = FileNames.readLines(file);
            for (int i = 0; i < lines.size(); i++) {
                for (String found : ConnectionStrings.findAll(lines.get(i))) {
                    ConnectionStrings.Parsed parsed = ConnectionStrings.parse(found);
                    if (parsed == null || parsed.isInMemory()) {
                        continue;
                    }
                    CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
                        .method(DiscoveryMethod.FILESYSTEM)
                        .locator(ConnectionStrings.stripCredentials(found))
                        .methodConfidence(CONFIG_REFERENCE_CONFIDENCE)
                        .assetType(parsed.getAssetType())
                        .attribute("source_file", relative)
                        .attribute("line", String.valueOf(i + 1))
                        .attribute("scheme", parsed.getScheme());
                    if (parsed.isFileEngine() && parsed.getPath() != null) {
                        Path target = FileNames.resolveLiteral(root, parsed.getPath());
                        if (target != null) {
                            builder.link(target.toString());
                        }
                    }
                    buffered.add(builder.build());
                }
            }
        }
    }
}
