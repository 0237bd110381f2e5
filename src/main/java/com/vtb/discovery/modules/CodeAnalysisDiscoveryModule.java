package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.util.ConnectionStrings;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Статический анализ исходного кода: литералы строк подключения
 * и литералы путей к файлам БД.
 */
@Slf4j
public class CodeAnalysisDiscoveryModule implements DiscoveryModule {

    static final double LITERAL_CONFIDENCE = 0.8;

    private static final Pattern DB_FILE_LITERAL = Pattern.compile(
        "[\"']([^\"'\\s]+\\.(?:db|sqlite3?|duckdb))[\"']");

    @Override
    public String getName() {
        return "code_analysis";
    }

    @Override
    public DiscoveryMethod getMethod() {
        return DiscoveryMethod.CODE_ANALYSIS;
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
        List<String> extensions = config.getCode().getCodeExtensions();
        ScopedFileWalker walker = new ScopedFileWalker(config, file -> FileNames.hasExtension(file, extensions));
        return new SourceStream(walker, deadline);
    }

    private static final class SourceStream extends AbstractObservationStream {

        private final ScopedFileWalker walker;
        private final Deque<CandidateObservation> buffered = new ArrayDeque<>();

        private SourceStream(ScopedFileWalker walker, DiscoveryDeadline deadline) {
            super(deadline);
            this.walker = walker;
        }

        @Override
        protected CandidateObservation computeNext() {
            while (buffered.isEmpty()) {
                if (deadlineReached() || !walker.hasNext()) {
                    return null;
                }
                analyzeSource(walker.next().toAbsolutePath().normalize());
            }
            return buffered.poll();
        }

        private void analyzeSource(Path file) {
            Path root = walker.rootOf(file);
            String relative = FileNames.relative(root, file);
            List<String> lines = FileNames.readLines(file);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                for (String found : ConnectionStrings.findAll(line)) {
                    connectionLiteral(found, root, relative, i + 1);
                }
                Matcher matcher = DB_FILE_LITERAL.matcher(line);
                while (matcher.find()) {
                    fileLiteral(matcher.group(1), root, relative, i + 1);
                }
            }
        }

        private void connectionLiteral(String found, Path root, String relative, int line) {
            ConnectionStrings.Parsed parsed = ConnectionStrings.parse(found);
            if (parsed == null || parsed.isInMemory()) {
                return;
            }
            CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
                .method(DiscoveryMethod.CODE_ANALYSIS)
                .locator(ConnectionStrings.stripCredentials(found))
                .methodConfidence(LITERAL_CONFIDENCE)
                .assetType(parsed.getAssetType())
                .attribute("source_file", relative)
                .attribute("line", String.valueOf(line))
                .attribute("scheme", parsed.getScheme());
            if (parsed.getDatabase() != null) {
                builder.attribute("database", parsed.getDatabase());
            }
            if (parsed.isFileEngine() && parsed.getPath() != null) {
                Path target = FileNames.resolveLiteral(root, parsed.getPath());
                if (target != null) {
                    builder.link(target.toString());
                }
            }
            buffered.add(builder.build());
        }

        private void fileLiteral(String literal, Path root, String relative, int line) {
            if (ConnectionStrings.looksLikeConnectionString(literal) || literal.contains("://")) {
                return;
            }
            Path target = FileNames.resolveLiteral(root, literal);
            if (target == null) {
                return;
            }
            AssetType type = AssetType.fromHint(FileNames.extension(target));
            buffered.add(CandidateObservation.builder()
                .method(DiscoveryMethod.CODE_ANALYSIS)
                .locator(target.toString())
                .methodConfidence(LITERAL_CONFIDENCE)
                .assetType(type)
                .attribute("source_file", relative)
                .attribute("line", String.valueOf(line))
                .attribute("path_literal", literal)
                .build());
        }
    }
}
