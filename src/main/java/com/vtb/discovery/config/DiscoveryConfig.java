package com.vtb.discovery.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.discovery.models.DiscoveryMethod;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Конфигурация обнаружения из YAML файла.
 * Значения по умолчанию лежат в discovery-config.yaml в classpath,
 * пользовательский файл задает только то, что хочет переопределить.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveryConfig {

    public static final String DEFAULT_RESOURCE = "discovery-config.yaml";

    private Modules modules;
    private Scope scope;
    private Container container;
    private Network network;
    private Code code;
    private Security security;
    private Performance performance;
    private GapAnalysis gapAnalysis;
    private Prioritization prioritization;
    private Output output;

    /**
     * Загрузить конфигурацию по умолчанию из classpath
     */
    public static DiscoveryConfig loadDefaults() {
        ObjectMapper mapper = yamlMapper();
        try (InputStream is = DiscoveryConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            DiscoveryConfig config = mapper.readValue(is, DiscoveryConfig.class);
            if (config == null) {
                config = new DiscoveryConfig();
            }
            config.ensureDefaults();
            config.validate();
            return config;
        } catch (IOException e) {
            throw new InvalidDiscoveryConfigurationException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить пользовательский файл. Отсутствующие секции и поля
     * заполняются значениями по умолчанию.
     */
    public static DiscoveryConfig load(Path path) {
        if (path == null) {
            return loadDefaults();
        }
        if (!Files.isRegularFile(path)) {
            throw new InvalidDiscoveryConfigurationException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            DiscoveryConfig config = yamlMapper().readValue(is, DiscoveryConfig.class);
            if (config == null) {
                log.warn("Файл конфигурации {} пуст, используются значения по умолчанию", path);
                config = new DiscoveryConfig();
            }
            config.ensureDefaults();
            config.validate();
            log.info("Конфигурация загружена: {}", path);
            return config;
        } catch (IOException e) {
            throw new InvalidDiscoveryConfigurationException(
                "Некорректный файл конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация только из встроенных значений, без чтения файлов
     */
    public static DiscoveryConfig defaults() {
        DiscoveryConfig config = new DiscoveryConfig();
        config.ensureDefaults();
        return config;
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    public void ensureDefaults() {
        if (modules == null) {
            modules = new Modules();
        }
        modules.ensureDefaults();
        if (scope == null) {
            scope = new Scope();
        }
        scope.ensureDefaults();
        if (container == null) {
            container = new Container();
        }
        container.ensureDefaults();
        if (network == null) {
            network = new Network();
        }
        network.ensureDefaults();
        if (code == null) {
            code = new Code();
        }
        code.ensureDefaults();
        if (security == null) {
            security = new Security();
        }
        security.ensureDefaults();
        if (performance == null) {
            performance = new Performance();
        }
        performance.ensureDefaults();
        if (gapAnalysis == null) {
            gapAnalysis = new GapAnalysis();
        }
        gapAnalysis.ensureDefaults();
        if (prioritization == null) {
            prioritization = new Prioritization();
        }
        prioritization.ensureDefaults();
        if (output == null) {
            output = new Output();
        }
        output.ensureDefaults();
    }

    /**
     * Проверить значения верхнего уровня
     *
     * @throws InvalidDiscoveryConfigurationException если значение вне допустимого диапазона
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (performance == null || scope == null || gapAnalysis == null || prioritization == null) {
            throw new InvalidDiscoveryConfigurationException("Конфигурация не инициализирована, вызовите ensureDefaults()");
        }
        if (performance.getMaxWorkers() < 1) {
            errors.add("performance.maxWorkers должен быть >= 1");
        }
        if (performance.getMaxExecutionTimeSeconds() <= 0) {
            errors.add("performance.maxExecutionTimeSeconds должен быть > 0");
        }
        if (performance.getModuleTimeoutSeconds() <= 0) {
            errors.add("performance.moduleTimeoutSeconds должен быть > 0");
        }
        if (performance.getMaxObservations() < 1) {
            errors.add("performance.maxObservations должен быть >= 1");
        }
        if (performance.getMaxMemoryUsageMb() < 1) {
            errors.add("performance.maxMemoryUsageMb должен быть >= 1");
        }
        if (performance.getCancellationGraceMs() < 0) {
            errors.add("performance.cancellationGraceMs не может быть отрицательным");
        }
        if (scope.getMaxFileSizeMb() <= 0) {
            errors.add("scope.maxFileSizeMb должен быть > 0");
        }
        double threshold = gapAnalysis.getCompletenessThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            errors.add("gapAnalysis.completenessThreshold должен быть в диапазоне [0,1]");
        }
        if (gapAnalysis.getStalenessDays() < 1) {
            errors.add("gapAnalysis.stalenessDays должен быть >= 1");
        }
        Weights weights = prioritization.getWeights();
        if (weights.getSeverity() < 0 || weights.getRegulatory() < 0 || weights.getExposure() < 0) {
            errors.add("prioritization.weights не могут быть отрицательными");
        } else if (weights.sum() <= 0.0) {
            errors.add("prioritization.weights: сумма весов должна быть > 0");
        }
        if (!errors.isEmpty()) {
            throw new InvalidDiscoveryConfigurationException("Некорректная конфигурация: " + String.join("; ", errors));
        }
    }

    public boolean isModuleEnabled(DiscoveryMethod method) {
        return modules == null || modules.isEnabled(method);
    }

    @Data
    public static class Modules {
        private Boolean container;
        private Boolean network;
        private Boolean filesystem;
        private Boolean codeAnalysis;
        private Boolean securityScan;

        void ensureDefaults() {
            if (container == null) {
                container = Boolean.TRUE;
            }
            if (network == null) {
                network = Boolean.TRUE;
            }
            if (filesystem == null) {
                filesystem = Boolean.TRUE;
            }
            if (codeAnalysis == null) {
                codeAnalysis = Boolean.TRUE;
            }
            if (securityScan == null) {
                securityScan = Boolean.TRUE;
            }
        }

        public boolean isEnabled(DiscoveryMethod method) {
            Boolean flag = switch (method) {
                case CONTAINER -> container;
                case NETWORK -> network;
                case FILESYSTEM -> filesystem;
                case CODE_ANALYSIS -> codeAnalysis;
                case SECURITY_SCAN -> securityScan;
            };
            return flag == null || flag;
        }
    }

    @Data
    public static class Scope {
        private static final List<String> DEFAULT_EXCLUDES = List.of(
            "node_modules", ".git", "__pycache__", ".venv", "venv", "target", "build", ".idea");
        private static final List<String> DEFAULT_EXTENSIONS = List.of(".db", ".sqlite", ".sqlite3", ".duckdb");

        private List<String> scanPaths;
        /** Имена каталогов и фрагменты пути, которые не обходятся */
        private List<String> excludePatterns;
        private List<String> fileExtensions;
        private Double maxFileSizeMb;
        private Integer maxDepth;

        void ensureDefaults() {
            if (scanPaths == null || scanPaths.isEmpty()) {
                scanPaths = new ArrayList<>(List.of("."));
            }
            if (excludePatterns == null) {
                excludePatterns = new ArrayList<>(DEFAULT_EXCLUDES);
            }
            if (fileExtensions == null || fileExtensions.isEmpty()) {
                fileExtensions = new ArrayList<>(DEFAULT_EXTENSIONS);
            }
            fileExtensions = normalizeExtensions(fileExtensions);
            if (maxFileSizeMb == null) {
                maxFileSizeMb = 100.0;
            }
            if (maxDepth == null || maxDepth < 1) {
                maxDepth = 20;
            }
        }

        public long maxFileSizeBytes() {
            return (long) (maxFileSizeMb * 1024 * 1024);
        }
    }

    @Data
    public static class Container {
        private List<String> composeFilePatterns;
        /** Опрашивать Docker daemon о запущенных контейнерах */
        private Boolean inspectRunning;
        /** Адрес daemon; null - DOCKER_HOST или сокет по умолчанию */
        private String dockerHost;
        private Integer apiTimeoutMs;

        void ensureDefaults() {
            if (inspectRunning == null) {
                inspectRunning = true;
            }
            if (apiTimeoutMs == null || apiTimeoutMs <= 0) {
                apiTimeoutMs = 2_000;
            }
            if (composeFilePatterns == null || composeFilePatterns.isEmpty()) {
                composeFilePatterns = new ArrayList<>(List.of(
                    "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml",
                    "docker-compose.*.yml", "docker-compose.*.yaml"));
            }
        }
    }

    @Data
    public static class Network {
        private List<String> hosts;
        private List<Integer> ports;
        private Integer connectTimeoutMs;
        private Integer bannerReadTimeoutMs;

        void ensureDefaults() {
            if (hosts == null) {
                hosts = new ArrayList<>(List.of("localhost"));
            }
            if (ports == null) {
                ports = new ArrayList<>(List.of(5432, 5433, 3306, 27017, 6379, 9000));
            }
            if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
                connectTimeoutMs = 500;
            }
            if (bannerReadTimeoutMs == null || bannerReadTimeoutMs <= 0) {
                bannerReadTimeoutMs = 300;
            }
        }
    }

    @Data
    public static class Code {
        private List<String> codeExtensions;

        void ensureDefaults() {
            if (codeExtensions == null || codeExtensions.isEmpty()) {
                codeExtensions = new ArrayList<>(List.of(
                    ".py", ".java", ".kt", ".scala", ".js", ".ts", ".go", ".rb", ".php", ".cs", ".rs"));
            }
            codeExtensions = normalizeExtensions(codeExtensions);
        }
    }

    @Data
    public static class Security {
        private List<String> excludePaths;
        private List<String> fileExtensions;

        void ensureDefaults() {
            if (excludePaths == null) {
                excludePaths = new ArrayList<>(List.of("tests/", "test/"));
            }
            if (fileExtensions == null || fileExtensions.isEmpty()) {
                fileExtensions = new ArrayList<>(List.of(
                    ".env", ".yml", ".yaml", ".json", ".properties", ".conf", ".ini", ".toml",
                    ".py", ".java", ".js", ".ts", ".go", ".rb", ".php"));
            }
            fileExtensions = normalizeExtensions(fileExtensions);
        }
    }

    @Data
    public static class Performance {
        private Integer maxWorkers;
        private Integer maxExecutionTimeSeconds;
        private Integer moduleTimeoutSeconds;
        private Integer maxObservations;
        private Integer maxMemoryUsageMb;
        private Long cancellationGraceMs;

        void ensureDefaults() {
            if (maxWorkers == null) {
                maxWorkers = 4;
            }
            if (maxExecutionTimeSeconds == null) {
                maxExecutionTimeSeconds = 300;
            }
            if (moduleTimeoutSeconds == null) {
                moduleTimeoutSeconds = 120;
            }
            if (maxObservations == null) {
                maxObservations = 100_000;
            }
            if (maxMemoryUsageMb == null) {
                maxMemoryUsageMb = 1024;
            }
            if (cancellationGraceMs == null) {
                cancellationGraceMs = 2_000L;
            }
        }
    }

    @Data
    public static class GapAnalysis {
        private List<String> ownerAttributes;
        private Double completenessThreshold;
        private Integer stalenessDays;
        private String criticalityAttribute;

        void ensureDefaults() {
            if (ownerAttributes == null || ownerAttributes.isEmpty()) {
                ownerAttributes = new ArrayList<>(List.of("owner", "team", "maintainer"));
            }
            if (completenessThreshold == null) {
                completenessThreshold = 0.7;
            }
            if (stalenessDays == null) {
                stalenessDays = 90;
            }
            if (criticalityAttribute == null || criticalityAttribute.isBlank()) {
                criticalityAttribute = "criticality";
            }
        }
    }

    @Data
    public static class Prioritization {
        private Weights weights;

        void ensureDefaults() {
            if (weights == null) {
                weights = new Weights();
            }
            weights.ensureDefaults();
        }
    }

    /**
     * Веса составной оценки приоритета. Нормализуются к сумме 1 при расчете.
     */
    @Data
    public static class Weights {
        private static final double EQUAL = 1.0 / 3.0;

        private Double severity;
        private Double regulatory;
        private Double exposure;

        void ensureDefaults() {
            if (severity == null) {
                severity = EQUAL;
            }
            if (regulatory == null) {
                regulatory = EQUAL;
            }
            if (exposure == null) {
                exposure = EQUAL;
            }
        }

        public double sum() {
            return severity + regulatory + exposure;
        }
    }

    @Data
    public static class Output {
        private String directory;
        private String fileNamePrefix;

        void ensureDefaults() {
            if (directory == null || directory.isBlank()) {
                directory = "reports";
            }
            if (fileNamePrefix == null || fileNamePrefix.isBlank()) {
                fileNamePrefix = "discovery-report";
            }
        }
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        List<String> normalized = new ArrayList<>();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String value = ext.trim().toLowerCase(Locale.ROOT);
            normalized.add(value.startsWith(".") ? value : "." + value);
        }
        return normalized;
    }
}
