package com.vtb.discovery.modules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Поиск БД в контейнерах: запущенные контейнеры Docker daemon и объявленные
 * сервисы docker-compose файлов. Если daemon недоступен, модуль работает
 * только по файлам.
 */
@Slf4j
public class ContainerDiscoveryModule implements DiscoveryModule {

    static final double IMAGE_MATCH_CONFIDENCE = 0.9;
    static final double PORT_MATCH_CONFIDENCE = 0.6;

    static final String LOCATOR_PREFIX = "compose://";
    static final String RUNNING_LOCATOR_PREFIX = "docker://";

    static final String COMPOSE_CONFIG_FILES_LABEL = "com.docker.compose.project.config_files";
    static final String COMPOSE_WORKING_DIR_LABEL = "com.docker.compose.project.working_dir";
    static final String COMPOSE_SERVICE_LABEL = "com.docker.compose.service";

    private static final Map<String, AssetType> IMAGE_PATTERNS = new LinkedHashMap<>();
    private static final Map<Integer, AssetType> DATABASE_PORTS = Map.of(
        5432, AssetType.POSTGRESQL,
        3306, AssetType.OTHER,
        27017, AssetType.OTHER,
        6379, AssetType.OTHER,
        9000, AssetType.FILE_STORAGE
    );
    private static final Map<String, AssetType> ENV_INDICATORS = Map.of(
        "POSTGRES_DB", AssetType.POSTGRESQL,
        "POSTGRES_PASSWORD", AssetType.POSTGRESQL,
        "POSTGRESQL_DATABASE", AssetType.POSTGRESQL,
        "MYSQL_DATABASE", AssetType.OTHER,
        "MONGO_INITDB_DATABASE", AssetType.OTHER,
        "MINIO_ROOT_USER", AssetType.FILE_STORAGE
    );
    private static final List<String> OWNER_LABELS = List.of("owner", "team", "maintainer");

    static {
        IMAGE_PATTERNS.put("postgis", AssetType.POSTGRESQL);
        IMAGE_PATTERNS.put("timescale", AssetType.POSTGRESQL);
        IMAGE_PATTERNS.put("postgres", AssetType.POSTGRESQL);
        IMAGE_PATTERNS.put("duckdb", AssetType.DUCKDB);
        IMAGE_PATTERNS.put("sqlite", AssetType.SQLITE);
        IMAGE_PATTERNS.put("minio", AssetType.FILE_STORAGE);
        IMAGE_PATTERNS.put("mysql", AssetType.OTHER);
        IMAGE_PATTERNS.put("mariadb", AssetType.OTHER);
        IMAGE_PATTERNS.put("mongo", AssetType.OTHER);
        IMAGE_PATTERNS.put("redis", AssetType.OTHER);
    }

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Function<DiscoveryConfig, ContainerRuntime> runtimeFactory;

    public ContainerDiscoveryModule() {
        this(DockerContainerRuntime::connect);
    }

    /**
     * @param runtimeFactory подключение к среде контейнеров; бросает
     *                       {@link ModuleUnavailableException}, если среда недоступна
     */
    public ContainerDiscoveryModule(Function<DiscoveryConfig, ContainerRuntime> runtimeFactory) {
        this.runtimeFactory = runtimeFactory;
    }

    @Override
    public String getName() {
        return "container";
    }

    @Override
    public DiscoveryMethod getMethod() {
        return DiscoveryMethod.CONTAINER;
    }

    @Override
    public ModuleAvailability checkAvailability(DiscoveryConfig config) {
        if (!ScopedFileWalker.anyRootExists(config) && !config.getContainer().getInspectRunning()) {
            return ModuleAvailability.unavailable("Ни один путь сканирования не существует, опрос Docker отключен");
        }
        return ModuleAvailability.available();
    }

    @Override
    public ObservationStream discover(DiscoveryConfig config, DiscoveryDeadline deadline) {
        boolean scanFiles = ScopedFileWalker.anyRootExists(config);
        ContainerRuntime runtime = null;
        if (config.getContainer().getInspectRunning()) {
            try {
                runtime = runtimeFactory.apply(config);
            } catch (ModuleUnavailableException e) {
                if (!scanFiles) {
                    throw e;
                }
                log.warn("Запущенные контейнеры не проверены, только compose файлы: {}", e.getMessage());
            }
        }
        if (runtime == null && !scanFiles) {
            throw new ModuleUnavailableException("Ни один путь сканирования не существует");
        }

        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : config.getContainer().getComposeFilePatterns()) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.toLowerCase(Locale.ROOT)));
        }
        ScopedFileWalker walker = new ScopedFileWalker(config, file -> {
            Path name = Path.of(FileNames.lowerName(file));
            for (PathMatcher matcher : matchers) {
                if (matcher.matches(name)) {
                    return true;
                }
            }
            return false;
        });
        return new ContainerStream(runtime, walker, deadline);
    }

    /**
     * Наблюдение по запущенному контейнеру или null, если это не хранилище
     */
    CandidateObservation analyzeRunningContainer(RunningContainer container) {
        String image = container.getImage() != null ? container.getImage().toLowerCase(Locale.ROOT) : "";
        Classification classification = classify(image, container.getPorts(), container.getEnvironmentKeys());
        if (classification == null) {
            return null;
        }

        CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
            .method(DiscoveryMethod.CONTAINER)
            .locator(RUNNING_LOCATOR_PREFIX + container.getName())
            .methodConfidence(classification.confidence)
            .assetType(classification.type)
            .attribute("container_name", container.getName())
            .attribute("container_state", "running");
        if (container.getId() != null) {
            builder.attribute("container_id", container.getId().length() > 12
                ? container.getId().substring(0, 12) : container.getId());
        }
        if (!image.isEmpty()) {
            builder.attribute("image", image);
        }
        if (!container.getMounts().isEmpty()) {
            builder.attribute("volumes", String.join(",", new TreeSet<>(container.getMounts())));
        }
        applyPorts(builder, container.getPorts());
        applyLabels(builder, container.getLabels());

        String service = container.getLabels().get(COMPOSE_SERVICE_LABEL);
        String configFiles = container.getLabels().get(COMPOSE_CONFIG_FILES_LABEL);
        if (service != null && !service.isBlank() && configFiles != null) {
            builder.attribute("service", service);
            String workingDir = container.getLabels().get(COMPOSE_WORKING_DIR_LABEL);
            for (String file : configFiles.split(",")) {
                if (file.isBlank()) {
                    continue;
                }
                try {
                    Path path = Path.of(file.trim());
                    if (!path.isAbsolute() && workingDir != null) {
                        path = Path.of(workingDir).resolve(path);
                    }
                    builder.link(LOCATOR_PREFIX + FileNames.canonical(path) + "#" + service);
                } catch (InvalidPathException e) {
                    log.debug("Некорректный путь compose файла в метке контейнера {}: {}", container.getName(), file);
                }
            }
        }
        return builder.build();
    }

    /**
     * Разобрать один compose-файл в наблюдения
     */
    List<CandidateObservation> analyzeComposeFile(Path composeFile) {
        List<CandidateObservation> observations = new ArrayList<>();
        Path canonical = FileNames.canonical(composeFile);
        JsonNode root;
        try {
            root = yamlMapper.readTree(canonical.toFile());
        } catch (IOException e) {
            log.warn("Некорректный YAML в compose файле {}: {}", canonical, e.getMessage());
            return observations;
        }
        if (root == null || !root.path("services").isObject()) {
            return observations;
        }
        Iterator<Map.Entry<String, JsonNode>> services = root.path("services").fields();
        while (services.hasNext()) {
            Map.Entry<String, JsonNode> service = services.next();
            CandidateObservation observation = analyzeService(canonical, service.getKey(), service.getValue());
            if (observation != null) {
                observations.add(observation);
            }
        }
        log.debug("В {} найдено {} сервисов БД", canonical, observations.size());
        return observations;
    }

    private CandidateObservation analyzeService(Path composeFile, String serviceName, JsonNode service) {
        String image = service.path("image").asText("").toLowerCase(Locale.ROOT);
        List<int[]> ports = parsePorts(service.path("ports"));
        Map<String, String> environment = toStringMap(service.path("environment"));

        Classification classification = classify(image, ports, environment.keySet());
        if (classification == null) {
            return null;
        }

        CandidateObservation.CandidateObservationBuilder builder = CandidateObservation.builder()
            .method(DiscoveryMethod.CONTAINER)
            .locator(LOCATOR_PREFIX + composeFile + "#" + serviceName)
            .methodConfidence(classification.confidence)
            .assetType(classification.type)
            .attribute("compose_file", composeFile.toString())
            .attribute("service", serviceName);
        if (!image.isEmpty()) {
            builder.attribute("image", image);
        }
        String containerName = service.path("container_name").asText("");
        if (!containerName.isEmpty()) {
            builder.attribute("container_name", containerName);
            builder.link(RUNNING_LOCATOR_PREFIX + containerName);
        }
        applyPorts(builder, ports);
        applyLabels(builder, toStringMap(service.path("labels")));
        return builder.build();
    }

    /**
     * Тип хранилища по образу, затем по внутренним портам, затем по переменным окружения
     */
    static Classification classify(String image, List<int[]> ports, Collection<String> environmentKeys) {
        for (Map.Entry<String, AssetType> entry : IMAGE_PATTERNS.entrySet()) {
            if (!image.isEmpty() && image.contains(entry.getKey())) {
                return new Classification(entry.getValue(), IMAGE_MATCH_CONFIDENCE);
            }
        }
        for (int[] mapping : ports) {
            AssetType byPort = DATABASE_PORTS.get(mapping[1]);
            if (byPort != null) {
                return new Classification(byPort, PORT_MATCH_CONFIDENCE);
            }
        }
        for (String key : environmentKeys) {
            AssetType byEnv = ENV_INDICATORS.get(key.toUpperCase(Locale.ROOT));
            if (byEnv != null) {
                return new Classification(byEnv, PORT_MATCH_CONFIDENCE);
            }
        }
        return null;
    }

    private static void applyPorts(CandidateObservation.CandidateObservationBuilder builder, List<int[]> ports) {
        TreeSet<String> published = new TreeSet<>();
        for (int[] mapping : ports) {
            if (mapping[0] > 0 && published.add(String.valueOf(mapping[0]))) {
                builder.link("localhost:" + mapping[0]);
            }
        }
        if (!published.isEmpty()) {
            builder.attribute("published_ports", String.join(",", published));
        }
    }

    /**
     * Метки владельца, критичности и окружения; префикс вида com.example. отбрасывается
     */
    private static void applyLabels(CandidateObservation.CandidateObservationBuilder builder, Map<String, String> labels) {
        for (Map.Entry<String, String> label : labels.entrySet()) {
            String key = label.getKey().toLowerCase(Locale.ROOT);
            if (key.startsWith("com.docker.")) {
                continue;
            }
            String shortKey = key.contains(".") ? key.substring(key.lastIndexOf('.') + 1) : key;
            String value = label.getValue();
            if (value == null || value.isBlank()) {
                continue;
            }
            if (OWNER_LABELS.contains(shortKey) || "criticality".equals(shortKey) || "environment".equals(shortKey)) {
                builder.attribute(shortKey, value.trim());
            }
        }
    }

    /**
     * Порты сервиса как пары [опубликованный, внутренний]; 0 - порт не опубликован.
     * Поддерживаются короткий синтаксис ("5433:5432", "127.0.0.1:5433:5432/tcp", 5432)
     * и длинный ({target, published}).
     */
    static List<int[]> parsePorts(JsonNode portsNode) {
        List<int[]> result = new ArrayList<>();
        if (portsNode == null || !portsNode.isArray()) {
            return result;
        }
        for (JsonNode port : portsNode) {
            if (port.isInt()) {
                result.add(new int[]{0, port.asInt()});
            } else if (port.isTextual()) {
                int[] parsed = parsePortSpec(port.asText());
                if (parsed != null) {
                    result.add(parsed);
                }
            } else if (port.isObject()) {
                int target = port.path("target").asInt(0);
                int published = port.path("published").asInt(0);
                if (target > 0) {
                    result.add(new int[]{published, target});
                }
            }
        }
        return result;
    }

    private static int[] parsePortSpec(String spec) {
        String value = spec.trim();
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        String[] parts = value.split(":");
        try {
            if (parts.length == 1) {
                return new int[]{0, Integer.parseInt(parts[0])};
            }
            int published = parseFirstOfRange(parts[parts.length - 2]);
            int target = parseFirstOfRange(parts[parts.length - 1]);
            return new int[]{published, target};
        } catch (NumberFormatException e) {
            log.debug("Не удалось разобрать порт '{}'", spec);
            return null;
        }
    }

    private static int parseFirstOfRange(String value) {
        int dash = value.indexOf('-');
        return Integer.parseInt(dash >= 0 ? value.substring(0, dash) : value);
    }

    /**
     * environment и labels бывают словарем или списком "KEY=VALUE"
     */
    private static Map<String, String> toStringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return result;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                result.put(field.getKey(), field.getValue().isNull() ? "" : field.getValue().asText());
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                String text = item.asText();
                int eq = text.indexOf('=');
                if (eq > 0) {
                    result.put(text.substring(0, eq), text.substring(eq + 1));
                } else if (!text.isEmpty()) {
                    result.put(text, "");
                }
            }
        }
        return result;
    }

    private static final class Classification {
        private final AssetType type;
        private final double confidence;

        private Classification(AssetType type, double confidence) {
            this.type = type;
            this.confidence = confidence;
        }
    }

    /**
     * Сначала запущенные контейнеры, затем compose файлы в корнях сканирования
     */
    private final class ContainerStream extends AbstractObservationStream {

        private final ContainerRuntime runtime;
        private final ScopedFileWalker walker;
        private final Deque<CandidateObservation> buffered = new ArrayDeque<>();
        private boolean runtimeDrained;

        private ContainerStream(ContainerRuntime runtime, ScopedFileWalker walker, DiscoveryDeadline deadline) {
            super(deadline);
            this.runtime = runtime;
            this.walker = walker;
            this.runtimeDrained = runtime == null;
        }

        @Override
        protected CandidateObservation computeNext() {
            if (!runtimeDrained) {
                runtimeDrained = true;
                bufferRunningContainers();
            }
            while (buffered.isEmpty()) {
                if (deadlineReached() || !walker.hasNext()) {
                    return null;
                }
                buffered.addAll(analyzeComposeFile(walker.next()));
            }
            return buffered.poll();
        }

        private void bufferRunningContainers() {
            List<RunningContainer> containers;
            try {
                containers = runtime.listRunningContainers();
            } catch (ModuleUnavailableException e) {
                log.warn("Список запущенных контейнеров недоступен: {}", e.getMessage());
                return;
            }
            int before = buffered.size();
            for (RunningContainer container : containers) {
                CandidateObservation observation = analyzeRunningContainer(container);
                if (observation != null) {
                    buffered.add(observation);
                }
            }
            log.debug("Запущено контейнеров: {}, из них хранилищ: {}", containers.size(), buffered.size() - before);
        }

        @Override
        protected void release() {
            if (runtime != null) {
                runtime.close();
            }
        }
    }
}
