package com.vtb.discovery.modules;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerMount;
import com.github.dockerjava.api.model.ContainerPort;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import com.vtb.discovery.config.DiscoveryConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Docker Engine API через docker-java. Только чтение: ping, список и inspect контейнеров.
 */
@Slf4j
public class DockerContainerRuntime implements ContainerRuntime {

    private final DockerClient client;

    DockerContainerRuntime(DockerClient client) {
        this.client = client;
    }

    /**
     * Подключиться к daemon и проверить, что он отвечает
     *
     * @throws ModuleUnavailableException если daemon недоступен
     */
    public static DockerContainerRuntime connect(DiscoveryConfig config) {
        DiscoveryConfig.Container settings = config.getContainer();
        DockerClient client;
        try {
            DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
            if (settings.getDockerHost() != null && !settings.getDockerHost().isBlank()) {
                builder.withDockerHost(settings.getDockerHost().trim());
            }
            DockerClientConfig clientConfig = builder.build();
            Duration timeout = Duration.ofMillis(settings.getApiTimeoutMs());
            DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(clientConfig.getDockerHost())
                .sslConfig(clientConfig.getSSLConfig())
                .maxConnections(4)
                .connectionTimeout(timeout)
                .responseTimeout(timeout)
                .build();
            client = DockerClientImpl.getInstance(clientConfig, httpClient);
        } catch (RuntimeException e) {
            throw new ModuleUnavailableException("Некорректные настройки Docker: " + e.getMessage(), e);
        }

        try {
            client.pingCmd().exec();
        } catch (RuntimeException e) {
            closeQuietly(client);
            throw new ModuleUnavailableException("Docker daemon не отвечает: " + e.getMessage(), e);
        }
        log.debug("Подключение к Docker daemon установлено");
        return new DockerContainerRuntime(client);
    }

    @Override
    public List<RunningContainer> listRunningContainers() {
        List<Container> containers;
        try {
            containers = client.listContainersCmd().withShowAll(false).exec();
        } catch (RuntimeException e) {
            throw new ModuleUnavailableException("Не удалось получить список контейнеров: " + e.getMessage(), e);
        }
        List<RunningContainer> result = new ArrayList<>();
        for (Container container : containers) {
            result.add(toRunningContainer(container));
        }
        return result;
    }

    private RunningContainer toRunningContainer(Container container) {
        RunningContainer.RunningContainerBuilder builder = RunningContainer.builder()
            .id(container.getId())
            .name(primaryName(container))
            .image(container.getImage());
        if (container.getPorts() != null) {
            for (ContainerPort port : container.getPorts()) {
                if (port.getPrivatePort() != null) {
                    int published = port.getPublicPort() != null ? port.getPublicPort() : 0;
                    builder.port(new int[]{published, port.getPrivatePort()});
                }
            }
        }
        if (container.getLabels() != null) {
            builder.labels(container.getLabels());
        }
        if (container.getMounts() != null) {
            for (ContainerMount mount : container.getMounts()) {
                if (mount.getDestination() != null) {
                    builder.mount(mount.getDestination());
                }
            }
        }
        builder.environmentKeys(environmentKeys(container.getId()));
        return builder.build();
    }

    /**
     * Имена переменных окружения без значений; при ошибке inspect - пустой список
     */
    private List<String> environmentKeys(String containerId) {
        List<String> keys = new ArrayList<>();
        try {
            InspectContainerResponse response = client.inspectContainerCmd(containerId).exec();
            if (response.getConfig() != null && response.getConfig().getEnv() != null) {
                for (String entry : response.getConfig().getEnv()) {
                    int eq = entry.indexOf('=');
                    keys.add(eq > 0 ? entry.substring(0, eq) : entry);
                }
            }
        } catch (RuntimeException e) {
            log.debug("inspect контейнера {} не удался: {}", containerId, e.getMessage());
        }
        return keys;
    }

    private static String primaryName(Container container) {
        String[] names = container.getNames();
        if (names == null || names.length == 0 || names[0] == null) {
            return container.getId();
        }
        String name = names[0];
        return name.startsWith("/") ? name.substring(1) : name;
    }

    @Override
    public void close() {
        closeQuietly(client);
    }

    private static void closeQuietly(DockerClient client) {
        try {
            client.close();
        } catch (IOException e) {
            log.debug("Ошибка закрытия Docker клиента: {}", e.getMessage());
        }
    }
}
