package com.vtb.discovery.modules;

import java.util.List;

/**
 * Доступ на чтение к среде выполнения контейнеров
 */
public interface ContainerRuntime extends AutoCloseable {

    /**
     * Запущенные контейнеры на момент вызова
     *
     * @throws ModuleUnavailableException если среда перестала отвечать
     */
    List<RunningContainer> listRunningContainers();

    @Override
    void close();
}
