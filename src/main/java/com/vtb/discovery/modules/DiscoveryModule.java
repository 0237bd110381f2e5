package com.vtb.discovery.modules;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.DiscoveryMethod;

/**
 * Модуль обнаружения: одна техника поиска хранилищ.
 * Реализации только читают окружение и ничего в нем не меняют.
 */
public interface DiscoveryModule {

    /**
     * Уникальное имя модуля в рамках прогона
     */
    String getName();

    DiscoveryMethod getMethod();

    /**
     * Модуль, вернувший false, отклоняется при регистрации
     */
    default boolean isReadOnly() {
        return true;
    }

    /**
     * Проверить, может ли модуль работать в текущем окружении.
     * Недоступный модуль пропускается, прогон продолжается.
     */
    ModuleAvailability checkAvailability(DiscoveryConfig config);

    /**
     * Запустить обнаружение в заданных границах.
     * Каждый вызов возвращает новый поток наблюдений, ничего не кэшируется.
     *
     * @param config   границы сканирования
     * @param deadline дедлайн модуля, проверяется на каждой границе ввода-вывода
     * @throws ModuleUnavailableException если окружение не позволяет выполнить обнаружение
     */
    ObservationStream discover(DiscoveryConfig config, DiscoveryDeadline deadline);
}
