package com.vtb.discovery.modules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Снимок запущенного контейнера, полученный от среды выполнения.
 * Значения переменных окружения не хранятся: в них бывают пароли.
 */
@Value
@Builder
public class RunningContainer {
    String id;
    String name;
    String image;
    /** Пары [опубликованный, внутренний]; 0 - порт не опубликован */
    @Singular
    List<int[]> ports;
    @Singular
    Map<String, String> labels;
    @Singular
    List<String> environmentKeys;
    /** Точки монтирования внутри контейнера */
    @Singular
    List<String> mounts;
}
