package com.vtb.discovery.models;

/**
 * Итог выполнения модуля в рамках одного прогона
 */
public enum ModuleStatus {
    /** Отработал полностью */
    COMPLETED,
    /** Остановлен по дедлайну, собранные наблюдения сохранены */
    PARTIAL,
    /** Недоступен или отклонен при регистрации */
    SKIPPED,
    /** Не уложился в период отмены, вывод отброшен */
    ABANDONED,
    /** Упал с исключением */
    FAILED;

    public boolean isExecuted() {
        return this == COMPLETED || this == PARTIAL;
    }
}
