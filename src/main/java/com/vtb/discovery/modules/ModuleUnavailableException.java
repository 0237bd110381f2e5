package com.vtb.discovery.modules;

/**
 * Модуль не может выполнить обнаружение в текущем окружении (нет доступа, нет инструмента).
 * Не фатально: модуль помечается как пропущенный.
 */
public class ModuleUnavailableException extends RuntimeException {

    public ModuleUnavailableException(String message) {
        super(message);
    }

    public ModuleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
