package com.vtb.discovery.config;

/**
 * Конфигурация прогона некорректна, выполнение не начинается.
 * Единственная ошибка, прерывающая прогон целиком.
 */
public class InvalidDiscoveryConfigurationException extends RuntimeException {

    public InvalidDiscoveryConfigurationException(String message) {
        super(message);
    }

    public InvalidDiscoveryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
