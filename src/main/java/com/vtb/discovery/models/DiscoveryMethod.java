package com.vtb.discovery.models;

/**
 * Способ обнаружения актива.
 * Приоритет используется при разрешении конфликтов типа актива:
 * исходный код и объявленная конфигурация авторитетнее косвенных признаков.
 */
public enum DiscoveryMethod {
    CONTAINER("container", 4),
    NETWORK("network", 2),
    FILESYSTEM("filesystem", 3),
    CODE_ANALYSIS("code_analysis", 5),
    SECURITY_SCAN("security_scan", 1);

    private final String code;
    private final int precedence;

    DiscoveryMethod(String code, int precedence) {
        this.code = code;
        this.precedence = precedence;
    }

    public String getCode() {
        return code;
    }

    public int getPrecedence() {
        return precedence;
    }
}
