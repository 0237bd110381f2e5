package com.vtb.discovery.models;

/**
 * Классификация нефатальных ошибок прогона.
 * Ни одна из них не прерывает прогон, они попадают в отчет.
 */
public enum ErrorKind {
    MODULE_UNAVAILABLE,
    MODULE_TIMEOUT,
    MODULE_FAILED,
    RECONCILIATION_CONFLICT,
    INVALID_RULE_DEFINITION,
    INVALID_DOCUMENTATION_ENTRY,
    BUDGET_EXCEEDED
}
