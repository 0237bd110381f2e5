package com.vtb.discovery.models;

public enum DocumentationIssue {
    /** Документации нет, но владелец известен */
    MISSING,
    /** Полнота ниже порога */
    INCOMPLETE,
    /** Давно не обновлялась */
    STALE
}
