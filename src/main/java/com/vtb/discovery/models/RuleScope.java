package com.vtb.discovery.models;

public enum RuleScope {
    /** Правило проверяется для каждого применимого актива */
    ASSET,
    /** Правило проверяется один раз против сводных фактов инвентаря */
    ENVIRONMENT
}
