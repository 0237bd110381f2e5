package com.vtb.discovery.models;

/**
 * Виды пробелов
 */
public enum GapType {
    ORPHANED_ASSET,
    DOCUMENTATION,
    COMPLIANCE
}
