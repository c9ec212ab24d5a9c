package com.gridline.app.models;

/**
 * Tags of the {@link Value} union produced by formula evaluation.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOL,
    ARRAY,
    CHART,
    ERROR
}
