package com.example.relayserver.model;

/**
 * 参数值类型
 */
public enum ValueType {
    NUMERIC,
    TEXT,
    BOOLEAN,
    EMPTY
}
