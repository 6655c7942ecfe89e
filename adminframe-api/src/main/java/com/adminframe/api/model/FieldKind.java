package com.adminframe.api.model;

/**
 * 字段类型
 */
public enum FieldKind {
    STRING,
    TEXT,
    BOOLEAN,
    INTEGER,
    BIGINT,
    FLOAT,
    DECIMAL,
    DATE,
    DATETIME,
    UUID,
    JSON,
    /** 外键 */
    FK,
    /** 多对多 */
    M2M;

    public boolean isRelation() {
        return this == FK || this == M2M;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == BIGINT || this == FLOAT || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }
}
