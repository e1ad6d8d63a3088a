package org.example.dxf.tag;

/**
 * 组码决定的值类型。
 */
public enum TagType {
    STRING,
    DOUBLE,
    INT,
    LONG,
    POINT
}
