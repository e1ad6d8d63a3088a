package org.example.dxf;

/**
 * 加载时表记录名 / 块名重复（大小写不敏感）的合并策略。
 */
public enum DuplicateNamePolicy {

    /**
     * 保留先出现的定义，丢弃后出现的定义。
     */
    FIRST_WINS,

    /**
     * 后出现的定义替换先出现的定义。
     */
    LAST_WINS
}
