package org.example.dxf;

/**
 * 属性最低版本高于文档（或目标写出）版本时的处理策略。
 */
public enum VersionConflictPolicy {

    /**
     * 设置时照常保存；写出低版本时省略该属性（记录 WARN 日志）。
     */
    IGNORE,

    /**
     * 设置时把文档版本提升到属性的最低版本；写出低版本时同 {@link #IGNORE}。
     */
    UPGRADE,

    /**
     * 设置和写出时都抛出 {@link DxfVersionException}。
     */
    RAISE
}
