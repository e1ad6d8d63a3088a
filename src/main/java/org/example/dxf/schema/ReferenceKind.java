package org.example.dxf.schema;

/**
 * 句柄引用的四种语义。硬引用（{@link #HARD_POINTER}、{@link #HARD_OWNER}）保护被引用实体不被删除，软引用不保护。
 */
public enum ReferenceKind {
    SOFT_POINTER,
    HARD_POINTER,
    SOFT_OWNER,
    HARD_OWNER;

    public boolean isHard() {
        return this == HARD_POINTER || this == HARD_OWNER;
    }

    /**
     * 按组码区间判断引用语义：330-339 软指针，340-349/390-399/480-481 硬指针，350-359 软所有者，360-369 硬所有者，
     * XDATA 数据库句柄 1005 视为软指针。
     *
     * @return 不是引用组码时返回 {@code null}
     */
    public static ReferenceKind ofGroupCode(int code) {
        if (code >= 330 && code <= 339) {
            return SOFT_POINTER;
        }
        if ((code >= 340 && code <= 349) || (code >= 390 && code <= 399) || code == 480 || code == 481) {
            return HARD_POINTER;
        }
        if (code >= 350 && code <= 359) {
            return SOFT_OWNER;
        }
        if (code >= 360 && code <= 369) {
            return HARD_OWNER;
        }
        if (code == 1005) {
            return SOFT_POINTER;
        }
        return null;
    }
}
