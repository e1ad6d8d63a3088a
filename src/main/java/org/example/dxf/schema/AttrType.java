package org.example.dxf.schema;

/**
 * 属性值类型。
 */
public enum AttrType {
    STRING,
    /**
     * 十六进制句柄串；引用类型由组码决定（见 {@link ReferenceKind#ofGroupCode(int)}）。
     */
    HANDLE,
    INT,
    LONG,
    DOUBLE,
    /**
     * 只写 x/y 的点。
     */
    POINT2D,
    POINT3D,
    /**
     * 变长结构的占位：不对应组码，标记该结构在子类中的输出位置。
     */
    SLOT
}
