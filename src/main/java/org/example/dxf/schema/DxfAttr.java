package org.example.dxf.schema;

import org.example.dxf.DxfVersion;
import org.example.dxf.tag.DxfPoint;

import java.util.Objects;

/**
 * 属性描述：组码 -> (属性名, 类型, 默认值, 最低版本)。
 * <p>
 * {@code optional} 的属性在未设置或等于默认值时不写出；必需属性未设置时写出默认值。
 *
 * @param name         属性名（同一实体类型内唯一）
 * @param code         组码；{@link AttrType#SLOT} 为 -1
 * @param type         值类型
 * @param defaultValue 默认值，可以为 {@code null}
 * @param optional     是否允许省略
 * @param minVersion   最低支持版本
 */
public record DxfAttr(
        String name,
        int code,
        AttrType type,
        Object defaultValue,
        boolean optional,
        DxfVersion minVersion
) {

    public DxfAttr {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(minVersion, "minVersion");
        defaultValue = defaultValue == null ? null : coerce(name, type, defaultValue);
    }

    public static DxfAttr required(String name, int code, AttrType type, Object defaultValue) {
        return new DxfAttr(name, code, type, defaultValue, false, DxfVersion.R12);
    }

    public static DxfAttr optional(String name, int code, AttrType type, Object defaultValue) {
        return new DxfAttr(name, code, type, defaultValue, true, DxfVersion.R12);
    }

    public static DxfAttr optional(String name, int code, AttrType type) {
        return new DxfAttr(name, code, type, null, true, DxfVersion.R12);
    }

    /**
     * 变长结构的输出位置。
     */
    public static DxfAttr slot(String name) {
        return new DxfAttr(name, -1, AttrType.SLOT, null, false, DxfVersion.R12);
    }

    public DxfAttr since(DxfVersion version) {
        return new DxfAttr(name, code, type, defaultValue, optional, version);
    }

    public boolean isSlot() {
        return type == AttrType.SLOT;
    }

    /**
     * @return 该属性承载的引用语义；不是句柄属性时返回 {@code null}
     */
    public ReferenceKind referenceKind() {
        return type == AttrType.HANDLE ? ReferenceKind.ofGroupCode(code) : null;
    }

    /**
     * 把值转换为该属性的存储类型。
     *
     * @throws IllegalArgumentException 值与属性类型不兼容
     */
    public Object coerce(Object value) {
        return coerce(name, type, value);
    }

    /**
     * @return tag 值能否直接作为该属性的值载入（类型严格匹配，不做数值转换）
     */
    public boolean accepts(Object tagValue) {
        return switch (type) {
            case STRING, HANDLE -> tagValue instanceof String;
            case INT -> tagValue instanceof Integer;
            case LONG -> tagValue instanceof Long;
            case DOUBLE -> tagValue instanceof Double;
            case POINT2D, POINT3D -> tagValue instanceof DxfPoint;
            case SLOT -> false;
        };
    }

    private static Object coerce(String name, AttrType type, Object value) {
        Objects.requireNonNull(value, name);
        switch (type) {
            case STRING, HANDLE -> {
                if (value instanceof String) {
                    return value;
                }
            }
            case INT -> {
                if (value instanceof Boolean b) {
                    return b ? 1 : 0;
                }
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).intValue();
                }
            }
            case LONG -> {
                if (value instanceof Number n && !(value instanceof Double) && !(value instanceof Float)) {
                    return n.longValue();
                }
            }
            case DOUBLE -> {
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
            }
            case POINT2D, POINT3D -> {
                if (value instanceof DxfPoint) {
                    return value;
                }
            }
            case SLOT -> throw new IllegalArgumentException("结构占位 " + name + " 不能赋值");
        }
        throw new IllegalArgumentException("属性 " + name + " 需要 " + type + " 类型，实际为 "
                + value.getClass().getSimpleName() + "：" + value);
    }
}
