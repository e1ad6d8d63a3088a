package org.example.dxf.tag;

import java.util.List;
import java.util.Objects;

/**
 * DXF 的原子单元：(组码, 值)。
 * <p>
 * 值类型由组码决定（见 {@link GroupCodes#typeOf(int)}）：{@link String}、{@link Integer}、{@link Long}、
 * {@link Double} 或 {@link DxfPoint}。
 * <p>
 * 从文件读出的 tag 同时保存原始值文本（点坐标为每个分量一行），写出时原样输出，
 * 保证未建模的 tag 可以逐字节往返；程序构造的 tag 没有原始文本，写出时按类型格式化。
 * 相等性只比较组码与值。
 */
public final class DxfTag {

    private final int code;
    private final Object value;
    private final List<String> rawText;
    private final int line;

    private DxfTag(int code, Object value, List<String> rawText, int line) {
        this.code = code;
        this.value = Objects.requireNonNull(value, "value");
        this.rawText = rawText;
        this.line = line;
    }

    public static DxfTag of(int code, Object value) {
        return new DxfTag(code, normalize(value), null, -1);
    }

    static DxfTag parsed(int code, Object value, List<String> rawText, int line) {
        return new DxfTag(code, value, List.copyOf(rawText), line);
    }

    private static Object normalize(Object value) {
        if (value instanceof Short s) {
            return s.intValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return value;
    }

    public int code() {
        return code;
    }

    public Object value() {
        return value;
    }

    /**
     * @return 原始值文本；程序构造的 tag 返回 {@code null}
     */
    public List<String> rawText() {
        return rawText;
    }

    /**
     * @return tag 在源文件中的行号（组码行，从 1 开始）；程序构造的 tag 返回 -1
     */
    public int line() {
        return line;
    }

    public String stringValue() {
        return value instanceof String s ? s : String.valueOf(value);
    }

    public int intValue() {
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw new IllegalStateException("组码 " + code + " 不是整数：" + value);
    }

    public double doubleValue() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalStateException("组码 " + code + " 不是数值：" + value);
    }

    public DxfPoint pointValue() {
        if (value instanceof DxfPoint p) {
            return p;
        }
        throw new IllegalStateException("组码 " + code + " 不是点坐标：" + value);
    }

    public boolean is(int code, String value) {
        return this.code == code && value.equals(this.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DxfTag other)) {
            return false;
        }
        return code == other.code && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * code + value.hashCode();
    }

    @Override
    public String toString() {
        return "(" + code + ", " + value + ")";
    }
}
