package org.example.dxf.tag;

import org.example.dxf.DxfVersion;
import org.example.dxf.VersionConflictPolicy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.util.List;
import java.util.Locale;

/**
 * ASCII DXF tag 写出器。
 * <p>
 * 组码右对齐为 3 位（与 AutoCAD 输出一致），每个 tag 两行，行尾统一为 {@code \n}。
 * 从文件读出的 tag 按原始文本输出；程序构造的 tag 按类型格式化。
 * 写出目标为 R2007 之前的版本时，目标代码页无法表示的字符写成 {@code \U+nnnn}。
 * <p>
 * 底层 {@link Writer} 的 {@link IOException} 被包装为 {@link UncheckedIOException}，
 * 由 {@code DxfWriter} 在最外层还原。
 */
public final class DxfTagWriter {

    private final Writer out;
    private final DxfVersion version;
    private final VersionConflictPolicy versionPolicy;
    private final CharsetEncoder encoder;

    public DxfTagWriter(Writer out, DxfVersion version, VersionConflictPolicy versionPolicy, Charset charset) {
        this.out = out;
        this.version = version;
        this.versionPolicy = versionPolicy;
        this.encoder = charset.newEncoder();
    }

    /**
     * @return 写出的目标版本
     */
    public DxfVersion version() {
        return version;
    }

    public VersionConflictPolicy versionPolicy() {
        return versionPolicy;
    }

    public void write(DxfTag tag) {
        List<String> raw = tag.rawText();
        if (raw != null) {
            for (int i = 0; i < raw.size(); i++) {
                line(tag.code() + i * 10, raw.get(i));
            }
            return;
        }
        Object value = tag.value();
        if (value instanceof DxfPoint p) {
            writePoint(tag.code(), p, true);
        } else if (value instanceof Double d) {
            write(tag.code(), d.doubleValue());
        } else {
            line(tag.code(), String.valueOf(value));
        }
    }

    public void writeAll(Iterable<DxfTag> tags) {
        for (DxfTag tag : tags) {
            write(tag);
        }
    }

    public void write(int code, String value) {
        line(code, value);
    }

    public void write(int code, int value) {
        line(code, Integer.toString(value));
    }

    public void write(int code, long value) {
        line(code, Long.toString(value));
    }

    public void write(int code, double value) {
        line(code, formatDouble(value));
    }

    /**
     * 写出点坐标；{@code with3d} 为 {@code false} 时只写 x/y。
     */
    public void writePoint(int code, DxfPoint p, boolean with3d) {
        line(code, formatDouble(p.x()));
        line(code + 10, formatDouble(p.y()));
        if (with3d) {
            line(code + 20, formatDouble(p.z()));
        }
    }

    private void line(int code, String value) {
        try {
            out.write(String.format(Locale.ROOT, "%3d", code));
            out.write('\n');
            out.write(version.usesUtf8() ? value : DxfEncoding.encodeUnicodeEscapes(value, encoder));
            out.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * 浮点数格式：最短的可精确还原的十进制表示，不用科学计数法，整数值保留 {@code .0}。
     */
    public static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("DXF 不支持的浮点数：" + value);
        }
        String s = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        if (s.indexOf('.') < 0) {
            s = s + ".0";
        }
        return s;
    }
}
