package org.example.dxf.tag;

import org.example.dxf.DxfStructureException;
import org.example.dxf.MalformedPointException;
import org.example.dxf.UnexpectedEndOfStreamException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * ASCII DXF tag 读取器：把已解码的文本惰性地转换为带类型的 {@link DxfTag} 序列。
 * <p>
 * 处理内容：
 * <ul>
 *   <li>组码行/值行交替读取，值行只去掉行尾的 {@code \r}，其余空白原样保留</li>
 *   <li>按组码转换值类型；字符串值解码 {@code \U+nnnn} 转义</li>
 *   <li>把连续的 x/y[/z] tag 合并为一个 {@link DxfPoint}；y 缺失或 y/z 单独出现时抛出 {@link MalformedPointException}</li>
 *   <li>跳过 999 注释</li>
 * </ul>
 * 本类只负责词法层，不关心 SECTION/ENDSEC 结构（结构检查在 {@code SectionSplitter} 中完成）。
 * 序列只能向前遍历一次，需要重新读取时重新构造读取器。
 */
public final class DxfTagReader implements Iterator<DxfTag> {

    private final String text;
    private int pos;
    private int lineNo;

    /**
     * 已读取但尚未消费的原始 tag（点坐标合并时的前瞻）。
     */
    private RawTag lookahead;
    private DxfTag next;

    private record RawTag(int code, String value, int line) {
    }

    public DxfTagReader(String text) {
        this.text = text;
        this.pos = !text.isEmpty() && text.charAt(0) == '\uFEFF' ? 1 : 0;
    }

    /**
     * 便捷方法：读取全部 tag。
     */
    public static List<DxfTag> readAll(String text) {
        List<DxfTag> tags = new ArrayList<>();
        new DxfTagReader(text).forEachRemaining(tags::add);
        return tags;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = compile();
        }
        return next != null;
    }

    @Override
    public DxfTag next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        DxfTag tag = next;
        next = null;
        return tag;
    }

    private DxfTag compile() {
        RawTag raw = nextRaw();
        while (raw != null && raw.code == GroupCodes.COMMENT) {
            raw = nextRaw();
        }
        if (raw == null) {
            return null;
        }
        int code = raw.code;
        if (GroupCodes.isPointCode(code)) {
            return compilePoint(raw);
        }
        if (GroupCodes.isPointTail(code)) {
            throw new MalformedPointException("坐标组码 " + code + " 前缺少对应的 x 坐标", raw.line);
        }
        Object value = convert(raw);
        return DxfTag.parsed(code, value, List.of(raw.value), raw.line);
    }

    private DxfTag compilePoint(RawTag x) {
        RawTag y = nextRaw();
        if (y == null || y.code != x.code + 10) {
            throw new MalformedPointException("组码 " + x.code + " 之后缺少 y 坐标（组码 " + (x.code + 10) + "）", x.line);
        }
        RawTag z = nextRaw();
        List<String> rawText;
        DxfPoint point;
        if (z != null && z.code == x.code + 20) {
            point = new DxfPoint(parseDouble(x), parseDouble(y), parseDouble(z));
            rawText = List.of(x.value, y.value, z.value);
        } else {
            lookahead = z;
            point = new DxfPoint(parseDouble(x), parseDouble(y), 0);
            rawText = List.of(x.value, y.value);
        }
        return DxfTag.parsed(x.code, point, rawText, x.line);
    }

    private Object convert(RawTag raw) {
        return switch (GroupCodes.typeOf(raw.code)) {
            case DOUBLE -> parseDouble(raw);
            case INT -> parseInt(raw);
            case LONG -> parseLong(raw);
            case STRING -> GroupCodes.isHandleCode(raw.code) || GroupCodes.isBinary(raw.code)
                    ? raw.value.trim()
                    : DxfEncoding.decodeUnicodeEscapes(raw.value);
            case POINT -> throw new IllegalStateException("点坐标必须通过 compilePoint 读取");
        };
    }

    private RawTag nextRaw() {
        if (lookahead != null) {
            RawTag t = lookahead;
            lookahead = null;
            return t;
        }
        String codeLine = nextLine();
        while (codeLine != null && codeLine.isBlank() && pos >= text.length()) {
            codeLine = nextLine();
        }
        if (codeLine == null) {
            return null;
        }
        int line = lineNo;
        int code;
        try {
            code = Integer.parseInt(codeLine.trim());
        } catch (NumberFormatException e) {
            throw new DxfStructureException("无效的组码：'" + codeLine + "'", line);
        }
        String value = nextLine();
        if (value == null) {
            throw new UnexpectedEndOfStreamException("组码 " + code + " 之后缺少值", line);
        }
        return new RawTag(code, value, line);
    }

    private String nextLine() {
        if (pos >= text.length()) {
            return null;
        }
        int end = text.indexOf('\n', pos);
        if (end < 0) {
            end = text.length();
        }
        int stop = end;
        if (stop > pos && text.charAt(stop - 1) == '\r') {
            stop--;
        }
        String line = text.substring(pos, stop);
        pos = end + 1;
        lineNo++;
        return line;
    }

    private static double parseDouble(RawTag raw) {
        try {
            return Double.parseDouble(raw.value.trim());
        } catch (NumberFormatException e) {
            throw new DxfStructureException("组码 " + raw.code + " 的值不是浮点数：'" + raw.value + "'", raw.line);
        }
    }

    private static int parseInt(RawTag raw) {
        String v = raw.value.trim();
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            // 部分导出器会把整数写成 "1.0"
            try {
                return (int) Double.parseDouble(v);
            } catch (NumberFormatException ignored) {
                throw new DxfStructureException("组码 " + raw.code + " 的值不是整数：'" + raw.value + "'", raw.line);
            }
        }
    }

    private static long parseLong(RawTag raw) {
        try {
            return Long.parseLong(raw.value.trim());
        } catch (NumberFormatException e) {
            throw new DxfStructureException("组码 " + raw.code + " 的值不是 64 位整数：'" + raw.value + "'", raw.line);
        }
    }
}
