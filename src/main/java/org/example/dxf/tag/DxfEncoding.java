package org.example.dxf.tag;

import org.example.dxf.DxfVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.CharsetEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DXF 文本编码处理。
 * <ul>
 *   <li>编码探测：R2007（AC1021）及以后固定为 UTF-8；更早的版本按 {@code $DWGCODEPAGE} 声明的代码页解码，
 *       未声明时使用配置的默认代码页。</li>
 *   <li>{@code \U+nnnn} 转义：旧代码页无法表示的字符在文件中以该形式出现，读取时解码为真实字符，
 *       写出时对目标编码无法表示的字符重新转义。</li>
 * </ul>
 */
public final class DxfEncoding {

    private static final Logger log = LoggerFactory.getLogger(DxfEncoding.class);

    private DxfEncoding() {
    }

    public static final String DEFAULT_CODEPAGE = "ANSI_1252";

    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\U\\+([0-9a-fA-F]{4})");

    private static final Map<String, String> CODEPAGES = Map.ofEntries(
            Map.entry("ANSI_874", "x-windows-874"),
            Map.entry("ANSI_932", "windows-31j"),
            Map.entry("ANSI_936", "GBK"),
            Map.entry("ANSI_949", "x-windows-949"),
            Map.entry("ANSI_950", "x-windows-950"),
            Map.entry("ANSI_1250", "windows-1250"),
            Map.entry("ANSI_1251", "windows-1251"),
            Map.entry("ANSI_1252", "windows-1252"),
            Map.entry("ANSI_1253", "windows-1253"),
            Map.entry("ANSI_1254", "windows-1254"),
            Map.entry("ANSI_1255", "windows-1255"),
            Map.entry("ANSI_1256", "windows-1256"),
            Map.entry("ANSI_1257", "windows-1257"),
            Map.entry("ANSI_1258", "windows-1258"),
            Map.entry("DOS437", "IBM437"),
            Map.entry("DOS850", "IBM850"),
            Map.entry("DOS866", "IBM866")
    );

    /**
     * 编码探测结果。
     *
     * @param version  {@code $ACADVER} 声明的版本（未声明时为 R12）
     * @param codepage {@code $DWGCODEPAGE} 声明的代码页（未声明时为 {@code null}）
     * @param charset  解码使用的字符集
     * @param bomSkip  需要跳过的 UTF-8 BOM 字节数
     */
    public record Detection(DxfVersion version, String codepage, Charset charset, int bomSkip) {
    }

    /**
     * 只扫描 HEADER 段（遇到第一个 ENDSEC 即停止），按 ISO-8859-1 逐行读取版本与代码页声明。
     */
    public static Detection detect(byte[] data, Charset defaultCharset) {
        int start = 0;
        if (data.length >= 3 && (data[0] & 0xFF) == 0xEF && (data[1] & 0xFF) == 0xBB && (data[2] & 0xFF) == 0xBF) {
            start = 3;
        }
        String acadver = null;
        String codepage = null;
        String variable = null;
        int[] pos = {start};
        while (pos[0] < data.length) {
            String code = nextLine(data, pos);
            String value = nextLine(data, pos);
            if ("0".equals(code) && "ENDSEC".equals(value)) {
                break;
            }
            if ("9".equals(code)) {
                variable = value;
            } else if ("$ACADVER".equals(variable) && acadver == null) {
                acadver = value;
            } else if ("$DWGCODEPAGE".equals(variable) && codepage == null) {
                codepage = value;
            }
            if (acadver != null && codepage != null) {
                break;
            }
        }
        DxfVersion version = acadver == null ? DxfVersion.R12 : DxfVersion.fromToken(acadver);
        Charset charset;
        if (start == 3 || version.usesUtf8()) {
            charset = StandardCharsets.UTF_8;
        } else {
            charset = codepage == null ? defaultCharset : charsetFor(codepage, defaultCharset);
        }
        return new Detection(version, codepage, charset, start);
    }

    private static String nextLine(byte[] data, int[] pos) {
        int begin = pos[0];
        int end = begin;
        while (end < data.length && data[end] != '\n') {
            end++;
        }
        pos[0] = end + 1;
        return new String(data, begin, end - begin, StandardCharsets.ISO_8859_1).trim();
    }

    /**
     * 把 {@code $DWGCODEPAGE} 的值（例如 {@code ANSI_1252}）映射为 Java 字符集；无法识别时返回 {@code fallback}。
     */
    public static Charset charsetFor(String codepage, Charset fallback) {
        if (codepage == null) {
            return fallback;
        }
        String name = CODEPAGES.get(codepage.trim().toUpperCase(Locale.ROOT));
        if (name == null) {
            log.warn("未知的代码页 {}，使用 {}", codepage, fallback.name());
            return fallback;
        }
        try {
            return Charset.forName(name);
        } catch (UnsupportedCharsetException e) {
            log.warn("当前 JVM 不支持字符集 {}（代码页 {}），使用 {}", name, codepage, fallback.name());
            return fallback;
        }
    }

    /**
     * 解码 {@code \U+nnnn} 转义。
     */
    public static String decodeUnicodeEscapes(String s) {
        if (s.indexOf("\\U+") < 0) {
            return s;
        }
        Matcher m = UNICODE_ESCAPE.matcher(s);
        StringBuilder sb = new StringBuilder(s.length());
        while (m.find()) {
            char c = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(c)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 把 {@code encoder} 无法编码的字符写成 {@code \U+nnnn}。
     */
    public static String encodeUnicodeEscapes(String s, CharsetEncoder encoder) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean encodable = c < 0x80 || encoder.canEncode(c);
            if (!encodable && sb == null) {
                sb = new StringBuilder(s.length() + 16);
                sb.append(s, 0, i);
            }
            if (sb != null) {
                if (encodable) {
                    sb.append(c);
                } else {
                    sb.append(String.format(Locale.ROOT, "\\U+%04X", (int) c));
                }
            }
        }
        return sb == null ? s : sb.toString();
    }
}
