package org.example.dxf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 支持的 DXF 版本。
 * <p>
 * 文件头 {@code $ACADVER} 中记录的是版本令牌（例如 {@code AC1009}），本枚举把令牌映射为可比较的版本：
 * <ul>
 *   <li>R12 之前的旧版本（AC1006 等）一律按 R12 处理</li>
 *   <li>R13/R14（AC1012/AC1014）按 R2000 处理</li>
 *   <li>比 AC1032 更新的令牌按 R2018 处理（未知的新字段依靠“未知 tag 原样保留”机制往返）</li>
 * </ul>
 */
public enum DxfVersion {

    R12("AC1009"),
    R2000("AC1015"),
    R2004("AC1018"),
    R2007("AC1021"),
    R2010("AC1024"),
    R2013("AC1027"),
    R2018("AC1032");

    private static final Logger log = LoggerFactory.getLogger(DxfVersion.class);

    private final String token;

    DxfVersion(String token) {
        this.token = token;
    }

    /**
     * @return {@code $ACADVER} 中使用的版本令牌
     */
    public String token() {
        return token;
    }

    public boolean isAtLeast(DxfVersion other) {
        return compareTo(other) >= 0;
    }

    public boolean isBefore(DxfVersion other) {
        return compareTo(other) < 0;
    }

    /**
     * R2007 起 DXF 文本统一为 UTF-8，之前的版本使用 {@code $DWGCODEPAGE} 声明的代码页。
     */
    public boolean usesUtf8() {
        return isAtLeast(R2007);
    }

    /**
     * 解析版本令牌（大小写不敏感）。
     *
     * @throws DxfVersionException 令牌不是 {@code ACnnnn} 格式
     */
    public static DxfVersion fromToken(String token) {
        if (token == null) {
            throw new DxfVersionException("缺少 DXF 版本令牌");
        }
        String t = token.trim().toUpperCase(Locale.ROOT);
        for (DxfVersion v : values()) {
            if (v.token.equals(t)) {
                return v;
            }
        }
        int number = parseNumber(t);
        if (number < 1009) {
            log.info("旧版本 {} 按 R12 读取", t);
            return R12;
        }
        if (number < 1015) {
            log.info("版本 {}（R13/R14）按 R2000 读取", t);
            return R2000;
        }
        if (number > 1032) {
            log.info("未知的新版本 {} 按 R2018 读取", t);
            return R2018;
        }
        // 介于已知令牌之间的非标准令牌：取不高于它的最近版本
        DxfVersion result = R2000;
        for (DxfVersion v : values()) {
            if (parseNumber(v.token) <= number) {
                result = v;
            }
        }
        return result;
    }

    private static int parseNumber(String token) {
        if (token.length() != 6 || !token.startsWith("AC")) {
            throw new DxfVersionException("无效的 DXF 版本令牌：" + token);
        }
        try {
            return Integer.parseInt(token.substring(2));
        } catch (NumberFormatException e) {
            throw new DxfVersionException("无效的 DXF 版本令牌：" + token);
        }
    }
}
