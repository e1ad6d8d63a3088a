package org.example.dxf.tag;

/**
 * 组码常量与“组码 -> 值类型”对照表。
 * <p>
 * 对照表按 DXF 参考手册的组码区间划分：
 * <ul>
 *   <li>0-9、100-109、300-369、390-399、410-419、430-439、470-481、999-1009：字符串（句柄、指针、二进制十六进制串也按字符串保存）</li>
 *   <li>10-59、110-149、210-239、460-469、1010-1059：浮点数（其中点坐标的 x 组码会与随后的 y/z 合并为 {@link DxfPoint}）</li>
 *   <li>60-99、170-179、270-299、370-389、400-409、420-429、440-459、1060-1071：整数</li>
 *   <li>160-169：64 位整数</li>
 * </ul>
 */
public final class GroupCodes {

    private GroupCodes() {
    }

    public static final int STRUCTURE = 0;
    public static final int TEXT = 1;
    public static final int NAME = 2;
    public static final int HANDLE = 5;
    public static final int HEADER_VARIABLE = 9;
    public static final int SUBCLASS_MARKER = 100;
    public static final int EMBEDDED_OBJECT = 101;
    public static final int CONTROL = 102;
    public static final int DIMSTYLE_HANDLE = 105;
    public static final int OWNER = 330;
    public static final int XDICTIONARY = 360;
    public static final int COMMENT = 999;
    public static final int XDATA_APPID = 1001;

    public static final String EMBEDDED_OBJECT_MARKER = "Embedded Object";
    public static final String REACTORS = "ACAD_REACTORS";
    public static final String XDICTIONARY_APPID = "ACAD_XDICTIONARY";

    /**
     * @return 组码 {@code code} 对应的值类型；点坐标的 x 组码返回 {@link TagType#POINT}
     */
    public static TagType typeOf(int code) {
        if (isPointCode(code)) {
            return TagType.POINT;
        }
        if (code < 0) {
            throw new IllegalArgumentException("无效组码：" + code);
        }
        if (code <= 9) {
            return TagType.STRING;
        }
        if (code <= 59) {
            return TagType.DOUBLE;
        }
        if (code <= 99) {
            return TagType.INT;
        }
        if (code <= 109) {
            return TagType.STRING;
        }
        if (code <= 149) {
            return TagType.DOUBLE;
        }
        if (code >= 160 && code <= 169) {
            return TagType.LONG;
        }
        if (code >= 170 && code <= 179) {
            return TagType.INT;
        }
        if (code >= 210 && code <= 239) {
            return TagType.DOUBLE;
        }
        if (code >= 270 && code <= 299) {
            return TagType.INT;
        }
        if (code >= 300 && code <= 369) {
            return TagType.STRING;
        }
        if (code >= 370 && code <= 389) {
            return TagType.INT;
        }
        if (code >= 390 && code <= 399) {
            return TagType.STRING;
        }
        if (code >= 400 && code <= 409) {
            return TagType.INT;
        }
        if (code >= 410 && code <= 419) {
            return TagType.STRING;
        }
        if (code >= 420 && code <= 429) {
            return TagType.INT;
        }
        if (code >= 430 && code <= 439) {
            return TagType.STRING;
        }
        if (code >= 440 && code <= 459) {
            return TagType.INT;
        }
        if (code >= 460 && code <= 469) {
            return TagType.DOUBLE;
        }
        if (code >= 470 && code <= 481) {
            return TagType.STRING;
        }
        if (code >= 999 && code <= 1009) {
            return TagType.STRING;
        }
        if (code >= 1010 && code <= 1059) {
            return TagType.DOUBLE;
        }
        if (code >= 1060 && code <= 1071) {
            return TagType.INT;
        }
        return TagType.STRING;
    }

    /**
     * 点坐标的 x 组码：10-18、110-112、210-213、1010-1013。
     */
    public static boolean isPointCode(int code) {
        return (code >= 10 && code <= 18)
                || (code >= 110 && code <= 112)
                || (code >= 210 && code <= 213)
                || (code >= 1010 && code <= 1013);
    }

    /**
     * 点坐标的 y/z 组码（只能紧跟在对应的 x 之后出现）。
     */
    public static boolean isPointTail(int code) {
        return isPointCode(code - 10) || (isPointCode(code - 20) && code != 38);
    }

    /**
     * 二进制数据组码（十六进制串）：310-319、1004。
     */
    public static boolean isBinary(int code) {
        return (code >= 310 && code <= 319) || code == 1004;
    }

    /**
     * 携带句柄值的组码（句柄本身、各类指针、XDATA 数据库句柄）。
     */
    public static boolean isHandleCode(int code) {
        return code == HANDLE || code == DIMSTYLE_HANDLE
                || (code >= 320 && code <= 369)
                || (code >= 390 && code <= 399)
                || code == 480 || code == 481
                || code == 1005;
    }
}
