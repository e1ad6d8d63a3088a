package org.example.dxf.db;

import org.example.dxf.DxfStructureException;

import java.util.Locale;

/**
 * 句柄生成器：从种子开始单调递增，输出大写十六进制字符串。句柄 0 保留为“空引用”。
 */
public final class HandleGenerator {

    private long next;

    public HandleGenerator() {
        this(1L);
    }

    public HandleGenerator(long seed) {
        this.next = Math.max(1L, seed);
    }

    /**
     * 以 {@code $HANDSEED} 的值初始化。
     */
    public static HandleGenerator fromSeed(String seed) {
        return new HandleGenerator(parse(seed));
    }

    public String next() {
        return format(next++);
    }

    /**
     * 记录一个已存在的句柄，保证以后生成的句柄都比它大。
     */
    public void observe(String handle) {
        long value = parse(handle);
        if (value >= next) {
            next = value + 1;
        }
    }

    /**
     * @return 下一个可用句柄（写入 {@code $HANDSEED}）
     */
    public String seed() {
        return format(next);
    }

    static String format(long value) {
        return Long.toHexString(value).toUpperCase(Locale.ROOT);
    }

    static long parse(String handle) {
        try {
            return Long.parseUnsignedLong(handle.trim(), 16);
        } catch (NumberFormatException e) {
            throw new DxfStructureException("无效的句柄：" + handle);
        }
    }
}
