package org.example.dxf;

/**
 * 新建文档的度量单位体系（写入 {@code $MEASUREMENT}）。
 */
public enum Measurement {

    IMPERIAL(0),
    METRIC(1);

    private final int headerValue;

    Measurement(int headerValue) {
        this.headerValue = headerValue;
    }

    public int headerValue() {
        return headerValue;
    }
}
