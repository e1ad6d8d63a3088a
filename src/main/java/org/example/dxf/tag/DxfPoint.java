package org.example.dxf.tag;

/**
 * 点坐标值（由 x/y[/z] 三个连续 tag 合并而来）。
 * <p>
 * 核心层只把它当作不透明的值类型，不做任何几何计算。缺省的 z 坐标为 0。
 */
public record DxfPoint(double x, double y, double z) {

    public static final DxfPoint ORIGIN = new DxfPoint(0, 0, 0);
    public static final DxfPoint Z_AXIS = new DxfPoint(0, 0, 1);

    public static DxfPoint of(double x, double y) {
        return new DxfPoint(x, y, 0);
    }

    public static DxfPoint of(double x, double y, double z) {
        return new DxfPoint(x, y, z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
