package org.example.dxf.entity;

import org.example.dxf.tag.DxfPoint;

import java.util.List;

/**
 * HATCH 边界路径中的一条边（72 组码区分类型）。
 */
public interface HatchEdge {

    EdgeType type();

    enum EdgeType {
        LINE(1), ARC(2), ELLIPSE(3), SPLINE(4);

        private final int code;

        EdgeType(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static EdgeType fromCode(int code) {
            for (EdgeType t : values()) {
                if (t.code == code) {
                    return t;
                }
            }
            return null;
        }
    }

    record Line(DxfPoint start, DxfPoint end) implements HatchEdge {
        @Override
        public EdgeType type() {
            return EdgeType.LINE;
        }
    }

    record Arc(DxfPoint center, double radius, double startAngle, double endAngle, boolean ccw) implements HatchEdge {
        @Override
        public EdgeType type() {
            return EdgeType.ARC;
        }
    }

    /**
     * @param majorAxis 长轴端点，相对于圆心
     */
    record Ellipse(DxfPoint center, DxfPoint majorAxis, double ratio, double startAngle, double endAngle,
                   boolean ccw) implements HatchEdge {
        @Override
        public EdgeType type() {
            return EdgeType.ELLIPSE;
        }
    }

    /**
     * @param weights      有理样条的权重，与控制点一一对应；非有理样条为空
     * @param startTangent 可以为 {@code null}
     * @param endTangent   可以为 {@code null}
     */
    record Spline(int degree, boolean rational, boolean periodic, List<Double> knots, List<DxfPoint> controlPoints,
                  List<Double> weights, List<DxfPoint> fitPoints, DxfPoint startTangent,
                  DxfPoint endTangent) implements HatchEdge {

        public Spline {
            knots = List.copyOf(knots);
            controlPoints = List.copyOf(controlPoints);
            weights = List.copyOf(weights);
            fitPoints = List.copyOf(fitPoints);
        }

        @Override
        public EdgeType type() {
            return EdgeType.SPLINE;
        }
    }
}
