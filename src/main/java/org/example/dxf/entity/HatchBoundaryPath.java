package org.example.dxf.entity;

import java.util.List;

/**
 * HATCH 的一条边界路径。
 * <p>
 * 标志位 2 表示多段线路径（只有 {@code vertices}），否则是边路径（只有 {@code edges}）。
 *
 * @param flags          路径类型标志（92）
 * @param hasBulge       多段线路径是否带凸度（72）
 * @param closed         多段线路径是否闭合（73）
 * @param vertices       多段线路径的顶点
 * @param edges          边路径的边
 * @param sourceHandles  关联的源边界对象句柄（330）
 */
public record HatchBoundaryPath(int flags, boolean hasBulge, boolean closed, List<Vertex> vertices,
                                List<HatchEdge> edges, List<String> sourceHandles) {

    public static final int POLYLINE = 2;

    public record Vertex(double x, double y, double bulge) {
    }

    public HatchBoundaryPath {
        vertices = List.copyOf(vertices);
        edges = List.copyOf(edges);
        sourceHandles = List.copyOf(sourceHandles);
    }

    public static HatchBoundaryPath polyline(int flags, boolean closed, List<Vertex> vertices) {
        boolean bulge = vertices.stream().anyMatch(v -> v.bulge() != 0);
        return new HatchBoundaryPath(flags | POLYLINE, bulge, closed, vertices, List.of(), List.of());
    }

    public static HatchBoundaryPath edges(int flags, List<HatchEdge> edges) {
        return new HatchBoundaryPath(flags & ~POLYLINE, false, false, List.of(), edges, List.of());
    }

    public boolean isPolyline() {
        return (flags & POLYLINE) != 0;
    }
}
